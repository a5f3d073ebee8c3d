package org.chunksieve.isa;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the 64-bit instruction word layout.
 */
@Tag("unit")
class InstructionEncoderTest {

    @Test
    void encode_init_producesLittleEndianFields() {
        byte[] bytes = InstructionEncoder.encode(0x01, 5, 3, 0);

        assertThat(bytes).containsExactly(0x01, 0x00, 0x05, 0x00, 0x03, 0x00, 0x00, 0x00);
    }

    @Test
    void encode_halt_hasOnlyOpcode() {
        byte[] bytes = InstructionEncoder.encode(Opcode.HALT.code());

        assertThat(bytes).containsExactly(0xFF, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00);
    }

    @Test
    void encode_maxFields_setsEveryBit() {
        byte[] bytes = InstructionEncoder.encode(0xFFFF, 0xFFFF, 0xFFFF, 0xFFFF);

        assertThat(bytes).hasSize(InstructionEncoder.WORD_BYTES);
        for (byte b : bytes) {
            assertThat(b).isEqualTo((byte) 0xFF);
        }
    }

    @Test
    void toWord_placesFieldsAtTheirShifts() {
        long word = InstructionEncoder.toWord(0x0B, 7, 0x0C, 0x1234);

        assertThat(word & 0xFFFF).isEqualTo(0x0B);
        assertThat((word >>> 16) & 0xFFFF).isEqualTo(7);
        assertThat((word >>> 32) & 0xFFFF).isEqualTo(0x0C);
        assertThat((word >>> 48) & 0xFFFF).isEqualTo(0x1234);
    }

    @Test
    void encode_instruction_matchesRawFields() {
        Instruction instruction = new Instruction(Opcode.STORE_HI, 4097, 0xBEEF, 0x0001);

        assertThat(InstructionEncoder.encode(instruction))
                .containsExactly(InstructionEncoder.encode(0x18, 4097, 0xBEEF, 0x0001));
    }

    @ParameterizedTest(name = "opcode={0}, target={1}, op1={2}, op2={3}")
    @CsvSource({
        "65536, 0, 0, 0",
        "1, 65536, 0, 0",
        "1, 0, 70000, 0",
        "1, 0, 0, -1"
    })
    void encode_fieldOutOfRange_throwsOverflow(int opcode, int target, int op1, int op2) {
        assertThatThrownBy(() -> InstructionEncoder.encode(opcode, target, op1, op2))
                .isInstanceOf(EncodingOverflowException.class)
                .hasMessageContaining("16");
    }

    @Test
    void overflow_reportsFieldAndValue() {
        assertThatThrownBy(() -> new Instruction(Opcode.INIT, 70_000, 1, 0))
                .isInstanceOfSatisfying(EncodingOverflowException.class, e -> {
                    assertThat(e.getField()).isEqualTo("target");
                    assertThat(e.getValue()).isEqualTo(70_000L);
                });
    }
}
