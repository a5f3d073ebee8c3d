package org.chunksieve.isa;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Encodes instructions into the engine's binary word format.
 *
 * <p>Every instruction is one 64-bit little-endian word made of four unsigned
 * 16-bit fields: {@code [op2][op1][target][opcode]}
 * <ul>
 *   <li>Opcode: bits 0-15</li>
 *   <li>Target: bits 16-31</li>
 *   <li>Operand 1: bits 32-47</li>
 *   <li>Operand 2: bits 48-63</li>
 * </ul>
 *
 * <p>Formula: {@code word = opcode | target << 16 | op1 << 32 | op2 << 48}
 *
 * <p>This class is thread-safe as it contains only static methods and immutable constants.
 */
public final class InstructionEncoder {

    /** Number of bits of every field. */
    public static final int FIELD_BITS = 16;

    /** Maximum value of every field (2^16 - 1). */
    public static final int MAX_FIELD = 0xFFFF;

    /** Size of one encoded instruction in bytes. */
    public static final int WORD_BYTES = 8;

    private static final int TARGET_SHIFT = 16;
    private static final int OP1_SHIFT = 32;
    private static final int OP2_SHIFT = 48;

    private InstructionEncoder() {
        // Utility class - prevent instantiation
    }

    /**
     * Encodes a single instruction into its 8-byte representation.
     *
     * @param opcode the opcode (0-65535)
     * @param target the target chunk or register (0-65535)
     * @param op1    the first operand (0-65535)
     * @param op2    the second operand (0-65535)
     * @return the encoded word as little-endian bytes
     * @throws EncodingOverflowException if any field is negative or wider than 16 bits
     */
    public static byte[] encode(int opcode, int target, int op1, int op2) {
        return ByteBuffer.allocate(WORD_BYTES)
                .order(ByteOrder.LITTLE_ENDIAN)
                .putLong(toWord(opcode, target, op1, op2))
                .array();
    }

    /**
     * Encodes an instruction without operands.
     *
     * @param opcode the opcode (0-65535)
     * @return the encoded word as little-endian bytes
     */
    public static byte[] encode(int opcode) {
        return encode(opcode, 0, 0, 0);
    }

    /**
     * Encodes an already validated instruction.
     *
     * @param instruction the instruction to encode
     * @return the encoded word as little-endian bytes
     */
    public static byte[] encode(Instruction instruction) {
        return encode(instruction.opcode().code(), instruction.target(), instruction.op1(), instruction.op2());
    }

    /**
     * Computes the 64-bit word for the given fields.
     *
     * @return the word, to be written in little-endian order
     * @throws EncodingOverflowException if any field is negative or wider than 16 bits
     */
    public static long toWord(int opcode, int target, int op1, int op2) {
        requireField("opcode", opcode);
        requireField("target", target);
        requireField("op1", op1);
        requireField("op2", op2);
        return (long) opcode
                | ((long) target << TARGET_SHIFT)
                | ((long) op1 << OP1_SHIFT)
                | ((long) op2 << OP2_SHIFT);
    }

    /**
     * Checks that a value fits one unsigned 16-bit field.
     *
     * @param field the field name used in the error message
     * @param value the value to check
     * @return the value itself
     * @throws EncodingOverflowException if the value does not fit
     */
    public static int requireField(String field, long value) {
        if (value < 0 || value > MAX_FIELD) {
            throw new EncodingOverflowException(field, value, FIELD_BITS);
        }
        return (int) value;
    }
}
