package org.chunksieve.isa;

import java.util.Objects;

/**
 * One fixed-width engine instruction.
 * <p>
 * Fields are validated on construction, so an {@code Instruction} instance always
 * encodes without loss.
 *
 * @param opcode the operation
 * @param target the addressed chunk or register
 * @param op1    first operand
 * @param op2    second operand
 */
public record Instruction(Opcode opcode, int target, int op1, int op2) {

    public Instruction {
        Objects.requireNonNull(opcode, "opcode");
        InstructionEncoder.requireField("target", target);
        InstructionEncoder.requireField("op1", op1);
        InstructionEncoder.requireField("op2", op2);
    }

    public static Instruction of(Opcode opcode) {
        return new Instruction(opcode, 0, 0, 0);
    }

    public static Instruction of(Opcode opcode, int target) {
        return new Instruction(opcode, target, 0, 0);
    }

    public static Instruction of(Opcode opcode, int target, int op1) {
        return new Instruction(opcode, target, op1, 0);
    }

    /**
     * @return the 64-bit word of this instruction
     */
    public long toWord() {
        return InstructionEncoder.toWord(opcode.code(), target, op1, op2);
    }

    @Override
    public String toString() {
        return String.format("%s %d %d %d", opcode, target, op1, op2);
    }
}
