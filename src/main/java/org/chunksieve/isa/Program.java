package org.chunksieve.isa;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * An immutable engine program: an ordered instruction sequence terminated by {@link Opcode#HALT}.
 * <p>
 * The serialized form is the concatenation of the instruction words, so
 * {@link #byteLength()} is always {@code 8 * size()}.
 */
public final class Program {

    private final List<Instruction> instructions;

    /**
     * Creates a program from its instructions.
     *
     * @param instructions the instructions; the last one must be {@code HALT}
     * @throws IllegalArgumentException if the sequence is empty or not terminated by {@code HALT}
     */
    public Program(List<Instruction> instructions) {
        if (instructions.isEmpty() || instructions.get(instructions.size() - 1).opcode() != Opcode.HALT) {
            throw new IllegalArgumentException("Program must end with a HALT instruction");
        }
        this.instructions = List.copyOf(instructions);
    }

    public List<Instruction> instructions() {
        return instructions;
    }

    public int size() {
        return instructions.size();
    }

    public long byteLength() {
        return (long) instructions.size() * InstructionEncoder.WORD_BYTES;
    }

    /**
     * Counts the instructions carrying the given opcode.
     */
    public long count(Opcode opcode) {
        return instructions.stream().filter(i -> i.opcode() == opcode).count();
    }

    /**
     * Serializes the program in the canonical little-endian layout.
     *
     * @return a fresh byte array of {@link #byteLength()} bytes
     */
    public byte[] toBytes() {
        ByteBuffer buffer = ByteBuffer.allocate(Math.toIntExact(byteLength())).order(ByteOrder.LITTLE_ENDIAN);
        for (Instruction instruction : instructions) {
            buffer.putLong(instruction.toWord());
        }
        return buffer.array();
    }

    /**
     * Writes the program file, replacing any existing content.
     *
     * @param file the destination
     * @throws IOException if the file cannot be written
     */
    public void writeTo(Path file) throws IOException {
        Files.write(file, toBytes());
    }
}
