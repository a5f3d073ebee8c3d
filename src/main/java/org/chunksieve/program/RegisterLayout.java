package org.chunksieve.program;

import org.chunksieve.isa.InstructionEncoder;

/**
 * Register addresses a program uses for its inputs.
 * <p>
 * The engine keeps one measurement slot per chunk at addresses {@code [0, maxChunks)}.
 * Inputs must live above that range, otherwise a chunk's measurement overwrites the
 * modulus or offset while other chunks still read it.
 *
 * @param offsetRegister  register holding the global offset of the chunk being processed
 * @param modulusBase     first register of the modulus limbs
 * @param modulusCapacity number of 64-bit limbs reserved for the modulus
 */
public record RegisterLayout(int offsetRegister, int modulusBase, int modulusCapacity) {

    /** Registers directly above the 4096 measurement slots, 64 limbs (4096 bits) of modulus. */
    public static final RegisterLayout DEFAULT = new RegisterLayout(4096, 4097, 64);

    public RegisterLayout {
        if (modulusCapacity < 1) {
            throw new IllegalArgumentException("Modulus capacity must be >= 1, got " + modulusCapacity);
        }
        InstructionEncoder.requireField("offsetRegister", offsetRegister);
        InstructionEncoder.requireField("modulusBase", modulusBase);
        InstructionEncoder.requireField("modulusEnd", (long) modulusBase + modulusCapacity - 1);
        if (offsetRegister >= modulusBase && offsetRegister < modulusBase + modulusCapacity) {
            throw new IllegalArgumentException(String.format(
                    "Offset register %d lies inside the modulus range [%d, %d)",
                    offsetRegister, modulusBase, modulusBase + modulusCapacity));
        }
    }

    /**
     * Checks that no input register aliases a measurement slot.
     *
     * @param maxChunks number of measurement slots of the engine
     * @throws IllegalArgumentException if the layout overlaps {@code [0, maxChunks)}
     */
    public void requireDisjointFrom(int maxChunks) {
        if (offsetRegister < maxChunks || modulusBase < maxChunks) {
            throw new IllegalArgumentException(String.format(
                    "Input registers (offset=%d, modulus=%d) overlap the measurement slots [0, %d)",
                    offsetRegister, modulusBase, maxChunks));
        }
    }
}
