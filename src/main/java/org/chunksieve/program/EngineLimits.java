package org.chunksieve.program;

/**
 * Fixed capacities of the external engine.
 * <p>
 * The engine does not report these limits; exceeding them makes it crash. They are
 * therefore configuration constants validated before dispatch.
 *
 * @param radix           number of basis states per digit
 * @param maxChunks       number of addressable chunks
 * @param maxDepth        maximum digits per chunk
 * @param maxInstructions maximum instructions per program
 */
public record EngineLimits(int radix, int maxChunks, int maxDepth, int maxInstructions) {

    /** Limits of the reference engine build: 4096 chunks of at most 10 trits. */
    public static final EngineLimits DEFAULT = new EngineLimits(3, 4096, 10, 16_777_216);

    public EngineLimits {
        if (radix < 2) {
            throw new IllegalArgumentException("Radix must be >= 2, got " + radix);
        }
        if (maxChunks < 1 || maxDepth < 1 || maxInstructions < 2) {
            throw new IllegalArgumentException(String.format(
                    "Engine limits must be positive: maxChunks=%d, maxDepth=%d, maxInstructions=%d",
                    maxChunks, maxDepth, maxInstructions));
        }
    }

    /**
     * Returns the number of local states of a chunk, {@code radix^depth}.
     *
     * @param depth the chunk depth (1 to {@link #maxDepth()})
     * @return the state count
     * @throws IllegalArgumentException if the depth is out of range
     */
    public long chunkStates(int depth) {
        requireDepth(depth);
        long states = 1;
        for (int i = 0; i < depth; i++) {
            states = Math.multiplyExact(states, radix);
        }
        return states;
    }

    /**
     * @throws IllegalArgumentException if the depth is out of range
     */
    public void requireDepth(int depth) {
        if (depth < 1 || depth > maxDepth) {
            throw new IllegalArgumentException(
                    "Chunk depth must be between 1 and " + maxDepth + ", got: " + depth);
        }
    }
}
