package org.chunksieve.program;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A contiguous range of global chunks assigned to one worker.
 * <p>
 * Local chunk {@code c} of the block is global chunk {@code blockStart + c} and covers
 * candidates {@code [(blockStart + c) * S, (blockStart + c + 1) * S)} for
 * {@code S} states per chunk.
 *
 * @param blockStart   index of the first global chunk
 * @param activeChunks number of chunks in the block
 */
public record SearchBlock(BigInteger blockStart, BigInteger activeChunks) {

    public SearchBlock {
        Objects.requireNonNull(blockStart, "blockStart");
        Objects.requireNonNull(activeChunks, "activeChunks");
        if (blockStart.signum() < 0) {
            throw new IllegalArgumentException("Block start must be >= 0, got " + blockStart);
        }
        if (activeChunks.signum() <= 0) {
            throw new IllegalArgumentException("Active chunks must be >= 1, got " + activeChunks);
        }
    }

    public static SearchBlock of(long blockStart, long activeChunks) {
        return new SearchBlock(BigInteger.valueOf(blockStart), BigInteger.valueOf(activeChunks));
    }

    /**
     * @return the first global chunk after this block
     */
    public BigInteger endChunk() {
        return blockStart.add(activeChunks);
    }

    /**
     * Returns the first candidate of a local chunk, {@code (blockStart + localChunk) * chunkStates}.
     */
    public BigInteger globalOffset(long localChunk, long chunkStates) {
        return blockStart.add(BigInteger.valueOf(localChunk)).multiply(BigInteger.valueOf(chunkStates));
    }

    /**
     * @return the first candidate of the block
     */
    public BigInteger firstCandidate(long chunkStates) {
        return globalOffset(0, chunkStates);
    }

    /**
     * Returns the exclusive end of the candidates this block is responsible for.
     * The last block of a run may extend beyond the search limit; its range is clamped.
     *
     * @param chunkStates states per chunk
     * @param limit       exclusive search limit of the run
     */
    public BigInteger endCandidate(long chunkStates, BigInteger limit) {
        return endChunk().multiply(BigInteger.valueOf(chunkStates)).min(limit);
    }

    @Override
    public String toString() {
        return "chunks [" + blockStart + ", " + endChunk() + ")";
    }
}
