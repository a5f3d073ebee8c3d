package org.chunksieve.scheduler;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.chunksieve.program.EngineLimits;
import org.chunksieve.program.SearchBlock;
import org.chunksieve.program.SizeExceededException;

/**
 * Splits the candidate interval {@code [0, searchLimit(N))} into chunk-aligned blocks.
 * <p>
 * The interval is first rounded up to whole chunks, {@code T = ceil(limit / S)}, and the
 * chunks are then divided into contiguous blocks of {@code ceil(T / workerCount)} chunks
 * (optionally capped). Consecutive blocks share their boundary chunk index, so the
 * candidate ranges of all blocks, clamped to the limit, cover the interval exactly once.
 */
public final class Partitioner {

    /** Upper bound on the number of blocks a single run may produce. */
    public static final int MAX_BLOCKS = 1 << 20;

    private Partitioner() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns the exclusive upper bound of the candidate interval, {@code isqrt(N) + 1}.
     * <p>
     * For non-square {@code N} this equals {@code ceil(sqrt(N))}; for perfect squares it
     * additionally includes the root.
     *
     * @param modulus the integer to factor (at least 2)
     */
    public static BigInteger searchLimit(BigInteger modulus) {
        requireModulus(modulus);
        return modulus.sqrt().add(BigInteger.ONE);
    }

    /**
     * Partitions the search interval into at most {@code workerCount} blocks, using the
     * radix of the reference engine.
     *
     * @param modulus     the integer to factor (at least 2)
     * @param chunkDepth  digits per chunk
     * @param workerCount number of workers (at least 1)
     * @return contiguous, non-empty blocks in ascending order
     */
    public static List<SearchBlock> partition(BigInteger modulus, int chunkDepth, int workerCount) {
        return partitionByStates(modulus, EngineLimits.DEFAULT.chunkStates(chunkDepth), workerCount, null);
    }

    /**
     * Partitions the search interval for a given engine. Blocks never exceed the
     * engine's addressable chunk count, so the result may hold more blocks than workers.
     *
     * @param modulus     the integer to factor (at least 2)
     * @param chunkDepth  digits per chunk
     * @param workerCount number of workers (at least 1)
     * @param limits      capacities of the engine
     * @return contiguous, non-empty blocks in ascending order
     */
    public static List<SearchBlock> partition(BigInteger modulus, int chunkDepth, int workerCount,
                                              EngineLimits limits) {
        return partitionByStates(modulus, limits.chunkStates(chunkDepth), workerCount, limits.maxChunks());
    }

    /**
     * Partitions the search interval into blocks of {@code ceil(T / workerCount)} chunks,
     * each capped at {@code maxChunksPerBlock}.
     *
     * @param modulus           the integer to factor (at least 2)
     * @param chunkStates       local states per chunk
     * @param workerCount       number of workers (at least 1)
     * @param maxChunksPerBlock cap per block, or {@code null} for none
     * @return contiguous, non-empty blocks in ascending order
     * @throws SizeExceededException if the partition would need more than {@link #MAX_BLOCKS} blocks
     */
    public static List<SearchBlock> partitionByStates(BigInteger modulus, long chunkStates, int workerCount,
                                                      Integer maxChunksPerBlock) {
        if (chunkStates < 1) {
            throw new IllegalArgumentException("Chunk states must be >= 1, got " + chunkStates);
        }
        if (workerCount < 1) {
            throw new IllegalArgumentException("Worker count must be >= 1, got " + workerCount);
        }
        if (maxChunksPerBlock != null && maxChunksPerBlock < 1) {
            throw new IllegalArgumentException("Chunks per block must be >= 1, got " + maxChunksPerBlock);
        }

        BigInteger totalChunks = ceilDiv(searchLimit(modulus), BigInteger.valueOf(chunkStates));
        BigInteger perBlock = ceilDiv(totalChunks, BigInteger.valueOf(workerCount));
        if (maxChunksPerBlock != null) {
            perBlock = perBlock.min(BigInteger.valueOf(maxChunksPerBlock));
        }

        BigInteger blockCount = ceilDiv(totalChunks, perBlock);
        if (blockCount.compareTo(BigInteger.valueOf(MAX_BLOCKS)) > 0) {
            throw new SizeExceededException(String.format(
                    "Search space of %s chunks needs %s blocks of %s chunks, at most %d allowed",
                    totalChunks, blockCount, perBlock, MAX_BLOCKS));
        }

        List<SearchBlock> blocks = new ArrayList<>(blockCount.intValueExact());
        BigInteger start = BigInteger.ZERO;
        while (start.compareTo(totalChunks) < 0) {
            BigInteger size = perBlock.min(totalChunks.subtract(start));
            blocks.add(new SearchBlock(start, size));
            start = start.add(size);
        }
        return blocks;
    }

    private static BigInteger ceilDiv(BigInteger dividend, BigInteger divisor) {
        BigInteger[] qr = dividend.divideAndRemainder(divisor);
        return qr[1].signum() == 0 ? qr[0] : qr[0].add(BigInteger.ONE);
    }

    private static void requireModulus(BigInteger modulus) {
        if (modulus.compareTo(BigInteger.TWO) < 0) {
            throw new IllegalArgumentException("Modulus must be >= 2, got " + modulus);
        }
    }
}
