package org.chunksieve.result;

import java.math.BigInteger;

/**
 * An integer hypothesized to divide the modulus, as extracted from engine output.
 *
 * @param value  the global candidate value
 * @param source the report shape the value came from
 */
public record Candidate(BigInteger value, Source source) {

    public enum Source {
        /** A per-chunk measurement recombined with the chunk's global offset. */
        MEASUREMENT,
        /** A direct hexadecimal factor report. */
        FACTOR_REPORT
    }
}
