package org.chunksieve.result;

import java.math.BigInteger;

/**
 * A verified factorization {@code factor * cofactor = N}.
 */
public record FactorPair(BigInteger factor, BigInteger cofactor) {

    public BigInteger product() {
        return factor.multiply(cofactor);
    }

    @Override
    public String toString() {
        return factor + " x " + cofactor;
    }
}
