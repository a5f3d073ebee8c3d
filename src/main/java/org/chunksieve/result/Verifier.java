package org.chunksieve.result;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Divisibility check deciding whether a candidate is a non-trivial factor.
 * Engine reports are never trusted without passing through this class.
 */
public final class Verifier {

    private Verifier() {
        // Utility class - prevent instantiation
    }

    /**
     * @return {@code true} iff {@code 1 < candidate < modulus} and {@code candidate} divides {@code modulus}
     */
    public static boolean isFactor(BigInteger modulus, BigInteger candidate) {
        return candidate.compareTo(BigInteger.ONE) > 0
                && candidate.compareTo(modulus) < 0
                && modulus.mod(candidate).signum() == 0;
    }

    /**
     * Verifies a candidate and splits the modulus.
     *
     * @return {@code (candidate, modulus / candidate)}, or empty if the candidate is not a non-trivial factor
     */
    public static Optional<FactorPair> verify(BigInteger modulus, BigInteger candidate) {
        if (!isFactor(modulus, candidate)) {
            return Optional.empty();
        }
        return Optional.of(new FactorPair(candidate, modulus.divide(candidate)));
    }
}
