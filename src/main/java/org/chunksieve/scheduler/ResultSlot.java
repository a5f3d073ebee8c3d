package org.chunksieve.scheduler;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import org.chunksieve.result.FactorPair;

/**
 * Single-assignment holder of the winning factorization of a search.
 * <p>
 * The first {@link #offer(FactorPair)} wins; every later offer is rejected without error.
 */
public final class ResultSlot {

    private final AtomicReference<FactorPair> winner = new AtomicReference<>();

    /**
     * Tries to claim the slot.
     *
     * @param pair a verified factorization
     * @return {@code true} if this call stored {@code pair}, {@code false} if the slot was already claimed
     */
    public boolean offer(FactorPair pair) {
        return winner.compareAndSet(null, pair);
    }

    public boolean isClaimed() {
        return winner.get() != null;
    }

    public Optional<FactorPair> get() {
        return Optional.ofNullable(winner.get());
    }
}
