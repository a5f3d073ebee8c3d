package org.chunksieve.scheduler;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import org.chunksieve.result.FactorPair;

/**
 * Outcome of a complete search: either a verified factorization or "not found".
 * <p>
 * "Not found" is a regular result meaning the iteration budget or search radius was
 * insufficient; it carries the per-worker outcomes for diagnosis.
 *
 * @param modulus  the searched integer
 * @param factor   the winning factorization, or {@code null}
 * @param outcomes the terminal outcome of every worker
 * @param timedOut whether the overall search deadline cut the search short
 */
public record SearchResult(BigInteger modulus, FactorPair factor, List<WorkerOutcome> outcomes, boolean timedOut) {

    public SearchResult {
        outcomes = List.copyOf(outcomes);
    }

    public static SearchResult found(BigInteger modulus, FactorPair factor, List<WorkerOutcome> outcomes) {
        return new SearchResult(modulus, factor, outcomes, false);
    }

    public static SearchResult notFound(BigInteger modulus, List<WorkerOutcome> outcomes, boolean timedOut) {
        return new SearchResult(modulus, null, outcomes, timedOut);
    }

    public boolean isFound() {
        return factor != null;
    }

    public Optional<FactorPair> getFactor() {
        return Optional.ofNullable(factor);
    }

    public long count(WorkerState state) {
        return outcomes.stream().filter(o -> o.state() == state).count();
    }
}
