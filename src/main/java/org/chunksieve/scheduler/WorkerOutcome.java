package org.chunksieve.scheduler;

import org.chunksieve.program.SearchBlock;
import org.chunksieve.result.FactorPair;

/**
 * Terminal result of one worker.
 *
 * @param workerId the worker
 * @param block    the block it searched
 * @param state    one of {@link WorkerState#SUCCEEDED}, {@link WorkerState#FAILED}, {@link WorkerState#TIMED_OUT}
 * @param factor   the verified factorization, only for {@code SUCCEEDED}
 * @param reason   human-readable failure reason, {@code null} for {@code SUCCEEDED}
 */
public record WorkerOutcome(int workerId, SearchBlock block, WorkerState state, FactorPair factor, String reason) {

    public WorkerOutcome {
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("Outcome state must be terminal, got " + state);
        }
    }

    public static WorkerOutcome succeeded(int workerId, SearchBlock block, FactorPair factor) {
        return new WorkerOutcome(workerId, block, WorkerState.SUCCEEDED, factor, null);
    }

    public static WorkerOutcome failed(int workerId, SearchBlock block, String reason) {
        return new WorkerOutcome(workerId, block, WorkerState.FAILED, null, reason);
    }

    public static WorkerOutcome timedOut(int workerId, SearchBlock block, String reason) {
        return new WorkerOutcome(workerId, block, WorkerState.TIMED_OUT, null, reason);
    }
}
