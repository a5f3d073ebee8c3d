package org.chunksieve.scheduler;

/**
 * Lifecycle of a {@link WorkerTask}.
 * <pre>
 *   IDLE -&gt; DISPATCHED -&gt; RUNNING -&gt; SUCCEEDED | FAILED | TIMED_OUT
 * </pre>
 */
public enum WorkerState {
    IDLE,
    DISPATCHED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == TIMED_OUT;
    }
}
