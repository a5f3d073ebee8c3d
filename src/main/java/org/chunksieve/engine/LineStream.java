package org.chunksieve.engine;

/**
 * Incremental view of one engine run.
 * <p>
 * {@link #next()} is called by the owning worker only. {@link #cancel()} may be called
 * from any thread and makes a blocked {@code next()} return the final
 * {@link EngineEvent.Exited} event once the process is gone.
 */
public interface LineStream extends AutoCloseable {

    /**
     * Waits for the next event.
     *
     * @return the next line, or the exit event after the last line
     * @throws TimedOutException    if the run's deadline elapsed; the process is destroyed
     * @throws InterruptedException if the calling thread is interrupted while waiting
     * @throws IllegalStateException if called after the exit event was returned
     */
    EngineEvent next() throws TimedOutException, InterruptedException;

    /**
     * Requests termination of the engine process. The process is killed forcibly if it
     * has not exited after the grace period. Does not block. Idempotent.
     */
    void cancel();

    /**
     * Kills the process if still alive and releases the program file. Idempotent.
     */
    @Override
    void close();
}
