package org.chunksieve.engine;

import java.time.Duration;

/**
 * Thrown when an engine run exceeds its deadline. The process has already been
 * destroyed when this exception is raised.
 */
public class TimedOutException extends EngineException {

    private final Duration timeout;

    public TimedOutException(Duration timeout) {
        super("Engine run exceeded its timeout of " + timeout.toMillis() + " ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
