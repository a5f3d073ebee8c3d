package org.chunksieve.engine;

/**
 * Thrown when the engine executable cannot be launched.
 */
public class ExecutorNotFoundException extends EngineException {

    public ExecutorNotFoundException(String executable, Throwable cause) {
        super("Engine executable could not be started: " + executable, cause);
    }
}
