package org.chunksieve.engine;

/**
 * Base class of failures while running a program on the external engine.
 * <p>
 * This is a checked exception: a worker catches it, records the failure in its
 * outcome and leaves the other workers running.
 */
public class EngineException extends Exception {

    /**
     * Constructs a new exception with the specified detail message.
     *
     * @param message the detail message
     */
    public EngineException(String message) {
        super(message);
    }

    /**
     * Constructs a new exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause   the underlying cause
     */
    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
