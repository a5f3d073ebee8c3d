package org.chunksieve.engine;

/**
 * An event read from a running engine: either one line of output or the process exit.
 * {@link Exited} is always the last event of a stream.
 */
public interface EngineEvent {

    /**
     * One line of engine output, without its line terminator.
     *
     * @param text the line
     */
    record Line(String text) implements EngineEvent {
    }

    /**
     * The engine process has terminated and its output is fully drained.
     *
     * @param exitCode the process exit code
     */
    record Exited(int exitCode) implements EngineEvent {
    }
}
