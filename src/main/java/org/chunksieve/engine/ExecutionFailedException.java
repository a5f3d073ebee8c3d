package org.chunksieve.engine;

/**
 * Thrown when the engine exits with a non-zero code without producing any
 * recognizable report.
 */
public class ExecutionFailedException extends EngineException {

    private final int exitCode;

    public ExecutionFailedException(int exitCode) {
        super("Engine exited with code " + exitCode + " without reporting any result");
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
