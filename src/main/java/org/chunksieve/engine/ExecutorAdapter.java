package org.chunksieve.engine;

import java.time.Duration;

import org.chunksieve.isa.Program;

/**
 * Runs programs on the external engine.
 */
public interface ExecutorAdapter {

    /**
     * Launches the engine on a program.
     * <p>
     * The returned stream owns the process and the program artifact; the caller must close it.
     *
     * @param program the program to run
     * @param timeout deadline for the whole run, measured from launch
     * @return the stream of output events
     * @throws ExecutorNotFoundException if the engine cannot be started
     * @throws EngineException           if the program artifact cannot be written
     */
    LineStream run(Program program, Duration timeout) throws EngineException;
}
