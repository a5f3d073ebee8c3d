package org.chunksieve.result;

import org.chunksieve.engine.EngineException;

/**
 * Thrown when an engine run completed without a single recognizable report line.
 */
public class ParseEmptyException extends EngineException {

    public ParseEmptyException(long linesRead) {
        super("Engine output contained no measurement or factor report (" + linesRead + " lines read)");
    }
}
