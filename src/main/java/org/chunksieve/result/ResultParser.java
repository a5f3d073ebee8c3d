package org.chunksieve.result;

import java.math.BigInteger;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.chunksieve.program.SearchBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts candidates from the output of one engine run, line by line.
 * <p>
 * Recognized lines:
 * <ul>
 *   <li>{@code [MEAS] Measuring chunk <c> => <v>}: local value {@code v} of local chunk {@code c},
 *       recombined to {@code v + (blockStart + c) * chunkStates}</li>
 *   <li>{@code Factor found: 0x<hex>}: a direct factor report</li>
 * </ul>
 * Any other line is ignored. Repeated reports are forwarded every time; deduplication is
 * left to the caller because verification is cheap.
 * <p>
 * Not thread-safe; one parser belongs to one worker.
 */
public class ResultParser {

    private static final Logger log = LoggerFactory.getLogger(ResultParser.class);

    static final Pattern MEASUREMENT = Pattern.compile("\\[MEAS]\\s*Measuring chunk\\s+(\\d+)\\s*=>\\s*(\\d+)");
    static final Pattern FACTOR_REPORT = Pattern.compile("Factor found:\\s*0[xX]([0-9a-fA-F]+)");

    private final SearchBlock block;
    private final long chunkStates;
    private final BigInteger stateCount;
    private long linesRead;
    private long recognizedLines;

    /**
     * @param block       the block the engine run searched
     * @param chunkStates local states per chunk
     */
    public ResultParser(SearchBlock block, long chunkStates) {
        this.block = block;
        this.chunkStates = chunkStates;
        this.stateCount = BigInteger.valueOf(chunkStates);
    }

    /**
     * Scans one line of output.
     *
     * @param line the line, without terminator
     * @return the candidates found on the line, possibly empty
     */
    public List<Candidate> accept(String line) {
        linesRead++;

        Matcher measurement = MEASUREMENT.matcher(line);
        if (measurement.find()) {
            BigInteger localChunk = new BigInteger(measurement.group(1));
            BigInteger localValue = new BigInteger(measurement.group(2));
            if (localChunk.compareTo(block.activeChunks()) >= 0 || localValue.compareTo(stateCount) >= 0) {
                log.warn("Ignoring out-of-range measurement for {} (chunk {}, value {}): {}",
                        block, localChunk, localValue, line.strip());
                return List.of();
            }
            recognizedLines++;
            return List.of(new Candidate(recombine(block, chunkStates, localChunk, localValue),
                    Candidate.Source.MEASUREMENT));
        }

        Matcher factor = FACTOR_REPORT.matcher(line);
        if (factor.find()) {
            recognizedLines++;
            return List.of(new Candidate(new BigInteger(factor.group(1), 16), Candidate.Source.FACTOR_REPORT));
        }
        return List.of();
    }

    /**
     * Maps a local measurement back to the global candidate space:
     * {@code localValue + (blockStart + localChunk) * chunkStates}.
     */
    public static BigInteger recombine(SearchBlock block, long chunkStates, BigInteger localChunk, BigInteger localValue) {
        return block.blockStart().add(localChunk).multiply(BigInteger.valueOf(chunkStates)).add(localValue);
    }

    public long linesRead() {
        return linesRead;
    }

    public long recognizedLines() {
        return recognizedLines;
    }
}
