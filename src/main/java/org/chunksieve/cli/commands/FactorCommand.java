package org.chunksieve.cli.commands;

import java.io.PrintWriter;
import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

import org.chunksieve.cli.CommandLineInterface;
import org.chunksieve.scheduler.SearchResult;
import org.chunksieve.scheduler.SearchScheduler;
import org.chunksieve.scheduler.SearchSettings;
import org.chunksieve.scheduler.WorkerOutcome;
import org.chunksieve.scheduler.WorkerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command searching a factor of an integer with the configured engine.
 * <p>
 * Exit codes: 0 when a verified factor was found, 2 when the search finished without
 * one, 1 on errors.
 */
@Command(
    name = "factor",
    mixinStandardHelpOptions = true,
    description = "Search a non-trivial factor of N across a pool of engine workers"
)
public class FactorCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(FactorCommand.class);

    static final int EXIT_NOT_FOUND = 2;

    @Parameters(
        index = "0",
        paramLabel = "N",
        description = "Integer to factor, decimal or 0x-prefixed hexadecimal"
    )
    private String modulus;

    @Option(names = {"-d", "--depth"}, description = "Digits per chunk (overrides chunksieve.search.chunk-depth)")
    private Integer depth;

    @Option(names = {"-w", "--workers"}, description = "Concurrent engine workers (overrides chunksieve.search.workers)")
    private Integer workers;

    @Option(names = {"-i", "--iterations"}, description = "Refinement rounds per program (overrides chunksieve.search.iterations)")
    private Integer iterations;

    @Option(names = {"-e", "--engine"}, description = "Engine executable (overrides chunksieve.engine.command)")
    private String engine;

    @Option(names = {"--worker-timeout"}, description = "Per-engine timeout in seconds")
    private Long workerTimeoutSeconds;

    @Option(names = {"--timeout"}, description = "Overall search timeout in seconds, 0 for none")
    private Long searchTimeoutSeconds;

    @Option(names = {"-v", "--verbose"}, description = "Print the outcome of every worker")
    private boolean verbose;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            BigInteger n = parseModulus(modulus);
            SearchSettings settings = applyOverrides(SearchSettings.fromConfig(parent.getConfig()));

            SearchResult result = SearchScheduler.create(settings).search(n);

            if (verbose) {
                for (WorkerOutcome outcome : result.outcomes()) {
                    out.printf("  worker %d %s: %s%n", outcome.workerId(), outcome.block(),
                            outcome.state() == WorkerState.SUCCEEDED ? outcome.factor() : outcome.state() + " (" + outcome.reason() + ")");
                }
            }
            if (result.isFound()) {
                out.printf("%s = %s%n", n, result.factor());
                return 0;
            }
            out.printf("No factor of %s found%s (%d blocks searched). Try more iterations or a larger depth.%n",
                    n, result.timedOut() ? " before the search timeout" : "", result.outcomes().size());
            return EXIT_NOT_FOUND;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Error: search interrupted");
            return 1;
        } catch (Exception e) {
            log.error("Factor search failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private SearchSettings applyOverrides(SearchSettings settings) {
        SearchSettings result = settings;
        if (depth != null) {
            result = result.withChunkDepth(depth);
        }
        if (workers != null) {
            result = result.withWorkers(workers);
        }
        if (iterations != null) {
            result = result.withIterations(iterations);
        }
        if (engine != null) {
            result = result.withEngineCommand(List.of(engine));
        }
        if (workerTimeoutSeconds != null) {
            result = result.withWorkerTimeout(Duration.ofSeconds(workerTimeoutSeconds));
        }
        if (searchTimeoutSeconds != null) {
            result = result.withSearchTimeout(Duration.ofSeconds(searchTimeoutSeconds));
        }
        return result;
    }

    /**
     * Parses a decimal or {@code 0x}-prefixed hexadecimal integer of at least 2.
     *
     * @throws IllegalArgumentException if the text is not such an integer
     */
    static BigInteger parseModulus(String text) {
        String trimmed = text.strip().replace("_", "");
        BigInteger value;
        try {
            value = trimmed.startsWith("0x") || trimmed.startsWith("0X")
                    ? new BigInteger(trimmed.substring(2), 16)
                    : new BigInteger(trimmed);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not an integer: " + text);
        }
        if (value.compareTo(BigInteger.TWO) < 0) {
            throw new IllegalArgumentException("N must be >= 2, got " + value);
        }
        return value;
    }
}
