package org.chunksieve.cli.commands;

import java.io.File;
import java.io.PrintWriter;
import java.math.BigInteger;
import java.util.concurrent.Callable;

import org.chunksieve.cli.CommandLineInterface;
import org.chunksieve.isa.Program;
import org.chunksieve.program.ProgramBuilder;
import org.chunksieve.program.SearchBlock;
import org.chunksieve.scheduler.Partitioner;
import org.chunksieve.scheduler.SearchSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command writing the program of a single search block to a file, for running the
 * engine by hand.
 */
@Command(
    name = "compile",
    mixinStandardHelpOptions = true,
    description = "Write the engine program searching one block of N's divisor space"
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    @Parameters(index = "0", paramLabel = "N", description = "Integer to factor, decimal or 0x-prefixed hexadecimal")
    private String modulus;

    @Option(names = {"-o", "--output"}, required = true, description = "Program file to write")
    private File output;

    @Option(names = {"-s", "--block-start"}, defaultValue = "0", description = "First global chunk of the block (default: ${DEFAULT-VALUE})")
    private BigInteger blockStart;

    @Option(names = {"-n", "--chunks"}, description = "Chunks in the block (default: all chunks up to sqrt(N), capped by the engine)")
    private BigInteger chunks;

    @Option(names = {"-d", "--depth"}, description = "Digits per chunk (overrides chunksieve.search.chunk-depth)")
    private Integer depth;

    @Option(names = {"-i", "--iterations"}, description = "Refinement rounds (overrides chunksieve.search.iterations)")
    private Integer iterations;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            BigInteger n = FactorCommand.parseModulus(modulus);
            SearchSettings settings = SearchSettings.fromConfig(parent.getConfig());
            if (depth != null) {
                settings = settings.withChunkDepth(depth);
            }
            if (iterations != null) {
                settings = settings.withIterations(iterations);
            }

            SearchBlock block = new SearchBlock(blockStart, chunks != null ? chunks : defaultChunks(n, settings));
            ProgramBuilder builder = new ProgramBuilder(settings.limits(), settings.registers(), settings.importWeights());
            Program program = builder.build(n, settings.chunkDepth(), block, settings.iterations());
            program.writeTo(output.toPath());

            out.printf("Wrote %s: %d instructions (%d bytes) for %s, candidates [%s, %s)%n",
                    output, program.size(), program.byteLength(), block,
                    block.firstCandidate(settings.chunkStates()),
                    block.endCandidate(settings.chunkStates(), Partitioner.searchLimit(n)));
            return 0;

        } catch (Exception e) {
            log.error("Compilation failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Chunks from the block start to the end of the search interval, capped by the engine.
     */
    private BigInteger defaultChunks(BigInteger n, SearchSettings settings) {
        BigInteger states = BigInteger.valueOf(settings.chunkStates());
        BigInteger totalChunks = Partitioner.searchLimit(n).add(states).subtract(BigInteger.ONE).divide(states);
        BigInteger remaining = totalChunks.subtract(blockStart);
        if (remaining.signum() <= 0) {
            throw new IllegalArgumentException("Block start " + blockStart + " lies beyond the last chunk " + totalChunks.subtract(BigInteger.ONE));
        }
        return remaining.min(BigInteger.valueOf(settings.limits().maxChunks()));
    }
}
