package org.chunksieve.engine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.chunksieve.isa.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ExecutorAdapter} that launches the engine as an operating system process.
 * <p>
 * Each run writes the program to a uniquely named temporary file, starts
 * {@code command + [programFile]} with stderr merged into stdout, and hands both the
 * process and the file to a {@link ProcessLineStream}, which deletes the file on close.
 * Thread-safe: concurrent runs share no state.
 */
public class ProcessExecutorAdapter implements ExecutorAdapter {

    private static final Logger log = LoggerFactory.getLogger(ProcessExecutorAdapter.class);

    private static final String FILE_PREFIX = "chunksieve-";
    private static final String FILE_SUFFIX = ".qbin";

    private final List<String> command;
    private final Path workDirectory;
    private final Duration gracePeriod;

    /**
     * @param command       engine executable and fixed leading arguments
     * @param workDirectory directory for program files, or {@code null} for the system temp directory
     * @param gracePeriod   time a cancelled engine gets to exit before it is killed
     */
    public ProcessExecutorAdapter(List<String> command, Path workDirectory, Duration gracePeriod) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Engine command must not be empty");
        }
        this.command = List.copyOf(command);
        this.workDirectory = workDirectory;
        this.gracePeriod = gracePeriod;
    }

    @Override
    public LineStream run(Program program, Duration timeout) throws EngineException {
        Path programFile;
        try {
            programFile = workDirectory == null
                    ? Files.createTempFile(FILE_PREFIX, FILE_SUFFIX)
                    : Files.createTempFile(workDirectory, FILE_PREFIX, FILE_SUFFIX);
        } catch (IOException e) {
            throw new EngineException("Failed to create program file: " + e.getMessage(), e);
        }

        try {
            program.writeTo(programFile);
        } catch (IOException e) {
            deleteProgramFile(programFile);
            throw new EngineException("Failed to write program file " + programFile + ": " + e.getMessage(), e);
        }

        List<String> args = new ArrayList<>(command);
        args.add(programFile.toAbsolutePath().toString());

        Process process;
        try {
            ProcessBuilder pb = new ProcessBuilder(args);
            pb.redirectErrorStream(true);
            process = pb.start();
        } catch (IOException e) {
            deleteProgramFile(programFile);
            throw new ExecutorNotFoundException(command.get(0), e);
        }

        log.debug("Started engine pid={} on {} ({} instructions, timeout {} ms)",
                process.pid(), programFile.getFileName(), program.size(), timeout.toMillis());
        return new ProcessLineStream(process, programFile, timeout, gracePeriod);
    }

    static void deleteProgramFile(Path programFile) {
        try {
            Files.deleteIfExists(programFile);
        } catch (IOException e) {
            log.warn("Failed to delete program file {}: {}", programFile, e.getMessage());
        }
    }
}
