package org.chunksieve.scheduler;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import org.chunksieve.program.EngineLimits;
import org.chunksieve.program.RegisterLayout;

import com.typesafe.config.Config;

/**
 * Immutable parameters of a search run, shared read-only by all workers.
 *
 * @param chunkDepth        digits per chunk
 * @param iterations        refinement rounds per program
 * @param workers           maximum number of concurrently running engines
 * @param workerTimeout     deadline of a single engine run
 * @param searchTimeout     deadline of the whole search, or {@code null} for none
 * @param cancelGracePeriod time a cancelled engine gets before it is killed
 * @param engineCommand     engine executable and fixed leading arguments
 * @param workDirectory     directory for program files, or {@code null} for the system temp directory
 * @param importWeights     whether programs start with {@code IMPORT_WEIGHTS}
 * @param limits            engine capacities
 * @param registers         input register layout
 */
public record SearchSettings(
        int chunkDepth,
        int iterations,
        int workers,
        Duration workerTimeout,
        Duration searchTimeout,
        Duration cancelGracePeriod,
        List<String> engineCommand,
        Path workDirectory,
        boolean importWeights,
        EngineLimits limits,
        RegisterLayout registers) {

    public SearchSettings {
        limits.requireDepth(chunkDepth);
        if (iterations < 0) {
            throw new IllegalArgumentException("Iterations must be >= 0, got " + iterations);
        }
        if (workers < 1) {
            throw new IllegalArgumentException("Workers must be >= 1, got " + workers);
        }
        if (workerTimeout.isNegative() || workerTimeout.isZero()) {
            throw new IllegalArgumentException("Worker timeout must be positive, got " + workerTimeout);
        }
        if (searchTimeout != null && (searchTimeout.isNegative() || searchTimeout.isZero())) {
            searchTimeout = null;
        }
        engineCommand = List.copyOf(engineCommand);
        if (engineCommand.isEmpty()) {
            throw new IllegalArgumentException("Engine command must not be empty");
        }
    }

    /**
     * Reads the settings from the {@code chunksieve} section of the configuration.
     *
     * @param config the resolved application configuration
     * @return the settings
     * @throws com.typesafe.config.ConfigException if a required value is missing or malformed
     */
    public static SearchSettings fromConfig(Config config) {
        Config root = config.getConfig("chunksieve");
        Config engine = root.getConfig("engine");
        Config search = root.getConfig("search");
        Config limits = engine.getConfig("limits");
        Config registers = root.getConfig("registers");

        return new SearchSettings(
                search.getInt("chunk-depth"),
                search.getInt("iterations"),
                search.getInt("workers"),
                engine.getDuration("worker-timeout"),
                search.hasPath("timeout") ? search.getDuration("timeout") : null,
                engine.getDuration("cancel-grace-period"),
                engine.getStringList("command"),
                engine.hasPath("work-directory") ? Path.of(engine.getString("work-directory")) : null,
                engine.getBoolean("import-weights"),
                new EngineLimits(
                        limits.getInt("radix"),
                        limits.getInt("max-chunks"),
                        limits.getInt("max-depth"),
                        limits.getInt("max-instructions")),
                new RegisterLayout(
                        registers.getInt("offset"),
                        registers.getInt("modulus-base"),
                        registers.getInt("modulus-capacity")));
    }

    public long chunkStates() {
        return limits.chunkStates(chunkDepth);
    }

    public SearchSettings withChunkDepth(int value) {
        return new SearchSettings(value, iterations, workers, workerTimeout, searchTimeout, cancelGracePeriod,
                engineCommand, workDirectory, importWeights, limits, registers);
    }

    public SearchSettings withIterations(int value) {
        return new SearchSettings(chunkDepth, value, workers, workerTimeout, searchTimeout, cancelGracePeriod,
                engineCommand, workDirectory, importWeights, limits, registers);
    }

    public SearchSettings withWorkers(int value) {
        return new SearchSettings(chunkDepth, iterations, value, workerTimeout, searchTimeout, cancelGracePeriod,
                engineCommand, workDirectory, importWeights, limits, registers);
    }

    public SearchSettings withWorkerTimeout(Duration value) {
        return new SearchSettings(chunkDepth, iterations, workers, value, searchTimeout, cancelGracePeriod,
                engineCommand, workDirectory, importWeights, limits, registers);
    }

    public SearchSettings withSearchTimeout(Duration value) {
        return new SearchSettings(chunkDepth, iterations, workers, workerTimeout, value, cancelGracePeriod,
                engineCommand, workDirectory, importWeights, limits, registers);
    }

    public SearchSettings withEngineCommand(List<String> value) {
        return new SearchSettings(chunkDepth, iterations, workers, workerTimeout, searchTimeout, cancelGracePeriod,
                value, workDirectory, importWeights, limits, registers);
    }
}
