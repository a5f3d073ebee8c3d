package org.chunksieve.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.util.Optional;

/**
 * Builds the chunksieve configuration for the command line.
 * <p>
 * Layers, strongest first:
 * <ol>
 *   <li>JVM system properties, e.g. {@code -Dchunksieve.search.workers=8}</li>
 *   <li>environment variables</li>
 *   <li>the user file, if one is found</li>
 *   <li>{@code reference.conf} shipped in the jar</li>
 * </ol>
 * The reference layer is merged unresolved, so its substitutions see the stronger layers.
 */
public final class ConfigLoader {

    static final String DEFAULT_FILE = "config/chunksieve.conf";
    static final String CONFIG_FILE_PROPERTY = "config.file";

    private ConfigLoader() {
    }

    /**
     * Severity of a resolution message.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives the messages produced while the user file is looked up.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        void log(MessageLevel level, String message);
    }

    /**
     * Looks up the user file and loads the layered configuration.
     * <p>
     * The file is taken from, in this order: {@code explicitFile} (the {@code --config}
     * option), the {@code config.file} system property, {@value #DEFAULT_FILE} below the
     * working directory. Without any, only the built-in defaults are used.
     *
     * @param explicitFile file given on the command line, or {@code null}
     * @param handler      receives which file was chosen
     * @return the resolved configuration
     * @throws IllegalArgumentException            if an explicitly named file does not exist
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or resolved
     */
    public static Config resolve(final File explicitFile, final ConfigMessageHandler handler) {
        Optional<File> userFile = locate(explicitFile, handler);
        return userFile.map(ConfigLoader::loadFromFile).orElseGet(ConfigLoader::loadDefaults);
    }

    private static Optional<File> locate(final File explicitFile, final ConfigMessageHandler handler) {
        if (explicitFile != null) {
            requireExists(explicitFile, "--config");
            handler.log(MessageLevel.INFO, "Using configuration file given by --config: " + explicitFile.getAbsolutePath());
            return Optional.of(explicitFile);
        }

        String property = System.getProperty(CONFIG_FILE_PROPERTY);
        if (property != null && !property.isBlank()) {
            File file = new File(property).getAbsoluteFile();
            requireExists(file, "-D" + CONFIG_FILE_PROPERTY);
            handler.log(MessageLevel.INFO, "Using configuration file given by -D" + CONFIG_FILE_PROPERTY + ": " + file);
            return Optional.of(file);
        }

        File local = new File(DEFAULT_FILE);
        if (local.isFile()) {
            handler.log(MessageLevel.INFO, "Using configuration file " + local.getAbsolutePath());
            return Optional.of(local);
        }

        handler.log(MessageLevel.WARN, "No " + DEFAULT_FILE + " in the working directory, using built-in defaults");
        return Optional.empty();
    }

    private static void requireExists(final File file, final String origin) {
        if (!file.exists()) {
            throw new IllegalArgumentException(
                    "Configuration file not found (" + origin + "): " + file.getAbsolutePath());
        }
    }

    /**
     * Loads {@code file} on top of the built-in defaults, below system properties and
     * environment variables.
     */
    public static Config loadFromFile(final File file) {
        return overrides()
                .withFallback(ConfigFactory.parseFile(file))
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    /**
     * Loads the built-in defaults below system properties and environment variables.
     */
    public static Config loadDefaults() {
        return overrides()
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    private static Config overrides() {
        return ConfigFactory.systemProperties().withFallback(ConfigFactory.systemEnvironment());
    }
}
