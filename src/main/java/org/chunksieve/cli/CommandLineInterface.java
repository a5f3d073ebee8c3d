package org.chunksieve.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.chunksieve.cli.commands.CompileCommand;
import org.chunksieve.cli.commands.FactorCommand;
import org.chunksieve.cli.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "chunksieve",
    mixinStandardHelpOptions = true,
    version = "Chunksieve 1.0",
    description = "Chunksieve - block-partitioned divisor search on an external chunk engine",
    subcommands = {
        FactorCommand.class,
        CompileCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "The engine is configured via chunksieve.engine.command in",
        "config/chunksieve.conf or the file given with --config; --engine overrides it."
    }
)
public class CommandLineInterface implements Callable<Integer> {

    static final String LOG_LEVEL_PATH = "chunksieve.logging.level";
    private static final String APPLICATION_LOGGER = "org.chunksieve";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/chunksieve.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("chunksieve");
        return commandLine;
    }

    /**
     * Returns the resolved configuration, loading it on first access.
     *
     * @throws IllegalStateException if the configuration file is missing or malformed
     */
    public Config getConfig() {
        if (config == null) {
            config = loadConfig();
            applyLogLevel(config);
        }
        return config;
    }

    private Config loadConfig() {
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
        try {
            return ConfigLoader.resolve(this.configFile, (level, message) -> {
                switch (level) {
                    case INFO -> logger.info(message);
                    case WARN -> logger.warn(message);
                }
            });
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(e.getMessage(), e);
        } catch (ConfigException e) {
            throw new IllegalStateException("Failed to load or parse configuration: " + e.getMessage(), e);
        }
    }

    private static void applyLogLevel(Config config) {
        if (!config.hasPath(LOG_LEVEL_PATH)) {
            return;
        }
        if (LoggerFactory.getLogger(APPLICATION_LOGGER) instanceof ch.qos.logback.classic.Logger logger) {
            logger.setLevel(ch.qos.logback.classic.Level.toLevel(config.getString(LOG_LEVEL_PATH),
                    ch.qos.logback.classic.Level.INFO));
        }
    }
}
