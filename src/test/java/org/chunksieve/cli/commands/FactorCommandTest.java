package org.chunksieve.cli.commands;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.chunksieve.cli.CommandLineInterface;
import org.chunksieve.testing.EngineCommands;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.typesafe.config.ConfigRenderOptions;
import com.typesafe.config.ConfigValueFactory;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the factor command, running the simulated engine.
 */
@Tag("integration")
class FactorCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    void factor_printsVerifiedFactorization() throws Exception {
        int exitCode = execute("--config", simulatedConfig().toString(), "factor", "21", "--depth", "2", "--workers", "1");

        assertThat(exitCode)
            .describedAs("stderr: %s, stdout: %s", err, out)
            .isEqualTo(0);
        assertThat(out.toString()).containsAnyOf("21 = 3 x 7", "21 = 7 x 3");
    }

    @Test
    void factor_acceptsHexModulusAndVerboseOutput() throws Exception {
        int exitCode = execute("--config", simulatedConfig().toString(),
                "factor", "0x28A3", "-d", "2", "-w", "3", "-i", "2", "--verbose");

        assertThat(exitCode).describedAs("stderr: %s", err).isEqualTo(0);
        assertThat(out.toString()).contains("10403 = 101 x 103");
        assertThat(out.toString()).contains("worker 2 chunks [8, 12)");
    }

    @Test
    void factor_withoutResult_exitsWithNotFoundCode() throws Exception {
        int exitCode = execute("--config", simulatedConfig().toString(), "factor", "10007", "--depth", "2");

        assertThat(exitCode).isEqualTo(FactorCommand.EXIT_NOT_FOUND);
        assertThat(out.toString()).contains("No factor of 10007 found");
    }

    @Test
    void factor_engineOverride_replacesConfiguredCommand() throws Exception {
        Path missing = tempDir.resolve("missing-engine");

        int exitCode = execute("--config", simulatedConfig().toString(),
                "factor", "21", "--depth", "2", "--workers", "1", "--engine", missing.toString(), "--verbose");

        assertThat(exitCode).isEqualTo(FactorCommand.EXIT_NOT_FOUND);
        assertThat(out.toString()).contains("could not be started");
    }

    @Test
    void factor_invalidModulus_fails() throws Exception {
        int exitCode = execute("--config", simulatedConfig().toString(), "factor", "1");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("N must be >= 2");
    }

    @Test
    void factor_missingConfigFile_fails() {
        int exitCode = execute("--config", tempDir.resolve("absent.conf").toString(), "factor", "21");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Configuration file not found");
    }

    @Test
    void parseModulus_acceptsDecimalAndHex() {
        assertThat(FactorCommand.parseModulus("143")).isEqualTo(BigInteger.valueOf(143));
        assertThat(FactorCommand.parseModulus("0x8F")).isEqualTo(BigInteger.valueOf(143));
        assertThat(FactorCommand.parseModulus("1_000_003")).isEqualTo(BigInteger.valueOf(1_000_003));
        assertThatThrownBy(() -> FactorCommand.parseModulus("abc"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Not an integer");
    }

    private int execute(String... args) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine.execute(args);
    }

    private Path simulatedConfig() throws Exception {
        List<String> command = EngineCommands.simulated();
        Path config = tempDir.resolve("chunksieve.conf");
        Files.writeString(config, String.join("\n",
                "chunksieve.engine.command = " + ConfigValueFactory.fromIterable(command).render(ConfigRenderOptions.concise()),
                "chunksieve.engine.work-directory = " + ConfigValueFactory.fromAnyRef(tempDir.toString()).render(ConfigRenderOptions.concise()),
                "chunksieve.search.iterations = 2",
                "chunksieve.search.workers = 2",
                "chunksieve.logging.level = WARN",
                ""));
        return config;
    }
}
