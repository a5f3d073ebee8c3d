package org.chunksieve.cli.commands;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

import org.chunksieve.cli.CommandLineInterface;
import org.chunksieve.isa.Opcode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Smoke tests for the compile command.
 */
@Tag("unit")
class CompileCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    void testCommandParses() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        assertThat(cmdLine.getSubcommands()).containsKeys("compile", "factor", "help");
    }

    @Test
    void testHelpOutput() {
        execute("compile", "--help");

        String output = out.toString() + err.toString();
        assertThat(output).contains("compile");
        assertThat(output).contains("--block-start");
        assertThat(output).contains("--output");
    }

    @Test
    void testCompileWritesProgramFile() throws Exception {
        Path output = tempDir.resolve("block.qbin");

        int exitCode = execute("compile", "143", "--depth", "1", "--iterations", "1",
                "--block-start", "2", "--chunks", "2", "-o", output.toString());

        assertThat(exitCode)
            .describedAs("Exit code should be 0. stderr: %s, stdout: %s", err.toString(), out.toString())
            .isEqualTo(0);
        byte[] bytes = Files.readAllBytes(output);
        // 2 INIT + 2 modulus stores + 2 chunks x 4 + 2 MEASURE + HALT
        assertThat(bytes).hasSize(15 * 8);
        ByteBuffer words = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        assertThat(words.getLong(0) & 0xFFFF).isEqualTo(Opcode.INIT.code());
        assertThat(words.getLong(14 * 8) & 0xFFFF).isEqualTo(Opcode.HALT.code());
        assertThat(out.toString()).contains("15 instructions", "chunks [2, 4)", "candidates [6, 12)");
    }

    @Test
    void testCompileDefaultsToWholeRange() throws Exception {
        Path output = tempDir.resolve("all.qbin");

        int exitCode = execute("compile", "10403", "--depth", "2", "-o", output.toString());

        assertThat(exitCode).describedAs("stderr: %s", err).isEqualTo(0);
        assertThat(out.toString()).contains("chunks [0, 12)");
    }

    @Test
    void testCompileRejectsOversizedBlock() {
        int exitCode = execute("compile", "143", "--chunks", "5000", "-o", tempDir.resolve("x.qbin").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("4096");
    }

    private int execute(String... args) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine.execute(args);
    }
}
