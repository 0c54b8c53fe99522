package org.braceform.cli.commands;

import org.braceform.cli.CommandLineInterface;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Smoke tests for the format command.
 */
@Tag("unit")
public class FormatCommandTest {

    private static final String BRACELESS = """
            main()
            {
                if (ready)
                    go()
            }
            """;

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private CommandLine commandLine() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine;
    }

    @Test
    void testCommandParses() {
        assertThat(CommandLineInterface.createCommandLine().getSubcommands())
            .containsKeys("format", "inspect", "help");
    }

    @Test
    void testHelpOutput() {
        commandLine().execute("format", "--help");

        String output = out.toString() + err.toString();
        assertThat(output).contains("--in-place", "--strict", "--emit-vsemi");
    }

    @Test
    void testPrintsFormattedSource() throws Exception {
        Path sourceFile = tempDir.resolve("test.p");
        Files.writeString(sourceFile, BRACELESS);

        int exitCode = commandLine().execute("format", sourceFile.toString());

        assertThat(exitCode)
            .describedAs("stderr: %s", err.toString())
            .isEqualTo(0);
        assertThat(out.toString()).isEqualTo(BRACELESS);
    }

    @Test
    void testEmitVirtualSemicolons() throws Exception {
        Path sourceFile = tempDir.resolve("test.p");
        Files.writeString(sourceFile, BRACELESS);

        int exitCode = commandLine().execute("format", "--emit-vsemi", sourceFile.toString());

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("        go();\n");
    }

    @Test
    void testInPlaceRewritesFile() throws Exception {
        Path sourceFile = tempDir.resolve("test.p");
        Files.writeString(sourceFile, "main()\n{\n    if (ready)   \n        go()\n}\n");

        int exitCode = commandLine().execute("format", "-i", "--emit-vsemi", sourceFile.toString());

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).isEmpty();
        assertThat(Files.readString(sourceFile)).isEqualTo("main()\n{\n    if (ready)\n        go();\n}\n");
    }

    @Test
    void testStrictFailsOnStructuralErrors() throws Exception {
        Path sourceFile = tempDir.resolve("broken.p");
        Files.writeString(sourceFile, "main()\n{\n    go()\n");

        assertThat(commandLine().execute("format", sourceFile.toString())).isEqualTo(0);
        assertThat(commandLine().execute("format", "--strict", sourceFile.toString())).isEqualTo(2);
    }

    @Test
    void testNonexistentFileReturnsError() {
        int exitCode = commandLine().execute("format", tempDir.resolve("missing.p").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("missing.p");
    }

    @Test
    void testMissingConfigFileReturnsError() throws Exception {
        Path sourceFile = tempDir.resolve("test.p");
        Files.writeString(sourceFile, BRACELESS);

        int exitCode = commandLine().execute("-c", tempDir.resolve("none.conf").toString(),
            "format", sourceFile.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Configuration file not found");
    }

    @Test
    void testMissingFileArgument() {
        int exitCode = commandLine().execute("format");

        assertThat(exitCode).isNotEqualTo(0);
        assertThat(err.toString()).contains("FILE");
    }
}
