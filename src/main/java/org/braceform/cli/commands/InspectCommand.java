package org.braceform.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

import org.braceform.cli.CommandLineInterface;
import org.braceform.engine.api.FormatResult;
import org.braceform.engine.api.SourceFormatter;
import org.braceform.engine.output.ChunkDumper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Prints the normalized chunk stream of a file, one chunk per line, followed by the pass
 * counters and diagnostics.
 */
@Command(
    name = "inspect",
    mixinStandardHelpOptions = true,
    description = "Dump the normalized chunk stream of a file"
)
public class InspectCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InspectCommand.class);

    @Parameters(index = "0", paramLabel = "FILE", description = "File to inspect")
    private Path file;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            String source = Files.readString(file, StandardCharsets.UTF_8);
            FormatResult result = new SourceFormatter(parent.getPassOptions()).format(source, file.toString());

            out.print(new ChunkDumper().dump(result.store()));
            out.println();
            out.println("=== Counters ===");
            for (Map.Entry<String, Integer> counter : result.counters().entrySet()) {
                out.printf("%-24s %d%n", counter.getKey(), counter.getValue());
            }
            if (!result.diagnostics().getDiagnostics().isEmpty()) {
                out.println("=== Diagnostics ===");
                out.print(result.diagnostics().summary());
            }
            out.flush();
            return 0;
        } catch (IOException e) {
            log.error("Failed to read {}: {}", file, e.getMessage());
            err.println("Error: cannot read " + file + ": " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException | ConfigException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
