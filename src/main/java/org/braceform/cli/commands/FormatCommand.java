package org.braceform.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.braceform.cli.CommandLineInterface;
import org.braceform.engine.api.FormatResult;
import org.braceform.engine.api.SourceFormatter;
import org.braceform.engine.diagnostics.Diagnostic;
import org.braceform.engine.passes.PassOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Formats source files and prints the result, or rewrites the files in place.
 * <p>
 * Exit codes: 0 on success, 1 if a file cannot be read or written or the configuration is
 * invalid, 2 if {@code --strict} is given and a file has structural errors.
 */
@Command(
    name = "format",
    mixinStandardHelpOptions = true,
    description = "Format source files"
)
public class FormatCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(FormatCommand.class);

    static final int EXIT_IO_OR_CONFIG = 1;
    static final int EXIT_STRUCTURAL_ERRORS = 2;

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "Files to format")
    private List<Path> files;

    @Option(names = {"-i", "--in-place"}, description = "Rewrite the files instead of printing them")
    private boolean inPlace;

    @Option(names = {"--strict"}, description = "Exit with code 2 if a file has structural errors")
    private boolean strict;

    @Option(names = {"--emit-vsemi"}, description = "Render visible virtual semicolons as ';'")
    private Boolean emitVirtualSemicolons;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        PassOptions options;
        try {
            options = parent.getPassOptions();
        } catch (IllegalArgumentException | ConfigException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_IO_OR_CONFIG;
        }
        if (emitVirtualSemicolons != null) {
            options = options.withEmitVirtualSemicolons(emitVirtualSemicolons);
        }
        SourceFormatter formatter = new SourceFormatter(options);

        boolean structuralErrors = false;
        for (Path file : files) {
            FormatResult result;
            try {
                String source = Files.readString(file, StandardCharsets.UTF_8);
                result = formatter.format(source, file.toString());
                if (inPlace) {
                    Files.writeString(file, result.text(), StandardCharsets.UTF_8);
                    log.info("Formatted {}", file);
                } else {
                    out.print(result.text());
                }
            } catch (IOException e) {
                log.error("Failed to format {}: {}", file, e.getMessage());
                err.println("Error: cannot process " + file + ": " + e.getMessage());
                return EXIT_IO_OR_CONFIG;
            }
            for (Diagnostic d : result.diagnostics().getDiagnostics()) {
                if (d.severity() == Diagnostic.Severity.ERROR) {
                    log.error("{}", d);
                } else {
                    log.warn("{}", d);
                }
            }
            structuralErrors |= result.hasErrors();
        }
        out.flush();
        return strict && structuralErrors ? EXIT_STRUCTURAL_ERRORS : 0;
    }
}
