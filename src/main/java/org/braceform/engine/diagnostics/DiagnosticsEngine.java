package org.braceform.engine.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the warnings and errors of one formatting run.
 * <p>
 * The normalization passes never throw on malformed input; they degrade and report here
 * instead, leaving it to the caller whether a run with errors is acceptable.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     * @param message The description.
     * @param source The file or pass the error belongs to.
     * @param line The source line, or 0 if unknown.
     */
    public void reportError(String message, String source, int line) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.ERROR, message, source, line));
    }

    /**
     * Reports a warning.
     * @param message The description.
     * @param source The file or pass the warning belongs to.
     * @param line The source line, or 0 if unknown.
     */
    public void reportWarning(String message, String source, int line) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.WARNING, message, source, line));
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Diagnostic.Severity.ERROR);
    }

    public boolean hasWarnings() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Diagnostic.Severity.WARNING);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Formats all collected messages, one per line.
     * @return The summary, empty if nothing was reported.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic d : diagnostics) {
            sb.append(d).append(System.lineSeparator());
        }
        return sb.toString();
    }
}
