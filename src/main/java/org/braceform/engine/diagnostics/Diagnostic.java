package org.braceform.engine.diagnostics;

/**
 * A single message raised while normalizing a chunk stream.
 *
 * @param severity Error or warning.
 * @param message  Human-readable description.
 * @param source   Where the message originated (file name or pass name).
 * @param line     1-based source line, or 0 if unknown.
 */
public record Diagnostic(Severity severity, String message, String source, int line) {

    public enum Severity {
        WARNING,
        ERROR
    }

    @Override
    public String toString() {
        return severity + " [" + source + ":" + line + "] " + message;
    }
}
