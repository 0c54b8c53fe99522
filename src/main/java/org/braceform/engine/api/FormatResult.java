package org.braceform.engine.api;

import org.braceform.engine.diagnostics.DiagnosticsEngine;
import org.braceform.engine.store.ChunkStore;

import java.util.Map;

/**
 * The outcome of formatting one source unit.
 *
 * @param text        The rendered text.
 * @param store       The normalized chunk stream, virtual chunks included.
 * @param diagnostics Everything reported while lexing, annotating and normalizing.
 * @param counters    Per-pass insertion counters in the order they were first incremented.
 */
public record FormatResult(String text, ChunkStore store, DiagnosticsEngine diagnostics,
                           Map<String, Integer> counters) {

    public boolean hasErrors() {
        return diagnostics.hasErrors();
    }
}
