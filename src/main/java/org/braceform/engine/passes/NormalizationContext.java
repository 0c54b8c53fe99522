package org.braceform.engine.passes;

import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import org.braceform.engine.diagnostics.DiagnosticsEngine;
import org.braceform.engine.frontend.annotate.StructuralAnnotator;
import org.braceform.engine.store.ChunkStore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared state of one formatting run, handed to every pass in turn.
 * Not shared between runs; not thread-safe.
 */
public class NormalizationContext {

    private final ChunkStore store;
    private final StructuralAnnotator annotator;
    private final DiagnosticsEngine diagnostics;
    private final PassOptions options;
    private final Object2IntLinkedOpenHashMap<String> counters = new Object2IntLinkedOpenHashMap<>();

    public NormalizationContext(ChunkStore store, StructuralAnnotator annotator,
                                DiagnosticsEngine diagnostics, PassOptions options) {
        this.store = store;
        this.annotator = annotator;
        this.diagnostics = diagnostics;
        this.options = options;
    }

    /**
     * Convenience constructor that annotates a freshly lexed store.
     */
    public static NormalizationContext annotated(ChunkStore store, DiagnosticsEngine diagnostics, PassOptions options) {
        StructuralAnnotator annotator = new StructuralAnnotator(store, diagnostics);
        annotator.annotate();
        return new NormalizationContext(store, annotator, diagnostics, options);
    }

    public ChunkStore store() {
        return store;
    }

    public StructuralAnnotator annotator() {
        return annotator;
    }

    public DiagnosticsEngine diagnostics() {
        return diagnostics;
    }

    public PassOptions options() {
        return options;
    }

    /** Adds one to the named counter. */
    public void count(String counter) {
        counters.addTo(counter, 1);
    }

    public int counter(String counter) {
        return counters.getInt(counter);
    }

    /** @return Counter values in the order they were first incremented. */
    public Map<String, Integer> counters() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(counters));
    }
}
