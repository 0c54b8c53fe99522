package org.braceform.engine.passes;

/**
 * One step of the normalization pipeline. Passes only add or flag chunks; they never
 * remove or reorder real tokens.
 */
public interface INormalizationPass {

    /**
     * @return A short, stable name used in logs and counters.
     */
    String name();

    /**
     * Decides whether the pass runs for the given options.
     *
     * @param options The run's options.
     * @return true if {@link #run(NormalizationContext)} should be called.
     */
    boolean isEnabled(PassOptions options);

    /**
     * Rewrites the context's chunk stream in place.
     *
     * @param context The run's store, annotator, diagnostics and options.
     */
    void run(NormalizationContext context);
}
