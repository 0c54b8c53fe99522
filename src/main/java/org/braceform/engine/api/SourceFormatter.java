package org.braceform.engine.api;

import org.braceform.engine.diagnostics.DiagnosticsEngine;
import org.braceform.engine.frontend.lexer.Lexer;
import org.braceform.engine.output.ChunkRenderer;
import org.braceform.engine.passes.NormalizationContext;
import org.braceform.engine.passes.NormalizationPipeline;
import org.braceform.engine.passes.PassOptions;
import org.braceform.engine.store.ChunkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for formatting a source unit: lex, annotate, run the normalization pipeline,
 * render.
 * <p>
 * An instance holds no per-run state and may format many files, also concurrently; each call
 * builds its own store, diagnostics and context.
 */
public class SourceFormatter {

    private static final Logger log = LoggerFactory.getLogger(SourceFormatter.class);

    private final PassOptions options;
    private final NormalizationPipeline pipeline;

    public SourceFormatter() {
        this(PassOptions.defaults());
    }

    public SourceFormatter(PassOptions options) {
        this(options, NormalizationPipeline.standard());
    }

    public SourceFormatter(PassOptions options, NormalizationPipeline pipeline) {
        this.options = options;
        this.pipeline = pipeline;
    }

    public FormatResult format(String source) {
        return format(source, "<input>");
    }

    /**
     * Formats one source unit.
     *
     * @param source   The source text.
     * @param fileName The name reported in diagnostics.
     * @return The rendered text together with the normalized stream and its diagnostics.
     */
    public FormatResult format(String source, String fileName) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        ChunkStore store = new Lexer(source, diagnostics, fileName).scan();
        NormalizationContext context = NormalizationContext.annotated(store, diagnostics, options);
        pipeline.run(context);
        String text = new ChunkRenderer(options.emitVirtualSemicolons()).render(store);
        if (diagnostics.hasErrors()) {
            log.warn("Formatted {} with errors", fileName);
        } else {
            log.debug("Formatted {} ({} chunks)", fileName, store.size());
        }
        return new FormatResult(text, store, diagnostics, context.counters());
    }

    public PassOptions options() {
        return options;
    }
}
