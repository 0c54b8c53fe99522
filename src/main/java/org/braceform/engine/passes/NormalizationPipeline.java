package org.braceform.engine.passes;

import org.braceform.engine.passes.braces.BraceVirtualizationPass;
import org.braceform.engine.passes.conditional.ConditionalBranchNormalizer;
import org.braceform.engine.passes.vsemi.VirtualSemicolonPass;
import org.braceform.engine.passes.vsemi.VirtualSemicolonScrub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs the passes strictly in sequence against one chunk stream. Each pass depends on the
 * structural markers the previous one finalized, so the order is fixed at construction.
 */
public class NormalizationPipeline {

    private static final Logger log = LoggerFactory.getLogger(NormalizationPipeline.class);

    private final List<INormalizationPass> passes;

    public NormalizationPipeline(List<INormalizationPass> passes) {
        this.passes = List.copyOf(passes);
    }

    /**
     * Creates the standard pipeline: brace virtualization, virtual semicolon insertion,
     * virtual semicolon scrub, conditional-branch normalization.
     *
     * @return A new pipeline instance.
     */
    public static NormalizationPipeline standard() {
        return new NormalizationPipeline(List.of(
                new BraceVirtualizationPass(),
                new VirtualSemicolonPass(),
                new VirtualSemicolonScrub(),
                new ConditionalBranchNormalizer()
        ));
    }

    /**
     * Runs every enabled pass in order.
     *
     * @param context The run to normalize.
     */
    public void run(NormalizationContext context) {
        for (INormalizationPass pass : passes) {
            if (!pass.isEnabled(context.options())) {
                log.debug("Pass '{}' disabled", pass.name());
                continue;
            }
            log.debug("Running pass '{}'", pass.name());
            pass.run(context);
        }
        log.info("Normalized {} chunks: {}", context.store().size(), context.counters());
    }

    public List<INormalizationPass> passes() {
        return passes;
    }
}
