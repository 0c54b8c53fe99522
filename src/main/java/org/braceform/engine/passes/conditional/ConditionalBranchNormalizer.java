package org.braceform.engine.passes.conditional;

import org.braceform.engine.model.Chunk;
import org.braceform.engine.passes.INormalizationPass;
import org.braceform.engine.passes.NormalizationContext;
import org.braceform.engine.passes.PassOptions;
import org.braceform.engine.store.ChunkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies one layout decision across the branches of a conditional group when the branches
 * are structurally parallel. The first branch is the reference; its line breaks around the
 * directives and the spacing inside its statements are carried to the other branches.
 * Groups whose branches differ in shape are left alone.
 * <p>
 * Blank lines around directives are squeezed first, so the squeezed counts are what get
 * carried.
 */
public class ConditionalBranchNormalizer implements INormalizationPass {

    private static final Logger log = LoggerFactory.getLogger(ConditionalBranchNormalizer.class);

    public static final String COUNTER_PARALLEL = "conditionals.parallel";
    public static final String COUNTER_ASYMMETRIC = "conditionals.asymmetric";

    private final IfdefSqueezer squeezer;

    public ConditionalBranchNormalizer() {
        this(new IfdefSqueezer());
    }

    ConditionalBranchNormalizer(IfdefSqueezer squeezer) {
        this.squeezer = squeezer;
    }

    @Override
    public String name() {
        return "conditional-normalizer";
    }

    @Override
    public boolean isEnabled(PassOptions options) {
        return options.normalizeConditionals() || options.squeezeIfdef();
    }

    @Override
    public void run(NormalizationContext context) {
        PassOptions options = context.options();
        if (options.squeezeIfdef()) {
            squeezer.squeeze(context);
        }
        if (!options.normalizeConditionals()) {
            return;
        }
        List<ConditionalGroup> groups = new ConditionalGroupScanner(context.diagnostics()).scan(context.store());
        for (ConditionalGroup group : groups) {
            if (normalize(context, group)) {
                context.count(COUNTER_PARALLEL);
            } else {
                context.count(COUNTER_ASYMMETRIC);
            }
        }
    }

    /**
     * Normalizes one group.
     *
     * @param context The run.
     * @param group   The group.
     * @return true if the group was parallel and the reference layout was applied.
     */
    public boolean normalize(NormalizationContext context, ConditionalGroup group) {
        ChunkStore store = context.store();
        List<BranchLayout> layouts = new ArrayList<>();
        for (ConditionalGroup.Branch branch : group.branches()) {
            Optional<BranchLayout> layout = BranchLayout.analyze(store, branch);
            if (layout.isEmpty()) {
                log.debug("Group at line {} has nested directives; left as it is", group.opening().line());
                return false;
            }
            layouts.add(layout.get());
        }
        if (!isParallel(layouts)) {
            log.debug("Group at line {} has branches of different shape; left as it is", group.opening().line());
            return false;
        }

        BranchLayout reference = layouts.get(0);
        Chunk commentGap = layouts.stream()
                .map(BranchLayout::leadingCommentNewline)
                .filter(nl -> nl != null)
                .findFirst()
                .orElse(null);
        int commentGapCount = commentGap != null ? commentGap.getNlCount() : 1;

        for (BranchLayout branch : layouts) {
            if (branch.leadingCommentNewline() != null) {
                branch.leadingCommentNewline().setNlCount(commentGapCount);
            }
            if (branch == reference) {
                continue;
            }
            copyNewlines(reference.newlineAfterDirective(), branch.newlineAfterDirective());
            copyNewlines(reference.newlineBeforeEnd(), branch.newlineBeforeEnd());
            copySpacing(store, reference, branch);
        }
        log.debug("Normalized {} parallel branch(es) of group at line {}", layouts.size(), group.opening().line());
        return true;
    }

    private static boolean isParallel(List<BranchLayout> layouts) {
        if (layouts.size() < 2) {
            return false;
        }
        BranchLayout first = layouts.get(0);
        if (first.shape().isEmpty()) {
            return false;
        }
        return layouts.stream().allMatch(first::isParallelTo);
    }

    private static void copyNewlines(Chunk from, Chunk to) {
        if (from != null && to != null) {
            to.setNlCount(from.getNlCount());
        }
    }

    private static void copySpacing(ChunkStore store, BranchLayout reference, BranchLayout branch) {
        for (int s = 0; s < reference.statements().size(); s++) {
            BranchLayout.Statement ref = reference.statements().get(s);
            BranchLayout.Statement target = branch.statements().get(s);
            for (int k = 0; k < ref.chunks().size(); k++) {
                Chunk from = ref.chunks().get(k);
                Chunk to = target.chunks().get(k);
                if (from.isVirtual() || to.isVirtual()) {
                    continue;
                }
                if (!isLineLeading(store, from) && !isLineLeading(store, to)) {
                    to.setWhitespaceBefore(from.getWhitespaceBefore());
                }
            }
            if (ref.trailingComment() != null && target.trailingComment() != null) {
                target.trailingComment().setWhitespaceBefore(ref.trailingComment().getWhitespaceBefore());
            }
        }
    }

    private static boolean isLineLeading(ChunkStore store, Chunk chunk) {
        Chunk prev = store.prevMatching(chunk, c -> !c.isVirtual());
        return prev == null || prev.isNewline();
    }
}
