package org.braceform.engine.passes.conditional;

import org.braceform.engine.diagnostics.DiagnosticsEngine;
import org.braceform.engine.frontend.lexer.Lexer;
import org.braceform.engine.output.ChunkRenderer;
import org.braceform.engine.passes.NormalizationContext;
import org.braceform.engine.passes.PassOptions;
import org.braceform.engine.passes.SemicolonScope;
import org.braceform.engine.store.ChunkStore;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for pairing the branches of conditional groups.
 */
@Tag("unit")
class ConditionalBranchNormalizerTest {

    private final ConditionalBranchNormalizer normalizer = new ConditionalBranchNormalizer();

    private NormalizationContext context;

    private String normalize(String source) {
        return normalize(source, PassOptions.defaults());
    }

    private String normalize(String source, PassOptions options) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        ChunkStore store = new Lexer(source, diagnostics).scan();
        context = NormalizationContext.annotated(store, diagnostics, options);
        normalizer.run(context);
        return new ChunkRenderer().render(store);
    }

    @Test
    void parallelBranchesTakeTheLayoutOfTheFirst() {
        String source = "\n#if defined(A)\n\n// Comment\nextern int ax;\n\n"
                + "#elif defined(B)\nextern  int bx;\n\n"
                + "#else\n\n\nextern int cx;\n#endif\n";

        String result = normalize(source);

        assertThat(result).isEqualTo("\n#if defined(A)\n\n// Comment\nextern int ax;\n\n"
                + "#elif defined(B)\n\nextern int bx;\n\n"
                + "#else\n\nextern int cx;\n\n#endif\n");
        assertThat(context.counter(ConditionalBranchNormalizer.COUNTER_PARALLEL)).isEqualTo(1);
    }

    @Test
    void leadingCommentGapFollowsTheFirstCommentedBranch() {
        String result = normalize("#if A\n// one\n\nx();\n#elif B\ny();\n#else\n// three\nz();\n#endif\n");

        assertThat(result).isEqualTo("#if A\n// one\n\nx();\n#elif B\ny();\n#else\n// three\n\nz();\n#endif\n");
    }

    @Test
    void spacingInsideStatementsAndTrailingCommentsIsCopied() {
        String result = normalize("#if A\nx = f(1);  // a\n#else\ny=g( 2 ); // b\n#endif\n");

        assertThat(result).isEqualTo("#if A\nx = f(1);  // a\n#else\ny = g(2);  // b\n#endif\n");
    }

    @Test
    void asymmetricBranchesAreLeftAlone() {
        String source = "#if A\nx = 1;\n\n\ny = 2;\n#else\n\n\nz=3;\n#endif\n";

        assertThat(normalize(source)).isEqualTo(source);
        assertThat(context.counter(ConditionalBranchNormalizer.COUNTER_ASYMMETRIC)).isEqualTo(1);
        assertThat(context.counter(ConditionalBranchNormalizer.COUNTER_PARALLEL)).isZero();
    }

    @Test
    void branchesWithNestedGroupsAreNotCompared() {
        String source = "#if A\n#if B\nb1;\n#else\n\n\nb2;\n#endif\n#else\nc;\n#endif\n";

        String result = normalize(source);

        // the inner group is parallel, the outer one contains directives
        assertThat(result).isEqualTo("#if A\n#if B\nb1;\n#else\nb2;\n#endif\n#else\nc;\n#endif\n");
        assertThat(context.counter(ConditionalBranchNormalizer.COUNTER_PARALLEL)).isEqualTo(1);
        assertThat(context.counter(ConditionalBranchNormalizer.COUNTER_ASYMMETRIC)).isEqualTo(1);
    }

    @Test
    void orphanDirectivesAreReportedAndNothingIsPaired() {
        String source = "#elif X\na;\n\n\n#else\nb;\n#endif\n";

        assertThat(normalize(source)).isEqualTo(source);
        assertThat(context.diagnostics().hasWarnings()).isTrue();
        assertThat(context.diagnostics().hasErrors()).isFalse();
    }

    @Test
    void emptyBranchesAreNotParallel() {
        String source = "#if A\n\n#else\n\n\n#endif\n";

        assertThat(normalize(source)).isEqualTo(source);
    }

    @Test
    void pairingCanBeSwitchedOffWhileSqueezeStays() {
        PassOptions squeezeOnly = new PassOptions(true, true, SemicolonScope.VIRTUAL_BLOCKS, true, false, true, true, false);
        String source = "#if A\n\nx;\n#else\ny  =  1;\n\n#endif\n";

        assertThat(normalize(source, squeezeOnly)).isEqualTo("#if A\nx;\n#else\ny  =  1;\n#endif\n");
        assertThat(normalizer.isEnabled(squeezeOnly)).isTrue();
        assertThat(normalizer.isEnabled(new PassOptions(true, true, SemicolonScope.VIRTUAL_BLOCKS,
                true, false, false, false, false))).isFalse();
    }
}
