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

@Tag("unit")
class IfdefSqueezerTest {

    private static final String NESTED = """
            void f()
            {
            #if A


              a();

            #else

              b();

            #endif

              c();
            }
            """;

    private static final String TOP_LEVEL = """
            #if A

            int a;

            #endif
            """;

    private static String squeeze(String source, PassOptions options) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        ChunkStore store = new Lexer(source, diagnostics).scan();
        NormalizationContext context = NormalizationContext.annotated(store, diagnostics, options);
        new IfdefSqueezer().squeeze(context);
        return new ChunkRenderer().render(store);
    }

    private static PassOptions topLevel(boolean on) {
        return new PassOptions(true, true, SemicolonScope.VIRTUAL_BLOCKS, true, true, true, on, false);
    }

    @Test
    void removesBlankLinesAroundDirectivesInsideBraces() {
        assertThat(squeeze(NESTED, PassOptions.defaults())).isEqualTo("""
                void f()
                {
                #if A
                  a();
                #else
                  b();
                #endif

                  c();
                }
                """);
    }

    @Test
    void leavesTopLevelDirectivesAloneByDefault() {
        assertThat(squeeze(TOP_LEVEL, PassOptions.defaults())).isEqualTo(TOP_LEVEL);
    }

    @Test
    void squeezesTopLevelDirectivesWhenEnabled() {
        assertThat(squeeze(TOP_LEVEL, topLevel(true))).isEqualTo("#if A\nint a;\n#endif\n");
    }

    @Test
    void countsEveryShortenedRun() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        ChunkStore store = new Lexer(NESTED, diagnostics).scan();
        NormalizationContext context = NormalizationContext.annotated(store, diagnostics, PassOptions.defaults());

        int squeezed = new IfdefSqueezer().squeeze(context);

        assertThat(squeezed).isEqualTo(4);
        assertThat(context.counter(IfdefSqueezer.COUNTER)).isEqualTo(4);
    }
}
