package org.braceform.engine.passes.conditional;

import org.braceform.engine.diagnostics.DiagnosticsEngine;
import org.braceform.engine.frontend.lexer.Lexer;
import org.braceform.engine.model.Chunk;
import org.braceform.engine.store.ChunkStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ConditionalGroupScannerTest {

    private DiagnosticsEngine diagnostics;
    private ConditionalGroupScanner scanner;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
        scanner = new ConditionalGroupScanner(diagnostics);
    }

    private List<ConditionalGroup> scan(String source) {
        ChunkStore store = new Lexer(source, diagnostics).scan();
        return scanner.scan(store);
    }

    @Test
    void collectsTheDirectivesOfAChain() {
        List<ConditionalGroup> groups = scan("#if A\na\n#elif B\nb\n#else\nc\n#endif\n");

        assertThat(groups).hasSize(1);
        assertThat(groups.get(0).directives()).extracting(Chunk::text)
                .containsExactly("#if A", "#elif B", "#else", "#endif");
        assertThat(groups.get(0).branches()).hasSize(3);
        assertThat(groups.get(0).branches().get(1).directive().text()).isEqualTo("#elif B");
        assertThat(groups.get(0).branches().get(1).end().text()).isEqualTo("#else");
        assertThat(diagnostics.hasWarnings()).isFalse();
    }

    @Test
    void innerGroupsComeFirst() {
        List<ConditionalGroup> groups = scan("#ifdef A\n#ifndef B\nx\n#endif\n#endif\n");

        assertThat(groups).extracting(g -> g.opening().text()).containsExactly("#ifndef B", "#ifdef A");
    }

    @Test
    void orphanDirectivesAreReportedAndSkipped() {
        List<ConditionalGroup> groups = scan("#elif X\na\n#endif\n");

        assertThat(groups).isEmpty();
        assertThat(diagnostics.getDiagnostics()).hasSize(2);
    }

    @Test
    void elifAfterElseMakesTheGroupMalformed() {
        List<ConditionalGroup> groups = scan("#if A\na\n#else\nb\n#elif C\nc\n#endif\n");

        assertThat(groups).isEmpty();
        assertThat(diagnostics.hasWarnings()).isTrue();
    }

    @Test
    void unclosedGroupIsReported() {
        List<ConditionalGroup> groups = scan("#if A\na\n#else\nb\n");

        assertThat(groups).isEmpty();
        assertThat(diagnostics.getDiagnostics()).singleElement()
                .satisfies(d -> assertThat(d.message()).contains("never closed"));
    }

    @Test
    void groupNeedsTwoDirectives() {
        assertThatThrownBy(() -> new ConditionalGroup(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
