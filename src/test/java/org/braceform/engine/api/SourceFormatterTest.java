package org.braceform.engine.api;

import org.braceform.engine.model.Chunk;
import org.braceform.engine.model.ChunkType;
import org.braceform.engine.passes.PassOptions;
import org.braceform.engine.passes.SemicolonScope;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests: lexing, all passes and rendering on complete sources.
 */
@Tag("integration")
class SourceFormatterTest {

    private static String fixture(String name) throws IOException {
        try (InputStream in = SourceFormatterTest.class.getResourceAsStream("/fixtures/" + name)) {
            assertThat(in).as("fixture %s", name).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void squeezeFixtureIsStable() throws IOException {
        String expected = fixture("squeeze_ifdef.cpp");

        FormatResult result = new SourceFormatter().format(expected, "squeeze_ifdef.cpp");

        assertThat(result.text()).isEqualTo(expected);
        assertThat(result.hasErrors()).isFalse();
    }

    @Test
    void perturbedConditionalsAreNormalizedToTheFixture() throws IOException {
        FormatResult result = new SourceFormatter().format(fixture("squeeze_ifdef.in.cpp"));

        assertThat(result.text()).isEqualTo(fixture("squeeze_ifdef.cpp"));
        assertThat(result.counters()).containsEntry("conditionals.parallel", 3);
    }

    @Test
    void braceOptionalSourceGetsVirtualSemicolons() throws IOException {
        PassOptions options = PassOptions.defaults().withEmitVirtualSemicolons(true);

        FormatResult result = new SourceFormatter(options).format(fixture("pawn_braceless.p"));

        assertThat(result.text()).isEqualTo(fixture("pawn_braceless.expected.p"));
        assertThat(result.diagnostics().getDiagnostics()).isEmpty();
    }

    @Test
    void virtualChunksAreInvisibleByDefault() throws IOException {
        String source = fixture("pawn_braceless.p");

        assertThat(new SourceFormatter().format(source).text()).isEqualTo(source);
    }

    @Test
    void ifElseScenario() {
        FormatResult result = new SourceFormatter().format("if cond stmt1; else stmt2;\n");

        List<ChunkType> types = result.store().stream()
                .filter(c -> !c.isNewline())
                .map(Chunk::type)
                .toList();
        assertThat(types).containsExactly(
                ChunkType.IF, ChunkType.WORD, ChunkType.VBRACE_OPEN, ChunkType.WORD, ChunkType.SEMICOLON,
                ChunkType.VBRACE_CLOSE, ChunkType.ELSE, ChunkType.VBRACE_OPEN, ChunkType.WORD,
                ChunkType.SEMICOLON, ChunkType.VBRACE_CLOSE);
    }

    @Test
    void newlineTerminatedIfElseScenario() {
        FormatResult result = new SourceFormatter().format("if cond\n  stmt1\nelse\n  stmt2\n");

        List<Chunk> vsemis = result.store().stream().filter(c -> c.is(ChunkType.VSEMICOLON)).toList();
        assertThat(vsemis).hasSize(2).noneMatch(Chunk::isInvisible);
        assertThat(vsemis).allSatisfy(v -> assertThat(result.store().next(v).type()).isEqualTo(ChunkType.VBRACE_CLOSE));
    }

    @Test
    void realTokensSurviveEveryPass() throws IOException {
        PassOptions everything = PassOptions.defaults().withSemicolonScope(SemicolonScope.ALL_STATEMENTS);
        for (String name : List.of("pawn_braceless.p", "squeeze_ifdef.in.cpp")) {
            String source = fixture(name);
            FormatResult raw = new SourceFormatter(new PassOptions(false, false, SemicolonScope.VIRTUAL_BLOCKS,
                    false, false, false, false, false)).format(source);
            FormatResult formatted = new SourceFormatter(everything).format(source);

            assertThat(formatted.store().stream().filter(c -> !c.isVirtual()).map(c -> c.type() + ":" + c.text()))
                    .as(name)
                    .containsExactlyElementsOf(raw.store().stream().map(c -> c.type() + ":" + c.text()).toList());
            assertThat(formatted.store().count(ChunkType.VBRACE_OPEN))
                    .isEqualTo(formatted.store().count(ChunkType.VBRACE_CLOSE));
        }
    }

    @Test
    void malformedInputDegradesInsteadOfFailing() {
        FormatResult result = new SourceFormatter().format("main()\n{\n  if (x\n#else\n  y\n");

        assertThat(result.hasErrors()).isTrue();
        assertThat(result.text()).isEqualTo("main()\n{\n  if (x\n#else\n  y\n");
    }
}
