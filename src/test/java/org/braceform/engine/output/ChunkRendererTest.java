package org.braceform.engine.output;

import org.braceform.engine.diagnostics.DiagnosticsEngine;
import org.braceform.engine.frontend.lexer.Lexer;
import org.braceform.engine.model.Chunk;
import org.braceform.engine.model.ChunkFlag;
import org.braceform.engine.model.ChunkType;
import org.braceform.engine.store.ChunkStore;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ChunkRendererTest {

    private static ChunkStore lex(String source) {
        return new Lexer(source, new DiagnosticsEngine()).scan();
    }

    @Test
    void reproducesLexedSource() {
        String source = "int f(int a)\n{\n\t/* block\n\t   comment */\n\treturn a << 2; // done\n\n\n}\n";

        assertThat(new ChunkRenderer().render(lex(source))).isEqualTo(source);
    }

    @Test
    void virtualBracesNeverRender() {
        ChunkStore store = lex("if (c) x\n");
        Chunk paren = store.stream().filter(c -> c.text().equals(")")).findFirst().orElseThrow();
        Chunk x = store.next(paren);
        store.insertAfter(paren, Chunk.virtual(ChunkType.VBRACE_OPEN, paren));
        store.insertAfter(x, Chunk.virtual(ChunkType.VBRACE_CLOSE, x));

        assertThat(new ChunkRenderer(true).render(store)).isEqualTo("if (c) x\n");
    }

    @Test
    void virtualSemicolonsRenderOnlyWhenRequestedAndVisible() {
        ChunkStore store = lex("a\nb\n");
        Chunk a = store.head();
        Chunk b = store.nextNcNnl(a);
        store.insertAfter(a, Chunk.virtual(ChunkType.VSEMICOLON, a));
        Chunk hidden = store.insertAfter(b, Chunk.virtual(ChunkType.VSEMICOLON, b));
        hidden.setFlag(ChunkFlag.INVISIBLE, true);

        assertThat(new ChunkRenderer(false).render(store)).isEqualTo("a\nb\n");
        assertThat(new ChunkRenderer(true).render(store)).isEqualTo("a;\nb\n");
    }

    @Test
    void newlineCountDrivesBlankLines() {
        ChunkStore store = lex("a\n\n\nb");
        store.next(store.head()).setNlCount(1);

        assertThat(new ChunkRenderer().render(store)).isEqualTo("a\nb");
    }

    @Test
    void lineEndsBecomeLineFeeds() {
        assertThat(new ChunkRenderer().render(lex("new a\rnew b\r"))).isEqualTo("new a\nnew b\n");
        assertThat(new ChunkRenderer().render(lex("a\r\n\r\nb"))).isEqualTo("a\n\nb");
    }
}
