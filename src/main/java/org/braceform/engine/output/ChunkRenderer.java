package org.braceform.engine.output;

import org.braceform.engine.model.Chunk;
import org.braceform.engine.model.ChunkType;
import org.braceform.engine.store.ChunkStore;

/**
 * Serializes a chunk stream back to source text.
 * <p>
 * Invisible chunks and virtual braces produce no output. A virtual semicolon renders as
 * {@code ;} only when requested. Newline chunks render their line break count; every other
 * chunk renders the whitespace recorded before it followed by its text.
 */
public class ChunkRenderer {

    private final boolean emitVirtualSemicolons;

    public ChunkRenderer() {
        this(false);
    }

    public ChunkRenderer(boolean emitVirtualSemicolons) {
        this.emitVirtualSemicolons = emitVirtualSemicolons;
    }

    public String render(ChunkStore store) {
        StringBuilder out = new StringBuilder();
        for (Chunk c : store) {
            if (c.isInvisible()) {
                continue;
            }
            if (c.isNewline()) {
                out.append("\n".repeat(c.getNlCount()));
            } else if (c.is(ChunkType.VSEMICOLON)) {
                if (emitVirtualSemicolons) {
                    out.append(';');
                }
            } else if (!c.isVirtual()) {
                out.append(c.getWhitespaceBefore()).append(c.text());
            }
        }
        return out.toString();
    }
}
