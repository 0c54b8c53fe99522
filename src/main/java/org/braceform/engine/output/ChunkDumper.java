package org.braceform.engine.output;

import org.braceform.engine.model.Chunk;
import org.braceform.engine.model.ChunkFlag;
import org.braceform.engine.model.ChunkType;
import org.braceform.engine.store.ChunkStore;

import java.util.stream.Collectors;

/**
 * Writes one line per chunk: position, type, levels, parent, flags and text.
 */
public class ChunkDumper {

    public String dump(ChunkStore store) {
        StringBuilder out = new StringBuilder();
        for (Chunk c : store) {
            out.append(line(c)).append('\n');
        }
        return out.toString();
    }

    static String line(Chunk c) {
        String flags = c.flags().stream()
                .map(ChunkFlag::name)
                .collect(Collectors.joining(","));
        String parent = c.getParentType() == ChunkType.NONE ? "-" : c.getParentType().name();
        return String.format("%4d:%-3d %-13s lvl=%d pl=%d pp=%d parent=%-9s [%s] %s",
                c.line(), c.column(), c.type(), c.getLevel(), c.getParenLevel(), c.getPpLevel(),
                parent, flags, printable(c));
    }

    private static String printable(Chunk c) {
        if (c.isNewline()) {
            return "\\n x" + c.getNlCount();
        }
        if (c.isVirtual()) {
            return "<" + c.type().name().toLowerCase() + ">";
        }
        return c.text().replace("\n", "\\n");
    }
}
