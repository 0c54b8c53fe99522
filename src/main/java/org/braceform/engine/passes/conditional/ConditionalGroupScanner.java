package org.braceform.engine.passes.conditional;

import org.braceform.engine.diagnostics.DiagnosticsEngine;
import org.braceform.engine.model.Chunk;
import org.braceform.engine.model.ChunkType;
import org.braceform.engine.store.ChunkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Collects the well-formed conditional groups of a stream. Orphan directives, an
 * {@code #elif} after {@code #else}, and groups left open at end of input are reported and
 * not returned, so no cross-branch decision is ever made for them.
 */
public class ConditionalGroupScanner {

    private static final Logger log = LoggerFactory.getLogger(ConditionalGroupScanner.class);
    private static final String SOURCE = "conditional-normalizer";

    private final DiagnosticsEngine diagnostics;

    private static final class OpenGroup {
        final List<Chunk> directives = new ArrayList<>();
        boolean elseSeen;
        boolean malformed;
    }

    public ConditionalGroupScanner(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * @param store The stream to scan.
     * @return Complete groups, inner groups before the groups that contain them.
     */
    public List<ConditionalGroup> scan(ChunkStore store) {
        List<ConditionalGroup> groups = new ArrayList<>();
        Deque<OpenGroup> open = new ArrayDeque<>();
        for (Chunk c : store) {
            ChunkType type = c.type();
            if (type == ChunkType.PP_IF) {
                OpenGroup group = new OpenGroup();
                group.directives.add(c);
                open.push(group);
            } else if (type == ChunkType.PP_ELIF || type == ChunkType.PP_ELSE) {
                if (open.isEmpty()) {
                    diagnostics.reportWarning("'" + c.text() + "' without #if; branches left as they are", SOURCE, c.line());
                    continue;
                }
                OpenGroup group = open.peek();
                if (group.elseSeen) {
                    diagnostics.reportWarning("'" + c.text() + "' after #else; group left as it is", SOURCE, c.line());
                    group.malformed = true;
                }
                group.elseSeen |= type == ChunkType.PP_ELSE;
                group.directives.add(c);
            } else if (type == ChunkType.PP_ENDIF) {
                if (open.isEmpty()) {
                    diagnostics.reportWarning("'" + c.text() + "' without #if", SOURCE, c.line());
                    continue;
                }
                OpenGroup group = open.pop();
                group.directives.add(c);
                if (!group.malformed) {
                    groups.add(new ConditionalGroup(group.directives));
                }
            }
        }
        for (OpenGroup group : open) {
            Chunk first = group.directives.get(0);
            diagnostics.reportWarning("'" + first.text() + "' is never closed; group left as it is", SOURCE, first.line());
        }
        log.debug("Found {} conditional group(s)", groups.size());
        return groups;
    }
}
