package org.braceform.engine.passes.vsemi;

import org.braceform.engine.frontend.annotate.StructuralAnnotator;
import org.braceform.engine.model.Chunk;
import org.braceform.engine.model.ChunkType;
import org.braceform.engine.passes.INormalizationPass;
import org.braceform.engine.passes.NormalizationContext;
import org.braceform.engine.passes.PassOptions;
import org.braceform.engine.passes.SemicolonScope;
import org.braceform.engine.store.ChunkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Makes every newline-terminated statement explicitly terminated by inserting a
 * {@link ChunkType#VSEMICOLON} where a newline, not a semicolon, ends it.
 * <p>
 * With {@link SemicolonScope#VIRTUAL_BLOCKS} only newlines inside virtual brace regions are
 * considered; with {@link SemicolonScope#ALL_STATEMENTS} every statement of the file is.
 * Running the pass again on its own output inserts nothing.
 */
public class VirtualSemicolonPass implements INormalizationPass {

    private static final Logger log = LoggerFactory.getLogger(VirtualSemicolonPass.class);

    public static final String COUNTER = "vsemicolons";

    @Override
    public String name() {
        return "virtual-semicolons";
    }

    @Override
    public boolean isEnabled(PassOptions options) {
        return options.virtualSemicolons();
    }

    @Override
    public void run(NormalizationContext context) {
        ChunkStore store = context.store();
        List<Chunk> newlines = store.stream().filter(Chunk::isNewline).toList();
        boolean everywhere = context.options().semicolonScope() == SemicolonScope.ALL_STATEMENTS;
        for (Chunk newline : newlines) {
            if (everywhere) {
                terminateBefore(context, newline, context.annotator().enclosingBlock(newline));
            } else {
                checkVSemicolon(context, newline);
            }
        }
    }

    /**
     * We are at a newline. If it sits inside a virtual brace region and ends the statement
     * before it, a virtual semicolon is inserted after the statement's last chunk.
     *
     * @param context The run.
     * @param newline A {@link ChunkType#NEWLINE} chunk.
     * @return The inserted virtual semicolon, or {@code newline} if nothing was inserted.
     */
    public Chunk checkVSemicolon(NormalizationContext context, Chunk newline) {
        if (!newline.isNewline()) {
            throw new IllegalArgumentException("Expected a newline chunk, got " + newline);
        }
        Chunk open = context.annotator().enclosingBlock(newline);
        if (open == null || !open.is(ChunkType.VBRACE_OPEN)) {
            return newline;
        }
        return terminateBefore(context, newline, open);
    }

    private Chunk terminateBefore(NormalizationContext context, Chunk newline, Chunk open) {
        ChunkStore store = context.store();
        Chunk prev = store.prevNcNnl(newline);
        if (prev == null || prev == open) {
            return newline;
        }
        if (prev.type().isTerminator() || prev.type().isPreprocessor()) {
            return newline;
        }
        if (open != null && open.getParentType() == ChunkType.ENUM) {
            return newline;
        }
        int baseLevel = open == null ? 0 : open.getLevel() + 1;
        int baseParenLevel = open == null ? 0 : open.getParenLevel();
        if (StatementContinuation.isContinued(prev, baseLevel, baseParenLevel)) {
            log.trace("Newline after {} continues the statement", prev);
            return newline;
        }
        return addVsemiAfter(context, prev);
    }

    /**
     * Inserts a fresh, visible virtual semicolon directly after {@code chunk}, unless the
     * chunk already is a semicolon or is already followed by one.
     *
     * @param context The run.
     * @param chunk   The last chunk of a statement.
     * @return The new virtual semicolon, or {@code chunk} if none was needed.
     */
    public static Chunk addVsemiAfter(NormalizationContext context, Chunk chunk) {
        if (chunk.type().isSemicolon()) {
            return chunk;
        }
        ChunkStore store = context.store();
        Chunk next = store.nextNc(chunk);
        if (next != null && next.type().isSemicolon()) {
            return chunk;
        }
        StructuralAnnotator annotator = context.annotator();
        Chunk vsemi = store.insertAfter(chunk, Chunk.virtual(ChunkType.VSEMICOLON, chunk));
        annotator.stampInserted(vsemi);
        context.count(COUNTER);
        log.debug("Added VSEMICOLON after {}", chunk);
        return vsemi;
    }
}
