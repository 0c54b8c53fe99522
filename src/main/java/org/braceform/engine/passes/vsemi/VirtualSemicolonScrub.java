package org.braceform.engine.passes.vsemi;

import org.braceform.engine.model.Chunk;
import org.braceform.engine.model.ChunkFlag;
import org.braceform.engine.model.ChunkType;
import org.braceform.engine.passes.INormalizationPass;
import org.braceform.engine.passes.NormalizationContext;
import org.braceform.engine.passes.PassOptions;
import org.braceform.engine.store.ChunkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Set;

/**
 * Turns certain virtual semicolons invisible: those directly after a close brace (real or
 * virtual) whose parent is {@code switch}, {@code case}, {@code else} or {@code if}. Those
 * constructs terminate themselves.
 * <p>
 * Must run after every virtual semicolon has been inserted. A close brace without a recorded
 * parent keeps its semicolon.
 */
public class VirtualSemicolonScrub implements INormalizationPass {

    private static final Logger log = LoggerFactory.getLogger(VirtualSemicolonScrub.class);

    public static final String COUNTER = "vsemicolons.scrubbed";

    static final Set<ChunkType> SELF_TERMINATING = EnumSet.of(
            ChunkType.SWITCH, ChunkType.CASE, ChunkType.ELSE, ChunkType.IF);

    @Override
    public String name() {
        return "scrub-virtual-semicolons";
    }

    @Override
    public boolean isEnabled(PassOptions options) {
        return options.scrubVirtualSemicolons();
    }

    @Override
    public void run(NormalizationContext context) {
        scrubVSemi(context);
    }

    /**
     * Sets {@link ChunkFlag#INVISIBLE} on every virtual semicolon if and only if the close brace
     * before it has a self-terminating parent.
     *
     * @param context The run.
     * @return The number of virtual semicolons that are invisible afterwards.
     */
    public int scrubVSemi(NormalizationContext context) {
        ChunkStore store = context.store();
        int hidden = 0;
        for (Chunk pc : store) {
            if (!pc.is(ChunkType.VSEMICOLON)) {
                continue;
            }
            Chunk prev = store.prevNcNnl(pc);
            boolean hide = prev != null
                    && prev.type().isCloseBlock()
                    && SELF_TERMINATING.contains(prev.getParentType());
            if (hide && !pc.isInvisible()) {
                log.debug("Scrubbed VSEMICOLON after {} (parent {})", prev, prev.getParentType());
                context.count(COUNTER);
            }
            pc.setFlag(ChunkFlag.INVISIBLE, hide);
            if (hide) hidden++;
        }
        return hidden;
    }
}
