package org.braceform.engine.passes.conditional;

import org.braceform.engine.model.Chunk;
import org.braceform.engine.model.ChunkType;
import org.braceform.engine.passes.NormalizationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes blank lines between conditional directives and the code they guard. Directives
 * at brace level 0 are only squeezed when the top-level option is on.
 */
public class IfdefSqueezer {

    private static final Logger log = LoggerFactory.getLogger(IfdefSqueezer.class);
    public static final String COUNTER = "ifdef.squeezed";

    /**
     * @param context The run to squeeze.
     * @return The number of newline chunks shortened.
     */
    public int squeeze(NormalizationContext context) {
        boolean topLevel = context.options().squeezeIfdefTopLevel();
        int squeezed = 0;
        for (Chunk c : context.store()) {
            if (!c.type().isConditionalDirective() || (c.getLevel() == 0 && !topLevel)) {
                continue;
            }
            ChunkType type = c.type();
            if (type != ChunkType.PP_IF) {
                squeezed += collapse(context, context.store().prev(c));
            }
            if (type != ChunkType.PP_ENDIF) {
                squeezed += collapse(context, context.store().next(c));
            }
        }
        log.debug("Squeezed {} blank line run(s) around directives", squeezed);
        return squeezed;
    }

    private int collapse(NormalizationContext context, Chunk newline) {
        if (newline == null || !newline.isNewline() || newline.getNlCount() <= 1) {
            return 0;
        }
        newline.setNlCount(1);
        context.count(COUNTER);
        return 1;
    }
}
