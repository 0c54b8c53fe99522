package org.braceform.engine.passes.vsemi;

import org.braceform.engine.model.Chunk;
import org.braceform.engine.model.ChunkType;

import java.util.EnumSet;
import java.util.Set;

/**
 * Decides whether a newline after a given chunk continues the statement instead of ending it.
 */
public final class StatementContinuation {

    private static final Set<ChunkType> CONTINUING_TYPES = EnumSet.of(
            ChunkType.OPERATOR, ChunkType.COMMA, ChunkType.COLON,
            ChunkType.PAREN_OPEN, ChunkType.SQUARE_OPEN,
            ChunkType.OPEN_BRACE, ChunkType.VBRACE_OPEN,
            ChunkType.IF, ChunkType.ELSE, ChunkType.FOR, ChunkType.WHILE, ChunkType.DO,
            ChunkType.SWITCH, ChunkType.CASE, ChunkType.ENUM
    );

    private static final Set<ChunkType> HEADER_PARENTS = EnumSet.of(
            ChunkType.IF, ChunkType.ELSE, ChunkType.FOR, ChunkType.WHILE, ChunkType.DO,
            ChunkType.SWITCH, ChunkType.FUNCTION, ChunkType.ENUM
    );

    private StatementContinuation() {
    }

    /**
     * @param last           The last significant chunk before the newline.
     * @param baseLevel      Brace level of the statement's own chunks.
     * @param baseParenLevel Paren level of the statement's own chunks.
     * @return true if the statement continues on the next line.
     */
    public static boolean isContinued(Chunk last, int baseLevel, int baseParenLevel) {
        if (last == null) {
            return false;
        }
        if (last.getLevel() > baseLevel || last.getParenLevel() > baseParenLevel) {
            return true;
        }
        if (continuesByType(last)) {
            return true;
        }
        // Header parts (condition parens, do-while tail) wait for their body.
        return !last.type().isCloseBlock() && HEADER_PARENTS.contains(last.getParentType());
    }

    /**
     * Type-only variant used while scanning raw statements, where levels are tracked locally.
     */
    public static boolean isContinuedByType(Chunk last) {
        return last != null && continuesByType(last);
    }

    private static boolean continuesByType(Chunk last) {
        if (last.is(ChunkType.OPERATOR) && (last.text().equals("++") || last.text().equals("--"))) {
            // postfix increment ends an expression
            return false;
        }
        return CONTINUING_TYPES.contains(last.type());
    }
}
