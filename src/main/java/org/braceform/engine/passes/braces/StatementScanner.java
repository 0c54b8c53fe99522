package org.braceform.engine.passes.braces;

import org.braceform.engine.model.Chunk;
import org.braceform.engine.model.ChunkType;
import org.braceform.engine.passes.vsemi.StatementContinuation;
import org.braceform.engine.store.ChunkStore;

/**
 * Finds where a single statement ends, following the rules of brace-optional languages:
 * a statement ends at a semicolon at its own depth, at the close of the enclosing block, or
 * at a newline that is not continued. Compound statements (control constructs) extend over
 * their body and tail; nested constructs are resolved recursively.
 * <p>
 * Works on raw and on already virtualized streams: a {@code VBRACE_OPEN} counts as a block
 * and a {@code VSEMICOLON} as a terminator.
 */
public class StatementScanner {

    /**
     * The extent of a statement.
     *
     * @param last       Its last chunk.
     * @param terminated Whether that chunk is a (real or virtual) semicolon or a label colon.
     */
    public record Extent(Chunk last, boolean terminated) {
    }

    private final ChunkStore store;

    public StatementScanner(ChunkStore store) {
        this.store = store;
    }

    /**
     * Finds the end of the statement starting at {@code start}. Comments and newlines before
     * the first significant chunk are skipped.
     *
     * @param start The first chunk of the statement.
     * @return The extent, or null if no statement follows.
     */
    public Extent statementEnd(Chunk start) {
        Chunk s = start.isCommentOrNewline() ? store.nextNcNnl(start) : start;
        if (s == null) {
            return null;
        }
        ChunkType t = s.type();
        if (t.isOpenBlock()) {
            Chunk close = store.pairedWith(s);
            return new Extent(close != null ? close : lastChunk(), false);
        }
        if (t.isSemicolon()) {
            return new Extent(s, true);
        }
        if (t == ChunkType.CASE) {
            return labelEnd(s);
        }
        BraceOptionalConstruct construct = BraceOptionalConstruct.forKeyword(s);
        if (construct != null) {
            return compoundEnd(construct, s);
        }
        return simpleEnd(s);
    }

    /**
     * Extent of a control construct: header, body, and the construct's tail.
     */
    public Extent compoundEnd(BraceOptionalConstruct construct, Chunk keyword) {
        Chunk headerEnd = construct.headerEnd(store, keyword);
        Chunk bodyStart = store.nextNcNnl(headerEnd);
        if (bodyStart == null || bodyStart.type().isCloseBlock() || bodyStart.type().isPreprocessor()) {
            return new Extent(headerEnd, false);
        }
        Extent body = statementEnd(bodyStart);
        if (body == null) {
            return new Extent(headerEnd, false);
        }
        switch (construct.tail()) {
            case ELSE_ARM -> {
                Chunk after = nextSkippingVsemi(body.last());
                if (after != null && after.is(ChunkType.ELSE)) {
                    return compoundEnd(BraceOptionalConstruct.ELSE, after);
                }
            }
            case WHILE_CONDITION -> {
                Chunk w = nextSkippingVsemi(body.last());
                if (w != null && w.is(ChunkType.WHILE)) {
                    Chunk conditionEnd = BraceOptionalConstruct.conditionEnd(store, w);
                    Chunk semi = store.nextNc(conditionEnd);
                    if (semi != null && semi.type().isSemicolon()) {
                        return new Extent(semi, true);
                    }
                    return new Extent(conditionEnd, false);
                }
            }
            case NONE -> {
            }
        }
        return body;
    }

    private Extent labelEnd(Chunk caseKeyword) {
        int depth = 0;
        Chunk last = caseKeyword;
        for (Chunk c = store.next(caseKeyword); c != null; c = store.next(c)) {
            ChunkType t = c.type();
            if (t.isOpenParen()) {
                depth++;
            } else if (t.isCloseParen()) {
                depth--;
            } else if (t == ChunkType.COLON && depth <= 0) {
                return new Extent(c, true);
            } else if (t.isTerminator() || t.isPreprocessor()) {
                break;
            }
            if (!c.isCommentOrNewline()) {
                last = c;
            }
        }
        return new Extent(last, false);
    }

    private Extent simpleEnd(Chunk first) {
        Chunk last = null;
        int depth = 0;
        for (Chunk c = first; c != null; c = store.next(c)) {
            ChunkType t = c.type();
            if (t == ChunkType.NEWLINE) {
                if (depth == 0 && last != null && !StatementContinuation.isContinuedByType(last)) {
                    return new Extent(last, false);
                }
                continue;
            }
            if (t == ChunkType.COMMENT) {
                continue;
            }
            if (t.isPreprocessor()) {
                if (last != null) {
                    return new Extent(last, false);
                }
                continue;
            }
            if (t.isOpenParen()) {
                depth++;
            } else if (t.isCloseParen()) {
                if (depth == 0) {
                    return new Extent(last != null ? last : c, false);
                }
                depth--;
            } else if (t.isSemicolon() && depth == 0) {
                return new Extent(c, true);
            } else if (t.isCloseBlock()) {
                if (depth == 0) {
                    return new Extent(last != null ? last : c, false);
                }
            } else if (t.isOpenBlock()) {
                Chunk close = store.pairedWith(c);
                if (close == null) {
                    return new Extent(c, false);
                }
                c = close;
            }
            last = c;
        }
        return new Extent(last, last != null && last.type().isSemicolon());
    }

    private Chunk nextSkippingVsemi(Chunk chunk) {
        Chunk n = store.nextNcNnl(chunk);
        while (n != null && n.is(ChunkType.VSEMICOLON)) {
            n = store.nextNcNnl(n);
        }
        return n;
    }

    private Chunk lastChunk() {
        return store.tail();
    }
}
