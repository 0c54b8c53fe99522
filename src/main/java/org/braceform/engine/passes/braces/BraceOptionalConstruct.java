package org.braceform.engine.passes.braces;

import org.braceform.engine.model.Chunk;
import org.braceform.engine.model.ChunkType;
import org.braceform.engine.store.ChunkStore;

import java.util.EnumMap;
import java.util.Map;

/**
 * Transition table of the constructs whose body may be a single unbraced statement.
 * <p>
 * Every construct goes through the same states: header seen, header consumed (as described by
 * its {@link Header}), body expected (braced, single statement, or missing at end of input),
 * statement end, and finally its {@link Tail}. Supporting another brace-optional construct
 * means adding a row here.
 */
public enum BraceOptionalConstruct {
    IF(ChunkType.IF, Header.CONDITION, Tail.ELSE_ARM),
    ELSE(ChunkType.ELSE, Header.KEYWORD, Tail.NONE),
    FOR(ChunkType.FOR, Header.CONDITION, Tail.NONE),
    WHILE(ChunkType.WHILE, Header.CONDITION, Tail.NONE),
    DO(ChunkType.DO, Header.KEYWORD, Tail.WHILE_CONDITION),
    SWITCH(ChunkType.SWITCH, Header.CONDITION, Tail.NONE),
    FUNCTION(ChunkType.FUNCTION, Header.PARAMETERS, Tail.NONE);

    /** How the header after the introducing chunk is laid out. */
    public enum Header {
        /** Only the keyword ({@code else}, {@code do}). */
        KEYWORD,
        /** Keyword plus a condition, parenthesized or a bare expression. */
        CONDITION,
        /** Function name, parameter list and an optional {@code <state>} clause. */
        PARAMETERS
    }

    /** What may follow the body and still belong to the same statement. */
    public enum Tail {
        NONE,
        /** An {@code else} arm. */
        ELSE_ARM,
        /** The {@code while (cond)} of a do-loop, optionally followed by {@code ;}. */
        WHILE_CONDITION
    }

    private static final Map<ChunkType, BraceOptionalConstruct> BY_KEYWORD = new EnumMap<>(ChunkType.class);

    static {
        for (BraceOptionalConstruct construct : values()) {
            if (construct != FUNCTION) {
                BY_KEYWORD.put(construct.keyword, construct);
            }
        }
    }

    private final ChunkType keyword;
    private final Header header;
    private final Tail tail;

    BraceOptionalConstruct(ChunkType keyword, Header header, Tail tail) {
        this.keyword = keyword;
        this.header = header;
        this.tail = tail;
    }

    /**
     * Looks up the construct a chunk introduces. A {@code while} that closes a do-loop
     * (parent {@link ChunkType#DO}) introduces nothing.
     *
     * @return The construct, or null if the chunk is not a header keyword.
     */
    public static BraceOptionalConstruct forKeyword(Chunk chunk) {
        if (chunk.is(ChunkType.WHILE) && chunk.getParentType() == ChunkType.DO) {
            return null;
        }
        return BY_KEYWORD.get(chunk.type());
    }

    /** @return The type recorded as {@code parentType} on the braces of this construct's body. */
    public ChunkType parentType() {
        return keyword;
    }

    public Header header() {
        return header;
    }

    public Tail tail() {
        return tail;
    }

    /**
     * Finds the last chunk of the header introduced by {@code start}. Pure lookup; nothing is
     * marked.
     *
     * @param store The stream.
     * @param start The keyword, or the function name for {@link #FUNCTION}.
     * @return The last header chunk; {@code start} itself if the header is cut short.
     */
    public Chunk headerEnd(ChunkStore store, Chunk start) {
        return switch (header) {
            case KEYWORD -> start;
            case CONDITION -> conditionEnd(store, start);
            case PARAMETERS -> parametersEnd(store, start);
        };
    }

    /**
     * End of the condition after {@code keyword}: the matching {@code )} if the condition is
     * parenthesized, otherwise the end of the bare expression that follows.
     */
    static Chunk conditionEnd(ChunkStore store, Chunk keyword) {
        Chunk first = store.nextNcNnl(keyword);
        if (first == null || first.type().isPreprocessor() || first.type().isTerminator()) {
            return keyword;
        }
        if (first.is(ChunkType.PAREN_OPEN)) {
            Chunk close = store.pairedWith(first);
            return close != null ? close : first;
        }
        return expressionEnd(store, first);
    }

    /**
     * Greedy operand/operator scan: {@code a + b(c) [d]} is one expression, two operands in a
     * row are not. A newline ends the expression unless the line ends in an operator.
     */
    static Chunk expressionEnd(ChunkStore store, Chunk first) {
        Chunk last = skipGroup(store, first);
        boolean expectOperand = first.is(ChunkType.OPERATOR);
        while (true) {
            Chunk n = store.nextNc(last);
            if (n == null) {
                return last;
            }
            if (n.isNewline()) {
                if (!expectOperand) {
                    return last;
                }
                n = store.nextNcNnl(n);
                if (n == null) {
                    return last;
                }
            }
            ChunkType t = n.type();
            if (t == ChunkType.OPERATOR) {
                expectOperand = true;
                last = n;
            } else if (expectOperand && isOperand(t)) {
                expectOperand = false;
                last = skipGroup(store, n);
            } else if (!expectOperand && t.isOpenParen()) {
                last = skipGroup(store, n);
            } else {
                return last;
            }
        }
    }

    private static boolean isOperand(ChunkType t) {
        return t == ChunkType.WORD || t == ChunkType.NUMBER || t == ChunkType.STRING || t.isOpenParen();
    }

    private static Chunk skipGroup(ChunkStore store, Chunk chunk) {
        if (chunk.type().isOpenParen()) {
            Chunk close = store.pairedWith(chunk);
            return close != null ? close : chunk;
        }
        return chunk;
    }

    private static Chunk parametersEnd(ChunkStore store, Chunk name) {
        Chunk open = store.nextNc(name);
        if (open == null || !open.is(ChunkType.PAREN_OPEN)) {
            return name;
        }
        Chunk last = store.pairedWith(open);
        if (last == null) {
            return open;
        }
        Chunk state = store.nextNcNnl(last);
        if (state != null && state.is(ChunkType.OPERATOR) && state.text().equals("<")) {
            for (Chunk c = store.next(state); c != null; c = store.next(c)) {
                if (c.is(ChunkType.OPERATOR) && c.text().equals(">")) {
                    return c;
                }
                if (c.type().isTerminator() || c.type().isPreprocessor()) {
                    break;
                }
            }
        }
        return last;
    }
}
