package org.braceform.engine.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * One token of the formatting stream, real or synthetic.
 * <p>
 * A chunk never references its neighbours; navigation, pairing and ownership belong to
 * {@link org.braceform.engine.store.ChunkStore}, which hands out the stable {@link #getId() id}
 * when the chunk is added.
 * <p>
 * Text, type and position of a real chunk are fixed once lexed. The passes may only change
 * {@code level}, {@code parenLevel}, {@code ppLevel}, {@code parentType}, the flags and,
 * for layout decisions, {@code whitespaceBefore} and {@code nlCount}.
 */
public final class Chunk {

    private final ChunkType type;
    private final String text;
    private final int line;
    private final int column;
    private final EnumSet<ChunkFlag> flags = EnumSet.noneOf(ChunkFlag.class);

    private int id = -1;
    private String whitespaceBefore;
    private int nlCount;
    private int level;
    private int parenLevel;
    private int ppLevel;
    private ChunkType parentType = ChunkType.NONE;

    private Chunk(ChunkType type, String text, int line, int column, String whitespaceBefore, int nlCount) {
        if (type == null) {
            throw new IllegalArgumentException("Chunk type must not be null");
        }
        this.type = type;
        this.text = text == null ? "" : text;
        this.line = line;
        this.column = column;
        this.whitespaceBefore = whitespaceBefore == null ? "" : whitespaceBefore;
        this.nlCount = nlCount;
    }

    /**
     * Creates a chunk that stands for source text.
     *
     * @param type             The token class.
     * @param text             The literal source text.
     * @param line             1-based source line.
     * @param column           1-based source column.
     * @param whitespaceBefore Horizontal whitespace preceding the chunk on its line.
     * @return The new, not yet linked chunk.
     */
    public static Chunk real(ChunkType type, String text, int line, int column, String whitespaceBefore) {
        if (type.isVirtual()) {
            throw new IllegalArgumentException("Type " + type + " cannot be lexed from source");
        }
        int nl = 0;
        if (type == ChunkType.NEWLINE) {
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n') nl++;
            }
            nl = Math.max(nl, 1);
        }
        return new Chunk(type, text, line, column, whitespaceBefore, nl);
    }

    /** Shorthand for a real chunk without position information, mostly useful in tests. */
    public static Chunk real(ChunkType type, String text) {
        return real(type, text, 0, 0, type == ChunkType.NEWLINE ? "" : " ");
    }

    /**
     * Creates a virtual chunk positioned at {@code anchor}. The chunk carries no text and
     * inherits the anchor's nesting information until the annotator stamps it.
     *
     * @param type   A virtual type ({@code VBRACE_OPEN}, {@code VBRACE_CLOSE}, {@code VSEMICOLON}).
     * @param anchor The chunk the new one is placed next to.
     * @return The new, not yet linked chunk, flagged {@link ChunkFlag#VIRTUAL}.
     */
    public static Chunk virtual(ChunkType type, Chunk anchor) {
        if (!type.isVirtual()) {
            throw new IllegalArgumentException("Type " + type + " is not a virtual type");
        }
        Chunk chunk = new Chunk(type, "", anchor.line, anchor.column + anchor.text.length(), "", 0);
        chunk.level = anchor.level;
        chunk.parenLevel = anchor.parenLevel;
        chunk.ppLevel = anchor.ppLevel;
        chunk.flags.add(ChunkFlag.VIRTUAL);
        if (anchor.flags.contains(ChunkFlag.IN_PREPROC_BRANCH)) {
            chunk.flags.add(ChunkFlag.IN_PREPROC_BRANCH);
        }
        return chunk;
    }

    public ChunkType type() {
        return type;
    }

    public boolean is(ChunkType candidate) {
        return type == candidate;
    }

    public String text() {
        return text;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public int getId() {
        return id;
    }

    /** Only the store assigns ids. */
    public void assignId(int id) {
        if (this.id >= 0) {
            throw new IllegalStateException("Chunk already belongs to a store (id " + this.id + ")");
        }
        this.id = id;
    }

    public String getWhitespaceBefore() {
        return whitespaceBefore;
    }

    public void setWhitespaceBefore(String whitespaceBefore) {
        this.whitespaceBefore = whitespaceBefore == null ? "" : whitespaceBefore;
    }

    /** @return Number of line breaks a newline chunk stands for; 0 for every other chunk. */
    public int getNlCount() {
        return nlCount;
    }

    public void setNlCount(int nlCount) {
        if (type != ChunkType.NEWLINE) {
            throw new IllegalStateException("Only newline chunks carry a line break count");
        }
        if (nlCount < 1) {
            throw new IllegalArgumentException("A newline chunk stands for at least one line break");
        }
        this.nlCount = nlCount;
    }

    public int getLevel() {
        return level;
    }

    public void setLevel(int level) {
        this.level = level;
    }

    public int getParenLevel() {
        return parenLevel;
    }

    public void setParenLevel(int parenLevel) {
        this.parenLevel = parenLevel;
    }

    public int getPpLevel() {
        return ppLevel;
    }

    public void setPpLevel(int ppLevel) {
        this.ppLevel = ppLevel;
    }

    public ChunkType getParentType() {
        return parentType;
    }

    public void setParentType(ChunkType parentType) {
        this.parentType = parentType == null ? ChunkType.NONE : parentType;
    }

    public boolean hasFlag(ChunkFlag flag) {
        return flags.contains(flag);
    }

    public Set<ChunkFlag> flags() {
        return EnumSet.copyOf(flags);
    }

    public void setFlag(ChunkFlag flag, boolean on) {
        if (flag == ChunkFlag.VIRTUAL) {
            throw new IllegalArgumentException("VIRTUAL is fixed at creation");
        }
        if (flag == ChunkFlag.INVISIBLE && on && !flags.contains(ChunkFlag.VIRTUAL)) {
            throw new IllegalStateException("Only virtual chunks can be made invisible: " + this);
        }
        if (on) {
            flags.add(flag);
        } else {
            flags.remove(flag);
        }
    }

    public boolean isVirtual() {
        return flags.contains(ChunkFlag.VIRTUAL);
    }

    public boolean isInvisible() {
        return flags.contains(ChunkFlag.INVISIBLE);
    }

    public boolean isNewline() {
        return type == ChunkType.NEWLINE;
    }

    public boolean isComment() {
        return type == ChunkType.COMMENT;
    }

    public boolean isCommentOrNewline() {
        return type == ChunkType.COMMENT || type == ChunkType.NEWLINE;
    }

    @Override
    public String toString() {
        String shown = type == ChunkType.NEWLINE ? "\\n x" + nlCount : text;
        return type + "['" + shown + "' L" + level + " @" + line + ":" + column + "]";
    }
}
