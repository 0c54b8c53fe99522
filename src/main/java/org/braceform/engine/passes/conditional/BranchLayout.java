package org.braceform.engine.passes.conditional;

import org.braceform.engine.model.Chunk;
import org.braceform.engine.model.ChunkType;
import org.braceform.engine.store.ChunkStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The layout-relevant parts of one branch of a conditional group: the line breaks around its
 * directives, an optional leading comment, and its statements.
 * <p>
 * The branch {@link #shape() shape} is the list of its statements, each given as the list of
 * its significant chunk types. Literal text, comments, newlines and invisible chunks do not
 * take part; virtual semicolons and braces compare equal to real ones.
 */
public final class BranchLayout {

    /**
     * One statement of a branch.
     *
     * @param chunks          Its significant chunks in order.
     * @param trailingComment A comment on the same line after the statement, or null.
     */
    public record Statement(List<Chunk> chunks, Chunk trailingComment) {
    }

    private final Chunk directive;
    private final Chunk newlineAfterDirective;
    private final Chunk newlineBeforeEnd;
    private final Chunk leadingComment;
    private final Chunk leadingCommentNewline;
    private final List<Statement> statements;
    private final List<List<ChunkType>> shape;

    private BranchLayout(Chunk directive, Chunk newlineAfterDirective, Chunk newlineBeforeEnd,
                         Chunk leadingComment, Chunk leadingCommentNewline, List<Statement> statements) {
        this.directive = directive;
        this.newlineAfterDirective = newlineAfterDirective;
        this.newlineBeforeEnd = newlineBeforeEnd;
        this.leadingComment = leadingComment;
        this.leadingCommentNewline = leadingCommentNewline;
        this.statements = List.copyOf(statements);
        List<List<ChunkType>> types = new ArrayList<>(statements.size());
        for (Statement statement : statements) {
            types.add(statement.chunks().stream().map(c -> normalize(c.type())).toList());
        }
        this.shape = List.copyOf(types);
    }

    /**
     * Analyzes a branch.
     *
     * @param store  The stream.
     * @param branch The branch.
     * @return The layout, or empty if the branch contains directives of nested groups and
     *         therefore cannot be compared with its siblings.
     */
    public static Optional<BranchLayout> analyze(ChunkStore store, ConditionalGroup.Branch branch) {
        Chunk afterDirective = store.next(branch.directive());
        Chunk newlineAfterDirective = afterDirective != null && afterDirective.isNewline() ? afterDirective : null;
        Chunk beforeEnd = store.prev(branch.end());
        Chunk newlineBeforeEnd = beforeEnd != null && beforeEnd.isNewline() ? beforeEnd : null;

        Chunk leadingComment = null;
        Chunk leadingCommentNewline = null;
        List<Statement> statements = new ArrayList<>();
        List<Chunk> current = new ArrayList<>();
        int depth = 0;
        boolean statementEndedOnLine = false;

        for (Chunk c = afterDirective; c != null && c != branch.end(); c = store.next(c)) {
            if (c.type().isPreprocessor()) {
                return Optional.empty();
            }
            if (c.isNewline()) {
                statementEndedOnLine = false;
                continue;
            }
            if (c.isComment()) {
                if (statementEndedOnLine && !statements.isEmpty()) {
                    Statement last = statements.remove(statements.size() - 1);
                    statements.add(new Statement(last.chunks(), c));
                } else if (statements.isEmpty() && current.isEmpty() && leadingComment == null && isOnOwnLine(store, c)) {
                    leadingComment = c;
                    Chunk n = store.next(c);
                    leadingCommentNewline = n != null && n.isNewline() ? n : null;
                }
                continue;
            }
            if (c.isInvisible()) {
                continue;
            }
            current.add(c);
            statementEndedOnLine = false;
            ChunkType t = normalize(c.type());
            if (t == ChunkType.OPEN_BRACE) {
                depth++;
            } else if (t == ChunkType.CLOSE_BRACE) {
                depth = Math.max(0, depth - 1);
            }
            boolean ends = depth == 0 && (t == ChunkType.SEMICOLON || t == ChunkType.CLOSE_BRACE);
            if (ends) {
                statements.add(new Statement(List.copyOf(current), null));
                current = new ArrayList<>();
                statementEndedOnLine = true;
            }
        }
        if (!current.isEmpty()) {
            statements.add(new Statement(List.copyOf(current), null));
        }
        return Optional.of(new BranchLayout(branch.directive(), newlineAfterDirective, newlineBeforeEnd,
                leadingComment, leadingCommentNewline, statements));
    }

    private static boolean isOnOwnLine(ChunkStore store, Chunk comment) {
        Chunk p = store.prev(comment);
        Chunk n = store.next(comment);
        return p != null && p.isNewline() && n != null && n.isNewline();
    }

    static ChunkType normalize(ChunkType type) {
        return switch (type) {
            case VSEMICOLON -> ChunkType.SEMICOLON;
            case VBRACE_OPEN -> ChunkType.OPEN_BRACE;
            case VBRACE_CLOSE -> ChunkType.CLOSE_BRACE;
            default -> type;
        };
    }

    /** @return true if both branches have the same statements, chunk type for chunk type. */
    public boolean isParallelTo(BranchLayout other) {
        return shape.equals(other.shape);
    }

    public Chunk directive() {
        return directive;
    }

    /** @return The newline chunk right after the directive, or null. */
    public Chunk newlineAfterDirective() {
        return newlineAfterDirective;
    }

    /** @return The newline chunk right before the next directive, or null. */
    public Chunk newlineBeforeEnd() {
        return newlineBeforeEnd;
    }

    /** @return A comment on its own line before the first statement, or null. */
    public Chunk leadingComment() {
        return leadingComment;
    }

    /** @return The newline between the leading comment and what follows it, or null. */
    public Chunk leadingCommentNewline() {
        return leadingCommentNewline;
    }

    public List<Statement> statements() {
        return statements;
    }

    public List<List<ChunkType>> shape() {
        return shape;
    }
}
