package org.braceform.engine.frontend.annotate;

import org.braceform.engine.diagnostics.DiagnosticsEngine;
import org.braceform.engine.model.Chunk;
import org.braceform.engine.model.ChunkFlag;
import org.braceform.engine.model.ChunkType;
import org.braceform.engine.store.ChunkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Keeps the per-chunk nesting metadata of a store current.
 * <p>
 * {@link #annotate()} stamps the whole stream once after lexing: brace level (real and
 * virtual braces), paren level, preprocessor depth, brace/paren pairing and the statement
 * start flag. Afterwards the passes call {@link #stampInserted(Chunk)} and
 * {@link #enclose(Chunk, Chunk)} for every structural chunk they insert, so levels are always
 * current before a later pass reads them. The annotator has no pass of its own.
 * <p>
 * Brace level semantics: an open brace carries the level outside of it, the chunks between a
 * pair carry one more, the close brace carries the outside level again.
 * Preprocessor depth: {@code #if} carries the depth before the group opens, {@code #elif} and
 * {@code #else} the same depth as their {@code #if}, {@code #endif} the depth after the group
 * closes; every other chunk carries the number of open groups around it.
 */
public class StructuralAnnotator {

    private static final Logger log = LoggerFactory.getLogger(StructuralAnnotator.class);
    private static final String SOURCE = "annotator";

    private final ChunkStore store;
    private final DiagnosticsEngine diagnostics;

    /**
     * Brace state saved at an {@code #if}, so that every branch of the group starts from the
     * same nesting and the group continues with the nesting of its first branch.
     */
    private static final class ConditionalFrame {
        final List<Chunk> bracesAtIf;
        List<Chunk> bracesAfterFirstBranch;

        ConditionalFrame(List<Chunk> bracesAtIf) {
            this.bracesAtIf = bracesAtIf;
        }
    }

    public StructuralAnnotator(ChunkStore store, DiagnosticsEngine diagnostics) {
        this.store = store;
        this.diagnostics = diagnostics;
    }

    /**
     * Recomputes levels, pairs and flags for the whole stream in one forward scan.
     * Unbalanced input is reported and stamped with the best available guess.
     */
    public void annotate() {
        Deque<Chunk> braces = new ArrayDeque<>();
        Deque<Chunk> parens = new ArrayDeque<>();
        Deque<ConditionalFrame> conditionals = new ArrayDeque<>();
        Chunk lastSignificant = null;

        for (Chunk c : store) {
            ChunkType type = c.type();

            if (type.isConditionalDirective()) {
                stampDirective(c, braces, conditionals);
                continue;
            }

            c.setPpLevel(conditionals.size());
            c.setFlag(ChunkFlag.IN_PREPROC_BRANCH, !conditionals.isEmpty());

            if (type.isOpenBlock()) {
                c.setLevel(braces.size());
                braces.push(c);
            } else if (type.isCloseBlock()) {
                if (braces.isEmpty()) {
                    diagnostics.reportError("Unmatched '" + describe(c) + "'", SOURCE, c.line());
                    c.setLevel(0);
                } else {
                    Chunk open = braces.pop();
                    store.pair(open, c);
                    c.setLevel(braces.size());
                }
            } else {
                c.setLevel(braces.size());
            }

            if (type.isOpenParen()) {
                c.setParenLevel(parens.size());
                parens.push(c);
            } else if (type.isCloseParen()) {
                if (parens.isEmpty()) {
                    diagnostics.reportError("Unmatched '" + c.text() + "'", SOURCE, c.line());
                    c.setParenLevel(0);
                } else {
                    store.pair(parens.pop(), c);
                    c.setParenLevel(parens.size());
                }
            } else {
                c.setParenLevel(parens.size());
            }

            if (!c.isCommentOrNewline() && !type.isPreprocessor()) {
                boolean startsStatement = !type.isTerminator()
                        && (lastSignificant == null || lastSignificant.type().isTerminator());
                c.setFlag(ChunkFlag.STMT_START, startsStatement);
                lastSignificant = c;
            }
        }

        for (Chunk open : braces) {
            diagnostics.reportError("Unclosed '" + describe(open) + "' at end of input", SOURCE, open.line());
        }
        if (!conditionals.isEmpty()) {
            diagnostics.reportWarning(conditionals.size() + " conditional group(s) not closed by #endif", SOURCE, 0);
        }
        log.debug("Annotated {} chunks", store.size());
    }

    private void stampDirective(Chunk c, Deque<Chunk> braces, Deque<ConditionalFrame> conditionals) {
        c.setLevel(braces.size());
        switch (c.type()) {
            case PP_IF -> {
                c.setPpLevel(conditionals.size());
                conditionals.push(new ConditionalFrame(new ArrayList<>(braces)));
            }
            case PP_ELIF, PP_ELSE -> {
                if (conditionals.isEmpty()) {
                    diagnostics.reportWarning("'" + c.text() + "' without matching #if", SOURCE, c.line());
                    c.setPpLevel(0);
                } else {
                    ConditionalFrame frame = conditionals.peek();
                    if (frame.bracesAfterFirstBranch == null) {
                        frame.bracesAfterFirstBranch = new ArrayList<>(braces);
                    }
                    restore(braces, frame.bracesAtIf);
                    c.setLevel(braces.size());
                    c.setPpLevel(conditionals.size() - 1);
                }
            }
            case PP_ENDIF -> {
                if (conditionals.isEmpty()) {
                    diagnostics.reportWarning("'" + c.text() + "' without matching #if", SOURCE, c.line());
                } else {
                    ConditionalFrame frame = conditionals.pop();
                    if (frame.bracesAfterFirstBranch != null) {
                        restore(braces, frame.bracesAfterFirstBranch);
                    }
                    c.setLevel(braces.size());
                }
                c.setPpLevel(conditionals.size());
            }
            default -> throw new IllegalStateException("Not a conditional directive: " + c);
        }
        c.setFlag(ChunkFlag.IN_PREPROC_BRANCH, c.getPpLevel() > 0);
    }

    private static void restore(Deque<Chunk> braces, List<Chunk> snapshot) {
        braces.clear();
        braces.addAll(snapshot);
    }

    /**
     * Stamps a freshly inserted chunk from its predecessor. Structural chunks inserted by a
     * pass must be stamped before the pass moves on.
     *
     * @param chunk A chunk already linked into the store.
     */
    public void stampInserted(Chunk chunk) {
        Chunk p = store.prev(chunk);
        int level = 0;
        int parenLevel = 0;
        int ppLevel = 0;
        if (p != null) {
            level = p.getLevel() + (p.type().isOpenBlock() ? 1 : 0);
            parenLevel = p.getParenLevel() + (p.type().isOpenParen() ? 1 : 0);
            ppLevel = switch (p.type()) {
                case PP_IF, PP_ELIF, PP_ELSE -> p.getPpLevel() + 1;
                default -> p.getPpLevel();
            };
        }
        if (chunk.type().isCloseBlock()) {
            level = Math.max(0, level - 1);
        }
        if (chunk.type().isCloseParen()) {
            parenLevel = Math.max(0, parenLevel - 1);
        }
        chunk.setLevel(level);
        chunk.setParenLevel(parenLevel);
        chunk.setPpLevel(ppLevel);
        chunk.setFlag(ChunkFlag.IN_PREPROC_BRANCH, ppLevel > 0);
    }

    /**
     * Registers a newly inserted open/close pair around a range of existing chunks: pairs
     * them, gives both the level of the opener and pushes every chunk in between one level
     * deeper.
     *
     * @param open  The inserted opener (already linked).
     * @param close The inserted closer (already linked, after {@code open}).
     */
    public void enclose(Chunk open, Chunk close) {
        stampInserted(open);
        int base = open.getLevel();
        for (Chunk c = store.next(open); c != null && c != close; c = store.next(c)) {
            c.setLevel(c.getLevel() + 1);
        }
        close.setLevel(base);
        close.setParenLevel(open.getParenLevel());
        close.setPpLevel(open.getPpLevel());
        store.pair(open, close);
    }

    /**
     * Finds the innermost real or virtual open brace that encloses {@code chunk}, skipping
     * complete blocks on the way back.
     *
     * @return The enclosing opener, or null at level 0.
     */
    public Chunk enclosingBlock(Chunk chunk) {
        Chunk c = store.prev(chunk);
        while (c != null) {
            if (c.type().isCloseBlock()) {
                Chunk open = store.pairedWith(c);
                if (open != null) {
                    c = open;
                }
            } else if (c.type().isOpenBlock()) {
                return c;
            }
            c = store.prev(c);
        }
        return null;
    }

    public int levelOf(Chunk chunk) {
        return chunk.getLevel();
    }

    public int precLevelOf(Chunk chunk) {
        return chunk.getPpLevel();
    }

    public boolean isInsidePreprocBranch(Chunk chunk) {
        return chunk.getPpLevel() > 0;
    }

    public ChunkStore store() {
        return store;
    }

    public DiagnosticsEngine diagnostics() {
        return diagnostics;
    }

    private static String describe(Chunk c) {
        return c.isVirtual() ? c.type().name() : c.text();
    }
}
