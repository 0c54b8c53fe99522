package org.braceform.engine.passes.braces;

import org.braceform.engine.frontend.annotate.StructuralAnnotator;
import org.braceform.engine.model.Chunk;
import org.braceform.engine.model.ChunkType;
import org.braceform.engine.passes.INormalizationPass;
import org.braceform.engine.passes.NormalizationContext;
import org.braceform.engine.passes.PassOptions;
import org.braceform.engine.passes.vsemi.StatementContinuation;
import org.braceform.engine.passes.vsemi.VirtualSemicolonPass;
import org.braceform.engine.store.ChunkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The prescan: one forward pass that gives every brace-optional construct a matched
 * block pair.
 * <p>
 * At the start of every level-0 line it looks for unbraced functions (and variable
 * declarations that end at a newline); at every control keyword it looks at the body. A body
 * that is not a real (or already virtual) block is bracketed by a {@code VBRACE_OPEN} right
 * after the header and a {@code VBRACE_CLOSE} after the statement's last chunk, preceded by a
 * virtual semicolon when the statement ended at a newline. Headers are processed in stream
 * order, so nested bodies are handled when the scan reaches their own header.
 * <p>
 * Running the pass again on its own output inserts nothing.
 */
public class BraceVirtualizationPass implements INormalizationPass {

    private static final Logger log = LoggerFactory.getLogger(BraceVirtualizationPass.class);

    public static final String COUNTER = "vbraces";

    @Override
    public String name() {
        return "virtual-braces";
    }

    @Override
    public boolean isEnabled(PassOptions options) {
        return options.virtualBraces();
    }

    @Override
    public void run(NormalizationContext context) {
        ChunkStore store = context.store();
        boolean atLineStart = true;
        Chunk pc = store.head();
        while (pc != null) {
            if (pc.isNewline()) {
                atLineStart = true;
            } else if (!pc.isComment()) {
                if (atLineStart && pc.getLevel() == 0 && pc.getParenLevel() == 0
                        && !pc.type().isPreprocessor() && !pc.isVirtual()) {
                    pc = processLevel0Line(context, pc);
                }
                atLineStart = pc.isNewline();
                BraceOptionalConstruct construct = BraceOptionalConstruct.forKeyword(pc);
                if (construct != null) {
                    processHeader(context, construct, pc);
                }
            }
            pc = store.next(pc);
        }
    }

    /**
     * Classifies a level-0 line: variable declaration, function prototype, function
     * definition or enum.
     *
     * @return The chunk the scan continues after.
     */
    Chunk processLevel0Line(NormalizationContext context, Chunk start) {
        ChunkStore store = context.store();
        if (start.is(ChunkType.WORD) && (start.text().equals("new") || start.text().equals("const"))) {
            return processVariable(context, start);
        }
        if (start.is(ChunkType.ENUM)) {
            return processEnum(store, start);
        }

        Chunk fcn = null;
        Chunk pc = start;
        while ((pc = store.nextNc(pc)) != null
                && !pc.is(ChunkType.PAREN_OPEN)
                && !isAssign(pc)
                && !pc.isNewline()
                && !pc.type().isTerminator()) {
            if (pc.getLevel() == 0 && pc.is(ChunkType.WORD)) {
                fcn = pc;
            }
        }
        if (pc == null) {
            return start;
        }
        if (isAssign(pc)) {
            return processVariable(context, start);
        }
        if (start.is(ChunkType.WORD) && pc.is(ChunkType.PAREN_OPEN)) {
            Chunk name = store.prev(pc);
            if (name == start || name == fcn) {
                return markFunction(context, start, name);
            }
        }
        return start;
    }

    private Chunk processVariable(NormalizationContext context, Chunk start) {
        ChunkStore store = context.store();
        Chunk prev = null;
        for (Chunk pc = store.nextNc(start); pc != null; pc = store.nextNc(pc)) {
            if (pc.isNewline() && prev != null
                    && !StatementContinuation.isContinued(prev, start.getLevel(), start.getParenLevel())) {
                if (!prev.type().isSemicolon()) {
                    VirtualSemicolonPass.addVsemiAfter(context, prev);
                }
                return pc;
            }
            if (pc.type().isSemicolon() && pc.getLevel() == start.getLevel()
                    && pc.getParenLevel() == start.getParenLevel()) {
                return pc;
            }
            if (!pc.isNewline()) {
                prev = pc;
            }
        }
        if (prev == null) {
            return start;
        }
        // last line of the input
        return VirtualSemicolonPass.addVsemiAfter(context, prev);
    }

    private Chunk processEnum(ChunkStore store, Chunk start) {
        Chunk open = store.nextMatching(start, c -> c.is(ChunkType.OPEN_BRACE) || c.is(ChunkType.SEMICOLON));
        if (open == null || !open.is(ChunkType.OPEN_BRACE)) {
            return start;
        }
        for (Chunk c = store.next(start); c != open; c = store.next(c)) {
            // the enum name waits for its body
            if (!c.isCommentOrNewline() && c.getParentType() == ChunkType.NONE) {
                c.setParentType(ChunkType.ENUM);
            }
        }
        Chunk close = store.pairedWith(open);
        open.setParentType(ChunkType.ENUM);
        if (close == null) {
            return open;
        }
        close.setParentType(ChunkType.ENUM);
        return close;
    }

    private Chunk markFunction(NormalizationContext context, Chunk start, Chunk fcn) {
        ChunkStore store = context.store();
        Chunk paramsClose = store.pairedWith(store.nextNc(fcn));
        if (paramsClose == null) {
            return start;
        }
        Chunk after = store.nextNc(paramsClose);
        if (after != null && after.is(ChunkType.SEMICOLON)) {
            log.debug("'{}' is a prototype (semicolon)", fcn.text());
            return after;
        }
        if (start != fcn && (start.text().equals("forward") || start.text().equals("native"))) {
            log.debug("'{}' is a prototype ({})", fcn.text(), start.text());
            return paramsClose;
        }
        processHeader(context, BraceOptionalConstruct.FUNCTION, fcn);
        return fcn;
    }

    /**
     * Handles one header: marks the header parts with the construct, then either marks a
     * braced body or virtualizes a single-statement body.
     */
    void processHeader(NormalizationContext context, BraceOptionalConstruct construct, Chunk keyword) {
        ChunkStore store = context.store();
        Chunk headerEnd = construct.headerEnd(store, keyword);
        markHeader(store, construct, keyword, headerEnd);

        Chunk bodyStart = store.nextNcNnl(headerEnd);
        if (construct == BraceOptionalConstruct.ELSE && bodyStart != null && bodyStart.is(ChunkType.IF)) {
            // else-if: the nested if virtualizes its own arm
            return;
        }
        if (bodyStart == null) {
            context.diagnostics().reportWarning(
                    "'" + keyword.text() + "' has no body before end of input", "virtual-braces", keyword.line());
            Chunk last = lastCodeChunk(store, headerEnd);
            insertPair(context, construct, last, last);
            return;
        }
        if (bodyStart.type().isPreprocessor()) {
            log.debug("No virtual brace before directive after {}", keyword);
            return;
        }
        if (bodyStart.type().isOpenBlock()) {
            markBlock(store, construct, bodyStart);
            markTail(context, construct, store.pairedWith(bodyStart));
            return;
        }
        if (bodyStart.type().isCloseBlock()) {
            // The enclosing block ends right after the header: empty body.
            insertPair(context, construct, headerEnd, headerEnd);
            return;
        }

        StatementScanner.Extent extent = new StatementScanner(store).statementEnd(bodyStart);
        Chunk last = extent.last();
        if (!extent.terminated()) {
            last = VirtualSemicolonPass.addVsemiAfter(context, last);
        }
        Chunk close = insertPair(context, construct, headerEnd, last);
        markTail(context, construct, close);
    }

    private Chunk insertPair(NormalizationContext context, BraceOptionalConstruct construct,
                             Chunk headerEnd, Chunk last) {
        ChunkStore store = context.store();
        StructuralAnnotator annotator = context.annotator();
        Chunk open = store.insertAfter(headerEnd, Chunk.virtual(ChunkType.VBRACE_OPEN, headerEnd));
        Chunk anchor = last == headerEnd ? open : last;
        Chunk close = store.insertAfter(anchor, Chunk.virtual(ChunkType.VBRACE_CLOSE, anchor));
        annotator.enclose(open, close);
        open.setParentType(construct.parentType());
        close.setParentType(construct.parentType());
        context.count(COUNTER);
        log.debug("Virtual braces for {} around {} .. {}", construct, store.next(open), last);
        return close;
    }

    private static void markHeader(ChunkStore store, BraceOptionalConstruct construct, Chunk keyword, Chunk headerEnd) {
        if (headerEnd == keyword) {
            return;
        }
        for (Chunk c = store.next(keyword); c != null; c = store.next(c)) {
            if (c.type().isOpenParen() || c.type().isCloseParen()
                    || (c == headerEnd && construct.header() != BraceOptionalConstruct.Header.KEYWORD)) {
                if (c.getParentType() == ChunkType.NONE) {
                    c.setParentType(construct.parentType());
                }
            }
            if (c == headerEnd) {
                break;
            }
        }
    }

    private static void markBlock(ChunkStore store, BraceOptionalConstruct construct, Chunk open) {
        if (open.is(ChunkType.VBRACE_OPEN)) {
            return;
        }
        open.setParentType(construct.parentType());
        Chunk close = store.pairedWith(open);
        if (close != null) {
            close.setParentType(construct.parentType());
        }
        if (construct == BraceOptionalConstruct.SWITCH) {
            markCaseBlocks(store, open, close);
        }
    }

    private static void markCaseBlocks(ChunkStore store, Chunk switchOpen, Chunk switchClose) {
        StatementScanner scanner = new StatementScanner(store);
        for (Chunk c = store.next(switchOpen); c != null && c != switchClose; c = store.next(c)) {
            if (!c.is(ChunkType.CASE) || c.getLevel() != switchOpen.getLevel() + 1) {
                continue;
            }
            StatementScanner.Extent label = scanner.statementEnd(c);
            Chunk body = label == null ? null : store.nextNcNnl(label.last());
            if (body != null && body.is(ChunkType.OPEN_BRACE)) {
                body.setParentType(ChunkType.CASE);
                Chunk close = store.pairedWith(body);
                if (close != null) {
                    close.setParentType(ChunkType.CASE);
                }
            }
        }
    }

    /** Marks the {@code while} of a do-loop and terminates it if it has no semicolon. */
    private static void markTail(NormalizationContext context, BraceOptionalConstruct construct, Chunk bodyClose) {
        if (construct.tail() != BraceOptionalConstruct.Tail.WHILE_CONDITION || bodyClose == null) {
            return;
        }
        ChunkStore store = context.store();
        Chunk w = store.nextNcNnl(bodyClose);
        while (w != null && w.is(ChunkType.VSEMICOLON)) {
            w = store.nextNcNnl(w);
        }
        if (w == null || !w.is(ChunkType.WHILE)) {
            return;
        }
        w.setParentType(ChunkType.DO);
        Chunk conditionEnd = BraceOptionalConstruct.conditionEnd(store, w);
        markHeader(store, construct, w, conditionEnd);
        VirtualSemicolonPass.addVsemiAfter(context, conditionEnd);
    }

    private static Chunk lastCodeChunk(ChunkStore store, Chunk fallback) {
        Chunk tail = store.tail();
        if (tail != null && tail.isCommentOrNewline()) {
            Chunk code = store.prevNcNnl(tail);
            return code != null ? code : fallback;
        }
        return tail != null ? tail : fallback;
    }

    private static boolean isAssign(Chunk chunk) {
        return chunk.is(ChunkType.OPERATOR) && chunk.text().equals("=");
    }
}
