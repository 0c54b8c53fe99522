package org.braceform.engine.model;

/**
 * Per-chunk flags shared by the passes.
 * <p>
 * Owning pass per flag: {@link #VIRTUAL} is set by whoever creates a virtual chunk;
 * {@link #INVISIBLE} is only ever set by the virtual semicolon scrub.
 * {@link #IN_PREPROC_BRANCH} and {@link #STMT_START} are stamped by the structural annotator.
 */
public enum ChunkFlag {
    /** No source text; exists only to give downstream passes a uniform brace/semicolon signal. */
    VIRTUAL,
    /** Virtual chunk that was suppressed; kept for bookkeeping, contributes nothing to output. */
    INVISIBLE,
    /** Chunk sits between a conditional directive and its matching {@code #endif}. */
    IN_PREPROC_BRANCH,
    /** First significant chunk of a statement. */
    STMT_START
}
