package org.braceform.engine.passes;

/**
 * Where the virtual semicolon pass looks for newline-terminated statements.
 */
public enum SemicolonScope {
    /** Only statements inside virtual brace regions. */
    VIRTUAL_BLOCKS,
    /** Every statement of the file, for languages where a newline ends any statement. */
    ALL_STATEMENTS
}
