package org.braceform.engine.model;

/**
 * Token classes of the formatting stream.
 * <p>
 * Only the classes that carry structure are distinguished; everything else the lexer
 * produces falls into one of the generic classes ({@link #WORD}, {@link #OPERATOR}, ...).
 * Virtual classes never come from source text, they are inserted by the normalization passes.
 */
public enum ChunkType {
    OPEN_BRACE,
    CLOSE_BRACE,
    VBRACE_OPEN,
    VBRACE_CLOSE,
    SEMICOLON,
    VSEMICOLON,
    NEWLINE,

    IF,
    ELSE,
    FOR,
    WHILE,
    DO,
    SWITCH,
    CASE,
    ENUM,

    PP_IF,
    PP_ELIF,
    PP_ELSE,
    PP_ENDIF,
    PP_OTHER,

    PAREN_OPEN,
    PAREN_CLOSE,
    SQUARE_OPEN,
    SQUARE_CLOSE,
    COMMA,
    COLON,
    OPERATOR,
    WORD,
    NUMBER,
    STRING,
    COMMENT,

    /** Marks constructs that have no keyword of their own; used as a parent type only. */
    FUNCTION,
    NONE;

    /** @return true for real and virtual open braces. */
    public boolean isOpenBlock() {
        return this == OPEN_BRACE || this == VBRACE_OPEN;
    }

    /** @return true for real and virtual close braces. */
    public boolean isCloseBlock() {
        return this == CLOSE_BRACE || this == VBRACE_CLOSE;
    }

    /** @return true for real and virtual semicolons. */
    public boolean isSemicolon() {
        return this == SEMICOLON || this == VSEMICOLON;
    }

    public boolean isOpenParen() {
        return this == PAREN_OPEN || this == SQUARE_OPEN;
    }

    public boolean isCloseParen() {
        return this == PAREN_CLOSE || this == SQUARE_CLOSE;
    }

    /** @return true for the four directives that form a conditional group. */
    public boolean isConditionalDirective() {
        return this == PP_IF || this == PP_ELIF || this == PP_ELSE || this == PP_ENDIF;
    }

    /** @return true for every preprocessor line. */
    public boolean isPreprocessor() {
        return isConditionalDirective() || this == PP_OTHER;
    }

    /**
     * A statement terminator in the sense of the virtual semicolon pass: the chunk already
     * closes (or opens) a statement, so no virtual semicolon may follow it.
     */
    public boolean isTerminator() {
        return isSemicolon() || isOpenBlock() || isCloseBlock();
    }

    /** @return true for chunks that exist only as structural markers. */
    public boolean isVirtual() {
        return this == VBRACE_OPEN || this == VBRACE_CLOSE || this == VSEMICOLON;
    }
}
