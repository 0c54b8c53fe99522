package org.braceform.engine.frontend.lexer;

import org.braceform.engine.diagnostics.DiagnosticsEngine;
import org.braceform.engine.model.Chunk;
import org.braceform.engine.model.ChunkType;
import org.braceform.engine.store.ChunkStore;

import java.util.List;
import java.util.Map;

/**
 * Reference lexer for C-family and Pawn-like source text.
 * <p>
 * Produces one chunk per token. Runs of line breaks (including blank lines) become a single
 * {@link ChunkType#NEWLINE} chunk whose line break count is the run length, and every
 * preprocessor line is kept whole as one directive chunk. Horizontal whitespace is recorded
 * on the chunk that follows it; whitespace at the end of a line is dropped.
 */
public class Lexer {

    private static final Map<String, ChunkType> KEYWORDS = Map.of(
            "if", ChunkType.IF,
            "else", ChunkType.ELSE,
            "for", ChunkType.FOR,
            "while", ChunkType.WHILE,
            "do", ChunkType.DO,
            "switch", ChunkType.SWITCH,
            "case", ChunkType.CASE,
            "default", ChunkType.CASE,
            "enum", ChunkType.ENUM
    );

    private static final List<String> MULTI_CHAR_OPERATORS = List.of(
            "<<=", ">>=", "...",
            "==", "!=", "<=", ">=", "&&", "||", "++", "--", "+=", "-=", "*=", "/=", "%=",
            "&=", "|=", "^=", "<<", ">>", "->", "::"
    );

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final String fileName;
    private final ChunkStore store = new ChunkStore();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;
    private String pendingWhitespace = "";
    private boolean atLineStart = true;

    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<input>");
    }

    public Lexer(String source, DiagnosticsEngine diagnostics, String fileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.fileName = fileName;
    }

    /**
     * Scans the whole source.
     * @return A store holding the chunks in source order; levels are not yet annotated.
     */
    public ChunkStore scan() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        return store;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ' ', '\t', '\f' -> {
                while (!isAtEnd() && (peek() == ' ' || peek() == '\t' || peek() == '\f')) advance();
                pendingWhitespace = source.substring(start, current);
            }
            case '\r' -> {
                // CRLF and a lone CR both end a line
                match('\n');
                newlineRun();
            }
            case '\n' -> newlineRun();
            case '{' -> add(ChunkType.OPEN_BRACE);
            case '}' -> add(ChunkType.CLOSE_BRACE);
            case '(' -> add(ChunkType.PAREN_OPEN);
            case ')' -> add(ChunkType.PAREN_CLOSE);
            case '[' -> add(ChunkType.SQUARE_OPEN);
            case ']' -> add(ChunkType.SQUARE_CLOSE);
            case ';' -> add(ChunkType.SEMICOLON);
            case ',' -> add(ChunkType.COMMA);
            case '"', '\'' -> literal(c);
            case '#' -> {
                if (atLineStart) {
                    directive();
                } else {
                    add(ChunkType.OPERATOR);
                }
            }
            case '/' -> {
                if (match('/')) {
                    while (!isAtEnd() && peek() != '\n' && peek() != '\r') advance();
                    add(ChunkType.COMMENT);
                } else if (match('*')) {
                    blockComment();
                } else {
                    operator();
                }
            }
            case ':' -> {
                if (match(':')) {
                    add(ChunkType.OPERATOR);
                } else {
                    add(ChunkType.COLON);
                }
            }
            default -> {
                if (Character.isDigit(c)) {
                    number();
                } else if (Character.isLetter(c) || c == '_' || c == '@') {
                    word();
                } else {
                    operator();
                }
            }
        }
    }

    private void newlineRun() {
        // Collapses blank lines (and whitespace on them) into one chunk.
        int breaks = 1;
        int lastBreak = current;
        while (!isAtEnd()) {
            char p = peek();
            if (p == '\n' || (p == '\r' && peekNext() != '\n')) {
                advance();
                breaks++;
                lastBreak = current;
            } else if (p == ' ' || p == '\t' || p == '\f' || p == '\r') {
                advance();
            } else {
                break;
            }
        }
        pendingWhitespace = "";
        store.append(Chunk.real(ChunkType.NEWLINE, "\n".repeat(breaks), startLine, startColumn, ""));
        pendingWhitespace = source.substring(lastBreak, current).replace("\r", "");
        atLineStart = true;
    }

    private void directive() {
        while (!isAtEnd()) {
            char p = peek();
            if (p == '\\' && (peekNext() == '\n' || peekNext() == '\r')) {
                advance();
                if (peek() == '\r') advance();
                if (peek() == '\n') advance();
                continue;
            }
            if (p == '\n' || p == '\r') break;
            advance();
        }
        String text = source.substring(start, current).stripTrailing();
        add(directiveType(text), text);
    }

    static ChunkType directiveType(String text) {
        String body = text.substring(1).stripLeading();
        int end = 0;
        while (end < body.length() && Character.isLetter(body.charAt(end))) end++;
        return switch (body.substring(0, end)) {
            case "if", "ifdef", "ifndef" -> ChunkType.PP_IF;
            case "elif", "elifdef", "elifndef" -> ChunkType.PP_ELIF;
            case "else" -> ChunkType.PP_ELSE;
            case "endif" -> ChunkType.PP_ENDIF;
            default -> ChunkType.PP_OTHER;
        };
    }

    private void blockComment() {
        while (!isAtEnd() && !(peek() == '*' && peekNext() == '/')) {
            advance();
        }
        if (isAtEnd()) {
            diagnostics.reportError("Unterminated block comment", fileName, startLine);
        } else {
            advance();
            advance();
        }
        add(ChunkType.COMMENT);
    }

    private void literal(char quote) {
        while (!isAtEnd() && peek() != quote && peek() != '\n') {
            if (peek() == '\\' && current + 1 < source.length()) {
                advance();
            }
            advance();
        }
        if (isAtEnd() || peek() != quote) {
            diagnostics.reportError("Unterminated literal", fileName, startLine);
        } else {
            advance();
        }
        add(ChunkType.STRING);
    }

    private void number() {
        while (!isAtEnd() && (Character.isLetterOrDigit(peek()) || peek() == '.' || peek() == '_')) {
            advance();
        }
        add(ChunkType.NUMBER);
    }

    private void word() {
        while (!isAtEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_' || peek() == '@')) {
            advance();
        }
        String text = source.substring(start, current);
        add(KEYWORDS.getOrDefault(text, ChunkType.WORD), text);
    }

    private void operator() {
        for (String op : MULTI_CHAR_OPERATORS) {
            if (source.startsWith(op, start)) {
                while (current < start + op.length()) advance();
                break;
            }
        }
        add(ChunkType.OPERATOR);
    }

    private void add(ChunkType type) {
        add(type, source.substring(start, current));
    }

    private void add(ChunkType type, String text) {
        store.append(Chunk.real(type, text, startLine, startColumn, pendingWhitespace));
        pendingWhitespace = "";
        atLineStart = false;
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n' || (c == '\r' && peek() != '\n')) {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(current);
    }

    private char peekNext() {
        return current + 1 >= source.length() ? '\0' : source.charAt(current + 1);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }
}
