package org.docweave.extractor.frontend.lexer;

import org.docweave.extractor.diagnostics.DiagnosticCode;
import org.docweave.extractor.diagnostics.DiagnosticsEngine;
import org.docweave.extractor.grammar.BlockCommentDelimiter;
import org.docweave.extractor.grammar.GrammarDescriptor;
import org.docweave.extractor.grammar.LiteralDelimiter;
import org.docweave.extractor.model.LineIndex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The Lexer (also known as Scanner) splits a source text into code, comment and literal tokens
 * in a single forward pass, driven by a {@link GrammarDescriptor}.
 * <p>
 * The produced tokens are ordered, never overlap and cover every character of the input.
 * Whitespace and newlines between comments and literals belong to {@link TokenKind#CODE} tokens.
 */
public class Lexer {

    /** The longest escape sequence accepted inside a character literal, such as a six digit Rust unicode escape. */
    private static final int MAX_CHAR_ESCAPE_LENGTH = 10;

    private final String source;
    private final GrammarDescriptor grammar;
    private final DiagnosticsEngine diagnostics;
    private final String logicalFileName;
    private final LineIndex lines;
    private final List<Token> tokens = new ArrayList<>();
    private int codeStart = 0;
    private int current = 0;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param grammar The comment and literal syntax of the language.
     * @param diagnostics The engine for reporting malformed comments and literals.
     */
    public Lexer(String source, GrammarDescriptor grammar, DiagnosticsEngine diagnostics) {
        this(source, grammar, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param grammar The comment and literal syntax of the language.
     * @param diagnostics The engine for reporting malformed comments and literals.
     * @param logicalFileName The name of the file being scanned, for error reporting.
     */
    public Lexer(String source, GrammarDescriptor grammar, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.grammar = grammar;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
        this.lines = new LineIndex(source);
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return An unmodifiable list of the tokens, in source order.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            if (!scanDelimited()) {
                current++;
            }
        }
        flushCode(source.length());
        return Collections.unmodifiableList(tokens);
    }

    private boolean scanDelimited() {
        BlockCommentDelimiter block = null;
        String linePrefix = null;
        LiteralDelimiter literal = null;
        int longest = 0;
        int literalLength = 0;

        for (BlockCommentDelimiter candidate : grammar.blockComments()) {
            if (candidate.open().length() > longest && source.startsWith(candidate.open(), current)) {
                block = candidate;
                longest = candidate.open().length();
            }
        }
        for (String candidate : grammar.lineCommentPrefixes()) {
            if (candidate.length() > longest && source.startsWith(candidate, current)) {
                block = null;
                linePrefix = candidate;
                longest = candidate.length();
            }
        }
        for (LiteralDelimiter candidate : grammar.literals()) {
            int length = candidate.openingLength(source, current);
            if (length > longest) {
                block = null;
                linePrefix = null;
                literal = candidate;
                longest = length;
                literalLength = length;
            }
        }

        int start = current;
        int end;
        TokenKind kind;
        if (block != null) {
            end = blockComment(block);
            kind = TokenKind.BLOCK_COMMENT;
        } else if (linePrefix != null) {
            end = lineComment();
            kind = TokenKind.LINE_COMMENT;
        } else if (literal != null && literal.kind() == LiteralDelimiter.Kind.CHAR) {
            end = charLiteral(literal);
            kind = TokenKind.CHAR_LITERAL;
        } else if (literal != null) {
            end = stringLiteral(literal, literalLength);
            kind = TokenKind.STRING_LITERAL;
        } else {
            return false;
        }
        if (end < 0) {
            // Not a literal after all (e.g. a lifetime 'a): the quote stays code.
            return false;
        }
        flushCode(start);
        addToken(kind, start, end);
        codeStart = end;
        current = end;
        return true;
    }

    private int blockComment(BlockCommentDelimiter delimiter) {
        int start = current;
        int position = current + delimiter.open().length();
        int depth = 1;
        while (position < source.length()) {
            if (source.startsWith(delimiter.close(), position)) {
                position += delimiter.close().length();
                if (--depth == 0) {
                    return position;
                }
            } else if (grammar.nestedBlockComments() && source.startsWith(delimiter.open(), position)) {
                position += delimiter.open().length();
                depth++;
            } else {
                position++;
            }
        }
        diagnostics.reportError(DiagnosticCode.MALFORMED_COMMENT,
                "Unterminated block comment starting with '" + delimiter.open() + "'",
                logicalFileName, lines.lineOf(start), lines.columnOf(start));
        return source.length();
    }

    private int lineComment() {
        int position = current;
        while (position < source.length()) {
            char c = source.charAt(position);
            if (c == '\n' || (c == '\r' && position + 1 < source.length() && source.charAt(position + 1) == '\n')) {
                break;
            }
            position++;
        }
        return position;
    }

    private int stringLiteral(LiteralDelimiter delimiter, int openingLength) {
        int start = current;
        String close = delimiter.closer(openingLength);
        int position = current + openingLength;
        while (position < source.length()) {
            if (isEscape(delimiter, position)) {
                position = Math.min(position + 2, source.length());
            } else if (source.startsWith(close, position)) {
                return position + close.length();
            } else {
                position++;
            }
        }
        diagnostics.reportError(DiagnosticCode.MALFORMED_LITERAL,
                "Unterminated string literal starting with '" + source.substring(start, start + openingLength) + "'",
                logicalFileName, lines.lineOf(start), lines.columnOf(start));
        return source.length();
    }

    /**
     * A character literal holds exactly one character or one escape sequence.
     * @return The end offset, or -1 if the delimiter does not open a character literal here.
     */
    private int charLiteral(LiteralDelimiter delimiter) {
        int start = current;
        int content = current + delimiter.open().length();
        if (content >= source.length()) {
            return -1;
        }
        if (isEscape(delimiter, content)) {
            int limit = Math.min(source.length(), content + MAX_CHAR_ESCAPE_LENGTH);
            for (int position = content + 2; position <= limit; position++) {
                if (source.startsWith(delimiter.close(), position)) {
                    return position + delimiter.close().length();
                }
                if (position < source.length() && source.charAt(position) == '\n') {
                    return -1;
                }
            }
            if (limit == source.length()) {
                diagnostics.reportError(DiagnosticCode.MALFORMED_LITERAL,
                        "Unterminated character literal",
                        logicalFileName, lines.lineOf(start), lines.columnOf(start));
                return source.length();
            }
            return -1;
        }
        char first = source.charAt(content);
        if (first == '\n' || source.startsWith(delimiter.close(), content)) {
            return -1;
        }
        int next = content + Character.charCount(source.codePointAt(content));
        return source.startsWith(delimiter.close(), next) ? next + delimiter.close().length() : -1;
    }

    private boolean isEscape(LiteralDelimiter delimiter, int position) {
        return delimiter.escapes()
                && grammar.escapeChar() != GrammarDescriptor.NO_ESCAPE
                && source.charAt(position) == grammar.escapeChar();
    }

    private void flushCode(int end) {
        if (end > codeStart) {
            addToken(TokenKind.CODE, codeStart, end);
        }
        codeStart = end;
    }

    private void addToken(TokenKind kind, int start, int end) {
        tokens.add(new Token(kind, lines.span(start, end), source.substring(start, end)));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }
}
