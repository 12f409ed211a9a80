package com.svparser;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Single-pass tokenizer for the SystemVerilog subset.
 *
 * <p>Tokenizing is total: whitespace and comments are dropped, and so is any character that
 * starts none of the recognized token classes. The returned list always ends with exactly
 * one {@link TokenType#EOF} token.</p>
 */
public class Lexer {
    // Single-character structural symbols; multi-character operators lex as a run of these
    private static final String SYMBOLS = "()[]{};,.:@#=<>+-*/%&|^~!?'$";

    private final String source;
    private final char[] buf;
    private final int length;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;

    public Lexer(String source) {
        this.source = Objects.requireNonNull(source, "source");
        this.buf = source.toCharArray();
        this.length = buf.length;
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        current = 0;
        line = 1;
        lineStart = 0;

        while (current < length) {
            Token token = nextToken();
            if (token != null) {
                tokens.add(token);
            }
        }
        tokens.add(Token.eof(length, line, length - lineStart));
        return tokens;
    }

    /**
     * Scan from the current position. Returns null when the scanned characters produce no
     * token (whitespace, comments, unrecognized characters).
     */
    private Token nextToken() {
        char c = buf[current];

        if (c == '\n') {
            current++;
            line++;
            lineStart = current;
            return null;
        }
        if (Character.isWhitespace(c)) {
            current++;
            return null;
        }
        if (c == '/' && peekChar(1) == '/') {
            skipLineComment();
            return null;
        }
        if (c == '/' && peekChar(1) == '*') {
            skipBlockComment();
            return null;
        }
        if (isIdentifierStart(c)) {
            return scanWord();
        }
        if (isDigit(c)) {
            return scanNumber();
        }
        if (c == '"') {
            Token str = scanString();
            if (str != null) {
                return str;
            }
            // No closing quote: drop the quote and keep going
            current++;
            return null;
        }
        if (SYMBOLS.indexOf(c) >= 0) {
            int start = current;
            int col = start - lineStart;
            current++;
            return new Token(TokenType.SYMBOL, String.valueOf(c), start, current, line, col);
        }

        current++;
        return null;
    }

    private Token scanWord() {
        int start = current;
        int col = start - lineStart;
        current++;
        while (current < length && isIdentifierPart(buf[current])) {
            current++;
        }
        String word = source.substring(start, current);
        Keyword kw = Keyword.lookup(word);
        if (kw != null) {
            return new Token(TokenType.KEYWORD, word, kw, start, current, line, col);
        }
        return new Token(TokenType.IDENTIFIER, word, start, current, line, col);
    }

    private Token scanNumber() {
        int start = current;
        int col = start - lineStart;
        while (current < length && (isDigit(buf[current]) || buf[current] == '_')) {
            current++;
        }
        // Sized literal: <digits>'<radix><digits>, e.g. 8'hFF, 1'b0
        if (peekChar(0) == '\'' && isRadix(peekChar(1)) && isRadixDigit(peekChar(2))) {
            current += 2;
            while (current < length && isRadixDigit(buf[current])) {
                current++;
            }
        }
        return new Token(TokenType.NUMBER, source.substring(start, current), start, current, line, col);
    }

    private Token scanString() {
        int start = current;
        int startLine = line;
        int col = start - lineStart;
        int close = source.indexOf('"', start + 1);
        if (close < 0) {
            return null;
        }
        // Strings may span lines; keep the line index accurate
        for (int i = start + 1; i < close; i++) {
            if (buf[i] == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        current = close + 1;
        return new Token(TokenType.STRING, source.substring(start, current), start, current, startLine, col);
    }

    private void skipLineComment() {
        while (current < length && buf[current] != '\n') {
            current++;
        }
    }

    private void skipBlockComment() {
        current += 2;
        while (current < length) {
            if (buf[current] == '*' && peekChar(1) == '/') {
                current += 2;
                return;
            }
            if (buf[current] == '\n') {
                line++;
                lineStart = current + 1;
            }
            current++;
        }
    }

    private char peekChar(int offset) {
        int pos = current + offset;
        return pos < length ? buf[pos] : '\0';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c) || c == '$';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isRadix(char c) {
        return switch (c) {
            case 'h', 'H', 'd', 'D', 'b', 'B', 'o', 'O' -> true;
            default -> false;
        };
    }

    private static boolean isRadixDigit(char c) {
        return isDigit(c)
            || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F')
            || c == 'x' || c == 'X' || c == 'z' || c == 'Z' || c == '_' || c == '?';
    }
}
