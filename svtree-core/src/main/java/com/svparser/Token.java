package com.svparser;

/**
 * A classified lexical unit.
 *
 * @param type        token class
 * @param lexeme      literal source text (empty for EOF)
 * @param keyword     the keyword, non-null exactly when {@code type == KEYWORD}
 * @param position    start offset in the source
 * @param endPosition end offset in the source (exclusive)
 * @param line        1-based line of the first character
 * @param column      0-based column of the first character
 */
public record Token(
    TokenType type,
    String lexeme,
    Keyword keyword,
    int position,
    int endPosition,
    int line,
    int column
) {
    public Token(TokenType type, String lexeme, int position, int endPosition, int line, int column) {
        this(type, lexeme, null, position, endPosition, line, column);
    }

    public static Token eof(int position, int line, int column) {
        return new Token(TokenType.EOF, "", null, position, position, line, column);
    }

    public boolean is(Keyword kw) {
        return keyword == kw;
    }

    public boolean isSymbol(String symbol) {
        return type == TokenType.SYMBOL && lexeme.equals(symbol);
    }

    /**
     * Identifiers, keywords, numbers and strings; adjacent word-like tokens need a
     * separating space when their text is joined back together.
     */
    public boolean isWordLike() {
        return type == TokenType.KEYWORD || type == TokenType.IDENTIFIER
            || type == TokenType.NUMBER || type == TokenType.STRING;
    }

    @Override
    public String toString() {
        return type + "('" + lexeme + "')@" + line + ":" + column;
    }
}
