package com.svparser;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Tunables for generic statement capture.
 *
 * @param statementTerminators  symbols that end a generic statement; the symbol is consumed
 *                              and not part of the statement text
 * @param statementStopKeywords keywords that end a generic statement without being consumed,
 *                              because they start or close a construct the parser models
 * @param maxNestingDepth       deepest construct nesting that is decomposed; anything deeper is
 *                              captured as generic statements so recursion stays bounded
 */
public record ParserOptions(
    Set<String> statementTerminators,
    Set<Keyword> statementStopKeywords,
    int maxNestingDepth
) {
    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    private static final Set<String> DEFAULT_TERMINATORS = Set.of(";");

    private static final Set<Keyword> DEFAULT_STOP_KEYWORDS = EnumSet.of(
        Keyword.BEGIN, Keyword.END,
        Keyword.IF, Keyword.ELSE,
        Keyword.CASE, Keyword.ENDCASE,
        Keyword.FUNCTION, Keyword.ENDFUNCTION,
        Keyword.MODULE, Keyword.ENDMODULE,
        Keyword.CLASS, Keyword.ENDCLASS,
        Keyword.ALWAYS, Keyword.ALWAYS_FF, Keyword.ALWAYS_COMB, Keyword.ALWAYS_LATCH
    );

    private static final ParserOptions DEFAULTS = new ParserOptions(
        DEFAULT_TERMINATORS, DEFAULT_STOP_KEYWORDS, DEFAULT_MAX_NESTING_DEPTH);

    public ParserOptions {
        Objects.requireNonNull(statementTerminators, "statementTerminators");
        Objects.requireNonNull(statementStopKeywords, "statementStopKeywords");
        statementTerminators = Set.copyOf(statementTerminators);
        statementStopKeywords = Set.copyOf(statementStopKeywords);
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
    }

    public static ParserOptions defaults() {
        return DEFAULTS;
    }

    public ParserOptions withStatementTerminators(Set<String> terminators) {
        return new ParserOptions(terminators, statementStopKeywords, maxNestingDepth);
    }

    public ParserOptions withStatementStopKeywords(Set<Keyword> keywords) {
        return new ParserOptions(statementTerminators, keywords, maxNestingDepth);
    }

    public ParserOptions withMaxNestingDepth(int depth) {
        return new ParserOptions(statementTerminators, statementStopKeywords, depth);
    }

    public boolean isStatementTerminator(Token token) {
        return token.type() == TokenType.SYMBOL && statementTerminators.contains(token.lexeme());
    }

    public boolean isStopKeyword(Token token) {
        return token.keyword() != null && statementStopKeywords.contains(token.keyword());
    }
}
