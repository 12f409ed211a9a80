package com.svparser;

import com.svparser.ast.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Recursive-descent structural parser.
 *
 * <p>Only the constructs needed to recover module and class structure are decomposed: signal
 * declarations, functions, process blocks, begin/end regions, if/else and case. Everything
 * else inside a body becomes a {@link GenericStatement} holding the joined token text.</p>
 *
 * <p>Parsing never fails. A construct whose terminator keyword is missing ends at end of input
 * (or at the terminator of an enclosing construct) and is reported with
 * {@code terminated == false}. The cursor only moves forward, one token per step, and never
 * past the final EOF token, so every loop here either consumes a token or stops.</p>
 *
 * <p>A parser instance is not thread-safe; use one per input.</p>
 */
public class Parser {
    private final List<Token> tokens;
    private final ParserOptions options;
    private final int sourceLength;
    private final int[] lineOffsets; // Starting offset of each line, null when built from tokens
    private int current = 0;
    private Token lastConsumed = null;
    private int depth = 0;

    // Terminator keyword of every construct currently open, innermost first.
    // A block stops at any of them but only its owner consumes one.
    private final ArrayDeque<Keyword> enclosing = new ArrayDeque<>();

    public Parser(String source) {
        this(source, ParserOptions.defaults());
    }

    public Parser(String source, ParserOptions options) {
        Objects.requireNonNull(source, "source");
        this.options = Objects.requireNonNull(options, "options");
        this.tokens = new Lexer(source).tokenize();
        this.sourceLength = source.length();
        this.lineOffsets = buildLineOffsetIndex(source);
    }

    public Parser(List<Token> tokens) {
        this(tokens, ParserOptions.defaults());
    }

    /**
     * Parse an already tokenized input. An EOF token is appended if the list lacks one.
     */
    public Parser(List<Token> tokens, ParserOptions options) {
        Objects.requireNonNull(tokens, "tokens");
        this.options = Objects.requireNonNull(options, "options");
        List<Token> copy = new ArrayList<>(tokens);
        if (copy.isEmpty() || copy.get(copy.size() - 1).type() != TokenType.EOF) {
            Token last = copy.isEmpty() ? null : copy.get(copy.size() - 1);
            copy.add(last == null
                ? Token.eof(0, 1, 0)
                : Token.eof(last.endPosition(), last.line(), last.column() + last.lexeme().length()));
        }
        this.tokens = List.copyOf(copy);
        this.sourceLength = this.tokens.get(this.tokens.size() - 1).endPosition();
        this.lineOffsets = null;
    }

    public static Source parse(String source) {
        return new Parser(source).parse();
    }

    public static Source parse(String source, ParserOptions options) {
        return new Parser(source, options).parse();
    }

    public List<Token> tokens() {
        return tokens;
    }

    /** Cursor index into {@link #tokens()}. */
    public int position() {
        return current;
    }

    public Source parse() {
        current = 0;
        lastConsumed = null;
        depth = 0;
        enclosing.clear();

        List<SourceItem> items = new ArrayList<>();
        while (!isAtEnd()) {
            Token token = peek();
            if (token.is(Keyword.CLASS)) {
                items.add(parseClassDeclaration());
            } else if (token.is(Keyword.MODULE)) {
                items.add(parseModuleDeclaration());
            } else {
                // Anything outside a class or module is ignored
                advance();
            }
        }

        SourceLocation.Position endPos = positionAfter(sourceLength);
        return new Source(0, sourceLength, 1, 0, endPos.line(), endPos.column(), items);
    }

    // ========================================================================
    // Declarations
    // ========================================================================

    private ClassDeclaration parseClassDeclaration() {
        Token startToken = advance(); // 'class'
        String name = parseName();

        String superClass = null;
        if (peek().type() == TokenType.IDENTIFIER && peek().lexeme().equals("extends")) {
            advance();
            if (!isAtEnd()) {
                superClass = advance().lexeme();
            }
        }
        matchSymbol(";");

        // Only function members are decomposed; every other token in a class body is skipped
        List<FunctionDeclaration> members = new ArrayList<>();
        enclosing.push(Keyword.ENDCLASS);
        try {
            while (!atBoundary()) {
                if (check(Keyword.FUNCTION)) {
                    members.add(parseFunctionDeclaration());
                } else {
                    advance();
                }
            }
        } finally {
            enclosing.pop();
        }

        boolean terminated = matchTerminator(Keyword.ENDCLASS);
        return new ClassDeclaration(startToken.position(), endOffset(startToken), locFrom(startToken),
            name, superClass, members, terminated);
    }

    private ModuleDeclaration parseModuleDeclaration() {
        Token startToken = advance(); // 'module'
        String name = parseName();

        List<String> parameters = List.of();
        if (checkSymbol("#") && peekAhead(1).isSymbol("(")) {
            advance();
            parameters = parseParenList();
        }
        List<String> ports = List.of();
        if (checkSymbol("(")) {
            ports = parseParenList();
        }
        matchSymbol(";");

        Block body = parseBlock(Keyword.ENDMODULE);
        boolean terminated = matchTerminator(Keyword.ENDMODULE);
        return new ModuleDeclaration(startToken.position(), endOffset(startToken), locFrom(startToken),
            name, parameters, ports, body, terminated);
    }

    /**
     * {@code function [return type] name [(args)] [;] body endfunction}. The header runs up to
     * the argument list or semicolon; its last token is the name and anything before it is the
     * return type.
     */
    private FunctionDeclaration parseFunctionDeclaration() {
        Token startToken = advance(); // 'function'

        List<Token> header = new ArrayList<>();
        while (!atBoundary() && !check(Keyword.ENDFUNCTION) && !checkSymbol("(") && !checkSymbol(";")) {
            header.add(advance());
        }
        String name = header.isEmpty() ? "" : header.get(header.size() - 1).lexeme();
        String returnType = header.size() > 1 ? joinTokens(header.subList(0, header.size() - 1)) : null;

        List<String> args = List.of();
        if (checkSymbol("(")) {
            args = parseParenList();
        }
        matchSymbol(";");

        Block body = parseBlock(Keyword.ENDFUNCTION);
        boolean terminated = matchTerminator(Keyword.ENDFUNCTION);
        return new FunctionDeclaration(startToken.position(), endOffset(startToken), locFrom(startToken),
            name, returnType, args, body, terminated);
    }

    /**
     * The declared name is whatever token follows the introducing keyword; no validation.
     */
    private String parseName() {
        return isAtEnd() ? "" : advance().lexeme();
    }

    /**
     * Raw lexemes of a parenthesized list, cursor on the opening parenthesis. Top-level commas
     * are dropped. Stops early at a semicolon or a declaration keyword so an unclosed list
     * cannot swallow the rest of the file.
     */
    private List<String> parseParenList() {
        advance(); // '('
        List<String> items = new ArrayList<>();
        int level = 1;
        while (!atBoundary() && !checkSymbol(";") && !isDeclarationKeyword(peek())) {
            Token token = advance();
            if (token.isSymbol("(")) {
                level++;
            } else if (token.isSymbol(")")) {
                level--;
                if (level == 0) {
                    break;
                }
            } else if (level == 1 && token.isSymbol(",")) {
                continue;
            }
            items.add(token.lexeme());
        }
        return items;
    }

    // ========================================================================
    // Blocks
    // ========================================================================

    /**
     * Items up to {@code terminator}, end of input, or the terminator of an enclosing construct.
     * The terminator itself is left for the caller.
     */
    private Block parseBlock(Keyword terminator) {
        List<BlockItem> items = new ArrayList<>();
        enclosing.push(terminator);
        try {
            while (!atBoundary()) {
                BlockItem item = parseBlockItem();
                if (item != null) {
                    items.add(item);
                }
            }
        } finally {
            enclosing.pop();
        }
        return new Block(items);
    }

    /**
     * Body of a process block or an if/else arm: the single statement that follows, which is a
     * {@link NestedBlock} for {@code begin ... end}.
     */
    private Block parseSingleStatement() {
        if (atBoundary() || check(Keyword.ELSE)) {
            return Block.empty();
        }
        BlockItem item = parseBlockItem();
        return item == null ? Block.empty() : new Block(List.of(item));
    }

    /**
     * Dispatch on the leading token. Always consumes at least one token; returns null for a
     * lone statement terminator.
     */
    private BlockItem parseBlockItem() {
        Token token = peek();
        if (token.type() != TokenType.KEYWORD || depth >= options.maxNestingDepth()) {
            return parseGenericStatement();
        }

        depth++;
        try {
            return switch (token.keyword()) {
                case LOGIC, WIRE, REG, BIT, BYTE, INT, INTEGER, SHORTINT, LONGINT, REAL, STRING ->
                    parseSignalDeclaration();
                case FUNCTION -> parseFunctionDeclaration();
                case ALWAYS, ALWAYS_FF, ALWAYS_COMB, ALWAYS_LATCH -> parseAlwaysBlock();
                case BEGIN -> parseNestedBlock();
                case IF -> parseIfStatement();
                case CASE -> parseCaseStatement();
                case CLASS, ENDCLASS, MODULE, ENDMODULE, ENDFUNCTION,
                     INPUT, OUTPUT, INOUT, ELSE, ENDCASE, END -> parseGenericStatement();
            };
        } finally {
            depth--;
        }
    }

    // ========================================================================
    // Block items
    // ========================================================================

    private SignalDeclaration parseSignalDeclaration() {
        Token startToken = advance(); // data type

        String width = null;
        if (checkSymbol("[")) {
            List<Token> dims = new ArrayList<>();
            while (checkSymbol("[")) {
                dims.addAll(collectBalanced("[", "]"));
            }
            width = joinTokens(dims);
        }

        // Names are the depth-0 comma separated segments before the terminator
        List<String> names = new ArrayList<>();
        List<Token> segment = new ArrayList<>();
        int level = 0;
        while (!atBoundary() && !options.isStopKeyword(peek())) {
            Token token = peek();
            if (level == 0 && options.isStatementTerminator(token)) {
                advance();
                break;
            }
            advance();
            if (level == 0 && token.isSymbol(",")) {
                addSegment(names, segment);
                continue;
            }
            if (isOpening(token)) {
                level++;
            } else if (isClosing(token) && level > 0) {
                level--;
            }
            segment.add(token);
        }
        addSegment(names, segment);

        return new SignalDeclaration(startToken.position(), endOffset(startToken), locFrom(startToken),
            startToken.lexeme(), width, names);
    }

    private static void addSegment(List<String> names, List<Token> segment) {
        if (!segment.isEmpty()) {
            names.add(joinTokens(segment));
            segment.clear();
        }
    }

    private AlwaysBlock parseAlwaysBlock() {
        Token startToken = advance(); // always, always_ff, always_comb or always_latch

        String sensitivity = null;
        if (checkSymbol("@")) {
            List<Token> trigger = new ArrayList<>();
            trigger.add(advance());
            if (checkSymbol("(")) {
                trigger.addAll(collectBalanced("(", ")"));
            } else if (!atBoundary() && !options.isStopKeyword(peek())) {
                // @* or @clk
                trigger.add(advance());
            }
            sensitivity = joinTokens(trigger);
        }

        Block body = parseSingleStatement();
        return new AlwaysBlock(startToken.position(), endOffset(startToken), locFrom(startToken),
            startToken.lexeme(), sensitivity, body);
    }

    private IfStatement parseIfStatement() {
        Token startToken = advance(); // 'if'

        String condition = "";
        if (checkSymbol("(")) {
            condition = joinTokens(innerTokens(collectBalanced("(", ")"), ")"));
        }

        Block consequent = parseSingleStatement();
        Block alternate = null;
        if (check(Keyword.ELSE)) {
            advance();
            alternate = parseSingleStatement();
        }
        return new IfStatement(startToken.position(), endOffset(startToken), locFrom(startToken),
            condition, consequent, alternate);
    }

    private CaseStatement parseCaseStatement() {
        Token startToken = advance(); // 'case'

        String expression = "";
        if (checkSymbol("(")) {
            expression = joinTokens(innerTokens(collectBalanced("(", ")"), ")"));
        } else if (!atBoundary() && !options.isStopKeyword(peek())) {
            expression = advance().lexeme();
        }

        Block body = parseBlock(Keyword.ENDCASE);
        boolean terminated = match(Keyword.ENDCASE);
        return new CaseStatement(startToken.position(), endOffset(startToken), locFrom(startToken),
            expression, body, terminated);
    }

    private NestedBlock parseNestedBlock() {
        Token startToken = advance(); // 'begin'

        String label = null;
        if (checkSymbol(":") && peekAhead(1).type() == TokenType.IDENTIFIER) {
            advance();
            label = advance().lexeme();
        }

        Block body = parseBlock(Keyword.END);
        boolean terminated = matchTerminator(Keyword.END);
        return new NestedBlock(startToken.position(), endOffset(startToken), locFrom(startToken),
            label, body, terminated);
    }

    /**
     * Raw tokens up to the first statement terminator (consumed) or stop keyword (not consumed).
     * The leading token is always taken, whatever it is.
     */
    private GenericStatement parseGenericStatement() {
        Token startToken = peek();
        if (options.isStatementTerminator(startToken)) {
            advance();
            return null;
        }

        List<Token> parts = new ArrayList<>();
        parts.add(advance());
        while (!atBoundary()) {
            Token token = peek();
            if (options.isStatementTerminator(token)) {
                advance();
                break;
            }
            if (options.isStopKeyword(token)) {
                break;
            }
            parts.add(advance());
        }
        return new GenericStatement(startToken.position(), endOffset(startToken), locFrom(startToken),
            joinTokens(parts));
    }

    // ========================================================================
    // Raw text helpers
    // ========================================================================

    /**
     * Tokens of a bracketed region including both delimiters, cursor on {@code open}. Stops
     * without the closing delimiter at a statement terminator, stop keyword or boundary.
     */
    private List<Token> collectBalanced(String open, String close) {
        List<Token> collected = new ArrayList<>();
        collected.add(advance());
        int level = 1;
        while (!atBoundary() && !options.isStatementTerminator(peek()) && !options.isStopKeyword(peek())) {
            Token token = advance();
            collected.add(token);
            if (token.isSymbol(open)) {
                level++;
            } else if (token.isSymbol(close)) {
                level--;
                if (level == 0) {
                    break;
                }
            }
        }
        return collected;
    }

    private static List<Token> innerTokens(List<Token> bracketed, String close) {
        int end = bracketed.size();
        if (end > 1 && bracketed.get(end - 1).isSymbol(close)) {
            end--;
        }
        return bracketed.subList(Math.min(1, end), end);
    }

    /**
     * Join lexemes, separating two adjacent word-like tokens with one space and nothing
     * otherwise: {@code @(posedge clk)}, {@code [7:0]}, {@code a<=0}.
     */
    static String joinTokens(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        Token prev = null;
        for (Token token : tokens) {
            if (prev != null && prev.isWordLike() && token.isWordLike()) {
                sb.append(' ');
            }
            sb.append(token.lexeme());
            prev = token;
        }
        return sb.toString();
    }

    private static boolean isOpening(Token token) {
        return token.isSymbol("(") || token.isSymbol("[") || token.isSymbol("{");
    }

    private static boolean isClosing(Token token) {
        return token.isSymbol(")") || token.isSymbol("]") || token.isSymbol("}");
    }

    private static boolean isDeclarationKeyword(Token token) {
        return token.keyword() != null && token.keyword().category() == Keyword.Category.DECLARATION;
    }

    // ========================================================================
    // Cursor
    // ========================================================================

    /**
     * End of input, the start of another top-level declaration, or the terminator keyword of
     * any construct currently open.
     */
    private boolean atBoundary() {
        if (isAtEnd()) {
            return true;
        }
        Keyword kw = peek().keyword();
        return kw == Keyword.MODULE || kw == Keyword.CLASS || (kw != null && enclosing.contains(kw));
    }

    /**
     * Consume {@code terminator} and an optional {@code : label} after it.
     */
    private boolean matchTerminator(Keyword terminator) {
        if (!match(terminator)) {
            return false;
        }
        if (checkSymbol(":") && peekAhead(1).type() == TokenType.IDENTIFIER) {
            advance();
            advance();
        }
        return true;
    }

    private boolean match(Keyword keyword) {
        if (check(keyword)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean matchSymbol(String symbol) {
        if (checkSymbol(symbol)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(Keyword keyword) {
        return peek().is(keyword);
    }

    private boolean checkSymbol(String symbol) {
        return peek().isSymbol(symbol);
    }

    private Token advance() {
        Token token = peek();
        if (!isAtEnd()) {
            current++;
            lastConsumed = token;
        }
        return token;
    }

    private boolean isAtEnd() {
        return current >= tokens.size() - 1;
    }

    private Token peek() {
        return tokens.get(Math.min(current, tokens.size() - 1));
    }

    private Token peekAhead(int offset) {
        return tokens.get(Math.min(current + offset, tokens.size() - 1));
    }

    // ========================================================================
    // Locations
    // ========================================================================

    private int endOffset(Token startToken) {
        return lastConsumed != null ? lastConsumed.endPosition() : startToken.endPosition();
    }

    private SourceLocation locFrom(Token startToken) {
        return new SourceLocation(
            new SourceLocation.Position(startToken.line(), startToken.column()),
            positionAfter(endOffset(startToken))
        );
    }

    private static int[] buildLineOffsetIndex(String source) {
        List<Integer> offsets = new ArrayList<>();
        offsets.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                offsets.add(i + 1);
            }
        }
        return offsets.stream().mapToInt(Integer::intValue).toArray();
    }

    // Line and column of an offset (O(log n)); falls back to the last consumed token's
    // line when the parser was built from tokens and has no line index
    private SourceLocation.Position positionAfter(int offset) {
        if (lineOffsets == null) {
            Token ref = lastConsumed != null ? lastConsumed : tokens.get(tokens.size() - 1);
            return new SourceLocation.Position(ref.line(), ref.column() + (offset - ref.position()));
        }

        offset = Math.max(0, Math.min(offset, sourceLength));

        int low = 0;
        int high = lineOffsets.length - 1;
        int line = 1;
        while (low <= high) {
            int mid = (low + high) / 2;
            if (lineOffsets[mid] <= offset) {
                line = mid + 1;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return new SourceLocation.Position(line, offset - lineOffsets[line - 1]);
    }
}
