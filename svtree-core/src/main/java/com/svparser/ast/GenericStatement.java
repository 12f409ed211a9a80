package com.svparser.ast;

/**
 * Undecomposed statement: the joined token text of a construct the grammar does not model.
 */
public record GenericStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String code
) implements BlockItem {
    public GenericStatement(String code) {
        this(0, 0, 0, 0, 0, 0, code);
    }

    public GenericStatement(
        int start,
        int end,
        SourceLocation loc,
        String code
    ) {
        this(start, end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             code);
    }

    @Override
    public SourceLocation loc() {
        return new SourceLocation(
            new SourceLocation.Position(startLine, startCol),
            new SourceLocation.Position(endLine, endCol)
        );
    }

    @Override
    public String type() {
        return "Statement";
    }
}
