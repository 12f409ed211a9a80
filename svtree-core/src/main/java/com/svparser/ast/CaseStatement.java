package com.svparser.ast;

public record CaseStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String expression,
    Block body,
    boolean terminated
) implements BlockItem {
    public CaseStatement(
        int start,
        int end,
        SourceLocation loc,
        String expression,
        Block body,
        boolean terminated
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             expression,
             body,
             terminated);
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
        return "Case";
    }
}
