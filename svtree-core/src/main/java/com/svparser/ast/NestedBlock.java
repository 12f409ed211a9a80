package com.svparser.ast;

/**
 * A {@code begin ... end} region.
 */
public record NestedBlock(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String label,  // begin : label, can be null
    Block body,
    boolean terminated
) implements BlockItem {
    public NestedBlock(
        int start,
        int end,
        SourceLocation loc,
        String label,
        Block body,
        boolean terminated
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             label,
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
        return "NestedBlock";
    }
}
