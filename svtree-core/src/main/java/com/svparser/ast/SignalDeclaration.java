package com.svparser.ast;

import java.util.List;

/**
 * {@code logic [7:0] a, b;}
 */
public record SignalDeclaration(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String dataType,
    String width,       // Can be null
    List<String> names
) implements BlockItem {
    public SignalDeclaration(
        int start,
        int end,
        SourceLocation loc,
        String dataType,
        String width,
        List<String> names
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             dataType,
             width,
             names);
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
        return "Signal";
    }
}
