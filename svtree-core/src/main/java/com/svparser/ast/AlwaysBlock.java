package com.svparser.ast;

public record AlwaysBlock(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String kind,         // always, always_ff, always_comb or always_latch
    String sensitivity,  // Can be null, e.g. for always_comb
    Block body
) implements BlockItem {
    public AlwaysBlock(
        int start,
        int end,
        SourceLocation loc,
        String kind,
        String sensitivity,
        Block body
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             kind,
             sensitivity,
             body);
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
        return "Always";
    }
}
