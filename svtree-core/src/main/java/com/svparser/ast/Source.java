package com.svparser.ast;

import java.util.List;

/**
 * Root of the tree: the recognized top-level declarations of one source text, in order.
 */
public record Source(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<SourceItem> items
) implements Node {

    public Source(List<SourceItem> items) {
        this(0, 0, 0, 0, 0, 0, items);
    }

    public Source(
        int start,
        int end,
        SourceLocation loc,
        List<SourceItem> items
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             items);
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
        return "Source";
    }
}
