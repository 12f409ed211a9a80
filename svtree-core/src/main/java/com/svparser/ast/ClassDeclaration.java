package com.svparser.ast;

import java.util.List;

public record ClassDeclaration(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String name,
    String superClass,                    // Can be null if no extends
    List<FunctionDeclaration> members,    // Only functions are decomposed
    boolean terminated                    // false when endclass was never seen
) implements SourceItem {
    public ClassDeclaration(
        int start,
        int end,
        SourceLocation loc,
        String name,
        String superClass,
        List<FunctionDeclaration> members,
        boolean terminated
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             name,
             superClass,
             members,
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
        return "Class";
    }
}
