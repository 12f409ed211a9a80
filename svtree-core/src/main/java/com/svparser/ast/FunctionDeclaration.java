package com.svparser.ast;

import java.util.List;

public record FunctionDeclaration(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String name,
    String returnType,  // Null when the header has no return type (function new(...))
    List<String> args,  // Raw argument tokens, commas stripped
    Block body,
    boolean terminated
) implements BlockItem {
    public FunctionDeclaration(
        int start,
        int end,
        SourceLocation loc,
        String name,
        String returnType,
        List<String> args,
        Block body,
        boolean terminated
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             name,
             returnType,
             args,
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
        return "Function";
    }
}
