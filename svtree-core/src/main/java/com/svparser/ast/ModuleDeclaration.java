package com.svparser.ast;

import java.util.List;

public record ModuleDeclaration(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String name,
    List<String> parameters,  // Raw text of #( ... ), commas stripped; empty if none
    List<String> ports,       // Raw text of ( ... ), commas stripped; empty if none
    Block body,
    boolean terminated
) implements SourceItem {
    public ModuleDeclaration(
        int start,
        int end,
        SourceLocation loc,
        String name,
        List<String> parameters,
        List<String> ports,
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
             parameters,
             ports,
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
        return "Module";
    }
}
