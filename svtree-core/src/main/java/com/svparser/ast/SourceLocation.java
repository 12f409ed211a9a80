package com.svparser.ast;

/**
 * Start and end position of a node. Lines are 1-based, columns 0-based.
 */
public record SourceLocation(Position start, Position end) {
    public record Position(int line, int column) {}
}
