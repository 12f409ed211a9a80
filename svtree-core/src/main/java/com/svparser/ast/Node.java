package com.svparser.ast;

/**
 * Base interface for all AST nodes.
 */
public sealed interface Node permits
    Source,
    SourceItem,
    BlockItem {

    /** Kind discriminant, e.g. {@code "Module"} or {@code "Statement"}. */
    String type();
    int start();
    int end();
    SourceLocation loc();
}
