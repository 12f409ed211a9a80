package com.svparser.ast;

/**
 * Anything that can appear inside a {@link Block}.
 */
public sealed interface BlockItem extends Node permits
    SignalDeclaration,
    FunctionDeclaration,
    AlwaysBlock,
    NestedBlock,
    IfStatement,
    CaseStatement,
    GenericStatement {
}
