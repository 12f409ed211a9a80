package com.svparser.ast;

/**
 * Top-level declarations.
 */
public sealed interface SourceItem extends Node permits
    ClassDeclaration,
    ModuleDeclaration {
}
