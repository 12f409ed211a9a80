package com.svparser.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.svparser.ast.*;

/**
 * Polymorphic handling for AST nodes: the node kind travels in the {@code "type"} property and
 * the location is written as a single {@code "loc"} object.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Source.class, name = "Source"),
    @JsonSubTypes.Type(value = ClassDeclaration.class, name = "Class"),
    @JsonSubTypes.Type(value = ModuleDeclaration.class, name = "Module"),
    @JsonSubTypes.Type(value = FunctionDeclaration.class, name = "Function"),
    @JsonSubTypes.Type(value = SignalDeclaration.class, name = "Signal"),
    @JsonSubTypes.Type(value = AlwaysBlock.class, name = "Always"),
    @JsonSubTypes.Type(value = IfStatement.class, name = "If"),
    @JsonSubTypes.Type(value = CaseStatement.class, name = "Case"),
    @JsonSubTypes.Type(value = NestedBlock.class, name = "NestedBlock"),
    @JsonSubTypes.Type(value = GenericStatement.class, name = "Statement")
})
public abstract class NodeMixin {
    @JsonProperty("loc")
    abstract SourceLocation loc();
}
