package com.complexity.analyzer.ast;

import com.complexity.analyzer.visitor.NodeVisitor;

import java.util.Objects;
import java.util.Optional;

/**
 * A formal parameter. Array dimensions are not retained; object parameters
 * remember the name of their class.
 */
public final class Parameter extends Node {

    private final String name;
    private final ParameterKind kind;
    private final String className;

    private Parameter(String name, ParameterKind kind, String className) {
        this.name = Objects.requireNonNull(name);
        this.kind = Objects.requireNonNull(kind);
        this.className = className;
    }

    public static Parameter scalar(String name) {
        return new Parameter(name, ParameterKind.SCALAR, null);
    }

    public static Parameter array(String name) {
        return new Parameter(name, ParameterKind.ARRAY, null);
    }

    public static Parameter object(String name, String className) {
        return new Parameter(name, ParameterKind.OBJECT, Objects.requireNonNull(className));
    }

    public String getName() {
        return name;
    }

    public ParameterKind getKind() {
        return kind;
    }

    public Optional<String> getClassName() {
        return Optional.ofNullable(className);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
