package com.complexity.analyzer.ast;

import com.complexity.analyzer.visitor.NodeVisitor;

import java.util.List;
import java.util.Objects;

/**
 * {@code Clase Name { attr1 attr2 ... }}
 */
public final class ClassDef extends Node {

    private final String name;
    private final List<String> attributes;

    public ClassDef(String name, List<String> attributes) {
        this.name = Objects.requireNonNull(name);
        this.attributes = List.copyOf(attributes);
    }

    public String getName() {
        return name;
    }

    public List<String> getAttributes() {
        return attributes;
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
