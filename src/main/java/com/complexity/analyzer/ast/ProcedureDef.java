package com.complexity.analyzer.ast;

import com.complexity.analyzer.visitor.NodeVisitor;

import java.util.List;
import java.util.Objects;

public final class ProcedureDef extends Node {

    private final String name;
    private final List<Parameter> parameters;
    private final Block body;

    public ProcedureDef(String name, List<Parameter> parameters, Block body) {
        this.name = Objects.requireNonNull(name);
        this.parameters = List.copyOf(parameters);
        this.body = Objects.requireNonNull(body);
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
