package com.complexity.analyzer.ast;

import com.complexity.analyzer.visitor.NodeVisitor;

import java.util.List;
import java.util.Objects;

/**
 * {@code call name(args)}. The callee is not resolved.
 */
public final class Call extends Statement {

    private final String procedureName;
    private final List<Expression> arguments;

    public Call(String procedureName, List<Expression> arguments) {
        this.procedureName = Objects.requireNonNull(procedureName);
        this.arguments = List.copyOf(arguments);
    }

    public String getProcedureName() {
        return procedureName;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
