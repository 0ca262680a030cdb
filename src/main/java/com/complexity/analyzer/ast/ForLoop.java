package com.complexity.analyzer.ast;

import com.complexity.analyzer.visitor.NodeVisitor;

import java.util.Objects;

/**
 * {@code for variable <- start to end do begin ... end}. The loop variable is
 * bound for the body only.
 */
public final class ForLoop extends Statement {

    private final String variable;
    private final Expression start;
    private final Expression end;
    private final Block body;

    public ForLoop(String variable, Expression start, Expression end, Block body) {
        this.variable = Objects.requireNonNull(variable);
        this.start = Objects.requireNonNull(start);
        this.end = Objects.requireNonNull(end);
        this.body = Objects.requireNonNull(body);
    }

    public String getVariable() {
        return variable;
    }

    public Expression getStart() {
        return start;
    }

    public Expression getEnd() {
        return end;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
