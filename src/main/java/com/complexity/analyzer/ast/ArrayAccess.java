package com.complexity.analyzer.ast;

import com.complexity.analyzer.visitor.NodeVisitor;

import java.util.Objects;

/**
 * {@code base[index]}, where base is the flattened text of the expression
 * the index was applied to.
 */
public final class ArrayAccess extends Expression {

    private final String baseText;
    private final Expression index;

    public ArrayAccess(String baseText, Expression index) {
        this.baseText = Objects.requireNonNull(baseText);
        this.index = Objects.requireNonNull(index);
    }

    public String getBaseText() {
        return baseText;
    }

    public Expression getIndex() {
        return index;
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String toString() {
        return baseText + "[" + index + "]";
    }
}
