package com.complexity.analyzer.ast;

import com.complexity.analyzer.visitor.NodeVisitor;

import java.util.Objects;
import java.util.Optional;

public final class IfStatement extends Statement {

    private final Expression condition;
    private final Block thenBlock;
    private final Block elseBlock;

    public IfStatement(Expression condition, Block thenBlock, Block elseBlock) {
        this.condition = Objects.requireNonNull(condition);
        this.thenBlock = Objects.requireNonNull(thenBlock);
        this.elseBlock = elseBlock;
    }

    public Expression getCondition() {
        return condition;
    }

    public Block getThenBlock() {
        return thenBlock;
    }

    public Optional<Block> getElseBlock() {
        return Optional.ofNullable(elseBlock);
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
