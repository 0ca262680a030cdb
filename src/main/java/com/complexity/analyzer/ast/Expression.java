package com.complexity.analyzer.ast;

/**
 * An expression. {@link #toString()} renders the flattened source form,
 * which is what array and field accesses keep as their base.
 */
public abstract class Expression extends Node {

    Expression() {
    }

    @Override
    public abstract String toString();
}
