package com.complexity.analyzer.ast;

/**
 * A statement inside a {@link Block}.
 */
public abstract class Statement extends Node {

    Statement() {
    }
}
