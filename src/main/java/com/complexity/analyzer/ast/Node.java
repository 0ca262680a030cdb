package com.complexity.analyzer.ast;

import com.complexity.analyzer.visitor.NodeVisitor;

/**
 * Root of the pseudocode syntax tree.
 *
 * The set of node kinds is closed: every concrete subclass has a matching
 * method on {@link NodeVisitor}, so a new kind cannot be added without every
 * visitor handling it.
 */
public abstract class Node {

    Node() {
    }

    public abstract <R, A> R accept(NodeVisitor<R, A> visitor, A arg);
}
