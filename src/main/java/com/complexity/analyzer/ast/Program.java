package com.complexity.analyzer.ast;

import com.complexity.analyzer.visitor.NodeVisitor;

import java.util.List;
import java.util.Objects;

/**
 * A parsed source file: class definitions, procedure definitions and the
 * optional main block (empty when the file has none).
 */
public final class Program extends Node {

    private final String name;
    private final List<ClassDef> classes;
    private final List<ProcedureDef> procedures;
    private final Block mainBlock;

    public Program(String name, List<ClassDef> classes, List<ProcedureDef> procedures, Block mainBlock) {
        this.name = Objects.requireNonNull(name);
        this.classes = List.copyOf(classes);
        this.procedures = List.copyOf(procedures);
        this.mainBlock = Objects.requireNonNull(mainBlock);
    }

    public String getName() {
        return name;
    }

    public List<ClassDef> getClasses() {
        return classes;
    }

    public List<ProcedureDef> getProcedures() {
        return procedures;
    }

    public Block getMainBlock() {
        return mainBlock;
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
