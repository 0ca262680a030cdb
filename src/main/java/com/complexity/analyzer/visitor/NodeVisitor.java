package com.complexity.analyzer.visitor;

import com.complexity.analyzer.ast.*;

/**
 * Visitor over every node kind of the pseudocode syntax tree, returning a value
 * and threading an argument through the traversal.
 *
 * @param <R> the result type
 * @param <A> the argument type
 */
public interface NodeVisitor<R, A> {

    R visit(Program program, A arg);

    R visit(ClassDef classDef, A arg);

    R visit(ProcedureDef procedureDef, A arg);

    R visit(Parameter parameter, A arg);

    R visit(Block block, A arg);

    R visit(Assignment assignment, A arg);

    R visit(IfStatement ifStatement, A arg);

    R visit(ForLoop forLoop, A arg);

    R visit(WhileLoop whileLoop, A arg);

    R visit(RepeatLoop repeatLoop, A arg);

    R visit(Call call, A arg);

    R visit(BinaryOp binaryOp, A arg);

    R visit(UnaryOp unaryOp, A arg);

    R visit(Literal literal, A arg);

    R visit(Variable variable, A arg);

    R visit(ArrayAccess arrayAccess, A arg);

    R visit(FieldAccess fieldAccess, A arg);
}
