package com.complexity.analyzer.analysis;

import com.complexity.analyzer.ast.BinaryOp;
import com.complexity.analyzer.ast.Expression;
import com.complexity.analyzer.ast.ForLoop;
import com.complexity.analyzer.ast.Variable;

/**
 * Decides whether a for-loop's bounds depend on a variable of an enclosing
 * loop, e.g. {@code for j <- 1 to i} nested in a loop over {@code i}.
 *
 * Only variables reached through chains of binary operators count. Array
 * accesses, field accesses, unary operators and literals are treated as not
 * referencing anything.
 */
public class LoopDependencyDetector {

    public boolean isDependent(ForLoop loop, AnalysisContext context) {
        if (context.isEmpty()) {
            return false;
        }
        return references(loop.getStart(), context) || references(loop.getEnd(), context);
    }

    boolean references(Expression expression, AnalysisContext context) {
        if (expression instanceof Variable) {
            return context.isLoopVariable(((Variable) expression).getName());
        }
        if (expression instanceof BinaryOp) {
            BinaryOp binaryOp = (BinaryOp) expression;
            return references(binaryOp.getLeft(), context) || references(binaryOp.getRight(), context);
        }
        return false;
    }
}
