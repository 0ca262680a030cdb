package com.complexity.analyzer.oracle;

import com.google.gson.JsonObject;

/**
 * External classifier consulted for loops the local cost algebra cannot
 * resolve (loops whose bounds depend on an enclosing loop variable).
 *
 * Implementations never throw: every problem, including a missing credential,
 * is reported as {@link OracleResult#failure(String)}.
 */
@FunctionalInterface
public interface ComplexityOracle {

    /**
     * @param subtree the serialized syntax subtree to classify
     * @return the classification, or the reason none could be produced
     */
    OracleResult classify(JsonObject subtree);
}
