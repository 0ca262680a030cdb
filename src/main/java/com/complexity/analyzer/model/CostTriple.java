package com.complexity.analyzer.model;

import com.complexity.analyzer.analysis.CostAlgebra;

import java.util.Objects;

/**
 * Worst (O), best (Omega) and average (Theta) case complexity of a subtree.
 *
 * A triple built from an oracle failure carries error markers as its terms
 * and stays marked as failed through every composition, so callers can tell
 * it apart from a real classification.
 */
public final class CostTriple {

    public static final String ERROR_PREFIX = "Error";

    public static final CostTriple CONSTANT =
            new CostTriple(CostAlgebra.CONSTANT, CostAlgebra.CONSTANT, CostAlgebra.CONSTANT);
    public static final CostTriple LINEAR =
            new CostTriple(CostAlgebra.LINEAR, CostAlgebra.LINEAR, CostAlgebra.LINEAR);

    private final String o;
    private final String omega;
    private final String theta;
    private final boolean failed;

    public CostTriple(String o, String omega, String theta) {
        this(o, omega, theta, false);
    }

    private CostTriple(String o, String omega, String theta, boolean failed) {
        this.o = Objects.requireNonNull(o);
        this.omega = Objects.requireNonNull(omega);
        this.theta = Objects.requireNonNull(theta);
        this.failed = failed;
    }

    public static CostTriple of(String term) {
        return new CostTriple(term, term, term);
    }

    /**
     * Triple standing in for a subtree whose classification failed.
     * The reason is kept on the worst-case term.
     */
    public static CostTriple failure(String reason) {
        return new CostTriple(ERROR_PREFIX + ": " + reason, ERROR_PREFIX, ERROR_PREFIX, true);
    }

    /**
     * Sequential composition, component-wise.
     */
    public CostTriple plus(CostTriple other) {
        return new CostTriple(
                CostAlgebra.add(o, other.o),
                CostAlgebra.add(omega, other.omega),
                CostAlgebra.add(theta, other.theta),
                failed || other.failed);
    }

    /**
     * Iteration: this triple is the iteration count, {@code body} the cost of
     * one iteration.
     */
    public CostTriple times(CostTriple body) {
        return new CostTriple(
                CostAlgebra.multiply(o, body.o),
                CostAlgebra.multiply(omega, body.omega),
                CostAlgebra.multiply(theta, body.theta),
                failed || body.failed);
    }

    public String getO() {
        return o;
    }

    public String getOmega() {
        return omega;
    }

    public String getTheta() {
        return theta;
    }

    public boolean isFailed() {
        return failed;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CostTriple)) return false;
        CostTriple other = (CostTriple) obj;
        return failed == other.failed && o.equals(other.o)
                && omega.equals(other.omega) && theta.equals(other.theta);
    }

    @Override
    public int hashCode() {
        return Objects.hash(o, omega, theta, failed);
    }

    @Override
    public String toString() {
        return "O(" + o + "), Ω(" + omega + "), Θ(" + theta + ")";
    }
}
