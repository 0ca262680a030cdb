package com.complexity.analyzer.oracle;

import com.complexity.analyzer.model.CostTriple;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of an oracle call: either a cost triple or a failure reason.
 */
public final class OracleResult {

    private final CostTriple triple;
    private final String failureReason;

    private OracleResult(CostTriple triple, String failureReason) {
        this.triple = triple;
        this.failureReason = failureReason;
    }

    public static OracleResult success(CostTriple triple) {
        return new OracleResult(Objects.requireNonNull(triple), null);
    }

    public static OracleResult failure(String reason) {
        return new OracleResult(null, Objects.requireNonNull(reason));
    }

    public boolean isSuccess() {
        return triple != null;
    }

    public Optional<CostTriple> getTriple() {
        return Optional.ofNullable(triple);
    }

    public Optional<String> getFailureReason() {
        return Optional.ofNullable(failureReason);
    }

    /**
     * The triple on success, otherwise a failed triple carrying the reason as
     * its error marker.
     */
    public CostTriple toCostTriple() {
        return isSuccess() ? triple : CostTriple.failure(failureReason);
    }

    @Override
    public String toString() {
        return isSuccess() ? "OracleResult[" + triple + "]" : "OracleResult[failure: " + failureReason + "]";
    }
}
