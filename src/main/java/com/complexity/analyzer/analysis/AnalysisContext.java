package com.complexity.analyzer.analysis;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Names of the loop variables bound by the enclosing for-loops.
 * Immutable: entering a loop body creates an extended copy.
 */
public final class AnalysisContext {

    private static final AnalysisContext EMPTY = new AnalysisContext(Collections.emptySet());

    private final Set<String> loopVariables;

    private AnalysisContext(Set<String> loopVariables) {
        this.loopVariables = loopVariables;
    }

    public static AnalysisContext empty() {
        return EMPTY;
    }

    public AnalysisContext withLoopVariable(String name) {
        if (loopVariables.contains(name)) {
            return this;
        }
        Set<String> extended = new LinkedHashSet<>(loopVariables);
        extended.add(name);
        return new AnalysisContext(Collections.unmodifiableSet(extended));
    }

    public boolean isLoopVariable(String name) {
        return loopVariables.contains(name);
    }

    public Set<String> getLoopVariables() {
        return loopVariables;
    }

    public boolean isEmpty() {
        return loopVariables.isEmpty();
    }

    @Override
    public String toString() {
        return "AnalysisContext" + loopVariables;
    }
}
