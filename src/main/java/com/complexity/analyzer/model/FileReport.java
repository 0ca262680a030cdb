package com.complexity.analyzer.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of analyzing one source file: the program's cost triple and the
 * triple of each procedure, or the first error that stopped the analysis.
 */
public class FileReport {

    public static final String SEPARATOR = "-".repeat(20);

    private final Path file;
    private final CostTriple programCost;
    private final Map<String, CostTriple> procedureCosts;
    private final String error;

    private FileReport(Path file, CostTriple programCost, Map<String, CostTriple> procedureCosts, String error) {
        this.file = Objects.requireNonNull(file);
        this.programCost = programCost;
        this.procedureCosts = procedureCosts;
        this.error = error;
    }

    public static FileReport success(Path file, CostTriple programCost, Map<String, CostTriple> procedureCosts) {
        return new FileReport(file, Objects.requireNonNull(programCost),
                Collections.unmodifiableMap(new LinkedHashMap<>(procedureCosts)), null);
    }

    public static FileReport failure(Path file, String error) {
        return new FileReport(file, null, Collections.emptyMap(), Objects.requireNonNull(error));
    }

    public Path getFile() {
        return file;
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<CostTriple> getProgramCost() {
        return Optional.ofNullable(programCost);
    }

    /**
     * @return procedure name to cost, in declaration order
     */
    public Map<String, CostTriple> getProcedureCosts() {
        return procedureCosts;
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Lines printed for this file after its {@code Analyzing ...} header.
     */
    public List<String> formatLines() {
        List<String> lines = new ArrayList<>();
        if (isSuccess()) {
            lines.add("  Complexity: " + programCost);
            procedureCosts.forEach((name, cost) -> lines.add("  procedure " + name + ": " + cost));
        } else {
            lines.add("  Error: " + error);
        }
        lines.add(SEPARATOR);
        return lines;
    }
}
