package com.complexity.analyzer.evaluation;

import com.complexity.analyzer.analysis.ComplexityAnalyzer;
import com.complexity.analyzer.model.CostTriple;
import com.complexity.analyzer.model.FileReport;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Collects statistics over one batch run: timing, file outcomes, cache and
 * oracle usage, and how worst-case classifications are distributed.
 */
public class MetricsCollector {

    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    // Timing
    private Instant startTime;
    private long totalAnalysisTimeMs = 0;

    // File metrics
    private int totalFiles = 0;
    private int analyzedFiles = 0;
    private int failedFiles = 0;
    private int totalProcedures = 0;

    // Analyzer metrics
    private int cacheHits = 0;
    private int cacheMisses = 0;
    private int cacheSize = 0;
    private int oracleCalls = 0;
    private int oracleFailures = 0;

    // Worst-case term -> number of programs and procedures
    private final Map<String, Integer> complexityDistribution = new TreeMap<>();

    /**
     * Marks the start of a batch.
     */
    public void startAnalysis() {
        this.startTime = Instant.now();
        logger.debug("Metrics collection started");
    }

    /**
     * Marks the end of a batch; a no-op if the batch never started.
     */
    public void endAnalysis() {
        if (startTime == null) {
            return;
        }
        this.totalAnalysisTimeMs = Duration.between(startTime, Instant.now()).toMillis();
        logger.info("Analysis completed in {}ms", totalAnalysisTimeMs);
    }

    public void recordFile(FileReport report) {
        totalFiles++;
        if (!report.isSuccess()) {
            failedFiles++;
            return;
        }
        analyzedFiles++;
        report.getProgramCost().ifPresent(this::recordComplexity);
        for (CostTriple cost : report.getProcedureCosts().values()) {
            totalProcedures++;
            recordComplexity(cost);
        }
    }

    private void recordComplexity(CostTriple cost) {
        String key = cost.isFailed() ? CostTriple.ERROR_PREFIX : "O(" + cost.getO() + ")";
        complexityDistribution.merge(key, 1, Integer::sum);
    }

    /**
     * Snapshot of the analyzer's cumulative cache and oracle counters.
     */
    public void recordAnalyzerStatistics(ComplexityAnalyzer analyzer) {
        cacheHits = analyzer.getCacheHits();
        cacheMisses = analyzer.getCacheMisses();
        cacheSize = analyzer.getCache().size();
        oracleCalls = analyzer.getOracleCalls();
        oracleFailures = analyzer.getOracleFailures();
    }

    public MetricsReport generateReport() {
        MetricsReport report = new MetricsReport();
        report.totalAnalysisTimeMs = totalAnalysisTimeMs;
        report.averageTimePerFile = totalFiles > 0 ? (double) totalAnalysisTimeMs / totalFiles : 0;

        report.totalFiles = totalFiles;
        report.analyzedFiles = analyzedFiles;
        report.failedFiles = failedFiles;
        report.totalProcedures = totalProcedures;

        report.cacheHits = cacheHits;
        report.cacheMisses = cacheMisses;
        report.cacheHitRate = calculatePercentage(cacheHits, cacheHits + cacheMisses);
        report.cacheSize = cacheSize;
        report.oracleCalls = oracleCalls;
        report.oracleFailures = oracleFailures;

        report.complexityDistribution = new TreeMap<>(complexityDistribution);
        return report;
    }

    public void printReport(PrintStream out) {
        MetricsReport report = generateReport();

        out.println("\n" + "=".repeat(60));
        out.println("COMPLEXITY ANALYSIS SUMMARY");
        out.println("=".repeat(60));

        out.println("\n[FILES]");
        out.printf("  Files processed:  %,6d%n", report.totalFiles);
        out.printf("  Analyzed:         %,6d%n", report.analyzedFiles);
        out.printf("  Failed:           %,6d%n", report.failedFiles);
        out.printf("  Procedures:       %,6d%n", report.totalProcedures);
        out.printf("  Total time:       %,6d ms (%.2f ms/file)%n",
                report.totalAnalysisTimeMs, report.averageTimePerFile);

        out.println("\n[KNOWLEDGE BASE]");
        out.printf("  Cache hits:       %,6d (%.1f%%)%n", report.cacheHits, report.cacheHitRate);
        out.printf("  Cache misses:     %,6d%n", report.cacheMisses);
        out.printf("  Entries:          %,6d%n", report.cacheSize);

        out.println("\n[ORACLE]");
        out.printf("  Calls:            %,6d%n", report.oracleCalls);
        out.printf("  Failures:         %,6d%n", report.oracleFailures);

        out.println("\n[WORST CASE DISTRIBUTION]");
        report.complexityDistribution.forEach((term, count) ->
                out.printf("  %-16s: %,6d%n", term, count));

        out.println("=".repeat(60) + "\n");
    }

    /**
     * Writes the report as pretty-printed JSON.
     */
    public void exportJSON(Path outputPath) throws IOException {
        try (Writer writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
            GSON.toJson(generateReport(), writer);
        }
        logger.info("Metrics exported to {}", outputPath);
    }

    private double calculatePercentage(int part, int total) {
        return total > 0 ? (100.0 * part / total) : 0.0;
    }

    /**
     * Serializable snapshot of the collected metrics.
     */
    public static class MetricsReport {
        // Timing
        public long totalAnalysisTimeMs;
        public double averageTimePerFile;

        // Files
        public int totalFiles;
        public int analyzedFiles;
        public int failedFiles;
        public int totalProcedures;

        // Knowledge base
        public int cacheHits;
        public int cacheMisses;
        public double cacheHitRate;
        public int cacheSize;

        // Oracle
        public int oracleCalls;
        public int oracleFailures;

        public Map<String, Integer> complexityDistribution;
    }
}
