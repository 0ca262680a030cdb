package com.complexity.analyzer;

import com.complexity.analyzer.analysis.ComplexityAnalyzer;
import com.complexity.analyzer.analysis.ComplexityCache;
import com.complexity.analyzer.config.AnalyzerConfig;
import com.complexity.analyzer.evaluation.MetricsCollector;
import com.complexity.analyzer.oracle.GeminiComplexityOracle;
import com.complexity.analyzer.processor.AlgorithmProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Main application entry point for the pseudocode complexity analyzer.
 * Analyzes every algorithm file in a directory and prints its worst, best and
 * average case complexity.
 */
public class ComplexityAnalyzerApp {

    private static final Logger logger = LoggerFactory.getLogger(ComplexityAnalyzerApp.class);

    static final String METRICS_FILE = "complexity-metrics.json";

    public static void main(String[] args) {
        if (args.length > 1) {
            System.err.println("Usage: java -jar complexity-analyzer.jar [algorithms-directory]");
            System.err.println("Example: java -jar complexity-analyzer.jar ./algorithms");
            System.exit(1);
        }

        try {
            AnalyzerConfig config = AnalyzerConfig.load();
            Path directory = args.length == 1 ? Paths.get(args[0]) : config.getAlgorithmsDir();
            logger.info("Starting complexity analysis of {}", directory);

            ComplexityCache cache = new ComplexityCache(config.getKnowledgeBasePath());
            ComplexityAnalyzer analyzer = new ComplexityAnalyzer(cache, new GeminiComplexityOracle(config));
            MetricsCollector metrics = new MetricsCollector();
            AlgorithmProcessor processor = new AlgorithmProcessor(analyzer, metrics, System.out);

            int processed = processor.processDirectory(directory).size();
            logger.info("Total files processed: {}", processed);

            if (processed > 0) {
                metrics.printReport(System.out);
                if (config.isMetricsExport()) {
                    exportMetrics(metrics, directory.resolve(METRICS_FILE));
                }
            }
        } catch (IOException e) {
            logger.error("Error processing algorithms directory", e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        } catch (IllegalArgumentException e) {
            logger.error("Invalid configuration", e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    private static void exportMetrics(MetricsCollector metrics, Path target) {
        try {
            metrics.exportJSON(target);
        } catch (IOException e) {
            logger.error("Failed to export metrics to JSON", e);
        }
    }
}
