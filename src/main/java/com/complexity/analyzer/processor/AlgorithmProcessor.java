package com.complexity.analyzer.processor;

import com.complexity.analyzer.analysis.ComplexityAnalyzer;
import com.complexity.analyzer.ast.ProcedureDef;
import com.complexity.analyzer.ast.Program;
import com.complexity.analyzer.evaluation.MetricsCollector;
import com.complexity.analyzer.lexer.SourceException;
import com.complexity.analyzer.model.CostTriple;
import com.complexity.analyzer.model.FileReport;
import com.complexity.analyzer.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Analyzes every pseudocode file under a directory.
 *
 * Files are independent: a lexical or syntax error, or any other failure, is
 * reported for that file and processing moves on to the next one.
 */
public class AlgorithmProcessor {

    private static final Logger logger = LoggerFactory.getLogger(AlgorithmProcessor.class);

    private static final List<String> EXTENSIONS = List.of(".psc", ".txt");

    private final ComplexityAnalyzer analyzer;
    private final MetricsCollector metricsCollector;
    private final PrintStream out;

    public AlgorithmProcessor(ComplexityAnalyzer analyzer) {
        this(analyzer, new MetricsCollector(), System.out);
    }

    public AlgorithmProcessor(ComplexityAnalyzer analyzer, MetricsCollector metricsCollector, PrintStream out) {
        this.analyzer = analyzer;
        this.metricsCollector = metricsCollector;
        this.out = out;
    }

    public static boolean isAlgorithmFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return EXTENSIONS.stream().anyMatch(name::endsWith);
    }

    /**
     * Processes all {@code .psc} and {@code .txt} files below the directory,
     * in path order.
     *
     * @param directory the directory holding the algorithms
     * @return one report per file
     * @throws IOException if the directory does not exist or cannot be listed
     */
    public List<FileReport> processDirectory(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            throw new NoSuchFileException(directory.toString(), null, "Directory not found");
        }
        if (!Files.isDirectory(directory)) {
            throw new NotDirectoryException(directory.toString());
        }

        List<Path> files;
        try (Stream<Path> paths = Files.walk(directory)) {
            files = paths.filter(Files::isRegularFile)
                    .filter(AlgorithmProcessor::isAlgorithmFile)
                    .sorted()
                    .collect(Collectors.toList());
        }

        if (files.isEmpty()) {
            logger.warn("No algorithm files found in {}", directory);
            out.println("No algorithm files found in " + directory + ".");
            return List.of();
        }
        logger.info("Found {} algorithm files in {}", files.size(), directory);

        metricsCollector.startAnalysis();
        List<FileReport> reports = new ArrayList<>();
        for (Path file : files) {
            reports.add(processFile(file));
        }
        metricsCollector.recordAnalyzerStatistics(analyzer);
        metricsCollector.endAnalysis();
        return reports;
    }

    /**
     * Analyzes a single file and prints its report.
     */
    public FileReport processFile(Path file) {
        out.println("Analyzing " + file + "...");
        FileReport report = analyzeFile(file);
        report.formatLines().forEach(out::println);
        metricsCollector.recordFile(report);
        return report;
    }

    private FileReport analyzeFile(Path file) {
        try {
            String source = Files.readString(file, StandardCharsets.UTF_8);
            Program program = Parser.parse(source, programName(file));

            CostTriple programCost = analyzer.analyze(program);
            Map<String, CostTriple> procedureCosts = new LinkedHashMap<>();
            for (ProcedureDef procedure : program.getProcedures()) {
                procedureCosts.put(procedure.getName(), analyzer.analyze(procedure));
            }

            logger.info("Analyzed {}: {}", file, programCost);
            return FileReport.success(file, programCost, procedureCosts);
        } catch (SourceException e) {
            logger.error("Rejected {}: {}", file, e.getMessage());
            return FileReport.failure(file, e.getMessage());
        } catch (IOException e) {
            logger.error("Error reading file: {}", file, e);
            return FileReport.failure(file, "Could not read file: " + e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Error analyzing file: {}", file, e);
            return FileReport.failure(file, e.toString());
        }
    }

    private static String programName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public MetricsCollector getMetricsCollector() {
        return metricsCollector;
    }
}
