package com.complexity.analyzer.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Analyzer settings.
 *
 * Sources, lowest priority first: {@code analyzer.properties} on the
 * classpath, a {@code .env} file in the working directory, environment
 * variables, JVM system properties. All sources use the same key names.
 */
public class AnalyzerConfig {

    private static final Logger logger = LoggerFactory.getLogger(AnalyzerConfig.class);

    public static final String API_KEY = "GEMINI_API_KEY";
    public static final String MODEL = "GEMINI_MODEL";
    public static final String ORACLE_TIMEOUT_SECONDS = "ORACLE_TIMEOUT_SECONDS";
    public static final String ORACLE_MAX_RETRIES = "ORACLE_MAX_RETRIES";
    public static final String KNOWLEDGE_BASE_PATH = "KNOWLEDGE_BASE_PATH";
    public static final String ALGORITHMS_DIR = "ALGORITHMS_DIR";
    public static final String METRICS_EXPORT = "METRICS_EXPORT";

    static final List<String> KEYS = List.of(API_KEY, MODEL, ORACLE_TIMEOUT_SECONDS, ORACLE_MAX_RETRIES,
            KNOWLEDGE_BASE_PATH, ALGORITHMS_DIR, METRICS_EXPORT);

    private static final String DEFAULTS_RESOURCE = "/analyzer.properties";

    private final Properties values;

    AnalyzerConfig(Properties values) {
        this.values = values;
    }

    /**
     * Loads the configuration from all sources for the current process.
     */
    public static AnalyzerConfig load() {
        return load(Paths.get(".env"), System.getenv(), System.getProperties());
    }

    static AnalyzerConfig load(Path dotEnvFile, Map<String, String> environment, Properties systemProperties) {
        Properties values = new Properties();
        loadDefaults(values);
        loadDotEnv(dotEnvFile, values);

        for (String key : KEYS) {
            String fromEnv = environment.get(key);
            if (fromEnv != null && !fromEnv.isBlank()) {
                values.setProperty(key, fromEnv.trim());
            }
            String fromSystem = systemProperties.getProperty(key);
            if (fromSystem != null && !fromSystem.isBlank()) {
                values.setProperty(key, fromSystem.trim());
            }
        }
        return new AnalyzerConfig(values);
    }

    private static void loadDefaults(Properties values) {
        try (InputStream in = AnalyzerConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                logger.debug("No {} on the classpath", DEFAULTS_RESOURCE);
                return;
            }
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                values.load(reader);
            }
        } catch (IOException e) {
            logger.warn("Could not read {}", DEFAULTS_RESOURCE, e);
        }
    }

    /**
     * Reads {@code KEY=value} lines; blank lines, {@code #} comments and an
     * optional {@code export} prefix are accepted, surrounding quotes are removed.
     */
    static void loadDotEnv(Path file, Properties values) {
        if (file == null || !Files.isRegularFile(file)) {
            return;
        }
        try {
            for (String raw : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                String line = raw.trim();
                if (line.isEmpty() || line.startsWith("#")) {
                    continue;
                }
                if (line.startsWith("export ")) {
                    line = line.substring("export ".length()).trim();
                }
                int eq = line.indexOf('=');
                if (eq <= 0) {
                    continue;
                }
                String key = line.substring(0, eq).trim();
                String value = unquote(line.substring(eq + 1).trim());
                values.setProperty(key, value);
            }
            logger.debug("Loaded settings from {}", file);
        } catch (IOException e) {
            logger.warn("Could not read {}", file, e);
        }
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    public Optional<String> getApiKey() {
        String key = values.getProperty(API_KEY);
        return key == null || key.isBlank() ? Optional.empty() : Optional.of(key);
    }

    public String getModel() {
        return values.getProperty(MODEL, "gemini-1.5-flash");
    }

    /**
     * @throws IllegalArgumentException if the configured value is not a positive integer
     */
    public Duration getOracleTimeout() {
        int seconds = getInt(ORACLE_TIMEOUT_SECONDS, 30);
        if (seconds == 0) {
            throw new IllegalArgumentException(ORACLE_TIMEOUT_SECONDS + " must be positive: 0");
        }
        return Duration.ofSeconds(seconds);
    }

    public int getOracleMaxRetries() {
        return getInt(ORACLE_MAX_RETRIES, 2);
    }

    public Path getKnowledgeBasePath() {
        return Paths.get(values.getProperty(KNOWLEDGE_BASE_PATH, "data/knowledge_base.json"));
    }

    public Path getAlgorithmsDir() {
        return Paths.get(values.getProperty(ALGORITHMS_DIR, "algorithms"));
    }

    public boolean isMetricsExport() {
        return Boolean.parseBoolean(values.getProperty(METRICS_EXPORT, "true"));
    }

    private int getInt(String key, int defaultValue) {
        String value = values.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 0) {
                throw new IllegalArgumentException(key + " must not be negative: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not an integer: " + value, e);
        }
    }
}
