package com.complexity.analyzer.oracle;

import com.complexity.analyzer.config.AnalyzerConfig;
import com.complexity.analyzer.model.CostTriple;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Oracle backed by the Google Gemini {@code generateContent} REST endpoint.
 *
 * The serialized subtree is embedded in a prompt that asks for a bare JSON
 * object with the keys {@code O}, {@code Omega} and {@code Theta}. Transport
 * errors and 429/5xx replies are retried with exponential backoff; a missing
 * API key or an unusable reply fails immediately.
 */
public class GeminiComplexityOracle implements ComplexityOracle {

    private static final Logger logger = LoggerFactory.getLogger(GeminiComplexityOracle.class);

    static final String DEFAULT_ENDPOINT = "https://generativelanguage.googleapis.com/v1beta";

    static final String MISSING_API_KEY = "Missing API Key";
    static final String INVALID_RESPONSE = "Invalid AI Response";

    private static final Gson PRETTY = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
    private static final Gson COMPACT = new GsonBuilder().disableHtmlEscaping().create();

    private final String apiKey;
    private final String model;
    private final Duration timeout;
    private final int maxRetries;
    private final String endpoint;
    private final HttpClient httpClient;
    private Duration initialBackoff = Duration.ofMillis(500);

    public GeminiComplexityOracle(AnalyzerConfig config) {
        this(config.getApiKey(), config.getModel(), config.getOracleTimeout(), config.getOracleMaxRetries(),
                DEFAULT_ENDPOINT);
        if (apiKey == null) {
            logger.warn("{} is not set. Dependent loops will be reported as errors.", AnalyzerConfig.API_KEY);
        }
    }

    GeminiComplexityOracle(Optional<String> apiKey, String model, Duration timeout, int maxRetries, String endpoint) {
        this.apiKey = apiKey.orElse(null);
        this.model = model;
        this.timeout = timeout;
        this.maxRetries = maxRetries;
        this.endpoint = endpoint;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    void setInitialBackoff(Duration initialBackoff) {
        this.initialBackoff = initialBackoff;
    }

    @Override
    public OracleResult classify(JsonObject subtree) {
        if (apiKey == null) {
            return OracleResult.failure(MISSING_API_KEY);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(endpoint + "/models/" + model + ":generateContent?key="
                        + URLEncoder.encode(apiKey, StandardCharsets.UTF_8)))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody(subtree), StandardCharsets.UTF_8))
                .build();

        Duration backoff = initialBackoff;
        String lastError = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (attempt > 0) {
                logger.debug("Retrying oracle call in {}ms (attempt {} of {})",
                        backoff.toMillis(), attempt + 1, maxRetries + 1);
                try {
                    Thread.sleep(backoff.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return OracleResult.failure("Interrupted");
                }
                backoff = backoff.multipliedBy(2);
            }

            try {
                HttpResponse<String> response = httpClient.send(request,
                        HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
                int status = response.statusCode();
                if (status == 200) {
                    return parseResponse(response.body());
                }
                lastError = "HTTP " + status;
                if (status != 429 && status < 500) {
                    break;
                }
                logger.warn("Oracle replied with HTTP {}", status);
            } catch (IOException e) {
                lastError = e.getClass().getSimpleName() + (e.getMessage() != null ? ": " + e.getMessage() : "");
                logger.warn("Oracle call failed: {}", lastError);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return OracleResult.failure("Interrupted");
            }
        }
        return OracleResult.failure(lastError);
    }

    static String buildPrompt(JsonObject subtree) {
        return "You are an expert in Algorithmic Complexity Analysis.\n"
                + "Analyze the time complexity of the following Abstract Syntax Tree (AST) "
                + "representing a pseudocode algorithm.\n"
                + "The AST is provided in JSON format.\n\n"
                + "Focus on:\n"
                + "1. Dependent loops (inner loop limits depending on outer loop variables).\n"
                + "2. Non-linear updates.\n"
                + "3. Recursive calls.\n\n"
                + "Return ONLY a raw JSON object (no markdown formatting, no explanations outside JSON) "
                + "with the following keys:\n"
                + "- \"O\": The Big O complexity (Worst Case).\n"
                + "- \"Omega\": The Big Omega complexity (Best Case).\n"
                + "- \"Theta\": The Big Theta complexity (Average Case).\n\n"
                + "Use standard notation like \"n^2\", \"n log n\", \"1\", \"n\".\n\n"
                + "AST:\n"
                + PRETTY.toJson(subtree) + "\n";
    }

    static String requestBody(JsonObject subtree) {
        JsonObject part = new JsonObject();
        part.addProperty("text", buildPrompt(subtree));
        JsonArray parts = new JsonArray();
        parts.add(part);
        JsonObject content = new JsonObject();
        content.add("parts", parts);
        JsonArray contents = new JsonArray();
        contents.add(content);
        JsonObject body = new JsonObject();
        body.add("contents", contents);
        return COMPACT.toJson(body);
    }

    /**
     * Extracts the model's text from a {@code generateContent} reply and
     * reads the classification out of it.
     */
    static OracleResult parseResponse(String responseBody) {
        try {
            JsonElement root = JsonParser.parseString(responseBody);
            if (!root.isJsonObject()) {
                return OracleResult.failure(INVALID_RESPONSE);
            }
            JsonArray candidates = root.getAsJsonObject().getAsJsonArray("candidates");
            if (candidates == null || candidates.size() == 0 || !candidates.get(0).isJsonObject()) {
                return OracleResult.failure(INVALID_RESPONSE);
            }
            JsonObject content = candidates.get(0).getAsJsonObject().getAsJsonObject("content");
            JsonArray parts = content != null ? content.getAsJsonArray("parts") : null;
            if (parts == null) {
                return OracleResult.failure(INVALID_RESPONSE);
            }

            StringBuilder text = new StringBuilder();
            for (JsonElement part : parts) {
                JsonElement partText = part.isJsonObject() ? part.getAsJsonObject().get("text") : null;
                if (partText != null && partText.isJsonPrimitive()) {
                    text.append(partText.getAsString());
                }
            }
            return parseClassification(text.toString());
        } catch (JsonParseException | ClassCastException | IllegalStateException | UnsupportedOperationException e) {
            return OracleResult.failure(INVALID_RESPONSE);
        }
    }

    /**
     * Reads {@code {"O": .., "Omega": .., "Theta": ..}}, tolerating a
     * surrounding markdown code fence.
     */
    static OracleResult parseClassification(String text) {
        String json = stripCodeFence(text.trim());
        try {
            JsonElement parsed = JsonParser.parseString(json);
            if (!parsed.isJsonObject()) {
                return OracleResult.failure(INVALID_RESPONSE);
            }
            JsonObject result = parsed.getAsJsonObject();
            String o = term(result, "O");
            String omega = term(result, "Omega");
            String theta = term(result, "Theta");
            if (o == null || omega == null || theta == null) {
                return OracleResult.failure(INVALID_RESPONSE);
            }
            return OracleResult.success(new CostTriple(o, omega, theta));
        } catch (JsonParseException e) {
            return OracleResult.failure(INVALID_RESPONSE);
        }
    }

    private static String term(JsonObject result, String key) {
        JsonElement value = result.get(key);
        if (value == null || !value.isJsonPrimitive()) {
            return null;
        }
        String term = value.getAsString().trim();
        return term.isEmpty() ? null : term;
    }

    static String stripCodeFence(String text) {
        String stripped = text;
        if (stripped.startsWith("```json")) {
            stripped = stripped.substring("```json".length());
        } else if (stripped.startsWith("```")) {
            stripped = stripped.substring(3);
        }
        if (stripped.endsWith("```")) {
            stripped = stripped.substring(0, stripped.length() - 3);
        }
        return stripped.trim();
    }
}
