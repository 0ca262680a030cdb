package com.complexity.analyzer.oracle;

import com.complexity.analyzer.model.CostTriple;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class GeminiComplexityOracleTest {

    private static final String CLASSIFICATION = "{\"O\": \"n^2\", \"Omega\": \"n\", \"Theta\": \"n^2\"}";

    private HttpServer server;
    private final AtomicInteger requestCount = new AtomicInteger();
    private final List<String> requestUris = new CopyOnWriteArrayList<>();
    private final List<String> requestBodies = new CopyOnWriteArrayList<>();
    private volatile int[] statuses = {200};

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            int attempt = requestCount.getAndIncrement();
            requestUris.add(exchange.getRequestURI().toString());
            try (InputStream in = exchange.getRequestBody()) {
                requestBodies.add(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
            int status = statuses[Math.min(attempt, statuses.length - 1)];
            byte[] body = (status == 200 ? geminiReply(CLASSIFICATION) : "{}").getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private GeminiComplexityOracle oracle(int maxRetries) {
        String endpoint = "http://127.0.0.1:" + server.getAddress().getPort() + "/v1beta";
        GeminiComplexityOracle oracle = new GeminiComplexityOracle(Optional.of("test-key"), "test-model",
                Duration.ofSeconds(5), maxRetries, endpoint);
        oracle.setInitialBackoff(Duration.ofMillis(1));
        return oracle;
    }

    private static JsonObject subtree() {
        JsonObject loop = new JsonObject();
        loop.addProperty("node", "ForLoop");
        loop.addProperty("variable", "j");
        return loop;
    }

    private static String geminiReply(String text) {
        JsonObject part = new JsonObject();
        part.addProperty("text", text);
        return "{\"candidates\": [{\"content\": {\"parts\": [" + part + "]}}]}";
    }

    @Test
    void missingApiKeyFailsWithoutCallingTheService() {
        GeminiComplexityOracle oracle = new GeminiComplexityOracle(Optional.empty(), "test-model",
                Duration.ofSeconds(5), 2, "http://127.0.0.1:" + server.getAddress().getPort());

        OracleResult result = oracle.classify(subtree());

        assertFalse(result.isSuccess());
        assertEquals(GeminiComplexityOracle.MISSING_API_KEY, result.getFailureReason().orElseThrow());
        assertEquals("Error: Missing API Key", result.toCostTriple().getO());
        assertEquals(0, requestCount.get());
    }

    @Test
    void postsPromptToGenerateContent() {
        OracleResult result = oracle(0).classify(subtree());

        assertTrue(result.isSuccess(), result.toString());
        assertEquals(new CostTriple("n^2", "n", "n^2"), result.getTriple().orElseThrow());
        assertEquals("/v1beta/models/test-model:generateContent?key=test-key", requestUris.get(0));

        JsonObject body = JsonParser.parseString(requestBodies.get(0)).getAsJsonObject();
        String prompt = body.getAsJsonArray("contents").get(0).getAsJsonObject()
                .getAsJsonArray("parts").get(0).getAsJsonObject().get("text").getAsString();
        assertTrue(prompt.contains("\"variable\": \"j\""), prompt);
    }

    @Test
    void retriesServerErrorsAndRateLimits() {
        statuses = new int[]{503, 429, 200};

        OracleResult result = oracle(2).classify(subtree());

        assertTrue(result.isSuccess(), result.toString());
        assertEquals(3, requestCount.get());
    }

    @Test
    void givesUpAfterMaxRetries() {
        statuses = new int[]{500};

        OracleResult result = oracle(1).classify(subtree());

        assertEquals("HTTP 500", result.getFailureReason().orElseThrow());
        assertEquals(2, requestCount.get());
    }

    @Test
    void clientErrorsAreNotRetried() {
        statuses = new int[]{400};

        OracleResult result = oracle(3).classify(subtree());

        assertEquals("HTTP 400", result.getFailureReason().orElseThrow());
        assertEquals(1, requestCount.get());
    }

    @Test
    void promptEmbedsTheSubtreeAndAsksForTheThreeBounds() {
        String prompt = GeminiComplexityOracle.buildPrompt(subtree());

        assertTrue(prompt.contains("\"node\": \"ForLoop\""), prompt);
        assertTrue(prompt.contains("\"O\""));
        assertTrue(prompt.contains("\"Omega\""));
        assertTrue(prompt.contains("\"Theta\""));
    }

    @Test
    void parsesClassificationInsideCodeFence() {
        OracleResult result = GeminiComplexityOracle.parseClassification("```json\n" + CLASSIFICATION + "\n```");
        assertEquals(new CostTriple("n^2", "n", "n^2"), result.getTriple().orElseThrow());

        OracleResult bare = GeminiComplexityOracle.parseClassification("```\n" + CLASSIFICATION + "\n```");
        assertTrue(bare.isSuccess());
    }

    @Test
    void rejectsIncompleteOrUnparsableClassifications() {
        assertEquals(GeminiComplexityOracle.INVALID_RESPONSE, GeminiComplexityOracle
                .parseClassification("{\"O\": \"n\", \"Omega\": \"1\"}").getFailureReason().orElseThrow());
        assertEquals(GeminiComplexityOracle.INVALID_RESPONSE, GeminiComplexityOracle
                .parseClassification("{\"O\": \"n\", \"Omega\": \"\", \"Theta\": \"n\"}").getFailureReason().orElseThrow());
        assertFalse(GeminiComplexityOracle.parseClassification("It is quadratic.").isSuccess());
        assertFalse(GeminiComplexityOracle.parseClassification("[\"n\"]").isSuccess());
    }

    @Test
    void rejectsRepliesWithoutCandidateText() {
        assertFalse(GeminiComplexityOracle.parseResponse("{}").isSuccess());
        assertFalse(GeminiComplexityOracle.parseResponse("{\"candidates\": []}").isSuccess());
        assertFalse(GeminiComplexityOracle.parseResponse("{\"candidates\": [{}]}").isSuccess());
        assertFalse(GeminiComplexityOracle.parseResponse("not json {").isSuccess());
        assertEquals(GeminiComplexityOracle.INVALID_RESPONSE, GeminiComplexityOracle
                .parseResponse("{\"candidates\": [{\"content\": {\"parts\": [{\"text\": null}]}}]}")
                .getFailureReason().orElseThrow());
        assertEquals(GeminiComplexityOracle.INVALID_RESPONSE, GeminiComplexityOracle
                .parseResponse("{\"candidates\": [{\"content\": {\"parts\": [{\"text\": {}}]}}]}")
                .getFailureReason().orElseThrow());
        assertTrue(GeminiComplexityOracle.parseResponse(geminiReply(CLASSIFICATION)).isSuccess());
    }

    @Test
    void stripsCodeFences() {
        assertEquals("{}", GeminiComplexityOracle.stripCodeFence("```json\n{}\n```"));
        assertEquals("{}", GeminiComplexityOracle.stripCodeFence("```{}```"));
        assertEquals("{}", GeminiComplexityOracle.stripCodeFence("{}"));
    }
}
