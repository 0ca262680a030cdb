package com.complexity.analyzer.analysis;

import com.complexity.analyzer.ast.Node;
import com.complexity.analyzer.visitor.NodeSerializer;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * Structural signature of a subtree: SHA-256 over the serialized node with
 * object keys in sorted order, as 64 lowercase hex characters.
 *
 * Names and literal values are part of the structure, so two loops that
 * differ only in a variable name get different signatures.
 */
public final class NodeSignature {

    private static final Gson GSON = new Gson();

    private NodeSignature() {
    }

    public static String of(Node node) {
        return hash(canonicalForm(node));
    }

    /**
     * The canonical text that is hashed: compact JSON, keys sorted at every level.
     */
    public static String canonicalForm(Node node) {
        return GSON.toJson(sortKeys(NodeSerializer.serialize(node)));
    }

    static String hash(String canonical) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(canonical.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes);
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static JsonElement sortKeys(JsonElement element) {
        if (element.isJsonObject()) {
            Map<String, JsonElement> sorted = new TreeMap<>();
            for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
                sorted.put(entry.getKey(), sortKeys(entry.getValue()));
            }
            JsonObject result = new JsonObject();
            sorted.forEach(result::add);
            return result;
        }
        if (element.isJsonArray()) {
            JsonArray result = new JsonArray();
            for (JsonElement item : element.getAsJsonArray()) {
                result.add(sortKeys(item));
            }
            return result;
        }
        return element;
    }
}
