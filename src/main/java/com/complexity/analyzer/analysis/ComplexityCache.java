package com.complexity.analyzer.analysis;

import com.complexity.analyzer.model.CostTriple;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Signature to cost triple store shared by every analysis in the process.
 *
 * When backed by a file (the "knowledge base"), the whole store is rewritten
 * after every insert, so there is no separate flush step. The file is a JSON
 * object mapping signatures to {@code {"O": .., "Omega": .., "Theta": ..}}.
 * A file that cannot be parsed is treated as an empty store.
 */
public class ComplexityCache {

    private static final Logger logger = LoggerFactory.getLogger(ComplexityCache.class);

    static final String KEY_O = "O";
    static final String KEY_OMEGA = "Omega";
    static final String KEY_THETA = "Theta";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private final Map<String, CostTriple> entries = new LinkedHashMap<>();
    private final Path storeFile;

    /**
     * Creates a cache that lives only as long as this object.
     */
    public ComplexityCache() {
        this.storeFile = null;
    }

    /**
     * Creates a cache persisted to the given file, loading whatever it already holds.
     *
     * @param storeFile JSON file; it does not need to exist yet
     */
    public ComplexityCache(Path storeFile) {
        this.storeFile = storeFile;
        load();
    }

    private void load() {
        if (!Files.exists(storeFile)) {
            logger.debug("No knowledge base at {}, starting empty", storeFile);
            return;
        }

        try (Reader reader = Files.newBufferedReader(storeFile, StandardCharsets.UTF_8)) {
            JsonElement root = JsonParser.parseReader(reader);
            if (!root.isJsonObject()) {
                logger.warn("Knowledge base {} is not a JSON object, starting empty", storeFile);
                return;
            }

            for (Map.Entry<String, JsonElement> entry : root.getAsJsonObject().entrySet()) {
                if (!entry.getValue().isJsonObject()) {
                    logger.warn("Skipping malformed knowledge base entry {}", entry.getKey());
                    continue;
                }
                entries.put(entry.getKey(), fromJson(entry.getValue().getAsJsonObject()));
            }
            logger.info("Loaded {} cached complexities from {}", entries.size(), storeFile);
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException e) {
            entries.clear();
            logger.warn("Knowledge base {} is corrupt, starting empty: {}", storeFile, e.getMessage());
        } catch (IOException e) {
            entries.clear();
            logger.warn("Could not read knowledge base {}, starting empty", storeFile, e);
        }
    }

    /**
     * @param signature structural signature of a subtree
     * @return the cached triple, if any
     */
    public Optional<CostTriple> get(String signature) {
        return Optional.ofNullable(entries.get(signature));
    }

    /**
     * Stores a triple and, for a file-backed cache, persists the store before
     * returning. Failed triples are rejected.
     */
    public void put(String signature, CostTriple triple) {
        if (triple.isFailed()) {
            throw new IllegalArgumentException("Refusing to cache a failed classification for " + signature);
        }
        entries.put(signature, triple);
        logger.debug("Cached {} for {}", triple, signature);
        if (storeFile != null) {
            save();
        }
    }

    private void save() {
        JsonObject root = new JsonObject();
        entries.forEach((signature, triple) -> root.add(signature, toJson(triple)));

        try {
            Path parent = storeFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = storeFile.resolveSibling(storeFile.getFileName() + ".tmp");
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                GSON.toJson(root, writer);
            }
            Files.move(temp, storeFile, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            logger.error("Failed to persist knowledge base to {}", storeFile, e);
        }
    }

    public boolean contains(String signature) {
        return entries.containsKey(signature);
    }

    public int size() {
        return entries.size();
    }

    /**
     * @return unmodifiable view of all entries
     */
    public Map<String, CostTriple> getAll() {
        return Collections.unmodifiableMap(entries);
    }

    static JsonObject toJson(CostTriple triple) {
        JsonObject json = new JsonObject();
        json.addProperty(KEY_O, triple.getO());
        json.addProperty(KEY_OMEGA, triple.getOmega());
        json.addProperty(KEY_THETA, triple.getTheta());
        return json;
    }

    static CostTriple fromJson(JsonObject json) {
        return new CostTriple(
                termOrConstant(json, KEY_O),
                termOrConstant(json, KEY_OMEGA),
                termOrConstant(json, KEY_THETA));
    }

    private static String termOrConstant(JsonObject json, String key) {
        JsonElement value = json.get(key);
        return value != null && value.isJsonPrimitive() ? value.getAsString() : CostAlgebra.CONSTANT;
    }
}
