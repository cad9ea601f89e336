package com.ifdefgraph.runner.index;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;
import java.util.TreeMap;

/**
 * Skip-if-unchanged index: {@code "<project>/<file>" -> "sha256:<hex>"} of the last successful run,
 * stored as a JSON object.
 *
 * A missing index file is an empty index. Only the runner's dispatch thread touches an instance.
 */
public class ProcessedIndex {

    private static final Type MAP_TYPE = new TypeToken<Map<String, String>>() {}.getType();
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private final Path location;
    private final Map<String, String> hashes;

    private ProcessedIndex(Path location, Map<String, String> hashes) {
        this.location = location;
        this.hashes = hashes;
    }

    /** An index that remembers nothing and is never written. */
    public static ProcessedIndex disabled() {
        return new ProcessedIndex(null, new TreeMap<>());
    }

    public static ProcessedIndex load(Path location) {
        if (!Files.exists(location)) {
            return new ProcessedIndex(location, new TreeMap<>());
        }
        try (Reader reader = Files.newBufferedReader(location, StandardCharsets.UTF_8)) {
            Map<String, String> stored = GSON.fromJson(reader, MAP_TYPE);
            return new ProcessedIndex(location, stored != null ? new TreeMap<>(stored) : new TreeMap<>());
        } catch (IOException | JsonParseException e) {
            throw new IndexException("Failed to read processed index " + location + ": " + e.getMessage(), e);
        }
    }

    public static String key(String projectId, String filePath) {
        return projectId + "/" + filePath;
    }

    public boolean isUnchanged(String key, String contentHash) {
        return contentHash != null && contentHash.equals(hashes.get(key));
    }

    public void record(String key, String contentHash) {
        hashes.put(key, contentHash);
    }

    public void forget(String key) {
        hashes.remove(key);
    }

    public int size() {
        return hashes.size();
    }

    public boolean isEnabled() {
        return location != null;
    }

    public void save() {
        if (location == null) return;
        try {
            Path parent = location.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (Writer w = Files.newBufferedWriter(location, StandardCharsets.UTF_8)) {
                GSON.toJson(hashes, MAP_TYPE, w);
            }
        } catch (IOException e) {
            throw new IndexException("Failed to write processed index " + location + ": " + e.getMessage(), e);
        }
    }

    /** {@code "sha256:"} followed by the lowercase hex digest of {@code content}. */
    public static String contentHash(byte[] content) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(content);
            StringBuilder sb = new StringBuilder("sha256:");
            for (byte b : digest) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static class IndexException extends RuntimeException {
        public IndexException(String message, Throwable cause) { super(message, cause); }
    }
}
