package com.ifdefgraph.runner.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

public class RunConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and validates run-config.json from the given path.
     *
     * @throws ConfigReadException if the file is missing, malformed or holds out-of-range values
     */
    public RunConfig read(Path configPath) {
        if (!Files.isRegularFile(configPath)) {
            throw new ConfigReadException("Run config not found: " + configPath);
        }
        RunConfig config;
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            config = GSON.fromJson(reader, RunConfig.class);
        } catch (NoSuchFileException e) {
            throw new ConfigReadException("Run config not found: " + configPath, e);
        } catch (JsonParseException e) {
            throw new ConfigReadException("Run config is not valid JSON: " + configPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read run config: " + configPath + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigReadException("Run config is empty: " + configPath);
        }
        validate(config, configPath);
        return config;
    }

    private static void validate(RunConfig config, Path source) {
        if (config.getWorkers() < 1) {
            throw new ConfigReadException("workers must be at least 1 in " + source);
        }
        if (config.getTimeoutSeconds() < 1) {
            throw new ConfigReadException("timeout_seconds must be at least 1 in " + source);
        }
        if (config.getExtensions().isEmpty()) {
            throw new ConfigReadException("extensions must not be empty in " + source);
        }
        for (String format : config.getOutputFormats()) {
            if (!RunConfig.FORMAT_CSV.equals(format) && !RunConfig.FORMAT_JSON.equals(format)) {
                throw new ConfigReadException("Unknown output format '" + format + "' in " + source);
            }
        }
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
