package com.ifdefgraph.runner;

import com.ifdefgraph.runner.config.RunConfig;
import com.ifdefgraph.runner.config.RunConfigReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RunConfigReaderTest {

    private final RunConfigReader reader = new RunConfigReader();

    private Path write(Path dir, String json) throws IOException {
        Path file = dir.resolve("run-config.json");
        Files.writeString(file, json);
        return file;
    }

    @Test
    void allFieldsAreRead(@TempDir Path tmp) throws IOException {
        RunConfig config = reader.read(write(tmp, """
            {
              "srcml_path": "/opt/srcml/bin/srcml",
              "workers": 8,
              "timeout_seconds": 120,
              "extensions": [".c", ".h"],
              "output_formats": ["json"],
              "processed_index": "state/processed.json",
              "commit_ids": {"linux": "4f2a9c1"}
            }
            """));

        assertEquals("/opt/srcml/bin/srcml", config.getSrcmlPath());
        assertEquals(8, config.getWorkers());
        assertEquals(120, config.getTimeoutSeconds());
        assertEquals(List.of(".c", ".h"), config.getExtensions());
        assertEquals(List.of("json"), config.getOutputFormats());
        assertEquals("state/processed.json", config.getProcessedIndex());
        assertEquals(Map.of("linux", "4f2a9c1"), config.getCommitIds());
    }

    @Test
    void missingFieldsFallBackToDefaults(@TempDir Path tmp) throws IOException {
        RunConfig config = reader.read(write(tmp, "{}"));

        assertEquals("srcml", config.getSrcmlPath());
        assertEquals(4, config.getWorkers());
        assertEquals(30, config.getTimeoutSeconds());
        assertEquals(List.of(".c"), config.getExtensions());
        assertEquals(List.of("csv", "json"), config.getOutputFormats());
        assertNull(config.getProcessedIndex());
        assertTrue(config.getCommitIds().isEmpty());
    }

    @Test
    void fileNotFoundThrowsConfigReadException() {
        Path missing = Path.of("/tmp/does-not-exist-run-config.json");
        assertThrows(RunConfigReader.ConfigReadException.class, () -> reader.read(missing));
    }

    @Test
    void emptyFileThrowsConfigReadException(@TempDir Path tmp) throws IOException {
        assertThrows(RunConfigReader.ConfigReadException.class, () -> reader.read(write(tmp, "")));
    }

    @Test
    void malformedJsonThrowsConfigReadException(@TempDir Path tmp) throws IOException {
        assertThrows(RunConfigReader.ConfigReadException.class, () -> reader.read(write(tmp, "{\"workers\": ")));
    }

    @Test
    void zeroWorkersIsRejected(@TempDir Path tmp) throws IOException {
        Path file = write(tmp, "{\"workers\": 0}");
        RunConfigReader.ConfigReadException e =
                assertThrows(RunConfigReader.ConfigReadException.class, () -> reader.read(file));
        assertTrue(e.getMessage().contains("workers"));
    }

    @Test
    void unknownOutputFormatIsRejected(@TempDir Path tmp) throws IOException {
        Path file = write(tmp, "{\"output_formats\": [\"csv\", \"xml\"]}");
        RunConfigReader.ConfigReadException e =
                assertThrows(RunConfigReader.ConfigReadException.class, () -> reader.read(file));
        assertTrue(e.getMessage().contains("xml"));
    }
}
