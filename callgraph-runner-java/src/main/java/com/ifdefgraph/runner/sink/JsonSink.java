package com.ifdefgraph.runner.sink;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.ifdefgraph.core.FileResult;
import com.ifdefgraph.core.graph.CallEdge;
import com.ifdefgraph.core.outcome.FileStatus;
import com.ifdefgraph.runner.BatchResult;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Serializes a run to {@code call_graph.json}. Files keep run order and edges keep encounter order.
 */
public class JsonSink implements OutputSink {

    public static final String FILE_NAME = "call_graph.json";
    static final String FORMAT_VERSION = "1";
    static final String TOOL = "ifdef-callgraph";
    static final String TOOL_VERSION = "0.1.0";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    @Override
    public void write(BatchResult result, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new SinkException("Could not create output directory: " + outputDir, e);
        }

        Path jsonPath = outputDir.resolve(FILE_NAME);
        try (Writer w = Files.newBufferedWriter(jsonPath, StandardCharsets.UTF_8)) {
            GSON.toJson(toDocument(result), w);
        } catch (IOException e) {
            throw new SinkException("Failed to write " + FILE_NAME + ": " + e.getMessage(), e);
        }
        System.err.println("[ifdef-callgraph] " + FILE_NAME + " written: " + jsonPath);
    }

    static OutputModel.CallGraphDocument toDocument(BatchResult result) {
        OutputModel.RunInfo run = new OutputModel.RunInfo();
        run.tool = TOOL;
        run.toolVersion = TOOL_VERSION;
        run.startedAt = result.startedAt().toString();
        run.finishedAt = result.finishedAt().toString();
        run.projects = result.projects();
        run.fileCount = result.results().size();
        run.edgeCount = result.edgeCount();
        run.okCount = result.count(FileStatus.OK);
        run.partialCount = result.count(FileStatus.PARTIAL);
        run.failedCount = result.count(FileStatus.FAILED);
        run.skippedFiles = result.skipped();

        List<OutputModel.FileRecord> files = new ArrayList<>(result.results().size());
        for (FileResult fileResult : result.results()) {
            files.add(toRecord(fileResult));
        }

        OutputModel.CallGraphDocument doc = new OutputModel.CallGraphDocument();
        doc.formatVersion = FORMAT_VERSION;
        doc.run = run;
        doc.files = files;
        return doc;
    }

    private static OutputModel.FileRecord toRecord(FileResult fileResult) {
        OutputModel.FileRecord record = new OutputModel.FileRecord();
        record.project = fileResult.projectId();
        record.file = fileResult.filePath();
        record.contentHash = fileResult.contentHash();
        record.commitId = fileResult.commitId();
        record.status = fileResult.outcome().status().name();
        record.warnings = fileResult.outcome().warnings();
        record.edges = new ArrayList<>(fileResult.edges().size());
        for (CallEdge edge : fileResult.edges()) {
            OutputModel.EdgeRecord e = new OutputModel.EdgeRecord();
            e.caller = edge.caller();
            e.callee = edge.callee();
            e.isIndirect = edge.indirect();
            e.presenceCondition = edge.presenceText();
            e.alwaysFalse = edge.alwaysFalse();
            record.edges.add(e);
        }
        return record;
    }
}
