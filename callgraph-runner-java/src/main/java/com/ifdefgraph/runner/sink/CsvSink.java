package com.ifdefgraph.runner.sink;

import com.ifdefgraph.core.FileResult;
import com.ifdefgraph.core.graph.CallEdge;
import com.ifdefgraph.runner.BatchResult;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes {@code call_graph.csv} (one row per edge) and {@code file_outcomes.csv} (one row per file).
 * Fields are quoted as RFC 4180 requires; rows end with CRLF.
 */
public class CsvSink implements OutputSink {

    public static final String EDGES_FILE = "call_graph.csv";
    public static final String OUTCOMES_FILE = "file_outcomes.csv";

    static final List<String> EDGE_HEADER = List.of(
        "Project", "File", "Caller", "Callee", "IsIndirect", "PresenceCondition", "AlwaysFalse");
    static final List<String> OUTCOME_HEADER = List.of(
        "Project", "File", "Status", "ContentHash", "CommitId", "Edges", "Warnings");

    /** Separates several warnings inside the single Warnings column. */
    static final String WARNING_SEPARATOR = " | ";

    @Override
    public void write(BatchResult result, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new SinkException("Could not create output directory: " + outputDir, e);
        }

        Path edgesPath = outputDir.resolve(EDGES_FILE);
        try (Writer w = Files.newBufferedWriter(edgesPath, StandardCharsets.UTF_8)) {
            writeRow(w, EDGE_HEADER);
            for (FileResult file : result.results()) {
                for (CallEdge edge : file.edges()) {
                    writeRow(w, List.of(
                        edge.project(),
                        edge.file(),
                        edge.caller(),
                        edge.callee(),
                        Boolean.toString(edge.indirect()),
                        edge.presenceText(),
                        Boolean.toString(edge.alwaysFalse())));
                }
            }
        } catch (IOException e) {
            throw new SinkException("Failed to write " + EDGES_FILE + ": " + e.getMessage(), e);
        }
        System.err.println("[ifdef-callgraph] " + EDGES_FILE + " written: " + edgesPath);

        Path outcomesPath = outputDir.resolve(OUTCOMES_FILE);
        try (Writer w = Files.newBufferedWriter(outcomesPath, StandardCharsets.UTF_8)) {
            writeRow(w, OUTCOME_HEADER);
            for (FileResult file : result.results()) {
                writeRow(w, List.of(
                    file.projectId(),
                    file.filePath(),
                    file.outcome().status().name(),
                    nullToEmpty(file.contentHash()),
                    nullToEmpty(file.commitId()),
                    Integer.toString(file.edges().size()),
                    String.join(WARNING_SEPARATOR, file.outcome().warnings())));
            }
        } catch (IOException e) {
            throw new SinkException("Failed to write " + OUTCOMES_FILE + ": " + e.getMessage(), e);
        }
        System.err.println("[ifdef-callgraph] " + OUTCOMES_FILE + " written: " + outcomesPath);
    }

    static void writeRow(Writer w, List<String> fields) throws IOException {
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) w.write(',');
            w.write(quote(fields.get(i)));
        }
        w.write("\r\n");
    }

    /**
     * Quotes a field when it holds a comma, a double quote, CR or LF; inner quotes are doubled.
     */
    static String quote(String field) {
        if (field.indexOf(',') < 0 && field.indexOf('"') < 0
                && field.indexOf('\n') < 0 && field.indexOf('\r') < 0) {
            return field;
        }
        return '"' + field.replace("\"", "\"\"") + '"';
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }
}
