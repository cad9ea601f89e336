package com.ifdefgraph.core;

import com.ifdefgraph.core.graph.CallEdge;
import com.ifdefgraph.core.outcome.FileOutcome;

import java.util.List;

/**
 * Everything the core produced for one file. {@code edges} is empty when the outcome is FAILED.
 */
public record FileResult(
    String projectId,
    String filePath,
    String contentHash,  // nullable
    String commitId,     // nullable
    List<CallEdge> edges,
    FileOutcome outcome
) {

    public FileResult {
        edges = List.copyOf(edges);
    }
}
