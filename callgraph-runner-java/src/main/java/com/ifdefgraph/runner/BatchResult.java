package com.ifdefgraph.runner;

import com.ifdefgraph.core.FileResult;
import com.ifdefgraph.core.outcome.FileStatus;

import java.time.Instant;
import java.util.List;

/**
 * Results of one run, in project then file order.
 *
 * @param skipped index keys of files left out because their content hash was unchanged
 */
public record BatchResult(
    List<String> projects,
    List<FileResult> results,
    List<String> skipped,
    Instant startedAt,
    Instant finishedAt
) {

    public BatchResult {
        projects = List.copyOf(projects);
        results = List.copyOf(results);
        skipped = List.copyOf(skipped);
    }

    public long count(FileStatus status) {
        return results.stream().filter(r -> r.outcome().status() == status).count();
    }

    public int edgeCount() {
        return results.stream().mapToInt(r -> r.edges().size()).sum();
    }
}
