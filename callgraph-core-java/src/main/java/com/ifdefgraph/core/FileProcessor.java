package com.ifdefgraph.core;

import com.ifdefgraph.core.condition.ConditionNormalizer;
import com.ifdefgraph.core.condition.ConditionParser;
import com.ifdefgraph.core.directive.DirectiveScopeTracker;
import com.ifdefgraph.core.graph.CallEdge;
import com.ifdefgraph.core.graph.CallGraphExtractor;
import com.ifdefgraph.core.outcome.FileOutcomeAggregator;
import com.ifdefgraph.core.tree.TreeIndex;

import java.util.List;

/**
 * Processing boundary for a single file: index -> directive tracking / call extraction -> outcome.
 *
 * Nothing thrown while handling one file escapes this class; it becomes the file's outcome.
 * Instances hold no per-file state and may be shared between worker threads.
 */
public class FileProcessor {

    private final ConditionNormalizer normalizer = new ConditionNormalizer();
    private final ConditionParser parser = new ConditionParser();

    public FileResult process(SourceUnit unit) {
        FileOutcomeAggregator outcome = new FileOutcomeAggregator(unit.filePath());
        List<CallEdge> edges;
        try {
            TreeIndex index = TreeIndex.build(unit.tree(), outcome);
            DirectiveScopeTracker tracker = new DirectiveScopeTracker(normalizer, parser, outcome);
            edges = new CallGraphExtractor(unit.projectId(), unit.filePath(), tracker).extract(index);
        } catch (RuntimeException e) {
            outcome.processingError(e.getClass().getSimpleName() + ": " + e.getMessage());
            edges = List.of();
        }
        return new FileResult(unit.projectId(), unit.filePath(), unit.contentHash(), unit.commitId(),
                edges, outcome.finish());
    }

    /**
     * Result for a file the structural converter could not convert. No edges are emitted.
     */
    public FileResult conversionFailed(String projectId, String filePath, String contentHash,
                                       String commitId, ConversionException error) {
        return new FileResult(projectId, filePath, contentHash, commitId, List.of(),
                FileOutcomeAggregator.conversionFailed(filePath, error.getMessage()));
    }
}
