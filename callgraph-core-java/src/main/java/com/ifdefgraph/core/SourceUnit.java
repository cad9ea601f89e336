package com.ifdefgraph.core;

import com.ifdefgraph.core.tree.TreeElement;

/**
 * One file handed to the core: identity, content hash, optional commit and the converter's tree.
 * The tree is only referenced for the duration of {@link FileProcessor#process(SourceUnit)}.
 */
public record SourceUnit(
    String projectId,
    String filePath,
    String contentHash,
    String commitId,    // nullable
    TreeElement tree
) {
}
