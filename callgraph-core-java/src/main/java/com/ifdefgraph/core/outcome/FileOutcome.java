package com.ifdefgraph.core.outcome;

import java.util.List;

/**
 * Final status of one file, with its warnings in the order they were raised.
 */
public record FileOutcome(String file, FileStatus status, List<String> warnings) {

    public FileOutcome {
        warnings = List.copyOf(warnings);
    }
}
