package com.ifdefgraph.core.outcome;

public enum FileStatus {
    /** Processed without warnings. */
    OK,
    /** Recoverable problems were recorded; edges were still produced. */
    PARTIAL,
    /** No tree could be produced or processing aborted; no edges for this file. */
    FAILED
}
