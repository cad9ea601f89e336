package com.ifdefgraph.core.outcome;

import com.ifdefgraph.core.tree.Span;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the warnings raised while one file is traversed and decides its final status.
 * One instance per file; not thread-safe.
 */
public class FileOutcomeAggregator {

    public enum WarningKind {
        MALFORMED_NODE("MalformedNode"),
        DIRECTIVE_IMBALANCE("DirectiveImbalance"),
        PROCESSING_ERROR("ProcessingError"),
        CONVERSION_ERROR("ConversionError");

        private final String label;

        WarningKind(String label) { this.label = label; }

        public String label() { return label; }
    }

    private final String file;
    private final List<String> warnings = new ArrayList<>();
    private boolean failed;

    public FileOutcomeAggregator(String file) {
        this.file = file;
    }

    public void malformedNode(Span span, String message) {
        add(WarningKind.MALFORMED_NODE, span, message);
    }

    public void directiveImbalance(Span span, String message) {
        add(WarningKind.DIRECTIVE_IMBALANCE, span, message);
    }

    /** An unexpected failure inside the core. Marks the file FAILED. */
    public void processingError(String message) {
        add(WarningKind.PROCESSING_ERROR, Span.UNKNOWN, message);
        failed = true;
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public boolean isFailed() {
        return failed;
    }

    public FileOutcome finish() {
        FileStatus status;
        if (failed) {
            status = FileStatus.FAILED;
        } else if (warnings.isEmpty()) {
            status = FileStatus.OK;
        } else {
            status = FileStatus.PARTIAL;
        }
        return new FileOutcome(file, status, warnings);
    }

    /**
     * Outcome for a file the structural converter could not turn into a tree.
     */
    public static FileOutcome conversionFailed(String file, String reason) {
        return new FileOutcome(file, FileStatus.FAILED,
                List.of(WarningKind.CONVERSION_ERROR.label() + ": " + reason));
    }

    private void add(WarningKind kind, Span span, String message) {
        StringBuilder sb = new StringBuilder(kind.label());
        if (span.isKnown()) {
            sb.append(" at ").append(span);
        }
        sb.append(": ").append(message);
        warnings.add(sb.toString());
    }
}
