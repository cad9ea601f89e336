package com.ifdefgraph.runner.sink;

import com.ifdefgraph.runner.BatchResult;

import java.nio.file.Path;

/**
 * Writes the results of a run into an output directory.
 */
public interface OutputSink {

    /**
     * @param outputDir created if absent
     * @throws SinkException if a file could not be written
     */
    void write(BatchResult result, Path outputDir);

    class SinkException extends RuntimeException {
        public SinkException(String msg, Throwable cause) { super(msg, cause); }
    }
}
