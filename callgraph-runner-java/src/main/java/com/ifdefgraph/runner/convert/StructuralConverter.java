package com.ifdefgraph.runner.convert;

import com.ifdefgraph.core.ConversionException;
import com.ifdefgraph.core.tree.TreeElement;

import java.nio.file.Path;

/**
 * Turns one source file into the tree the core indexes.
 * Implementations must be safe to call from several worker threads at once.
 */
public interface StructuralConverter {

    /**
     * Verifies once, before any file is processed, that the converter can run at all.
     *
     * @throws ConverterUnavailableException if it cannot
     */
    void checkAvailable();

    /**
     * @throws ConversionException if this file could not be converted; other files are unaffected
     */
    TreeElement convert(Path sourceFile) throws ConversionException;

    class ConverterUnavailableException extends RuntimeException {
        public ConverterUnavailableException(String message) { super(message); }
        public ConverterUnavailableException(String message, Throwable cause) { super(message, cause); }
    }
}
