package com.ifdefgraph.core;

/**
 * The structural converter could not produce a tree for one file (tool failure, timeout,
 * non-source input, unparseable output). Fatal to that file only.
 */
public class ConversionException extends Exception {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
