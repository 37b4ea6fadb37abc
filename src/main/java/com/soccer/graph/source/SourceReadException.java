package com.soccer.graph.source;

/**
 * The source as a whole cannot be read. Fails the run of that source only.
 */
public class SourceReadException extends RuntimeException {

    public SourceReadException(String message) {
        super(message);
    }

    public SourceReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
