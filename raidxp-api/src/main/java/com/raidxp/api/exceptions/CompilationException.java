package com.raidxp.api.exceptions;

/**
 * Exception thrown when rule compilation fails.
 *
 * <p>Raised once at startup for malformed patterns, award tables or quest seeds;
 * it must prevent the ingestion worker from running.
 */
public class CompilationException extends RuntimeException {

    public CompilationException(String message) {
        super(message);
    }

    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
