package com.raidxp.api.exceptions;

/**
 * Exception thrown when an operation against the durable store fails.
 *
 * <p>Event application is rolled back in full before this is thrown, so the caller
 * may retry the same event.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
