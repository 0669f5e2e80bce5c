package io.github.flameyossnowy.simpledb.api.exceptions;

/**
 * Base type of every error raised by the client.
 *
 * <p>None of the subclasses are retried by the library. Retry policy belongs
 * to the caller, who knows whether an operation is safe to repeat.</p>
 */
public class SimpleDBException extends RuntimeException {
    public SimpleDBException(String message) {
        super(message);
    }

    public SimpleDBException(String message, Throwable cause) {
        super(message, cause);
    }
}
