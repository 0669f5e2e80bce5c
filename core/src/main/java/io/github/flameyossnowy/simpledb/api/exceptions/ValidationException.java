package io.github.flameyossnowy.simpledb.api.exceptions;

/**
 * A condition, query or schema was built with invalid arguments.
 * Always raised before any request is sent.
 */
public class ValidationException extends SimpleDBException {
    public ValidationException(String message) {
        super(message);
    }
}
