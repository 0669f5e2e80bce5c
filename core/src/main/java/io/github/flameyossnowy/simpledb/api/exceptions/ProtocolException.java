package io.github.flameyossnowy.simpledb.api.exceptions;

/**
 * A response did not have the structure the protocol promises, e.g. a missing
 * {@code ResponseMetadata} element or a body that is not XML at all.
 */
public class ProtocolException extends SimpleDBException {
    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
