package io.github.flameyossnowy.simpledb.api.exceptions;

/**
 * The request never produced a response: connection failure, timeout or
 * interruption of the calling thread.
 */
public class TransportException extends SimpleDBException {
    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
