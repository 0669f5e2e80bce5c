package io.github.flameyossnowy.simpledb.api.exceptions;

public class DecodeException extends SimpleDBException {
    private final String value;

    public DecodeException(String message, String value) {
        super(message);
        this.value = value;
    }

    public DecodeException(String message, String value, Throwable cause) {
        super(message, cause);
        this.value = value;
    }

    /**
     * The stored string that could not be decoded.
     */
    public String getValue() {
        return value;
    }
}
