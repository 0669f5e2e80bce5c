package io.github.flameyossnowy.simpledb.api.exceptions;

import org.jetbrains.annotations.Nullable;

/**
 * The service answered with an {@code Errors/Error} payload.
 * The message is the service's text, unmodified.
 */
public class RemoteServiceException extends SimpleDBException {
    private final String code;
    private final String requestId;

    public RemoteServiceException(@Nullable String code, String message, @Nullable String requestId) {
        super(message);
        this.code = code;
        this.requestId = requestId;
    }

    @Nullable
    public String getCode() {
        return code;
    }

    @Nullable
    public String getRequestId() {
        return requestId;
    }
}
