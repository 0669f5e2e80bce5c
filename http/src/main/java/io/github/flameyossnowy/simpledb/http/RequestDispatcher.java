package io.github.flameyossnowy.simpledb.http;

import org.jetbrains.annotations.NotNull;

/**
 * Sends a signed request and returns the raw response body.
 *
 * <p>Implementations do not interpret the body: error documents are returned
 * like any other and mapped by the client. I/O failures are raised as
 * {@link io.github.flameyossnowy.simpledb.api.exceptions.TransportException}.</p>
 */
@FunctionalInterface
public interface RequestDispatcher {

    @NotNull
    String dispatch(@NotNull ServiceRequest request);
}
