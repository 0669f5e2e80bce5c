package io.github.flameyossnowy.simpledb.http;

import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.NotNull;

/**
 * A successful response: the request id and box usage from the response
 * metadata, and the parsed document for the action's result element.
 */
public record ServiceResponse(@NotNull String requestId, double boxUsage, @NotNull JsonNode body) {

    /**
     * The named result element, e.g. {@code SelectResult}. Missing when the
     * service sent none.
     */
    public JsonNode result(String element) {
        return body.path(element);
    }
}
