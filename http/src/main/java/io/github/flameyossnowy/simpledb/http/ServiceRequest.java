package io.github.flameyossnowy.simpledb.http;

import io.github.flameyossnowy.simpledb.http.signing.UrlEncoding;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * A request to the service: an HTTP method, a target URL and the parameters
 * sent as the form-encoded body, in insertion order.
 */
public record ServiceRequest(@NotNull String method, @NotNull URI url, @NotNull Map<String, String> parameters) {

    public ServiceRequest {
        Objects.requireNonNull(method, "Method cannot be null");
        Objects.requireNonNull(url, "Url cannot be null");
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static ServiceRequest post(@NotNull URI url, @NotNull Map<String, String> parameters) {
        return new ServiceRequest("POST", url, parameters);
    }

    /**
     * A copy with {@code name} set to {@code value}. An existing parameter
     * keeps its position.
     */
    @Contract(pure = true)
    public ServiceRequest withParameter(@NotNull String name, @NotNull String value) {
        Map<String, String> copy = new LinkedHashMap<>(parameters);
        copy.put(name, value);
        return new ServiceRequest(method, url, copy);
    }

    @Contract(pure = true)
    public ServiceRequest withParameters(@NotNull Map<String, String> extra) {
        Map<String, String> copy = new LinkedHashMap<>(parameters);
        copy.putAll(extra);
        return new ServiceRequest(method, url, copy);
    }

    public String parameter(String name) {
        return parameters.get(name);
    }

    /**
     * The parameters as an {@code application/x-www-form-urlencoded} body,
     * escaped the same way the signature base string is.
     */
    public String formBody() {
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, String> entry : parameters.entrySet()) {
            joiner.add(UrlEncoding.encode(entry.getKey()) + '=' + UrlEncoding.encode(entry.getValue()));
        }
        return joiner.toString();
    }
}
