package io.github.flameyossnowy.simpledb.http;

import io.github.flameyossnowy.simpledb.api.exceptions.TransportException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * {@link RequestDispatcher} backed by {@link HttpClient}. One request at a
 * time per call; the client itself may be shared.
 */
public final class JdkHttpDispatcher implements RequestDispatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(JdkHttpDispatcher.class);

    static final String CONTENT_TYPE = "application/x-www-form-urlencoded; charset=utf-8";

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public JdkHttpDispatcher() {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), Duration.ofSeconds(30));
    }

    public JdkHttpDispatcher(@NotNull HttpClient httpClient, @NotNull Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public @NotNull String dispatch(@NotNull ServiceRequest request) {
        HttpRequest httpRequest = HttpRequest.newBuilder(request.url())
            .timeout(requestTimeout)
            .header("Content-Type", CONTENT_TYPE)
            .method(request.method(), HttpRequest.BodyPublishers.ofString(request.formBody(), StandardCharsets.UTF_8))
            .build();

        try {
            HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            LOGGER.debug("{} {} -> {}", request.parameter("Action"), request.url(), response.statusCode());
            return response.body();
        } catch (IOException e) {
            throw new TransportException("Request " + request.parameter("Action") + " to " + request.url() + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while waiting for " + request.parameter("Action"), e);
        }
    }
}
