package io.github.flameyossnowy.simpledb.http.batch;

import io.github.flameyossnowy.simpledb.api.exceptions.ValidationException;
import io.github.flameyossnowy.simpledb.api.model.ItemWrite;
import io.github.flameyossnowy.simpledb.http.ServiceResponse;
import io.github.flameyossnowy.simpledb.http.SimpleDBClient;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Writes any number of items as consecutive batch puts.
 *
 * <p>Items are sent in the order given, at most {@code chunkSize} per
 * request, one request after the other. A failing chunk stops the write and
 * its exception propagates; chunks already sent stay written.</p>
 */
public final class BatchWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(BatchWriter.class);

    public static final int MAX_ITEMS_PER_BATCH = 25;

    private final SimpleDBClient client;
    private final int chunkSize;

    public BatchWriter(@NotNull SimpleDBClient client) {
        this(client, MAX_ITEMS_PER_BATCH);
    }

    public BatchWriter(@NotNull SimpleDBClient client, int chunkSize) {
        this.client = Objects.requireNonNull(client, "Client cannot be null");
        if (chunkSize < 1 || chunkSize > MAX_ITEMS_PER_BATCH) {
            throw new ValidationException("Chunk size must be between 1 and " + MAX_ITEMS_PER_BATCH + ": " + chunkSize);
        }
        this.chunkSize = chunkSize;
    }

    public int chunkSize() {
        return chunkSize;
    }

    /**
     * @return one response per request sent, in order
     */
    public List<ServiceResponse> write(@NotNull String domain, @NotNull List<ItemWrite> items) {
        List<ServiceResponse> responses = new ArrayList<>((items.size() + chunkSize - 1) / chunkSize);
        for (int from = 0; from < items.size(); from += chunkSize) {
            List<ItemWrite> chunk = items.subList(from, Math.min(from + chunkSize, items.size()));
            responses.add(client.sendBatch(domain, chunk));
            LOGGER.debug("Wrote items {}..{} of {} to {}", from, from + chunk.size() - 1, items.size(), domain);
        }
        return responses;
    }
}
