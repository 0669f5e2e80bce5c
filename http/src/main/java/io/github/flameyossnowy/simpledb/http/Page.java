package io.github.flameyossnowy.simpledb.http;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * One page of a paged action, with the token of the next page if there is one.
 */
public record Page<T>(@NotNull List<T> items, @Nullable String nextToken) {

    public Page {
        items = List.copyOf(items);
        if (nextToken != null && nextToken.isEmpty()) {
            nextToken = null;
        }
    }
}
