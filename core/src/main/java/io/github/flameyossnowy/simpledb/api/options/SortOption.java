package io.github.flameyossnowy.simpledb.api.options;

import io.github.flameyossnowy.simpledb.api.exceptions.ValidationException;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

public record SortOption(@NotNull String field, @NotNull SortOrder order) {

    public SortOption {
        Objects.requireNonNull(field, "Sort field cannot be null");
        Objects.requireNonNull(order, "Sort order cannot be null");
        if (field.isBlank()) throw new ValidationException("Sort field cannot be blank");
    }

    /**
     * Parses {@code "age"} as ascending and {@code "-age"} as descending.
     */
    public static SortOption parse(@NotNull String field) {
        if (field.startsWith("-")) {
            return new SortOption(field.substring(1), SortOrder.DESCENDING);
        }
        return new SortOption(field, SortOrder.ASCENDING);
    }
}
