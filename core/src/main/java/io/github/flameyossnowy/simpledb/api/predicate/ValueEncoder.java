package io.github.flameyossnowy.simpledb.api.predicate;

import org.jetbrains.annotations.NotNull;

/**
 * Encodes a condition value for the attribute it is compared against.
 */
@FunctionalInterface
public interface ValueEncoder {
    @NotNull
    String encode(@NotNull String attribute, @NotNull Object value);

    static ValueEncoder plain() {
        return (attribute, value) -> String.valueOf(value);
    }
}
