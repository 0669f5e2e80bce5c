package io.github.flameyossnowy.simpledb.api.model;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One item of a batch put.
 */
public record ItemWrite(@NotNull String itemName, @NotNull List<ReplaceableAttribute> attributes) {

    public ItemWrite {
        Objects.requireNonNull(itemName, "Item name cannot be null");
        attributes = List.copyOf(attributes);
    }

    public static ItemWrite of(@NotNull String itemName, @NotNull Map<String, ?> attributes) {
        return new ItemWrite(itemName, ReplaceableAttribute.replacingAll(attributes));
    }

    public static ItemWrite of(@NotNull Item item) {
        return of(item.name(), item.attributes());
    }
}
