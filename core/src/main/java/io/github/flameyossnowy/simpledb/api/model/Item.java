package io.github.flameyossnowy.simpledb.api.model;

import io.github.flameyossnowy.simpledb.api.codec.AttributeCodec;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named item and its attributes as stored: every attribute maps to one or
 * more string values, in the order the service returned them.
 */
public record Item(@NotNull String name, @NotNull Map<String, List<String>> attributes) {

    public Item {
        Objects.requireNonNull(name, "Item name cannot be null");
        Map<String, List<String>> copy = new LinkedHashMap<>(attributes.size());
        for (Map.Entry<String, List<String>> entry : attributes.entrySet()) {
            copy.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        attributes = Collections.unmodifiableMap(copy);
    }

    public static Item empty(@NotNull String name) {
        return new Item(name, Map.of());
    }

    /**
     * Builds an item one value at a time, keeping multi-valued attributes
     * together in arrival order.
     */
    public static Builder builder(@NotNull String name) {
        return new Builder(name);
    }

    public boolean isEmpty() {
        return attributes.isEmpty();
    }

    public boolean has(String attribute) {
        return attributes.containsKey(attribute);
    }

    public List<String> values(String attribute) {
        return attributes.getOrDefault(attribute, List.of());
    }

    /**
     * First value of an attribute, or {@code null} when absent.
     */
    @Nullable
    public String value(String attribute) {
        List<String> values = attributes.get(attribute);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    @Nullable
    public <T> T value(String attribute, @NotNull AttributeCodec<T> codec) {
        String raw = value(attribute);
        return raw == null ? null : codec.decode(raw);
    }

    public <T> List<T> values(String attribute, @NotNull AttributeCodec<T> codec) {
        List<String> raw = values(attribute);
        List<T> decoded = new ArrayList<>(raw.size());
        for (String each : raw) {
            decoded.add(codec.decode(each));
        }
        return decoded;
    }

    public static final class Builder {
        private final String name;
        private final Map<String, List<String>> attributes = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder add(String attribute, String value) {
            attributes.computeIfAbsent(attribute, k -> new ArrayList<>(1)).add(value);
            return this;
        }

        public Item build() {
            return new Item(name, attributes);
        }
    }
}
