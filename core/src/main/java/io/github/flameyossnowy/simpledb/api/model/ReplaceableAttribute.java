package io.github.flameyossnowy.simpledb.api.model;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One attribute of a put. {@code value} is either a single value or a
 * collection of values; {@code replace} overwrites the values already
 * stored instead of adding to them.
 */
public record ReplaceableAttribute(@NotNull String name, @NotNull Object value, boolean replace) {

    public ReplaceableAttribute {
        Objects.requireNonNull(name, "Attribute name cannot be null");
        Objects.requireNonNull(value, "Value of attribute " + name + " cannot be null");
    }

    public static ReplaceableAttribute replace(String name, Object value) {
        return new ReplaceableAttribute(name, value, true);
    }

    public static ReplaceableAttribute add(String name, Object value) {
        return new ReplaceableAttribute(name, value, false);
    }

    /**
     * Every entry of {@code attributes} as a replacing attribute, in map order.
     */
    public static List<ReplaceableAttribute> replacingAll(@NotNull Map<String, ?> attributes) {
        List<ReplaceableAttribute> list = new ArrayList<>(attributes.size());
        for (Map.Entry<String, ?> entry : attributes.entrySet()) {
            list.add(replace(entry.getKey(), entry.getValue()));
        }
        return list;
    }

    /**
     * The individual values, one entry per stored value.
     */
    public List<Object> valueList() {
        if (value instanceof Collection<?> many) {
            return List.copyOf(many);
        }
        return List.of(value);
    }
}
