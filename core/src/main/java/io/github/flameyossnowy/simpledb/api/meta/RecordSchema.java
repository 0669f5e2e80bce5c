package io.github.flameyossnowy.simpledb.api.meta;

import io.github.flameyossnowy.simpledb.api.codec.AttributeCodec;
import io.github.flameyossnowy.simpledb.api.codec.AttributeEncoder;
import io.github.flameyossnowy.simpledb.api.exceptions.ValidationException;
import io.github.flameyossnowy.simpledb.api.model.Item;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Immutable description of the records stored in one domain: the ordered
 * field list and the attribute-name to codec table derived from it.
 *
 * <pre>{@code
 * RecordSchema users = RecordSchema.builder("users")
 *     .itemName("id")
 *     .field("age", new NumberCodec(3, 100))
 *     .field("active", BooleanCodec.INSTANCE).defaultValue(() -> true)
 *     .field("joined", new TimestampCodec()).required()
 *     .build();
 * }</pre>
 *
 * <p>Validation happens once, in {@link Builder#build()}.</p>
 */
public final class RecordSchema implements AttributeEncoder {
    private final String domain;
    private final List<FieldDescriptor> fields;
    private final Map<String, FieldDescriptor> byName;
    private final FieldDescriptor nameField;

    private RecordSchema(String domain, List<FieldDescriptor> fields) {
        this.domain = domain;
        this.fields = List.copyOf(fields);

        Map<String, FieldDescriptor> index = new LinkedHashMap<>(fields.size());
        FieldDescriptor key = null;
        for (FieldDescriptor field : fields) {
            if (index.put(field.name(), field) != null) {
                throw new ValidationException("Duplicate field '" + field.name() + "' in schema for domain " + domain);
            }
            if (field.itemName()) {
                if (key != null) {
                    throw new ValidationException("Multiple item name fields defined for domain '" + domain + "'");
                }
                key = field;
            }
        }
        this.byName = Collections.unmodifiableMap(index);
        this.nameField = key;
    }

    public static Builder builder(@NotNull String domain) {
        return new Builder(domain);
    }

    public String domain() {
        return domain;
    }

    public List<FieldDescriptor> fields() {
        return fields;
    }

    @Nullable
    public FieldDescriptor field(String name) {
        return byName.get(name);
    }

    @Nullable
    public FieldDescriptor nameField() {
        return nameField;
    }

    /**
     * The codec of an attribute, or {@code null} when the attribute is not
     * declared or is the item name.
     */
    @Nullable
    public AttributeCodec<?> codec(String attribute) {
        FieldDescriptor field = byName.get(attribute);
        if (field == null || field.itemName()) return null;
        return field.codec();
    }

    @Override
    public @Nullable String encode(@NotNull String domain, @NotNull String attribute, @Nullable Object value) {
        if (value == null) return null;
        AttributeCodec<?> codec = codec(attribute);
        return codec == null ? String.valueOf(value) : codec.encodeValue(value);
    }

    @Override
    public @Nullable Object decode(@NotNull String domain, @NotNull String attribute, @Nullable String value) {
        if (value == null) return null;
        AttributeCodec<?> codec = codec(attribute);
        return codec == null ? value : codec.decode(value);
    }

    /**
     * Encodes a record's values into attributes ready for a put.
     *
     * <p>Declared fields missing from {@code values} get their default; a
     * required field with neither raises {@link ValidationException}. The item
     * name field is skipped. Undeclared keys pass through unencoded.
     * Collections become multi-valued attributes.</p>
     */
    public Map<String, List<String>> toAttributes(@NotNull Map<String, ?> values) {
        Map<String, List<String>> attributes = new LinkedHashMap<>(values.size());

        for (FieldDescriptor field : fields) {
            if (field.itemName()) continue;

            Object value = values.get(field.name());
            if (value == null) value = field.defaultOrNull();
            if (value == null) {
                if (field.required()) {
                    throw new ValidationException("Missing required field '" + field.name() + "'");
                }
                continue;
            }
            attributes.put(field.name(), encodeAll(field.name(), value));
        }

        for (Map.Entry<String, ?> entry : values.entrySet()) {
            if (byName.containsKey(entry.getKey()) || entry.getValue() == null) continue;
            attributes.put(entry.getKey(), encodeAll(entry.getKey(), entry.getValue()));
        }
        return attributes;
    }

    /**
     * Reads an item back into field values, keyed in declaration order.
     * Multi-valued attributes decode to a list; the item name is stored under
     * the name field when one is declared.
     */
    public Map<String, Object> fromItem(@NotNull Item item) {
        Map<String, Object> record = new LinkedHashMap<>(fields.size() + 1);
        if (nameField != null) {
            record.put(nameField.name(), item.name());
        }

        for (FieldDescriptor field : fields) {
            if (field.itemName()) continue;
            List<String> stored = item.values(field.name());
            if (stored.isEmpty()) continue;
            record.put(field.name(), decodeAll(field.name(), stored));
        }

        for (Map.Entry<String, List<String>> entry : item.attributes().entrySet()) {
            if (byName.containsKey(entry.getKey())) continue;
            List<String> stored = entry.getValue();
            record.put(entry.getKey(), stored.size() == 1 ? stored.get(0) : stored);
        }
        return record;
    }

    private List<String> encodeAll(String attribute, Object value) {
        if (value instanceof Collection<?> many) {
            List<String> out = new ArrayList<>(many.size());
            for (Object each : many) {
                out.add(encode(domain, attribute, Objects.requireNonNull(each, "Null element in " + attribute)));
            }
            return out;
        }
        return List.of(Objects.requireNonNull(encode(domain, attribute, value)));
    }

    private Object decodeAll(String attribute, List<String> stored) {
        if (stored.size() == 1) {
            return decode(domain, attribute, stored.get(0));
        }
        List<Object> out = new ArrayList<>(stored.size());
        for (String each : stored) {
            out.add(decode(domain, attribute, each));
        }
        return out;
    }

    @SuppressWarnings("unused")
    public static final class Builder {
        private final String domain;
        private final List<FieldDescriptor> fields = new ArrayList<>();

        Builder(String domain) {
            if (domain == null || domain.isBlank()) {
                throw new ValidationException("Domain name cannot be blank");
            }
            this.domain = domain;
        }

        public Builder itemName(@NotNull String name) {
            fields.add(FieldDescriptor.itemNameField(name));
            return this;
        }

        public Builder field(@NotNull String name, @NotNull AttributeCodec<?> codec) {
            Objects.requireNonNull(name, "Field name cannot be null");
            Objects.requireNonNull(codec, "Codec cannot be null");
            fields.add(new FieldDescriptor(name, codec, false, null, false));
            return this;
        }

        public Builder field(@NotNull FieldDescriptor descriptor) {
            fields.add(Objects.requireNonNull(descriptor, "Field cannot be null"));
            return this;
        }

        /**
         * Marks the last declared field as required.
         */
        public Builder required() {
            FieldDescriptor last = last();
            fields.set(fields.size() - 1, new FieldDescriptor(last.name(), last.codec(), true, last.defaultValue(), last.itemName()));
            return this;
        }

        /**
         * Sets the default of the last declared field.
         */
        public Builder defaultValue(@NotNull Supplier<?> supplier) {
            FieldDescriptor last = last();
            if (last.itemName()) {
                throw new ValidationException("The item name field '" + last.name() + "' cannot have a default");
            }
            fields.set(fields.size() - 1, new FieldDescriptor(last.name(), last.codec(), last.required(), supplier, false));
            return this;
        }

        public RecordSchema build() {
            return new RecordSchema(domain, fields);
        }

        private FieldDescriptor last() {
            if (fields.isEmpty()) {
                throw new ValidationException("No field declared yet");
            }
            return fields.get(fields.size() - 1);
        }
    }
}
