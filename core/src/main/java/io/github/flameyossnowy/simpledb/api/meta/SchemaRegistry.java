package io.github.flameyossnowy.simpledb.api.meta;

import io.github.flameyossnowy.simpledb.api.codec.AttributeEncoder;
import io.github.flameyossnowy.simpledb.api.exceptions.ValidationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Routes encoding to the {@link RecordSchema} of each domain. Domains with no
 * registered schema fall back to the identity encoder.
 *
 * <p>Built once and handed to a client; there is no process-wide registry.</p>
 */
public final class SchemaRegistry implements AttributeEncoder {
    private final Map<String, RecordSchema> schemas;

    private SchemaRegistry(Map<String, RecordSchema> schemas) {
        this.schemas = Map.copyOf(schemas);
    }

    public static SchemaRegistry of(@NotNull RecordSchema... schemas) {
        Map<String, RecordSchema> byDomain = new LinkedHashMap<>(schemas.length);
        for (RecordSchema schema : schemas) {
            if (byDomain.put(schema.domain(), schema) != null) {
                throw new ValidationException("Two schemas declared for domain '" + schema.domain() + "'");
            }
        }
        return new SchemaRegistry(byDomain);
    }

    @Nullable
    public RecordSchema schema(String domain) {
        return schemas.get(domain);
    }

    public Collection<RecordSchema> schemas() {
        return schemas.values();
    }

    @Override
    public @Nullable String encode(@NotNull String domain, @NotNull String attribute, @Nullable Object value) {
        RecordSchema schema = schemas.get(domain);
        return schema == null
            ? AttributeEncoder.identity().encode(domain, attribute, value)
            : schema.encode(domain, attribute, value);
    }

    @Override
    public @Nullable Object decode(@NotNull String domain, @NotNull String attribute, @Nullable String value) {
        RecordSchema schema = schemas.get(domain);
        return schema == null
            ? AttributeEncoder.identity().decode(domain, attribute, value)
            : schema.decode(domain, attribute, value);
    }
}
