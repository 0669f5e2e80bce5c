package io.github.flameyossnowy.simpledb.api.meta;

import io.github.flameyossnowy.simpledb.api.codec.AttributeCodec;
import io.github.flameyossnowy.simpledb.api.codec.FieldKind;
import io.github.flameyossnowy.simpledb.api.codec.OpaqueCodec;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.function.Supplier;

/**
 * One declared field of a {@link RecordSchema}.
 *
 * @param name         attribute name in the store
 * @param codec        codec of the stored values
 * @param required     whether writing a record without this field fails
 * @param defaultValue supplies the value written when the record has none, or {@code null}
 * @param itemName     whether this field holds the item name instead of an attribute
 */
public record FieldDescriptor(
    @NotNull String name,
    @NotNull AttributeCodec<?> codec,
    boolean required,
    @Nullable Supplier<?> defaultValue,
    boolean itemName
) {
    public static FieldDescriptor itemNameField(@NotNull String name) {
        return new FieldDescriptor(name, OpaqueCodec.INSTANCE, true, null, true);
    }

    public FieldKind kind() {
        return codec.kind();
    }

    @Nullable
    public Object defaultOrNull() {
        return defaultValue == null ? null : defaultValue.get();
    }
}
