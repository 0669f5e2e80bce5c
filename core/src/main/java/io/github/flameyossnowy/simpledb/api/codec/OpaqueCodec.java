package io.github.flameyossnowy.simpledb.api.codec;

import org.jetbrains.annotations.NotNull;

/**
 * Pass-through codec for attributes without a declared type.
 */
public final class OpaqueCodec implements AttributeCodec<String> {
    public static final OpaqueCodec INSTANCE = new OpaqueCodec();

    @Override
    public @NotNull String encode(@NotNull String value) {
        return value;
    }

    @Override
    public @NotNull String decode(@NotNull String value) {
        return value;
    }

    @Override
    public @NotNull String encodeValue(@NotNull Object value) {
        return String.valueOf(value);
    }

    @Override
    public @NotNull Class<String> type() {
        return String.class;
    }

    @Override
    public @NotNull FieldKind kind() {
        return FieldKind.OPAQUE;
    }
}
