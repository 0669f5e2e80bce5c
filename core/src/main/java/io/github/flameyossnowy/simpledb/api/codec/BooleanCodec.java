package io.github.flameyossnowy.simpledb.api.codec;

import io.github.flameyossnowy.simpledb.api.exceptions.DecodeException;
import org.jetbrains.annotations.NotNull;

/**
 * {@code true}/{@code false} as {@code "1"}/{@code "0"}.
 */
public final class BooleanCodec implements AttributeCodec<Boolean> {
    public static final BooleanCodec INSTANCE = new BooleanCodec();

    @Override
    public @NotNull String encode(@NotNull Boolean value) {
        return value ? "1" : "0";
    }

    @Override
    public @NotNull Boolean decode(@NotNull String value) {
        return switch (value) {
            case "1" -> Boolean.TRUE;
            case "0" -> Boolean.FALSE;
            default -> throw new DecodeException("Not an encoded boolean: '" + value + "'", value);
        };
    }

    @Override
    public @NotNull Class<Boolean> type() {
        return Boolean.class;
    }

    @Override
    public @NotNull FieldKind kind() {
        return FieldKind.BOOLEAN;
    }
}
