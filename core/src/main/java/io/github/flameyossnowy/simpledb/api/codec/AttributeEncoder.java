package io.github.flameyossnowy.simpledb.api.codec;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Looks up the codec of an attribute and applies it.
 *
 * <p>A client holds one encoder for all domains. It is used when writing
 * attribute values and when rendering condition values into a select
 * expression, so a filter on an encoded attribute compares like with like.</p>
 */
public interface AttributeEncoder {

    /**
     * Encodes {@code value} for {@code attribute} of {@code domain}.
     * Returns {@code null} only for a {@code null} value.
     */
    @Nullable
    String encode(@NotNull String domain, @NotNull String attribute, @Nullable Object value);

    /**
     * Decodes a stored string of {@code attribute} of {@code domain}.
     */
    @Nullable
    Object decode(@NotNull String domain, @NotNull String attribute, @Nullable String value);

    /**
     * The encoder used when nothing is declared: every value goes through
     * {@link String#valueOf(Object)} and decoding is the identity.
     */
    @Contract(pure = true)
    static AttributeEncoder identity() {
        return Identity.INSTANCE;
    }

    final class Identity implements AttributeEncoder {
        private static final Identity INSTANCE = new Identity();

        private Identity() {}

        @Override
        public String encode(@NotNull String domain, @NotNull String attribute, Object value) {
            return value == null ? null : String.valueOf(value);
        }

        @Override
        public Object decode(@NotNull String domain, @NotNull String attribute, String value) {
            return value;
        }
    }
}
