package io.github.flameyossnowy.simpledb.api.codec;

import io.github.flameyossnowy.simpledb.api.exceptions.ValidationException;
import org.jetbrains.annotations.NotNull;

/**
 * Translates a typed value to and from the string the store keeps.
 *
 * <p>The store compares attribute values as strings only, so an encoding is
 * expected to preserve order: {@code a < b} implies
 * {@code encode(a).compareTo(encode(b)) < 0} for the range the codec was
 * configured for. {@code decode(encode(v))} must give back {@code v}.</p>
 *
 * @param <T> the decoded value type
 */
public interface AttributeCodec<T> {

    @NotNull
    String encode(@NotNull T value);

    /**
     * @throws io.github.flameyossnowy.simpledb.api.exceptions.DecodeException if the string is not a valid encoding
     */
    @NotNull
    T decode(@NotNull String value);

    @NotNull
    Class<T> type();

    @NotNull
    FieldKind kind();

    /**
     * Encodes a value of unknown static type.
     *
     * <p>A {@link String} handed to a non-string codec is taken to be encoded
     * already and is returned as is, which lets callers filter with literal
     * encoded values. Any other type mismatch is rejected.</p>
     */
    @NotNull
    default String encodeValue(@NotNull Object value) {
        Class<T> type = type();
        if (type.isInstance(value)) {
            return encode(type.cast(value));
        }
        if (value instanceof String s) {
            return s;
        }
        throw new ValidationException(
            "Cannot encode " + value.getClass().getSimpleName() + " with a " + kind() + " codec expecting " + type.getSimpleName()
        );
    }
}
