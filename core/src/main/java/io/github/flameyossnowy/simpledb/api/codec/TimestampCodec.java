package io.github.flameyossnowy.simpledb.api.codec;

import io.github.flameyossnowy.simpledb.api.exceptions.DecodeException;
import io.github.flameyossnowy.simpledb.api.exceptions.ValidationException;
import org.jetbrains.annotations.NotNull;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Formats {@link LocalDateTime} values with a fixed pattern.
 *
 * <p>The default pattern, {@value #DEFAULT_PATTERN}, has fixed-width fields so
 * string order equals chronological order. Precision is whatever the pattern
 * keeps; the default drops fractional seconds.</p>
 */
public final class TimestampCodec implements AttributeCodec<LocalDateTime> {
    public static final String DEFAULT_PATTERN = "yyyy-MM-dd'T'HH:mm:ss";

    private final String pattern;
    private final DateTimeFormatter formatter;

    public TimestampCodec() {
        this(DEFAULT_PATTERN);
    }

    public TimestampCodec(@NotNull String pattern) {
        this.pattern = pattern;
        try {
            this.formatter = DateTimeFormatter.ofPattern(pattern, Locale.ROOT);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid timestamp pattern '" + pattern + "': " + e.getMessage());
        }
    }

    @Override
    public @NotNull String encode(@NotNull LocalDateTime value) {
        return formatter.format(value);
    }

    @Override
    public @NotNull LocalDateTime decode(@NotNull String value) {
        try {
            return LocalDateTime.parse(value, formatter);
        } catch (DateTimeParseException e) {
            throw new DecodeException("Timestamp '" + value + "' does not match pattern " + pattern, value, e);
        }
    }

    @Override
    public @NotNull Class<LocalDateTime> type() {
        return LocalDateTime.class;
    }

    @Override
    public @NotNull FieldKind kind() {
        return FieldKind.TIMESTAMP;
    }
}
