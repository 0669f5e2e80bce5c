package io.github.flameyossnowy.simpledb.api.codec;

import io.github.flameyossnowy.simpledb.api.exceptions.DecodeException;
import io.github.flameyossnowy.simpledb.api.exceptions.ValidationException;
import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Encodes numbers as fixed-width, zero-padded decimal strings.
 *
 * <p>The value is first shifted by {@code offset} so that negative values
 * become positive, then printed with {@code precision} fractional digits and
 * left-padded with zeros. When both padding and precision are positive the
 * total width grows by {@code precision + 1} so the padding only counts the
 * integer digits:</p>
 *
 * <pre>{@code
 * new NumberCodec(6, 10000, 0).encode(-42)   // "009958"
 * new NumberCodec(6, 100, 2).encode(3.5)     // "000103.50"
 * }</pre>
 *
 * <p>Values outside the range the width can hold are still encoded; they just
 * stop sorting correctly.</p>
 *
 * <p>Encoding is exact for any {@link Number}, but {@link #decode(String)}
 * returns a {@link Double}: integers beyond 2<sup>53</sup> come back rounded to
 * the nearest double.</p>
 */
public final class NumberCodec implements AttributeCodec<Number> {
    private final BigDecimal offset;
    private final int precision;
    private final int width;

    public NumberCodec(int padding, double offset, int precision) {
        if (padding < 0) throw new ValidationException("Padding cannot be negative: " + padding);
        if (precision < 0) throw new ValidationException("Precision cannot be negative: " + precision);

        this.offset = BigDecimal.valueOf(offset);
        this.precision = precision;
        this.width = precision > 0 && padding > 0 ? padding + precision + 1 : padding;
    }

    public NumberCodec(int padding, double offset) {
        this(padding, offset, 0);
    }

    @Override
    public @NotNull String encode(@NotNull Number value) {
        BigDecimal shifted = toBigDecimal(value).add(offset).setScale(precision, RoundingMode.HALF_EVEN);
        String digits = shifted.abs().toPlainString();

        StringBuilder out = new StringBuilder(Math.max(width, digits.length() + 1));
        int targetDigits = width;
        if (shifted.signum() < 0) {
            out.append('-');
            targetDigits--;
        }
        for (int i = digits.length(); i < targetDigits; i++) {
            out.append('0');
        }
        return out.append(digits).toString();
    }

    /**
     * Parses {@code value} and removes the offset. The result is always a
     * {@link Double}.
     */
    @Override
    public @NotNull Number decode(@NotNull String value) {
        try {
            return new BigDecimal(value.trim()).subtract(offset).doubleValue();
        } catch (NumberFormatException e) {
            throw new DecodeException("Not a number: '" + value + "'", value, e);
        }
    }

    @Override
    public @NotNull Class<Number> type() {
        return Number.class;
    }

    @Override
    public @NotNull FieldKind kind() {
        return FieldKind.NUMBER;
    }

    /**
     * Total characters of an in-range encoded value.
     */
    public int width() {
        return width;
    }

    private static BigDecimal toBigDecimal(Number value) {
        if (value instanceof BigDecimal d) return d;
        if (value instanceof BigInteger i) return new BigDecimal(i);
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return BigDecimal.valueOf(value.longValue());
        }
        double d = value.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new ValidationException("Cannot encode non-finite number: " + d);
        }
        return BigDecimal.valueOf(d);
    }
}
