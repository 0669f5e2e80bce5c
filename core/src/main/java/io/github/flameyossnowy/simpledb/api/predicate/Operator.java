package io.github.flameyossnowy.simpledb.api.predicate;

import io.github.flameyossnowy.simpledb.api.exceptions.ValidationException;
import org.jetbrains.annotations.NotNull;

import java.util.Locale;

/**
 * Comparison operators of the select-expression dialect, with the short
 * names used in {@code attribute__operator} bindings.
 *
 * <p>{@code IS NULL} and {@code IS NOT NULL} are not operators of their own:
 * they are {@link #EQ} and {@link #NOT_EQ} with a {@code null} value.</p>
 */
public enum Operator {
    EQ("eq", "="),
    NOT_EQ("noteq", "!="),
    GT("gt", ">"),
    GTE("gte", ">="),
    LT("lt", "<"),
    LTE("lte", "<="),
    LIKE("like", "like"),
    NOT_LIKE("notlike", "not like"),
    BETWEEN("btwn", "between"),
    IN("in", "in");

    private final String bindingName;
    private final String symbol;

    Operator(String bindingName, String symbol) {
        this.bindingName = bindingName;
        this.symbol = symbol;
    }

    public String bindingName() {
        return bindingName;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Resolves a binding suffix such as {@code gte} or {@code btwn}.
     * {@code between} is accepted as a synonym of {@code btwn}.
     */
    public static Operator fromBindingName(@NotNull String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (Operator operator : values()) {
            if (operator.bindingName.equals(lower)) return operator;
        }
        if ("between".equals(lower)) return BETWEEN;
        throw new ValidationException(name + " is not a valid query operation");
    }
}
