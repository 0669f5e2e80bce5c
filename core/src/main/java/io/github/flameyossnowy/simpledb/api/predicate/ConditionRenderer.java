package io.github.flameyossnowy.simpledb.api.predicate;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Renders leaf conditions in the select-expression dialect.
 */
public final class ConditionRenderer {
    /**
     * Pseudo-attribute addressing the item name.
     */
    public static final String ITEM_NAME = "itemName()";

    private static final Set<String> RESERVED_KEYWORDS = Set.of(
        "OR", "AND", "NOT", "FROM", "WHERE", "SELECT", "LIKE", "NULL", "IS", "ORDER",
        "BY", "ASC", "DESC", "IN", "BETWEEN", "INTERSECTION", "LIMIT", "EVERY"
    );

    private ConditionRenderer() {}

    static String render(@NotNull Condition.Leaf leaf, @NotNull ValueEncoder encoder) {
        String attribute = leaf.attribute();
        String reference = leaf.quantifier() == Quantifier.EVERY
            ? "every(" + quoteAttribute(attribute) + ")"
            : quoteAttribute(attribute);

        Operator operator = leaf.operator();
        Object value = leaf.value();

        return switch (operator) {
            case EQ -> value == null ? reference + " IS NULL" : comparison(reference, operator, encoder.encode(attribute, value));
            case NOT_EQ -> value == null ? reference + " IS NOT NULL" : comparison(reference, operator, encoder.encode(attribute, value));
            case LIKE, NOT_LIKE -> comparison(reference, operator, String.valueOf(value));
            case BETWEEN -> {
                List<?> range = (List<?>) value;
                yield reference + " between '" + quote(encoder.encode(attribute, range.get(0)))
                    + "' and '" + quote(encoder.encode(attribute, range.get(1))) + "'";
            }
            case IN -> {
                StringJoiner joiner = new StringJoiner(", ", reference + " in(", ")");
                for (Object each : (List<?>) value) {
                    joiner.add("'" + quote(encoder.encode(attribute, each)) + "'");
                }
                yield joiner.toString();
            }
            default -> comparison(reference, operator, encoder.encode(attribute, value));
        };
    }

    private static String comparison(String reference, Operator operator, String encoded) {
        return reference + " " + operator.symbol() + " '" + quote(encoded) + "'";
    }

    /**
     * Back-quotes names that collide with a keyword of the dialect.
     */
    public static String quoteAttribute(@NotNull String name) {
        if (RESERVED_KEYWORDS.contains(name.toUpperCase(Locale.ROOT))) {
            return "`" + name + "`";
        }
        return name;
    }

    /**
     * Doubles single quotes so the value can sit inside a quoted literal.
     */
    public static String quote(@NotNull String value) {
        return value.replace("'", "''");
    }
}
