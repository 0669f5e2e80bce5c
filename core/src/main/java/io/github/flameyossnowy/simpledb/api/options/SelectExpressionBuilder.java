package io.github.flameyossnowy.simpledb.api.options;

import io.github.flameyossnowy.simpledb.api.predicate.Condition;
import io.github.flameyossnowy.simpledb.api.predicate.ConditionRenderer;
import io.github.flameyossnowy.simpledb.api.predicate.ValueEncoder;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.StringJoiner;

/**
 * Renders {@code SELECT <fields> FROM `domain` [WHERE ...] [ORDER BY ...] [LIMIT n]}.
 */
final class SelectExpressionBuilder {
    private SelectExpressionBuilder() {}

    static String build(
        @NotNull String domain,
        @NotNull List<String> fields,
        @NotNull Condition where,
        @Nullable SortOption order,
        int limit,
        @NotNull ValueEncoder encoder
    ) {
        StringBuilder expression = new StringBuilder("SELECT ")
            .append(outputList(fields))
            .append(" FROM `")
            .append(domain)
            .append('`');

        appendConditions(where, encoder, expression);
        appendSortingAndLimit(order, limit, expression);

        return expression.toString();
    }

    private static String outputList(List<String> fields) {
        if (fields.isEmpty()) return "*";

        StringJoiner joiner = new StringJoiner(", ");
        for (String field : fields) {
            // functions such as count(*) and itemName() are emitted verbatim
            joiner.add(field.indexOf('(') >= 0 ? field : ConditionRenderer.quoteAttribute(field));
        }
        return joiner.toString();
    }

    private static void appendConditions(Condition where, ValueEncoder encoder, StringBuilder expression) {
        if (where.isEmpty()) return;

        String rendered = where.toExpression(encoder);
        if (!rendered.isEmpty()) {
            expression.append(" WHERE ").append(rendered);
        }
    }

    private static void appendSortingAndLimit(@Nullable SortOption order, int limit, StringBuilder expression) {
        if (order != null) {
            String field = order.field();
            expression.append(" ORDER BY ")
                .append(field.indexOf('(') >= 0 ? field : ConditionRenderer.quoteAttribute(field))
                .append(' ')
                .append(order.order().keyword());
        }

        if (limit != -1) {
            expression.append(" LIMIT ").append(limit);
        }
    }
}
