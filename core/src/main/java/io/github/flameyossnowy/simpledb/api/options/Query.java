package io.github.flameyossnowy.simpledb.api.options;

import io.github.flameyossnowy.simpledb.api.codec.AttributeEncoder;
import io.github.flameyossnowy.simpledb.api.exceptions.ValidationException;
import io.github.flameyossnowy.simpledb.api.predicate.AttributeField;
import io.github.flameyossnowy.simpledb.api.predicate.Condition;
import io.github.flameyossnowy.simpledb.api.predicate.ConditionRenderer;
import io.github.flameyossnowy.simpledb.api.predicate.Operator;
import io.github.flameyossnowy.simpledb.api.predicate.Quantifier;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A select over one domain, plus the static factories for queries and conditions.
 *
 * <pre>{@code
 * String expression = Query.select("users", encoder)
 *     .filter(Query.where("age__lt", 25))
 *     .values("name", "age")
 *     .orderBy("-age")
 *     .limit(10)
 *     .compile();
 * // SELECT name, age FROM `users` WHERE age < '...' ORDER BY age DESC LIMIT 10
 * }</pre>
 */
public sealed interface Query permits SelectQuery, ItemNameQuery {

    @NotNull
    String domain();

    /**
     * The select expression this query sends.
     */
    @NotNull
    String compile();

    /**
     * Number of matching items, counted by the service unless the results
     * are already loaded.
     */
    long count();

    /**
     * Number of results, loading them if needed.
     */
    int size();

    /**
     * Start building a query whose values are sent unencoded.
     * The query can be compiled but not run.
     */
    static SelectQuery select(@NotNull String domain) {
        return SelectQuery.of(domain, AttributeEncoder.identity(), null);
    }

    /**
     * Start building a query that encodes condition values with {@code encoder}.
     * The query can be compiled but not run.
     */
    static SelectQuery select(@NotNull String domain, @NotNull AttributeEncoder encoder) {
        return SelectQuery.of(domain, encoder, null);
    }

    /**
     * Groups conditions under one AND node. Each non-leaf member renders in
     * parentheses.
     */
    static Condition where(@NotNull Condition... conditions) {
        return new Condition.And(List.of(conditions));
    }

    /**
     * A single condition from an {@code attribute__operator} binding, e.g.
     * {@code where("age__gte", 18)}. A binding without an operator means
     * equality.
     *
     * @throws ValidationException for an unknown operator or a malformed value
     */
    static Condition.Leaf where(@NotNull String binding, @Nullable Object value) {
        return binding(binding, value, Quantifier.ANY);
    }

    /**
     * One condition per binding, joined with AND in the map's order.
     */
    static Condition where(@NotNull Map<String, ?> bindings) {
        return bindings(bindings, Quantifier.ANY);
    }

    /**
     * Like {@link #where(String, Object)}, but the condition must hold for
     * every value of a multi-valued attribute.
     */
    static Condition.Leaf every(@NotNull String binding, @Nullable Object value) {
        return binding(binding, value, Quantifier.EVERY);
    }

    static Condition every(@NotNull Map<String, ?> bindings) {
        return bindings(bindings, Quantifier.EVERY);
    }

    /**
     * Equality on the item name. Several names are joined with AND.
     */
    static Condition itemName(@NotNull Object... equals) {
        if (equals.length == 1) {
            return new Condition.Leaf(ConditionRenderer.ITEM_NAME, Operator.EQ, equals[0]);
        }
        List<Condition> leaves = new ArrayList<>(equals.length);
        for (Object name : equals) {
            leaves.add(new Condition.Leaf(ConditionRenderer.ITEM_NAME, Operator.EQ, name));
        }
        return new Condition.And(leaves);
    }

    /**
     * Any operator on the item name, e.g. {@code itemName(Operator.LIKE, "user-%")}.
     */
    static Condition.Leaf itemName(@NotNull Operator operator, @Nullable Object value) {
        return new Condition.Leaf(ConditionRenderer.ITEM_NAME, operator, value);
    }

    static AttributeField field(@NotNull String attribute) {
        return new AttributeField(attribute, Quantifier.ANY);
    }

    static AttributeField everyField(@NotNull String attribute) {
        return new AttributeField(attribute, Quantifier.EVERY);
    }

    private static Condition.Leaf binding(String binding, Object value, Quantifier quantifier) {
        String[] parts = binding.split("__", -1);
        if (parts.length > 2) {
            throw new ValidationException("Filter arguments should be of the form `field__operation`: " + binding);
        }
        Operator operator = parts.length == 2 ? Operator.fromBindingName(parts[1]) : Operator.EQ;
        return new Condition.Leaf(parts[0], operator, value, quantifier);
    }

    private static Condition bindings(Map<String, ?> bindings, Quantifier quantifier) {
        List<Condition> leaves = new ArrayList<>(bindings.size());
        for (Map.Entry<String, ?> entry : bindings.entrySet()) {
            leaves.add(binding(entry.getKey(), entry.getValue(), quantifier));
        }
        return new Condition.And(leaves);
    }
}
