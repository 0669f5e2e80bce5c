package io.github.flameyossnowy.simpledb.api.predicate;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.List;

/**
 * Attribute-scoped operator builder.
 *
 * <p>Ties every operator to a concrete attribute, so a malformed leaf cannot
 * be constructed:</p>
 *
 * <pre>{@code
 * Query.field("age").gte(18)
 *     .and(Query.field("name").like("A%"))
 *     .and(Query.everyField("tags").in(List.of("red", "blue")))
 * }</pre>
 */
@SuppressWarnings("unused")
public final class AttributeField {
    private final String attribute;
    private final Quantifier quantifier;

    @Contract(pure = true)
    public AttributeField(@NotNull String attribute, @NotNull Quantifier quantifier) {
        this.attribute = attribute;
        this.quantifier = quantifier;
    }

    private Condition.Leaf leaf(Operator operator, Object value) {
        return new Condition.Leaf(attribute, operator, value, quantifier);
    }

    public Condition.Leaf eq(Object value) { return leaf(Operator.EQ, value); }
    public Condition.Leaf ne(Object value) { return leaf(Operator.NOT_EQ, value); }
    public Condition.Leaf gt(Object value) { return leaf(Operator.GT, value); }
    public Condition.Leaf gte(Object value) { return leaf(Operator.GTE, value); }
    public Condition.Leaf lt(Object value) { return leaf(Operator.LT, value); }
    public Condition.Leaf lte(Object value) { return leaf(Operator.LTE, value); }
    public Condition.Leaf like(String pattern) { return leaf(Operator.LIKE, pattern); }
    public Condition.Leaf notLike(String pattern) { return leaf(Operator.NOT_LIKE, pattern); }
    public Condition.Leaf isNull() { return leaf(Operator.EQ, null); }
    public Condition.Leaf isNotNull() { return leaf(Operator.NOT_EQ, null); }
    public Condition.Leaf between(Object low, Object high) { return leaf(Operator.BETWEEN, List.of(low, high)); }
    public Condition.Leaf in(Collection<?> values) { return leaf(Operator.IN, values); }
    public Condition.Leaf in(Object... values) { return leaf(Operator.IN, values); }
}
