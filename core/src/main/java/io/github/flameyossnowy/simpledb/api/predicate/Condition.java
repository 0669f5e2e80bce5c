package io.github.flameyossnowy.simpledb.api.predicate;

import io.github.flameyossnowy.simpledb.api.exceptions.ValidationException;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Boolean expression over attribute conditions.
 *
 * <p>A tree is either a {@link Leaf} or a connector node ({@link And},
 * {@link Or}) owning an ordered list of children. Trees are immutable;
 * {@link #and(Condition)} and {@link #or(Condition)} return new trees and
 * keep the parenthesization minimal:</p>
 *
 * <ul>
 *   <li>combining with the receiver's own connector appends to its children,
 *   flattening the other tree when it uses the same connector or holds at
 *   most one child;</li>
 *   <li>a receiver with fewer than two children takes on the requested
 *   connector;</li>
 *   <li>otherwise a new root owning both trees is created.</li>
 * </ul>
 *
 * <pre>{@code
 * where("a", 1).and(where("b", 2)).or(where("c", 3)).toExpression(plain())
 * // (a = '1' AND b = '2') OR c = '3'
 * }</pre>
 */
public sealed interface Condition permits Condition.Leaf, Condition.Compound {

    /**
     * Number of direct children; a leaf counts as one.
     */
    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Renders the tree. Returns an empty string for an empty tree.
     */
    @NotNull
    String toExpression(@NotNull ValueEncoder encoder);

    @Contract(pure = true)
    default Condition and(@NotNull Condition other) {
        return combine(this, other, Connector.AND);
    }

    @Contract(pure = true)
    default Condition or(@NotNull Condition other) {
        return combine(this, other, Connector.OR);
    }

    static Condition empty() {
        return And.EMPTY;
    }

    enum Connector {
        AND,
        OR
    }

    private static Condition combine(Condition self, Condition other, Connector connector) {
        Objects.requireNonNull(other, "Cannot combine with a null condition");

        List<Condition> children = self instanceof Compound compound ? compound.children() : List.of(self);
        Connector current = self instanceof Compound compound ? compound.connector() : Connector.AND;

        if (other instanceof Compound && current == connector && children.contains(other)) {
            return self;
        }
        if (children.size() < 2) {
            current = connector;
        }
        if (current != connector) {
            return Compound.of(connector, List.of(self, other));
        }

        List<Condition> merged = new ArrayList<>(children.size() + other.size());
        merged.addAll(children);
        if (other instanceof Compound compound) {
            if (compound.connector() == connector || compound.size() <= 1) {
                merged.addAll(compound.children());
            } else {
                merged.add(other);
            }
        } else {
            merged.add(other);
        }
        return Compound.of(connector, merged);
    }

    /**
     * A single comparison.
     *
     * <p>{@code between} values are normalized to a two-element list and
     * {@code in} values to a non-empty list; any other shape is rejected here,
     * before a query can be sent.</p>
     */
    record Leaf(
        @NotNull String attribute,
        @NotNull Operator operator,
        @Nullable Object value,
        @NotNull Quantifier quantifier
    ) implements Condition {

        public Leaf {
            Objects.requireNonNull(attribute, "Attribute cannot be null");
            Objects.requireNonNull(operator, "Operator cannot be null");
            Objects.requireNonNull(quantifier, "Quantifier cannot be null");
            if (attribute.isBlank()) {
                throw new ValidationException("Attribute name cannot be blank");
            }

            switch (operator) {
                case BETWEEN -> {
                    List<Object> range = toList(value);
                    if (range == null || range.size() != 2) {
                        throw new ValidationException(
                            "Invalid value `" + describe(value) + "` for between clause. Requires two item list."
                        );
                    }
                    value = range;
                }
                case IN -> {
                    List<Object> options = toList(value);
                    if (options == null || options.isEmpty()) {
                        throw new ValidationException(
                            "Invalid value `" + describe(value) + "` for in clause. Requires a non-empty collection."
                        );
                    }
                    value = options;
                }
                case EQ, NOT_EQ -> {
                    // null renders as IS NULL / IS NOT NULL
                }
                default -> {
                    if (value == null) {
                        throw new ValidationException("Operator " + operator.bindingName() + " on " + attribute + " requires a value");
                    }
                }
            }
        }

        public Leaf(@NotNull String attribute, @NotNull Operator operator, @Nullable Object value) {
            this(attribute, operator, value, Quantifier.ANY);
        }

        @Override
        public int size() {
            return 1;
        }

        @Override
        public @NotNull String toExpression(@NotNull ValueEncoder encoder) {
            return ConditionRenderer.render(this, encoder);
        }

        @Nullable
        private static List<Object> toList(@Nullable Object value) {
            if (value instanceof Collection<?> collection) {
                List<Object> list = new ArrayList<>(collection.size());
                for (Object each : collection) {
                    list.add(Objects.requireNonNull(each, "Null element in condition values"));
                }
                return List.copyOf(list);
            }
            if (value != null && value.getClass().isArray()) {
                int length = Array.getLength(value);
                List<Object> list = new ArrayList<>(length);
                for (int i = 0; i < length; i++) {
                    list.add(Objects.requireNonNull(Array.get(value, i), "Null element in condition values"));
                }
                return List.copyOf(list);
            }
            return null;
        }

        private static String describe(@Nullable Object value) {
            if (value != null && value.getClass().isArray()) {
                List<Object> list = toList(value);
                return String.valueOf(list);
            }
            return String.valueOf(value);
        }
    }

    /**
     * A connector node.
     */
    sealed interface Compound extends Condition permits And, Or {
        @NotNull
        Connector connector();

        @NotNull
        List<Condition> children();

        @Override
        default int size() {
            return children().size();
        }

        @Override
        default @NotNull String toExpression(@NotNull ValueEncoder encoder) {
            StringJoiner joiner = new StringJoiner(" " + connector().name() + " ");
            for (Condition child : children()) {
                if (child instanceof Leaf) {
                    joiner.add(child.toExpression(encoder));
                    continue;
                }
                String nested = child.toExpression(encoder);
                if (!nested.isEmpty()) {
                    joiner.add("(" + nested + ")");
                }
            }
            return joiner.toString();
        }

        static Compound of(Connector connector, List<Condition> children) {
            return connector == Connector.AND ? new And(children) : new Or(children);
        }
    }

    record And(@NotNull List<Condition> children) implements Compound {
        static final And EMPTY = new And(List.of());

        public And {
            children = List.copyOf(children);
        }

        @Override
        public @NotNull Connector connector() {
            return Connector.AND;
        }
    }

    record Or(@NotNull List<Condition> children) implements Compound {
        public Or {
            children = List.copyOf(children);
        }

        @Override
        public @NotNull Connector connector() {
            return Connector.OR;
        }
    }
}
