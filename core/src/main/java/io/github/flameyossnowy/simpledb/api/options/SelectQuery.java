package io.github.flameyossnowy.simpledb.api.options;

import io.github.flameyossnowy.simpledb.api.SimpleDBOperations;
import io.github.flameyossnowy.simpledb.api.codec.AttributeEncoder;
import io.github.flameyossnowy.simpledb.api.exceptions.DecodeException;
import io.github.flameyossnowy.simpledb.api.exceptions.ItemNotFoundException;
import io.github.flameyossnowy.simpledb.api.exceptions.ProtocolException;
import io.github.flameyossnowy.simpledb.api.exceptions.ValidationException;
import io.github.flameyossnowy.simpledb.api.model.Item;
import io.github.flameyossnowy.simpledb.api.predicate.Condition;
import io.github.flameyossnowy.simpledb.api.predicate.ValueEncoder;
import io.github.flameyossnowy.simpledb.api.utils.Logging;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable select over one domain.
 *
 * <p>Every builder method returns a new query; the receiver is never
 * modified. A query bound to a {@link SimpleDBOperations} can be evaluated by
 * iterating it, indexing it or asking its size. The first evaluation runs
 * the select and keeps the result for the lifetime of this instance, even
 * when several threads trigger it at once. Builder calls never reuse or
 * invalidate that result.</p>
 */
public final class SelectQuery implements Query, Iterable<Item> {
    static final String COUNT_ALL = "count(*)";
    static final String COUNT_ATTRIBUTE = "Count";

    private final String domain;
    private final AttributeEncoder encoder;
    @Nullable
    private final SimpleDBOperations operations;
    private final Condition where;
    private final List<String> fields;
    @Nullable
    private final SortOption order;
    private final int limit;

    private final Object evaluationLock = new Object();
    private volatile List<Item> resultCache;
    private volatile Long countCache;

    private SelectQuery(
        String domain,
        AttributeEncoder encoder,
        @Nullable SimpleDBOperations operations,
        Condition where,
        List<String> fields,
        @Nullable SortOption order,
        int limit
    ) {
        this.domain = domain;
        this.encoder = encoder;
        this.operations = operations;
        this.where = where;
        this.fields = List.copyOf(fields);
        this.order = order;
        this.limit = limit;
    }

    /**
     * An unfiltered query over {@code domain}. Without {@code operations} the
     * query can only be compiled.
     */
    public static SelectQuery of(@NotNull String domain, @NotNull AttributeEncoder encoder, @Nullable SimpleDBOperations operations) {
        Objects.requireNonNull(domain, "Domain cannot be null");
        Objects.requireNonNull(encoder, "Encoder cannot be null");
        if (domain.isBlank()) throw new ValidationException("Domain name cannot be blank");
        return new SelectQuery(domain, encoder, operations, Condition.empty(), List.of(), null, -1);
    }

    // ==================== Builders ====================

    @Contract(pure = true)
    public SelectQuery filter(@NotNull Condition... conditions) {
        return copy(where.and(Query.where(conditions)), fields, order, limit);
    }

    @Contract(pure = true)
    public SelectQuery filter(@NotNull String binding, @Nullable Object value) {
        return filter(Query.where(binding, value));
    }

    @Contract(pure = true)
    public SelectQuery filter(@NotNull Map<String, ?> bindings) {
        return filter(Query.where(bindings));
    }

    /**
     * Restricts the returned attributes. No fields means all attributes.
     */
    @Contract(pure = true)
    public SelectQuery values(@NotNull String... fields) {
        return copy(where, List.of(fields), order, limit);
    }

    /**
     * Orders by {@code field}; a leading {@code -} sorts descending.
     */
    @Contract(pure = true)
    public SelectQuery orderBy(@NotNull String field) {
        return copy(where, fields, SortOption.parse(field), limit);
    }

    @Contract(pure = true)
    public SelectQuery orderBy(@NotNull String field, @NotNull SortOrder direction) {
        return copy(where, fields, new SortOption(field, direction), limit);
    }

    @Contract(pure = true)
    public SelectQuery limit(int limit) {
        if (limit < 1) throw new ValidationException("Limit must be greater than 0: " + limit);
        return copy(where, fields, order, limit);
    }

    /**
     * A query returning only item names.
     *
     * @throws ValidationException if this query already projects values
     */
    @Contract(pure = true)
    public ItemNameQuery itemNames() {
        if (!fields.isEmpty()) {
            throw new ValidationException("Cannot combine itemNames() with values(" + String.join(", ", fields) + ")");
        }
        return new ItemNameQuery(copy(where, List.of(ItemNameQuery.ITEM_NAME_FIELD), order, limit));
    }

    private SelectQuery copy(Condition where, List<String> fields, @Nullable SortOption order, int limit) {
        return new SelectQuery(domain, encoder, operations, where, fields, order, limit);
    }

    // ==================== Accessors ====================

    @Override
    public @NotNull String domain() {
        return domain;
    }

    // ==================== Compilation ====================

    @Override
    public @NotNull String compile() {
        ValueEncoder values = (attribute, value) -> Objects.requireNonNull(
            encoder.encode(domain, attribute, value),
            () -> "Encoder returned null for " + attribute
        );
        return SelectExpressionBuilder.build(domain, fields, where, order, limit, values);
    }

    @Override
    public String toString() {
        return compile();
    }

    // ==================== Evaluation ====================

    @Override
    public @NotNull Iterator<Item> iterator() {
        return results().iterator();
    }

    public List<Item> toList() {
        return results();
    }

    @Override
    public int size() {
        return results().size();
    }

    /**
     * The result at {@code index}. When nothing is loaded yet, only the first
     * {@code index + 1} items are requested, never more than this query's own limit.
     */
    public Item get(int index) {
        if (index < 0) throw new IndexOutOfBoundsException("Negative index: " + index);
        if (limit != -1 && index >= limit) {
            throw new IndexOutOfBoundsException("Index " + index + " is outside the query limit " + limit);
        }

        List<Item> cached = resultCache;
        if (cached != null) {
            return cached.get(index);
        }
        if (index == Integer.MAX_VALUE) {
            return results().get(index);
        }
        return copy(where, fields, order, index + 1).toList().get(index);
    }

    @Override
    public long count() {
        List<Item> cached = resultCache;
        if (cached != null) {
            return cached.size();
        }
        Long counted = countCache;
        if (counted != null) {
            return counted;
        }

        synchronized (evaluationLock) {
            if (countCache == null) {
                countCache = countRows(copy(where, List.of(COUNT_ALL), order, limit).toList());
            }
            return countCache;
        }
    }

    /**
     * The item with the given name among this query's matches.
     *
     * @throws ItemNotFoundException when there is none
     */
    public Item getItem(@NotNull String itemName) {
        return findItem(itemName).orElseThrow(() -> new ItemNotFoundException(itemName));
    }

    /**
     * Existence check by item name.
     */
    public Optional<Item> findItem(@NotNull String itemName) {
        SelectQuery byName = filter(Query.itemName(itemName));
        List<Item> matches = byName.toList();
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }

    List<Item> results() {
        List<Item> cached = resultCache;
        if (cached != null) {
            return cached;
        }

        synchronized (evaluationLock) {
            if (resultCache == null) {
                SimpleDBOperations ops = requireOperations();
                String expression = compile();
                Logging.info(() -> "Running select: " + expression);

                List<Item> rows = new ArrayList<>();
                for (Item item : ops.select(expression)) {
                    rows.add(item);
                }
                resultCache = List.copyOf(rows);
            }
            return resultCache;
        }
    }

    private SimpleDBOperations requireOperations() {
        if (operations == null) {
            throw new IllegalStateException("Query over " + domain + " is not bound to a client and can only be compiled");
        }
        return operations;
    }

    /**
     * Sums the {@code Count} attribute of every row. The service answers a
     * count with a single row unless the count itself was paged.
     */
    static long countRows(List<Item> rows) {
        if (rows.isEmpty()) {
            throw new ProtocolException("Count query returned no rows");
        }
        long total = 0;
        for (Item row : rows) {
            String value = row.value(COUNT_ATTRIBUTE);
            if (value == null) {
                throw new ProtocolException("Count row '" + row.name() + "' has no " + COUNT_ATTRIBUTE + " attribute");
            }
            try {
                total += Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                throw new DecodeException("Count is not a number: '" + value + "'", value, e);
            }
        }
        return total;
    }
}
