package io.github.flameyossnowy.simpledb.api.options;

import io.github.flameyossnowy.simpledb.api.model.Item;
import io.github.flameyossnowy.simpledb.api.predicate.Condition;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Iterator;
import java.util.List;

/**
 * A select projecting only {@code itemName()}. It iterates names instead of
 * items and, having a fixed projection, offers no {@code values(...)}.
 */
public final class ItemNameQuery implements Query, Iterable<String> {
    static final String ITEM_NAME_FIELD = "itemName()";

    private final SelectQuery delegate;

    ItemNameQuery(SelectQuery delegate) {
        this.delegate = delegate;
    }

    @Contract(pure = true)
    public ItemNameQuery filter(@NotNull Condition... conditions) {
        return new ItemNameQuery(delegate.filter(conditions));
    }

    @Contract(pure = true)
    public ItemNameQuery filter(@NotNull String binding, Object value) {
        return new ItemNameQuery(delegate.filter(binding, value));
    }

    @Contract(pure = true)
    public ItemNameQuery orderBy(@NotNull String field) {
        return new ItemNameQuery(delegate.orderBy(field));
    }

    @Contract(pure = true)
    public ItemNameQuery orderBy(@NotNull String field, @NotNull SortOrder direction) {
        return new ItemNameQuery(delegate.orderBy(field, direction));
    }

    @Contract(pure = true)
    public ItemNameQuery limit(int limit) {
        return new ItemNameQuery(delegate.limit(limit));
    }

    @Override
    public @NotNull String domain() {
        return delegate.domain();
    }

    @Override
    public @NotNull String compile() {
        return delegate.compile();
    }

    @Override
    public long count() {
        return delegate.count();
    }

    @Override
    public int size() {
        return delegate.size();
    }

    public String get(int index) {
        return delegate.get(index).name();
    }

    public List<String> toList() {
        return delegate.results().stream().map(Item::name).toList();
    }

    @Override
    public @NotNull Iterator<String> iterator() {
        return toList().iterator();
    }

    @Override
    public String toString() {
        return compile();
    }
}
