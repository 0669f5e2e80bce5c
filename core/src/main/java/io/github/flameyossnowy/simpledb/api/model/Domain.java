package io.github.flameyossnowy.simpledb.api.model;

import io.github.flameyossnowy.simpledb.api.SimpleDBOperations;
import io.github.flameyossnowy.simpledb.api.exceptions.ItemNotFoundException;
import io.github.flameyossnowy.simpledb.api.exceptions.ValidationException;
import io.github.flameyossnowy.simpledb.api.options.ItemNameQuery;
import io.github.flameyossnowy.simpledb.api.options.SelectQuery;
import io.github.flameyossnowy.simpledb.api.predicate.Condition;
import io.github.flameyossnowy.simpledb.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A named domain bound to the operations that reach it.
 *
 * <p>Items fetched by name are kept in a local cache. The cache is best
 * effort: writes through this domain refresh it, writes made elsewhere do
 * not. Use {@link #evict(String)} or {@link #clearCache()} to force a fresh
 * read.</p>
 */
public final class Domain {
    private final String name;
    private final SimpleDBOperations operations;
    private final Map<String, Item> items = new ConcurrentHashMap<>();

    public Domain(@NotNull String name, @NotNull SimpleDBOperations operations) {
        Objects.requireNonNull(name, "Domain name cannot be null");
        Objects.requireNonNull(operations, "Operations cannot be null");
        if (name.isBlank()) throw new ValidationException("Domain name cannot be blank");
        this.name = name;
        this.operations = operations;
    }

    public String name() {
        return name;
    }

    // ==================== Queries ====================

    /**
     * Every item of this domain, as a query to refine further.
     */
    public SelectQuery query() {
        return SelectQuery.of(name, operations.encoder(), operations);
    }

    public SelectQuery filter(@NotNull Condition... conditions) {
        return query().filter(conditions);
    }

    public SelectQuery filter(@NotNull String binding, @Nullable Object value) {
        return query().filter(binding, value);
    }

    public SelectQuery filter(@NotNull Map<String, ?> bindings) {
        return query().filter(bindings);
    }

    public SelectQuery values(@NotNull String... fields) {
        return query().values(fields);
    }

    public ItemNameQuery itemNames() {
        return query().itemNames();
    }

    public long count() {
        return query().count();
    }

    /**
     * Runs a hand-written select expression.
     */
    public Iterable<Item> select(@NotNull String expression) {
        return operations.select(expression);
    }

    // ==================== Items ====================

    /**
     * The item with the given name, from the cache when present.
     *
     * @throws ItemNotFoundException when the item has no attributes
     */
    public Item get(@NotNull String itemName) {
        return find(itemName).orElseThrow(() -> new ItemNotFoundException(itemName));
    }

    public Optional<Item> find(@NotNull String itemName) {
        Item cached = items.get(itemName);
        if (cached != null) {
            return Optional.of(cached);
        }

        Item loaded = operations.getAttributes(name, itemName);
        if (loaded.isEmpty()) {
            return Optional.empty();
        }
        items.put(itemName, loaded);
        return Optional.of(loaded);
    }

    /**
     * Like {@link #get(String)}, but an absent item is returned as an empty
     * one instead of raising.
     */
    public Item getOrEmpty(@NotNull String itemName) {
        return find(itemName).orElseGet(() -> Item.empty(itemName));
    }

    /**
     * Stores {@code attributes} on the item, replacing the values of every
     * attribute named in the map. Other attributes of the item are kept; use
     * {@link #replace(String, Map)} to overwrite the whole item. The cached
     * copy is evicted so the next {@link #get(String)} reloads it.
     */
    public void put(@NotNull String itemName, @NotNull Map<String, ?> attributes) {
        items.remove(itemName);
        operations.putAttributes(name, itemName, attributes);
        Logging.deepInfo(() -> "Put item " + itemName + " in " + name);
    }

    /**
     * Deletes the item, then stores {@code attributes}. Attributes missing
     * from the map do not survive.
     */
    public void replace(@NotNull String itemName, @NotNull Map<String, ?> attributes) {
        delete(itemName);
        put(itemName, attributes);
    }

    /**
     * Deletes every attribute of the item.
     */
    public void delete(@NotNull String itemName) {
        operations.deleteAttributes(name, itemName, null);
        items.remove(itemName);
    }

    /**
     * Deletes some attributes of the item. A {@code null} value deletes
     * every value of that attribute.
     */
    public void deleteAttributes(@NotNull String itemName, @NotNull Map<String, ?> attributes) {
        operations.deleteAttributes(name, itemName, attributes);
        items.remove(itemName);
    }

    public DomainMetadata metadata() {
        return operations.domainMetadata(name);
    }

    public void evict(@NotNull String itemName) {
        items.remove(itemName);
    }

    public void clearCache() {
        items.clear();
    }

    public boolean isCached(@NotNull String itemName) {
        return items.containsKey(itemName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Domain other)) return false;
        return name.equals(other.name) && operations == other.operations;
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "Domain[" + name + "]";
    }
}
