package io.github.flameyossnowy.simpledb.api;

import io.github.flameyossnowy.simpledb.api.codec.AttributeEncoder;
import io.github.flameyossnowy.simpledb.api.model.Domain;
import io.github.flameyossnowy.simpledb.api.model.DomainMetadata;
import io.github.flameyossnowy.simpledb.api.model.Item;
import io.github.flameyossnowy.simpledb.api.model.ItemWrite;
import io.github.flameyossnowy.simpledb.api.model.ReplaceableAttribute;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * The operations of the store that queries, domains and record layers build on.
 *
 * <p>Every call is synchronous and issues its requests one at a time. Reads
 * may not observe writes made shortly before; nothing here hides that.</p>
 */
public interface SimpleDBOperations {

    /**
     * Encoder applied to attribute values on write and to condition values in
     * compiled select expressions.
     */
    @NotNull
    AttributeEncoder encoder();

    void createDomain(@NotNull String domain);

    void deleteDomain(@NotNull String domain);

    /**
     * All domain names, fetched page by page.
     */
    List<String> listDomains();

    default boolean hasDomain(@NotNull String domain) {
        return listDomains().contains(domain);
    }

    DomainMetadata domainMetadata(@NotNull String domain);

    void putAttributes(@NotNull String domain, @NotNull String itemName, @NotNull List<ReplaceableAttribute> attributes);

    /**
     * Puts every entry, replacing the stored values. A collection value
     * stores one value per element.
     */
    default void putAttributes(@NotNull String domain, @NotNull String itemName, @NotNull Map<String, ?> attributes) {
        putAttributes(domain, itemName, ReplaceableAttribute.replacingAll(attributes));
    }

    /**
     * One batch put request. Callers with more items than the protocol allows
     * per request split them first.
     */
    void batchPutAttributes(@NotNull String domain, @NotNull List<ItemWrite> items);

    /**
     * Deletes the given attributes. A {@code null} value deletes every value
     * of that attribute; a {@code null} or empty map deletes the whole item.
     */
    void deleteAttributes(@NotNull String domain, @NotNull String itemName, @Nullable Map<String, ?> attributes);

    /**
     * Attributes of an item, optionally restricted to the given names.
     * An absent item yields an empty {@link Item}, never an error.
     */
    Item getAttributes(@NotNull String domain, @NotNull String itemName, String... attributeNames);

    /**
     * Runs a select expression. The result is lazy and re-runs the query,
     * page by page, each time it is iterated.
     */
    Iterable<Item> select(@NotNull String expression);

    default Domain domain(@NotNull String name) {
        return new Domain(name, this);
    }
}
