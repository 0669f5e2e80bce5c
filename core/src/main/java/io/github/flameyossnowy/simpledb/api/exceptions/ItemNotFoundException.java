package io.github.flameyossnowy.simpledb.api.exceptions;

/**
 * Raised only by lookups keyed on an item name. Attribute fetches return an
 * empty item instead, since an empty answer may just be replication lag.
 */
public class ItemNotFoundException extends SimpleDBException {
    private final String itemName;

    public ItemNotFoundException(String itemName) {
        super("Item does not exist: " + itemName);
        this.itemName = itemName;
    }

    public String getItemName() {
        return itemName;
    }
}
