package me.christianrobert.nativebind.declaration.metadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable bag of {@link DeclarationMetadataItem}s keyed by item class.
 *
 * <p>Lookups are exact class matches. {@link #add} and {@link #remove} return a new bag and leave
 * this one untouched.</p>
 */
public final class DeclarationMetadata {

    public static final DeclarationMetadata EMPTY = new DeclarationMetadata(Collections.emptyMap());

    private final Map<Class<? extends DeclarationMetadataItem>, DeclarationMetadataItem> items;

    private DeclarationMetadata(Map<Class<? extends DeclarationMetadataItem>, DeclarationMetadataItem> items) {
        this.items = items;
    }

    public boolean has(Class<? extends DeclarationMetadataItem> key) {
        return items.containsKey(key);
    }

    /**
     * Gets the item stored under the given class.
     *
     * @return the item, or null when absent
     */
    public <T extends DeclarationMetadataItem> T get(Class<T> key) {
        return key.cast(items.get(key));
    }

    public DeclarationMetadata add(DeclarationMetadataItem item) {
        if (item == null) {
            throw new IllegalArgumentException("Metadata item cannot be null");
        }
        Map<Class<? extends DeclarationMetadataItem>, DeclarationMetadataItem> copy = new LinkedHashMap<>(items);
        copy.put(item.getClass(), item);
        return new DeclarationMetadata(Collections.unmodifiableMap(copy));
    }

    public DeclarationMetadata remove(Class<? extends DeclarationMetadataItem> key) {
        if (!items.containsKey(key)) {
            return this;
        }
        Map<Class<? extends DeclarationMetadataItem>, DeclarationMetadataItem> copy = new LinkedHashMap<>(items);
        copy.remove(key);
        return copy.isEmpty() ? EMPTY : new DeclarationMetadata(Collections.unmodifiableMap(copy));
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    @Override
    public String toString() {
        return "DeclarationMetadata" + items.values();
    }
}
