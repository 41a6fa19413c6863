package com.libragraph.sdc.core.container;

import com.libragraph.sdc.formats.registry.CodecRegistry;
import com.libragraph.sdc.types.ItemName;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Payload items keyed by qualified name, excluding the two reserved attribute records.
 *
 * <p>While mutable, values are held as given and encoded lazily. Sealing
 * encodes every value once; from then on each read decodes a fresh copy
 * from the sealed bytes, so sealed content cannot be altered through a
 * returned object.
 */
final class ItemMap {

    private final CodecRegistry registry;
    private final Map<ItemName, Object> values = new HashMap<>();
    private Map<ItemName, byte[]> sealed;

    ItemMap(CodecRegistry registry) {
        this.registry = registry;
    }

    static ItemMap ofEncoded(CodecRegistry registry, Map<ItemName, byte[]> encoded) {
        ItemMap items = new ItemMap(registry);
        Map<ItemName, byte[]> copy = new TreeMap<>();
        encoded.forEach((name, bytes) -> copy.put(name, Arrays.copyOf(bytes, bytes.length)));
        items.sealed = Collections.unmodifiableMap(copy);
        return items;
    }

    boolean isSealed() {
        return sealed != null;
    }

    Object get(ItemName name) {
        if (sealed != null) {
            byte[] bytes = sealed.get(name);
            return bytes == null ? null : registry.decode(name.extension(), bytes);
        }
        return values.get(name);
    }

    boolean contains(ItemName name) {
        return sealed != null ? sealed.containsKey(name) : values.containsKey(name);
    }

    /**
     * Stores a value unencoded after checking a codec can store and read it back.
     */
    void put(ItemName name, Object value) {
        registry.itemCodec(name.extension(), value);
        values.put(name, value);
    }

    boolean remove(ItemName name) {
        return values.remove(name) != null;
    }

    SortedSet<ItemName> names() {
        return new TreeSet<>(sealed != null ? sealed.keySet() : values.keySet());
    }

    int size() {
        return sealed != null ? sealed.size() : values.size();
    }

    /**
     * Encodes all values. Nothing changes if any value fails to encode.
     */
    void seal() {
        if (sealed != null) {
            return;
        }
        Map<ItemName, byte[]> encoded = new TreeMap<>();
        for (var entry : values.entrySet()) {
            ItemName name = entry.getKey();
            encoded.put(name, registry.encodeItem(name.extension(), entry.getValue()));
        }
        sealed = Collections.unmodifiableMap(encoded);
        values.clear();
    }

    /**
     * Decodes every sealed item into a fresh, independent value.
     */
    void unseal() {
        if (sealed == null) {
            return;
        }
        for (var entry : sealed.entrySet()) {
            ItemName name = entry.getKey();
            values.put(name, registry.decode(name.extension(), entry.getValue()));
        }
        sealed = null;
    }

    /** Copy of the sealed bytes, or null if absent. */
    byte[] encoded(ItemName name) {
        if (sealed == null) {
            throw new IllegalStateException("Items are not sealed");
        }
        byte[] bytes = sealed.get(name);
        return bytes == null ? null : Arrays.copyOf(bytes, bytes.length);
    }

    /** Shares the sealed map; its byte arrays are never handed out directly. */
    ItemMap sealedCopy() {
        if (sealed == null) {
            throw new IllegalStateException("Items are not sealed");
        }
        ItemMap copy = new ItemMap(registry);
        copy.sealed = sealed;
        return copy;
    }
}
