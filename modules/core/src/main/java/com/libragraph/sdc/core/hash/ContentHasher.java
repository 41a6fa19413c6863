package com.libragraph.sdc.core.hash;

import com.libragraph.sdc.core.container.DataContainer;
import com.libragraph.sdc.core.model.AttributeMapper;
import com.libragraph.sdc.formats.registry.CodecRegistry;
import com.libragraph.sdc.types.ItemName;
import com.libragraph.sdc.util.ContentHash;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic SHA-256 digest over a container's full content.
 *
 * <p>Items are visited in qualified-name order. For each one the digest is
 * fed the UTF-8 name, a zero byte, the length of the item digest and the
 * item digest itself, where the item digest is the codec's {@code hash} of
 * the encoded bytes.
 *
 * <p>Bookkeeping attributes are left out so that identical payloads always
 * hash the same: identity, lineage, timestamps, lifecycle flags and the
 * hash itself from {@code content.json}, and {@code created} from
 * {@code meta.json}.
 */
public class ContentHasher {

    static final Set<String> EXCLUDED_CONTENT = Set.of(
            "uuid", "replaces", "created", "modified", "storageTime",
            "static", "complete", "hash", "modelVersion");
    static final Set<String> EXCLUDED_META = Set.of("created");

    private static final String JSON = "json";

    private final CodecRegistry registry;

    public ContentHasher(CodecRegistry registry) {
        this.registry = registry;
    }

    /**
     * @throws IllegalStateException if the container is not sealed
     */
    public ContentHash hash(DataContainer container) {
        MessageDigest md = ContentHash.newDigest();
        for (ItemName name : container.itemNames()) {
            ContentHash itemHash = itemHash(container, name);
            byte[] digest = itemHash.bytes();
            md.update(name.toString().getBytes(StandardCharsets.UTF_8));
            md.update((byte) 0);
            md.update(ByteBuffer.allocate(Integer.BYTES).putInt(digest.length).array());
            md.update(digest);
        }
        return new ContentHash(md.digest());
    }

    private ContentHash itemHash(DataContainer container, ItemName name) {
        if (name.equals(ItemName.CONTENT)) {
            return attributeHash(AttributeMapper.toMap(container.content()), EXCLUDED_CONTENT);
        }
        if (name.equals(ItemName.META)) {
            return attributeHash(AttributeMapper.toMap(container.meta()), EXCLUDED_META);
        }
        return registry.hash(name.extension(), container.encoded(name));
    }

    private ContentHash attributeHash(Map<String, Object> attributes, Set<String> excluded) {
        attributes.keySet().removeAll(excluded);
        return registry.hash(JSON, registry.encode(JSON, attributes));
    }
}
