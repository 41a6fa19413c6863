package com.libragraph.sdc.core.container;

import com.libragraph.sdc.core.hash.ContentHasher;
import com.libragraph.sdc.core.model.AttributeMapper;
import com.libragraph.sdc.core.model.AttributeValidator;
import com.libragraph.sdc.core.model.Attributes;
import com.libragraph.sdc.core.model.ContentAttributes;
import com.libragraph.sdc.core.model.MetaAttributes;
import com.libragraph.sdc.core.model.SchemaViolationException;
import com.libragraph.sdc.formats.api.UnsupportedFormatException;
import com.libragraph.sdc.formats.registry.CodecRegistry;
import com.libragraph.sdc.types.InvalidNameException;
import com.libragraph.sdc.types.ItemName;
import com.libragraph.sdc.util.Timestamps;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Scientific data container: an identifier, two attribute records and a set
 * of named payload items.
 *
 * <p>Built from an item payload, a container starts {@link ContainerState#MUTABLE};
 * loaded from an archive or a remote store it starts {@link ContainerState#IMMUTABLE}.
 * Serializing, hashing, freezing or uploading seals it; {@link #release()} forks a
 * mutable copy under a new identifier.
 *
 * <p>Not thread-safe. Use one instance per task.
 */
public final class DataContainer {

    private static final Logger log = Logger.getLogger(DataContainer.class);

    private final CodecRegistry registry;
    private final AttributeValidator validator;
    private final Lifecycle lifecycle;
    private ItemMap items;
    private ContentAttributes content;
    private MetaAttributes meta;

    private DataContainer(CodecRegistry registry, AttributeValidator validator,
                          ContainerState initial, ItemMap items, Attributes attributes) {
        this.registry = registry;
        this.validator = validator;
        this.lifecycle = new Lifecycle(initial);
        this.items = items;
        this.content = attributes.content();
        this.meta = attributes.meta();
    }

    /**
     * Builds a mutable container from an item payload. The payload must contain
     * {@code content.json} and {@code meta.json}, as JSON maps or attribute
     * records; every other key is a qualified item name.
     *
     * @throws SchemaViolationException if the attributes are invalid
     * @throws InvalidNameException     if an item name is malformed
     */
    public static DataContainer create(Map<String, ?> payload, CodecRegistry registry,
                                       AttributeValidator validator) {
        Objects.requireNonNull(payload, "payload cannot be null");
        ContentAttributes content = AttributeMapper.content(payload.get(ItemName.CONTENT.toString()));
        MetaAttributes meta = AttributeMapper.meta(payload.get(ItemName.META.toString()));
        Attributes attributes = validator.validate(content, meta);

        ItemMap items = new ItemMap(registry);
        for (var entry : payload.entrySet()) {
            ItemName name = ItemName.parse(entry.getKey());
            if (name.isReserved()) {
                continue;
            }
            items.put(name, Objects.requireNonNull(entry.getValue(), "value of " + name));
        }
        DataContainer container = new DataContainer(registry, validator,
                ContainerState.MUTABLE, items, attributes);
        log.debugf("Created container %s with %d items", container.uuid(), items.size());
        return container;
    }

    /**
     * Rebuilds an immutable container from stored attributes and encoded items.
     */
    public static DataContainer restore(ContentAttributes content, MetaAttributes meta,
                                        Map<ItemName, byte[]> encoded, CodecRegistry registry,
                                        AttributeValidator validator) {
        Attributes attributes = validator.validate(content, meta);
        return new DataContainer(registry, validator, ContainerState.IMMUTABLE,
                ItemMap.ofEncoded(registry, encoded), attributes);
    }

    // -- attributes --

    public String uuid() {
        return content.uuid();
    }

    public ContentAttributes content() {
        return content;
    }

    public MetaAttributes meta() {
        return meta;
    }

    public Instant modified() {
        return content.modified();
    }

    public boolean isStatic() {
        return content.staticFlag();
    }

    public ContainerState state() {
        return lifecycle.state();
    }

    public boolean isMutable() {
        return lifecycle.isMutable();
    }

    public CodecRegistry registry() {
        return registry;
    }

    /**
     * Applies an edit to the container descriptor. The identifier, the static
     * flag and the hash are managed by the container and cannot be edited.
     *
     * @throws ImmutableContainerException unless mutable
     * @throws SchemaViolationException    if the result is invalid
     */
    public void editContent(UnaryOperator<ContentAttributes> edit) {
        lifecycle.requireMutable(uuid(), "edit content");
        ContentAttributes edited = edit.apply(content);
        if (!Objects.equals(edited.uuid(), content.uuid())) {
            throw new SchemaViolationException("uuid can only change through release()");
        }
        if (edited.staticFlag() != content.staticFlag() || !Objects.equals(edited.hash(), content.hash())) {
            throw new SchemaViolationException("static and hash can only change through freeze()");
        }
        content = validator.validate(edited, meta).content();
        touch();
    }

    /**
     * Applies an edit to the dataset metadata.
     *
     * @throws ImmutableContainerException unless mutable
     * @throws SchemaViolationException    if the result is invalid
     */
    public void editMeta(UnaryOperator<MetaAttributes> edit) {
        lifecycle.requireMutable(uuid(), "edit meta");
        meta = validator.validate(content, edit.apply(meta)).meta();
        touch();
    }

    // -- items --

    /**
     * Returns the value of an item. Reserved names return the attribute record as a map.
     *
     * @throws ItemNotFoundException if there is no such item
     */
    public Object get(String name) {
        ItemName itemName = ItemName.parse(name);
        if (itemName.equals(ItemName.CONTENT)) {
            return AttributeMapper.toMap(content);
        }
        if (itemName.equals(ItemName.META)) {
            return AttributeMapper.toMap(meta);
        }
        Object value = items.get(itemName);
        if (value == null) {
            throw new ItemNotFoundException(name);
        }
        return value;
    }

    public <T> T get(String name, Class<T> type) {
        return type.cast(get(name));
    }

    public Optional<Object> find(String name) {
        ItemName itemName = ItemName.parse(name);
        return contains(itemName) ? Optional.of(get(name)) : Optional.empty();
    }

    public boolean contains(String name) {
        return contains(ItemName.parse(name));
    }

    private boolean contains(ItemName name) {
        return name.isReserved() || items.contains(name);
    }

    /**
     * Sets an item. The value is encoded when the container is sealed.
     *
     * @throws ImmutableContainerException unless mutable
     * @throws InvalidNameException        for malformed or reserved names
     * @throws UnsupportedFormatException  if the value would not read back under its extension
     */
    public void set(String name, Object value) {
        ItemName itemName = ItemName.parse(name);
        lifecycle.requireMutable(uuid(), "set " + name);
        if (itemName.isReserved()) {
            throw new InvalidNameException(name, "reserved for container attributes");
        }
        items.put(itemName, Objects.requireNonNull(value, "value cannot be null"));
        touch();
    }

    /**
     * Removes an item.
     *
     * @throws ImmutableContainerException unless mutable
     * @throws InvalidNameException        for malformed or reserved names
     * @throws ItemNotFoundException       if there is no such item
     */
    public void delete(String name) {
        ItemName itemName = ItemName.parse(name);
        lifecycle.requireMutable(uuid(), "delete " + name);
        if (itemName.isReserved()) {
            throw new InvalidNameException(name, "reserved for container attributes");
        }
        if (!items.remove(itemName)) {
            throw new ItemNotFoundException(name);
        }
        touch();
    }

    /**
     * All qualified names including the reserved ones, sorted by part then name.
     */
    public List<String> names() {
        List<String> names = new ArrayList<>();
        for (ItemName name : itemNames()) {
            names.add(name.toString());
        }
        return names;
    }

    /**
     * Same as {@link #names()}, as parsed names.
     */
    public List<ItemName> itemNames() {
        var all = items.names();
        all.add(ItemName.CONTENT);
        all.add(ItemName.META);
        return new ArrayList<>(all);
    }

    /**
     * Snapshot of every item by name. Usable as payload for {@link #create}.
     */
    public Map<String, Object> items() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        for (ItemName name : itemNames()) {
            snapshot.put(name.toString(), get(name.toString()));
        }
        return snapshot;
    }

    /**
     * Encoded bytes of a sealed item; reserved names are not included.
     *
     * @throws IllegalStateException while the container is mutable
     * @throws ItemNotFoundException if there is no such item
     */
    public byte[] encoded(ItemName name) {
        byte[] bytes = items.encoded(name);
        if (bytes == null) {
            throw new ItemNotFoundException(name.toString());
        }
        return bytes;
    }

    // -- lifecycle --

    /**
     * Encodes all items and makes the container immutable. No-op if already immutable.
     */
    public void seal() {
        items.seal();
        if (lifecycle.seal()) {
            log.debugf("Container %s sealed", uuid());
        }
    }

    /**
     * Computes the content hash. Seals the container; for a non-static
     * container the digest is also stored in {@code content.hash}.
     *
     * @return lowercase hex SHA-256 digest
     */
    public String hash() {
        seal();
        String digest = new ContentHasher(registry).hash(this).toHex();
        if (!content.staticFlag()) {
            content = content.withHash(digest);
        }
        return digest;
    }

    /**
     * Recomputes the digest and compares it with the stored hash.
     */
    public boolean verifyHash() {
        seal();
        String stored = content.hash();
        return stored != null && stored.equals(new ContentHasher(registry).hash(this).toHex());
    }

    /**
     * Marks the container static: stores the content hash and makes it permanently immutable.
     * Sealed or loaded containers can be frozen too.
     *
     * @throws AlreadyStaticException if already static
     */
    public void freeze() {
        if (content.staticFlag()) {
            throw new AlreadyStaticException(uuid());
        }
        seal();
        String digest = new ContentHasher(registry).hash(this).toHex();
        content = content.withStatic(true, digest);
        log.debugf("Container %s frozen with hash %s", uuid(), digest);
    }

    /**
     * Forks a mutable container lineage from the current content: new uuid,
     * and cleared replaces, timestamps, hash, model version and static flag.
     * Items are decoded into fresh values that share nothing with the sealed state.
     */
    public void release() {
        String previous = uuid();
        items.unseal();
        ContentAttributes cleared = content
                .withUuid(null)
                .withReplaces(null)
                .withTimestamps(null, null)
                .withStatic(false, null)
                .withModelVersion(null)
                .withStorageTime(null);
        content = validator.validate(cleared, meta).content();
        lifecycle.release();
        log.debugf("Container %s released as %s", previous, uuid());
    }

    /**
     * Replaces this container's entire state with another container's,
     * e.g. the state accepted by a remote store.
     */
    public void adopt(DataContainer other) {
        other.seal();
        this.items = other.items.sealedCopy();
        this.content = other.content;
        this.meta = other.meta;
        lifecycle.seal();
    }

    /**
     * Returns a sealed copy carrying the given storage time.
     */
    public DataContainer withStorageTime(Instant storageTime) {
        seal();
        return new DataContainer(registry, validator, ContainerState.IMMUTABLE, items.sealedCopy(),
                new Attributes(content.withStorageTime(Timestamps.truncate(storageTime)), meta));
    }

    private void touch() {
        content = content.withModified(Timestamps.advance(content.modified()));
    }

    @Override
    public String toString() {
        return "DataContainer[uuid=" + uuid()
                + ", type=" + content.containerType().name()
                + ", items=" + items.size()
                + ", state=" + lifecycle.state()
                + (content.staticFlag() ? ", static" : "")
                + "]";
    }
}
