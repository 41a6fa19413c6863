package com.libragraph.sdc.formats.registry;

import com.libragraph.sdc.formats.api.CodecException;
import com.libragraph.sdc.formats.api.ItemCodec;
import com.libragraph.sdc.formats.api.UnsupportedFormatException;
import com.libragraph.sdc.formats.codecs.BinaryCodec;
import com.libragraph.sdc.formats.codecs.JsonCodec;
import com.libragraph.sdc.formats.codecs.PngCodec;
import com.libragraph.sdc.formats.codecs.TextCodec;
import com.libragraph.sdc.util.ContentHash;
import org.jboss.logging.Logger;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Maps item file extensions to {@link ItemCodec}s, with a type-keyed table of
 * default codecs used for extensions nobody registered.
 *
 * <p>Populate at startup, read-mostly afterwards. Registrations are serialized
 * by a single writer lock and publish immutable snapshots, so lookups never lock.
 */
public class CodecRegistry {

    private static final Logger log = Logger.getLogger(CodecRegistry.class);

    /** Extension used to decode items whose extension is unknown. */
    public static final String RAW_EXTENSION = "bin";

    private final ReentrantLock writeLock = new ReentrantLock();

    private volatile Map<String, ItemCodec<?>> byExtension = Map.of();
    private volatile Map<Class<?>, ItemCodec<?>> defaults = Map.of();
    private volatile List<ItemCodec<?>> formats = List.of();

    /**
     * Creates a registry with the built-in JSON, text and binary codecs, plus
     * PNG when the runtime supports it.
     */
    public static CodecRegistry withDefaults() {
        CodecRegistry registry = new CodecRegistry();
        JsonCodec json = new JsonCodec();
        registry.register("json", json, Map.class);
        registry.register("json", json, List.class);
        registry.register("txt", new TextCodec(), String.class);
        registry.alias("log", "txt");
        registry.alias("pgm", "txt");
        registry.register(RAW_EXTENSION, new BinaryCodec(), byte[].class);

        if (PngCodec.isSupported()) {
            registry.register("png", new PngCodec(), BufferedImage.class);
        } else {
            log.debug("ImageIO not available, .png items unsupported");
        }
        return registry;
    }

    /**
     * Registers a codec for an extension, replacing any previous one.
     */
    public void register(String extension, ItemCodec<?> codec) {
        register(extension, codec, null);
    }

    /**
     * Registers a codec for an extension and, if {@code defaultFor} is given,
     * makes it the default codec for that value type (last registration wins).
     */
    public void register(String extension, ItemCodec<?> codec, Class<?> defaultFor) {
        Objects.requireNonNull(codec, "codec cannot be null");
        String key = normalize(extension);

        writeLock.lock();
        try {
            Map<String, ItemCodec<?>> extensions = new LinkedHashMap<>(byExtension);
            extensions.put(key, codec);
            byExtension = Collections.unmodifiableMap(extensions);

            if (defaultFor != null) {
                Map<Class<?>, ItemCodec<?>> types = new LinkedHashMap<>(defaults);
                types.remove(defaultFor);
                types.put(defaultFor, codec);
                defaults = Collections.unmodifiableMap(types);
            }

            if (!formats.contains(codec)) {
                List<ItemCodec<?>> all = new ArrayList<>(formats);
                all.add(codec);
                formats = List.copyOf(all);
            }
        } finally {
            writeLock.unlock();
        }
        log.debugf("Registered codec .%s -> %s", key, codec.getClass().getSimpleName());
    }

    /**
     * Registers {@code extension} as an alias of an already-known extension.
     *
     * @throws UnsupportedFormatException if {@code knownExtension} is not registered
     */
    public void alias(String extension, String knownExtension) {
        ItemCodec<?> codec = lookup(knownExtension).orElseThrow(() ->
                new UnsupportedFormatException("Cannot alias unknown extension: " + knownExtension));
        register(extension, codec);
    }

    public Optional<ItemCodec<?>> lookup(String extension) {
        return Optional.ofNullable(byExtension.get(normalize(extension)));
    }

    /**
     * Returns the default codec for a value type: exact match first, then the
     * earliest registered supertype.
     */
    public Optional<ItemCodec<?>> defaultFor(Class<?> type) {
        Map<Class<?>, ItemCodec<?>> snapshot = defaults;
        ItemCodec<?> exact = snapshot.get(type);
        if (exact != null) {
            return Optional.of(exact);
        }
        for (var entry : snapshot.entrySet()) {
            if (entry.getKey().isAssignableFrom(type)) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    public Set<String> extensions() {
        return Collections.unmodifiableSet(new TreeSet<>(byExtension.keySet()));
    }

    /**
     * Encodes a value for the given extension. For an unknown extension, the
     * type default is used, then every codec that accepts the value is tried
     * in registration order. Bytes produced for an unknown extension decode as
     * raw bytes; container items go through {@link #encodeItem} instead.
     *
     * @throws UnsupportedFormatException if no codec can encode the value
     */
    public byte[] encode(String extension, Object value) {
        Objects.requireNonNull(value, "value cannot be null");
        String key = normalize(extension);

        ItemCodec<?> known = byExtension.get(key);
        if (known != null) {
            if (!known.accepts(value)) {
                throw new UnsupportedFormatException("Codec for ." + key + " cannot encode "
                        + value.getClass().getName());
            }
            return encodeWith(known, value);
        }

        Optional<ItemCodec<?>> fallback = defaultFor(value.getClass());
        if (fallback.isPresent()) {
            return encodeWith(fallback.get(), value);
        }

        for (ItemCodec<?> codec : formats) {
            if (!codec.accepts(value)) {
                continue;
            }
            try {
                return encodeWith(codec, value);
            } catch (CodecException e) {
                log.debugf("Codec %s rejected %s: %s", codec.getClass().getSimpleName(),
                        value.getClass().getName(), e.getMessage());
            }
        }
        throw new UnsupportedFormatException("No codec for ." + key + " and value type "
                + value.getClass().getName());
    }

    /**
     * Returns the codec that stores {@code value} under {@code extension} so that
     * {@link #decode} gives back a value of the same kind. Known extensions use
     * their codec; unknown extensions only hold what the raw codec accepts.
     *
     * @throws UnsupportedFormatException if the value would not decode back
     */
    public ItemCodec<?> itemCodec(String extension, Object value) {
        Objects.requireNonNull(value, "value cannot be null");
        String key = normalize(extension);
        ItemCodec<?> codec = codecForDecode(key);
        if (!codec.accepts(value)) {
            String reason = byExtension.containsKey(key)
                    ? "Codec for ." + key + " cannot encode "
                    : "Unknown extension ." + key + " only holds raw bytes, not ";
            throw new UnsupportedFormatException(reason + value.getClass().getName());
        }
        return codec;
    }

    /**
     * Encodes a stored item with the codec that will also decode it.
     *
     * @throws UnsupportedFormatException if the value would not decode back
     */
    public byte[] encodeItem(String extension, Object value) {
        return encodeWith(itemCodec(extension, value), value);
    }

    /**
     * Decodes bytes for the given extension. Unknown extensions decode as raw bytes.
     */
    public Object decode(String extension, byte[] data) {
        return codecForDecode(extension).decode(data);
    }

    /**
     * Digest of encoded bytes, using the codec's own hash where it overrides one.
     */
    public ContentHash hash(String extension, byte[] data) {
        return codecForDecode(extension).hash(data);
    }

    private ItemCodec<?> codecForDecode(String extension) {
        String key = normalize(extension);
        ItemCodec<?> codec = byExtension.get(key);
        if (codec != null) {
            return codec;
        }
        ItemCodec<?> raw = byExtension.get(RAW_EXTENSION);
        if (raw == null) {
            throw new UnsupportedFormatException("No codec for ." + key);
        }
        log.debugf("Unknown extension .%s, treating as raw bytes", key);
        return raw;
    }

    @SuppressWarnings("unchecked")
    private static byte[] encodeWith(ItemCodec<?> codec, Object value) {
        return ((ItemCodec<Object>) codec).encode(value);
    }

    private static String normalize(String extension) {
        Objects.requireNonNull(extension, "extension cannot be null");
        String key = extension.startsWith(".") ? extension.substring(1) : extension;
        if (key.isEmpty()) {
            throw new UnsupportedFormatException("Empty extension");
        }
        return key.toLowerCase(Locale.ROOT);
    }
}
