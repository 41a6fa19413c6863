package com.libragraph.sdc.core.model;

import com.libragraph.sdc.util.Timestamps;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Validates the two attribute records and fills automatic fields.
 *
 * <p>Runs identically for newly built, file-loaded and server-loaded
 * containers. Validating an already valid pair returns it unchanged.
 */
public class AttributeValidator {

    /** Schema version stamped into {@code content.json}. */
    public static final String MODEL_VERSION = "1.0.0";

    private static final Pattern UUID_PATTERN = Pattern.compile(
            "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");
    private static final Pattern HASH_PATTERN = Pattern.compile("[0-9a-f]{64}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s");

    private final IdentityDefaults defaults;

    public AttributeValidator(IdentityDefaults defaults) {
        this.defaults = Objects.requireNonNull(defaults, "defaults cannot be null");
    }

    public IdentityDefaults defaults() {
        return defaults;
    }

    /**
     * @throws SchemaViolationException if a required field is missing and has no default,
     *                                  or fields are inconsistent
     */
    public Attributes validate(ContentAttributes content, MetaAttributes meta) {
        if (content == null) {
            throw new SchemaViolationException("Missing required content.json");
        }
        if (meta == null) {
            throw new SchemaViolationException("Missing required meta.json");
        }
        return new Attributes(validateContent(content), validateMeta(meta));
    }

    private ContentAttributes validateContent(ContentAttributes content) {
        String uuid = content.uuid() != null ? content.uuid() : UUID.randomUUID().toString();
        requireUuid("uuid", uuid);
        if (content.replaces() != null) {
            requireUuid("replaces", content.replaces());
        }

        ContainerType type = content.containerType();
        if (type == null) {
            throw new SchemaViolationException("Missing required content.containerType");
        }
        requireText("containerType.name", type.name());
        if (WHITESPACE.matcher(type.name()).find()) {
            throw new SchemaViolationException("containerType.name must not contain whitespace: '"
                    + type.name() + "'");
        }
        if (type.id() != null && isBlank(type.version())) {
            throw new SchemaViolationException("containerType.version is required when id is set");
        }

        Instant now = Timestamps.now();
        Instant created = content.created() != null ? Timestamps.truncate(content.created()) : now;
        Instant modified = content.modified() != null ? Timestamps.truncate(content.modified()) : now;

        boolean isStatic = content.staticFlag();
        boolean complete = content.complete() == null || content.complete();
        String hash = content.hash();
        if (hash != null && !HASH_PATTERN.matcher(hash).matches()) {
            throw new SchemaViolationException("hash must be 64 lowercase hex characters: " + hash);
        }
        if (isStatic && hash == null) {
            throw new SchemaViolationException("A static container requires a hash");
        }

        List<Software> software = content.usedSoftware() == null
                ? List.of() : content.usedSoftware();
        for (int i = 0; i < software.size(); i++) {
            validateSoftware(i, software.get(i));
        }

        String modelVersion = content.modelVersion() != null ? content.modelVersion() : MODEL_VERSION;

        return new ContentAttributes(uuid, content.replaces(), type, created, modified,
                isStatic, complete, hash, software, modelVersion,
                Timestamps.truncate(content.storageTime()));
    }

    private void validateSoftware(int index, Software software) {
        String prefix = "usedSoftware[" + index + "]";
        if (software == null) {
            throw new SchemaViolationException(prefix + " must not be null");
        }
        requireText(prefix + ".name", software.name());
        requireText(prefix + ".version", software.version());
        if (software.id() != null && isBlank(software.idType())) {
            throw new SchemaViolationException(prefix + ".idType is required when id is set");
        }
    }

    private MetaAttributes validateMeta(MetaAttributes meta) {
        String author = meta.author() != null ? meta.author() : defaults.author().orElse(null);
        String email = meta.email() != null ? meta.email() : defaults.email().orElse(null);
        requireText("meta.author", author);
        requireText("meta.email", email);
        requireText("meta.title", meta.title());

        List<String> keywords = meta.keywords() == null ? List.of() : meta.keywords();

        return new MetaAttributes(author, email, meta.organization(), meta.comment(), meta.title(),
                keywords, meta.description(), meta.created(), meta.doi(), meta.license());
    }

    private static void requireUuid(String field, String value) {
        if (!UUID_PATTERN.matcher(value).matches()) {
            throw new SchemaViolationException(field + " is not a well-formed identifier: " + value);
        }
    }

    private static void requireText(String field, String value) {
        if (isBlank(value)) {
            throw new SchemaViolationException("Missing required " + field);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
