package com.libragraph.sdc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Container descriptor, stored as {@code content.json} in the archive root.
 *
 * <p>Nullable fields mean "absent"; {@link AttributeValidator} fills the
 * automatic ones. After validation only {@code replaces}, {@code hash} and
 * {@code storageTime} may still be null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContentAttributes(
        String uuid,
        String replaces,
        ContainerType containerType,
        Instant created,
        Instant modified,
        @JsonProperty("static") Boolean staticContainer,
        Boolean complete,
        String hash,
        List<Software> usedSoftware,
        String modelVersion,
        Instant storageTime
) {
    public ContentAttributes {
        usedSoftware = usedSoftware == null ? null : List.copyOf(usedSoftware);
    }

    /** Minimal descriptor; everything else is defaulted on validation. */
    public static ContentAttributes of(ContainerType containerType) {
        return new ContentAttributes(null, null, containerType, null, null,
                null, null, null, null, null, null);
    }

    public boolean staticFlag() {
        return Boolean.TRUE.equals(staticContainer);
    }

    public boolean completeFlag() {
        return Boolean.TRUE.equals(complete);
    }

    public ContentAttributes withUuid(String uuid) {
        return new ContentAttributes(uuid, replaces, containerType, created, modified,
                staticContainer, complete, hash, usedSoftware, modelVersion, storageTime);
    }

    public ContentAttributes withReplaces(String replaces) {
        return new ContentAttributes(uuid, replaces, containerType, created, modified,
                staticContainer, complete, hash, usedSoftware, modelVersion, storageTime);
    }

    public ContentAttributes withContainerType(ContainerType containerType) {
        return new ContentAttributes(uuid, replaces, containerType, created, modified,
                staticContainer, complete, hash, usedSoftware, modelVersion, storageTime);
    }

    public ContentAttributes withTimestamps(Instant created, Instant modified) {
        return new ContentAttributes(uuid, replaces, containerType, created, modified,
                staticContainer, complete, hash, usedSoftware, modelVersion, storageTime);
    }

    public ContentAttributes withModified(Instant modified) {
        return withTimestamps(created, modified);
    }

    public ContentAttributes withStatic(boolean staticContainer, String hash) {
        return new ContentAttributes(uuid, replaces, containerType, created, modified,
                staticContainer, complete, hash, usedSoftware, modelVersion, storageTime);
    }

    public ContentAttributes withHash(String hash) {
        return withStatic(staticFlag(), hash);
    }

    public ContentAttributes withComplete(boolean complete) {
        return new ContentAttributes(uuid, replaces, containerType, created, modified,
                staticContainer, complete, hash, usedSoftware, modelVersion, storageTime);
    }

    public ContentAttributes withUsedSoftware(List<Software> usedSoftware) {
        return new ContentAttributes(uuid, replaces, containerType, created, modified,
                staticContainer, complete, hash, usedSoftware, modelVersion, storageTime);
    }

    public ContentAttributes withModelVersion(String modelVersion) {
        return new ContentAttributes(uuid, replaces, containerType, created, modified,
                staticContainer, complete, hash, usedSoftware, modelVersion, storageTime);
    }

    public ContentAttributes withStorageTime(Instant storageTime) {
        return new ContentAttributes(uuid, replaces, containerType, created, modified,
                staticContainer, complete, hash, usedSoftware, modelVersion, storageTime);
    }
}
