package com.libragraph.sdc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Entry of the {@code usedSoftware} list. {@code idType} is required when {@code id} is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Software(String name, String version, String id, String idType) {

    public static Software of(String name, String version) {
        return new Software(name, version, null, null);
    }
}
