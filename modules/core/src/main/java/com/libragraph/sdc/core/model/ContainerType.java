package com.libragraph.sdc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Kind of dataset a container holds. {@code version} is required when {@code id} is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContainerType(String name, String id, String version) {

    public static ContainerType named(String name) {
        return new ContainerType(name, null, null);
    }
}
