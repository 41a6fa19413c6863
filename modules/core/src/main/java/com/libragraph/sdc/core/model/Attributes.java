package com.libragraph.sdc.core.model;

/**
 * The two mandatory attribute records of a container, after validation.
 */
public record Attributes(ContentAttributes content, MetaAttributes meta) {
}
