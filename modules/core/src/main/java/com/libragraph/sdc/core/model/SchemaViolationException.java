package com.libragraph.sdc.core.model;

import com.libragraph.sdc.types.ContainerException;

/**
 * Thrown when a container attribute is missing, malformed, or inconsistent.
 */
public class SchemaViolationException extends ContainerException {

    public SchemaViolationException(String message) {
        super(message);
    }

    public SchemaViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
