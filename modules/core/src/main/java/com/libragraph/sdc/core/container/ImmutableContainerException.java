package com.libragraph.sdc.core.container;

import com.libragraph.sdc.types.ContainerException;

/**
 * Thrown when a mutation is attempted on a container that is no longer mutable.
 */
public class ImmutableContainerException extends ContainerException {

    public ImmutableContainerException(String uuid, String operation) {
        super("Container " + uuid + " is immutable, cannot " + operation);
    }
}
