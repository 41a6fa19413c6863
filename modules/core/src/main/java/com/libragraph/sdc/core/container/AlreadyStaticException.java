package com.libragraph.sdc.core.container;

import com.libragraph.sdc.types.ContainerException;

/**
 * Thrown by {@link DataContainer#freeze()} on a container that is already static.
 */
public class AlreadyStaticException extends ContainerException {

    public AlreadyStaticException(String uuid) {
        super("Container " + uuid + " is already static");
    }
}
