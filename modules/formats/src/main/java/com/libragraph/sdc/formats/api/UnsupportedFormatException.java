package com.libragraph.sdc.formats.api;

import com.libragraph.sdc.types.ContainerException;

/**
 * Thrown when no codec is registered for an extension or can encode a value.
 */
public class UnsupportedFormatException extends ContainerException {

    public UnsupportedFormatException(String message) {
        super(message);
    }
}
