package com.libragraph.sdc.formats.api;

import com.libragraph.sdc.types.ContainerException;

/**
 * Wraps failures while encoding or decoding an item payload.
 */
public class CodecException extends ContainerException {

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }

    public CodecException(String message) {
        super(message);
    }
}
