package com.libragraph.sdc.core.archive;

import com.libragraph.sdc.types.ContainerException;

/**
 * Wraps I/O failures while reading or writing a container archive.
 */
public class ArchiveException extends ContainerException {

    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }

    public ArchiveException(String message) {
        super(message);
    }
}
