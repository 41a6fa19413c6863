package com.libragraph.sdc.core.archive;

/**
 * Thrown when an archive cannot be parsed or lacks a reserved entry.
 */
public class CorruptArchiveException extends ArchiveException {

    public CorruptArchiveException(String message, Throwable cause) {
        super(message, cause);
    }

    public CorruptArchiveException(String message) {
        super(message);
    }
}
