package com.libragraph.sdc.core.sync;

/**
 * Thrown when a write does not move the remote dataset forward: its modification time is not after the stored one, or the predecessor it replaces was already superseded.
 */
public class StaleWriteException extends RemoteStoreException {

    private final String uuid;

    public StaleWriteException(String uuid, String message) {
        super(message + ": " + uuid);
        this.uuid = uuid;
    }

    public String uuid() {
        return uuid;
    }
}
