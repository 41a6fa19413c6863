package com.libragraph.sdc.core.sync;

/**
 * Thrown when a credential does not own the remote dataset it tries to change or supersede.
 */
public class NotOwnerException extends RemoteStoreException {

    private final String uuid;

    public NotOwnerException(String uuid, String message) {
        super(message + ": " + uuid);
        this.uuid = uuid;
    }

    public String uuid() {
        return uuid;
    }
}
