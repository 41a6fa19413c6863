package com.libragraph.sdc.core.sync;

/**
 * Thrown when the remote store has no dataset with the given identifier.
 */
public class DatasetNotFoundException extends RemoteStoreException {

    private final String uuid;

    public DatasetNotFoundException(String uuid, String message) {
        super(message + ": " + uuid);
        this.uuid = uuid;
    }

    public String uuid() {
        return uuid;
    }
}
