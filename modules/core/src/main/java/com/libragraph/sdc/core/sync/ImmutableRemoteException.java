package com.libragraph.sdc.core.sync;

/**
 * Thrown when a write targets a remote dataset that is complete, static or superseded.
 */
public class ImmutableRemoteException extends RemoteStoreException {

    private final String uuid;

    public ImmutableRemoteException(String uuid, String message) {
        super(message + ": " + uuid);
        this.uuid = uuid;
    }

    public String uuid() {
        return uuid;
    }
}
