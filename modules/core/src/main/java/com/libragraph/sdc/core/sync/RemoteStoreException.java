package com.libragraph.sdc.core.sync;

import com.libragraph.sdc.types.ContainerException;

/**
 * Failure talking to a remote store: transport errors, timeouts and
 * responses that match no known outcome. Subclasses name the rejections
 * a store reports on purpose.
 */
public class RemoteStoreException extends ContainerException {

    public RemoteStoreException(String message) {
        super(message);
    }

    public RemoteStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
