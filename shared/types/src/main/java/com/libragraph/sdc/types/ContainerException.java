package com.libragraph.sdc.types;

/**
 * Root of the data container error taxonomy. All container failures are
 * unchecked and reported synchronously to the caller.
 */
public class ContainerException extends RuntimeException {

    public ContainerException(String message) {
        super(message);
    }

    public ContainerException(String message, Throwable cause) {
        super(message, cause);
    }
}
