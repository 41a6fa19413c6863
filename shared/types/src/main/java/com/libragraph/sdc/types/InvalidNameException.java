package com.libragraph.sdc.types;

/**
 * Thrown for a malformed qualified item name, or a write to a reserved name.
 */
public class InvalidNameException extends ContainerException {

    private final String name;

    public InvalidNameException(String name, String reason) {
        super("Invalid item name '" + name + "': " + reason);
        this.name = name;
    }

    public String name() {
        return name;
    }
}
