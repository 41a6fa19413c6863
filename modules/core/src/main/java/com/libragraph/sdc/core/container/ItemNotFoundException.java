package com.libragraph.sdc.core.container;

import com.libragraph.sdc.types.ContainerException;

public class ItemNotFoundException extends ContainerException {

    private final String name;

    public ItemNotFoundException(String name) {
        super("Item not found: " + name);
        this.name = name;
    }

    public String name() {
        return name;
    }
}
