package com.libragraph.sdc.core.container;

public enum ContainerState {
    MUTABLE,
    IMMUTABLE
}
