package com.libragraph.sdc.core.sync;

import java.util.Objects;

/**
 * API key presented to a remote store. The token identifies the principal
 * that owns the datasets it creates.
 */
public record Credential(String token) {

    public Credential {
        Objects.requireNonNull(token, "token cannot be null");
        if (token.isBlank()) {
            throw new IllegalArgumentException("token cannot be blank");
        }
    }

    @Override
    public String toString() {
        return "Credential[****]";
    }
}
