package com.libragraph.sdc.core.model;

import java.net.URI;
import java.util.Optional;

/**
 * Source of default author identity and server access, consulted only when the
 * corresponding value is missing. Where the values come from is up to the
 * implementation (configuration, environment).
 */
public interface IdentityDefaults {

    Optional<String> author();

    Optional<String> email();

    Optional<URI> server();

    Optional<String> credential();

    /** Defaults that supply nothing. */
    static IdentityDefaults none() {
        return of(null, null);
    }

    /** Fixed author identity, no server. */
    static IdentityDefaults of(String author, String email) {
        return new IdentityDefaults() {
            @Override
            public Optional<String> author() {
                return Optional.ofNullable(author);
            }

            @Override
            public Optional<String> email() {
                return Optional.ofNullable(email);
            }

            @Override
            public Optional<URI> server() {
                return Optional.empty();
            }

            @Override
            public Optional<String> credential() {
                return Optional.empty();
            }
        };
    }
}
