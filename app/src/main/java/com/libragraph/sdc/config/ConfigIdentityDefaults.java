package com.libragraph.sdc.config;

import com.libragraph.sdc.core.model.IdentityDefaults;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.net.URI;
import java.util.Optional;

/**
 * Identity defaults read from configuration. Each key can also be supplied as
 * an environment variable, e.g. {@code SDC_SERVER_KEY}.
 */
@ApplicationScoped
public class ConfigIdentityDefaults implements IdentityDefaults {

    @ConfigProperty(name = "sdc.identity.author")
    Optional<String> author;

    @ConfigProperty(name = "sdc.identity.email")
    Optional<String> email;

    @ConfigProperty(name = "sdc.server.url")
    Optional<URI> server;

    @ConfigProperty(name = "sdc.server.key")
    Optional<String> key;

    @Override
    public Optional<String> author() {
        return author;
    }

    @Override
    public Optional<String> email() {
        return email;
    }

    @Override
    public Optional<URI> server() {
        return server;
    }

    @Override
    public Optional<String> credential() {
        return key;
    }
}
