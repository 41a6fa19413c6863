package com.libragraph.sdc.config;

import com.libragraph.sdc.core.archive.ContainerArchive;
import com.libragraph.sdc.core.model.AttributeValidator;
import com.libragraph.sdc.core.model.IdentityDefaults;
import com.libragraph.sdc.core.sync.HttpRemoteStore;
import com.libragraph.sdc.core.sync.InMemoryRemoteStore;
import com.libragraph.sdc.core.sync.RemoteStore;
import com.libragraph.sdc.core.sync.SyncEngine;
import com.libragraph.sdc.formats.registry.CodecRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;

/**
 * Wires the container library into CDI.
 *
 * <p>The hosted store backs the HTTP API. The sync engine talks to
 * {@code sdc.server.url} when set and to the hosted store otherwise.
 */
@ApplicationScoped
public class ContainerProducers {

    private static final Logger log = Logger.getLogger(ContainerProducers.class);

    @ConfigProperty(name = "sdc.server.timeout", defaultValue = "30s")
    Duration timeout;

    @Produces
    @Singleton
    public CodecRegistry codecRegistry() {
        CodecRegistry registry = CodecRegistry.withDefaults();
        log.infof("Codecs registered for: %s", registry.extensions());
        return registry;
    }

    @Produces
    @Singleton
    public AttributeValidator attributeValidator(IdentityDefaults defaults) {
        return new AttributeValidator(defaults);
    }

    @Produces
    @Singleton
    public ContainerArchive containerArchive(CodecRegistry registry, AttributeValidator validator) {
        return new ContainerArchive(registry, validator);
    }

    @Produces
    @Singleton
    public RemoteStore hostedStore() {
        return new InMemoryRemoteStore();
    }

    @Produces
    @Singleton
    public SyncEngine syncEngine(IdentityDefaults defaults, ContainerArchive archive, RemoteStore hosted) {
        RemoteStore store = defaults.server()
                .<RemoteStore>map(uri -> {
                    log.infof("Syncing with %s (timeout %s)", uri, timeout);
                    return new HttpRemoteStore(uri, archive, timeout);
                })
                .orElseGet(() -> {
                    log.info("No sdc.server.url configured, syncing with the hosted store");
                    return hosted;
                });
        return new SyncEngine(store, defaults, timeout);
    }
}
