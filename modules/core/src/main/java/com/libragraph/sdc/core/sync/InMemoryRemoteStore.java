package com.libragraph.sdc.core.sync;

import com.libragraph.sdc.core.container.DataContainer;
import com.libragraph.sdc.util.Timestamps;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Remote store held in memory. Enforces the store-side rules: ownership by
 * credential, terminal complete and static datasets, strictly increasing
 * modification times, supersession through {@code replaces} and static dedup.
 *
 * <p>Thread-safe. Every returned container is an independent sealed copy.
 */
public class InMemoryRemoteStore implements RemoteStore {

    private static final Logger log = Logger.getLogger(InMemoryRemoteStore.class);

    private record Entry(DataContainer container, String owner, String supersededBy) {

        Entry supersede(String successor) {
            return new Entry(container, owner, successor);
        }

        boolean isTerminal() {
            return container.isStatic() || container.content().completeFlag();
        }
    }

    private final Map<String, Entry> entries = new HashMap<>();
    private final Clock clock;

    public InMemoryRemoteStore() {
        this(Clock.systemUTC());
    }

    public InMemoryRemoteStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Uni<DataContainer> create(DataContainer container, Credential credential) {
        return Uni.createFrom().item(() -> doCreate(container, credential));
    }

    @Override
    public Uni<DataContainer> replace(String uuid, DataContainer container, Credential credential) {
        return Uni.createFrom().item(() -> doReplace(uuid, container, credential));
    }

    @Override
    public Uni<RemoteLookup> get(String uuid, Credential credential) {
        return Uni.createFrom().item(() -> doGet(uuid));
    }

    @Override
    public Uni<Optional<DataContainer>> findStatic(String typeName, String hash, Credential credential) {
        return Uni.createFrom().item(() -> doFindStatic(typeName, hash).map(InMemoryRemoteStore::copy));
    }

    /** Number of stored datasets, superseded ones included. */
    public synchronized int size() {
        return entries.size();
    }

    private synchronized DataContainer doCreate(DataContainer container, Credential credential) {
        Objects.requireNonNull(credential, "credential cannot be null");
        container.seal();
        String uuid = container.uuid();

        if (container.isStatic()) {
            Optional<DataContainer> existing = doFindStatic(
                    container.content().containerType().name(), container.content().hash());
            if (existing.isPresent()) {
                log.debugf("Create of static %s resolved to existing %s", uuid, existing.get().uuid());
                return copy(existing.get());
            }
        }
        if (entries.containsKey(uuid)) {
            throw new StaleWriteException(uuid, "Dataset already exists");
        }

        String predecessor = container.content().replaces();
        if (predecessor != null) {
            Entry previous = entries.get(predecessor);
            if (previous == null) {
                throw new DatasetNotFoundException(predecessor, "Replaced dataset does not exist");
            }
            if (!previous.owner().equals(credential.token())) {
                throw new NotOwnerException(predecessor, "Only the creator may supersede dataset");
            }
            if (previous.supersededBy() != null) {
                throw new StaleWriteException(predecessor, "Dataset already superseded by "
                        + previous.supersededBy());
            }
            entries.put(predecessor, previous.supersede(uuid));
        }

        DataContainer stored = container.withStorageTime(Timestamps.now(clock));
        entries.put(uuid, new Entry(stored, credential.token(), null));
        log.debugf("Stored dataset %s", uuid);
        return copy(stored);
    }

    private synchronized DataContainer doReplace(String uuid, DataContainer container, Credential credential) {
        Objects.requireNonNull(credential, "credential cannot be null");
        Entry existing = entries.get(uuid);
        if (existing == null) {
            throw new DatasetNotFoundException(uuid, "No such dataset");
        }
        if (existing.supersededBy() != null) {
            throw new ImmutableRemoteException(uuid, "Dataset superseded by " + existing.supersededBy());
        }
        if (existing.isTerminal()) {
            throw new ImmutableRemoteException(uuid, "Dataset is complete");
        }
        if (!existing.owner().equals(credential.token())) {
            throw new NotOwnerException(uuid, "Only the creator may replace dataset");
        }
        container.seal();
        if (!uuid.equals(container.uuid())) {
            throw new StaleWriteException(uuid, "Submitted container has uuid " + container.uuid());
        }
        if (!container.modified().isAfter(existing.container().modified())) {
            throw new StaleWriteException(uuid, "Modification time " + container.modified()
                    + " is not after stored " + existing.container().modified());
        }
        DataContainer stored = container.withStorageTime(Timestamps.now(clock));
        entries.put(uuid, new Entry(stored, existing.owner(), null));
        log.debugf("Replaced dataset %s", uuid);
        return copy(stored);
    }

    private synchronized RemoteLookup doGet(String uuid) {
        Entry entry = entries.get(uuid);
        if (entry == null) {
            throw new DatasetNotFoundException(uuid, "No such dataset");
        }
        if (entry.supersededBy() != null) {
            return new RemoteLookup.Redirect(entry.supersededBy());
        }
        return new RemoteLookup.Found(copy(entry.container()));
    }

    private synchronized Optional<DataContainer> doFindStatic(String typeName, String hash) {
        return entries.values().stream()
                .map(Entry::container)
                .filter(DataContainer::isStatic)
                .filter(c -> c.content().containerType().name().equals(typeName))
                .filter(c -> c.content().hash().equals(hash))
                .findFirst();
    }

    private static DataContainer copy(DataContainer stored) {
        return stored.withStorageTime(stored.content().storageTime());
    }
}
