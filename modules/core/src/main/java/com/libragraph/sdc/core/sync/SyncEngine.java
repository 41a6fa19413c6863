package com.libragraph.sdc.core.sync;

import com.libragraph.sdc.core.container.DataContainer;
import com.libragraph.sdc.core.model.ContentAttributes;
import com.libragraph.sdc.core.model.IdentityDefaults;
import com.libragraph.sdc.core.model.SchemaViolationException;
import io.smallrye.mutiny.TimeoutException;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Reconciles local containers with a {@link RemoteStore}.
 *
 * <p>Calls block for at most the configured timeout each. Nothing is retried:
 * a repeated multi-step upload needs a later {@code modified}, which only the
 * caller can provide.
 */
public class SyncEngine {

    private static final Logger log = Logger.getLogger(SyncEngine.class);

    static final int MAX_REDIRECTS = 32;

    private final RemoteStore store;
    private final IdentityDefaults defaults;
    private final Duration timeout;

    public SyncEngine(RemoteStore store, IdentityDefaults defaults, Duration timeout) {
        this.store = store;
        this.defaults = defaults;
        this.timeout = timeout;
    }

    /**
     * Uploads with the default credential.
     *
     * @throws IllegalStateException if no default credential is configured
     */
    public UploadResult upload(DataContainer container) {
        return upload(container, defaultCredential());
    }

    /**
     * Uploads a container and makes it adopt the state the store accepted.
     * The container is sealed first.
     *
     * <ol>
     *   <li>static: the stored hash must match the content; an existing static
     *       dataset with the same type and hash is adopted instead of uploading</li>
     *   <li>unknown uuid: created</li>
     *   <li>known uuid: replaced if the remote copy is neither complete nor static
     *       and the local modification time is strictly later</li>
     * </ol>
     *
     * @throws SchemaViolationException  if a static container's hash does not match its content
     * @throws StaleWriteException       if the local modification time is not after the remote one
     * @throws ImmutableRemoteException  if the remote dataset is complete, static or superseded
     * @throws NotOwnerException         if the credential may not change the dataset
     * @throws RemoteStoreException      on transport failures and timeouts
     */
    public UploadResult upload(DataContainer container, Credential credential) {
        container.seal();
        ContentAttributes content = container.content();
        String uuid = container.uuid();

        if (container.isStatic()) {
            if (!container.verifyHash()) {
                throw new SchemaViolationException("hash of static container " + uuid
                        + " does not match its content");
            }
            Optional<DataContainer> existing = await(
                    store.findStatic(content.containerType().name(), content.hash(), credential),
                    "find static " + content.hash());
            if (existing.isPresent()) {
                log.infof("Static container %s deduplicated to %s", uuid, existing.get().uuid());
                container.adopt(existing.get());
                return new UploadResult(UploadResult.Outcome.DEDUPLICATED, container);
            }
        }

        RemoteLookup lookup;
        try {
            lookup = await(store.get(uuid, credential), "get " + uuid);
        } catch (DatasetNotFoundException e) {
            DataContainer accepted = await(store.create(container, credential), "create " + uuid);
            container.adopt(accepted);
            log.infof("Created remote dataset %s", container.uuid());
            return new UploadResult(UploadResult.Outcome.CREATED, container);
        }

        if (lookup instanceof RemoteLookup.Redirect redirect) {
            throw new ImmutableRemoteException(uuid, "Dataset superseded by " + redirect.uuid());
        }
        DataContainer remote = ((RemoteLookup.Found) lookup).container();
        if (remote.content().completeFlag() || remote.isStatic()) {
            throw new ImmutableRemoteException(uuid, "Remote dataset is complete");
        }
        if (!container.modified().isAfter(remote.modified())) {
            throw new StaleWriteException(uuid, "Modification time " + container.modified()
                    + " is not after remote " + remote.modified());
        }
        DataContainer accepted = await(store.replace(uuid, container, credential), "replace " + uuid);
        container.adopt(accepted);
        log.infof("Replaced remote dataset %s", uuid);
        return new UploadResult(UploadResult.Outcome.REPLACED, container);
    }

    /**
     * Downloads with the default credential.
     *
     * @throws IllegalStateException if no default credential is configured
     */
    public DataContainer download(String uuid) {
        return download(uuid, defaultCredential());
    }

    /**
     * Fetches a dataset, following supersession links to the latest entry.
     * The result is immutable.
     *
     * @throws DatasetNotFoundException if a dataset on the chain does not exist
     * @throws IllegalStateException    if the chain loops or is unreasonably long
     * @throws RemoteStoreException     on transport failures and timeouts
     */
    public DataContainer download(String uuid, Credential credential) {
        Set<String> visited = new HashSet<>();
        String current = uuid;
        while (true) {
            if (!visited.add(current)) {
                throw new IllegalStateException("Supersession cycle at " + current + " starting from " + uuid);
            }
            if (visited.size() > MAX_REDIRECTS) {
                throw new IllegalStateException("More than " + MAX_REDIRECTS + " redirects from " + uuid);
            }
            RemoteLookup lookup = await(store.get(current, credential), "get " + current);
            if (lookup instanceof RemoteLookup.Found found) {
                if (!current.equals(uuid)) {
                    log.debugf("Dataset %s resolved to %s", uuid, current);
                }
                return found.container();
            }
            current = ((RemoteLookup.Redirect) lookup).uuid();
        }
    }

    private Credential defaultCredential() {
        return defaults.credential()
                .map(Credential::new)
                .orElseThrow(() -> new IllegalStateException("No credential configured for the remote store"));
    }

    private <T> T await(Uni<T> call, String operation) {
        try {
            return call.await().atMost(timeout);
        } catch (TimeoutException e) {
            throw new RemoteStoreException("Timed out after " + timeout + ": " + operation, e);
        }
    }
}
