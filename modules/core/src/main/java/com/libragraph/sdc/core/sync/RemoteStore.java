package com.libragraph.sdc.core.sync;

import com.libragraph.sdc.core.container.DataContainer;
import io.smallrye.mutiny.Uni;

import java.util.Optional;

/**
 * Authoritative remote dataset store.
 *
 * <p>Every write returns the container as stored, which may differ from the
 * submitted one (storage time, or an existing dataset on static dedup).
 * Submitted containers must be sealed.
 */
public interface RemoteStore {

    /**
     * Stores a new dataset. A static container whose type and hash match an
     * existing static dataset returns that dataset instead.
     *
     * @throws StaleWriteException       if the uuid exists, or the predecessor named by
     *                                   {@code replaces} was already superseded
     * @throws NotOwnerException         if the predecessor belongs to another principal
     * @throws DatasetNotFoundException  if the predecessor does not exist
     */
    Uni<DataContainer> create(DataContainer container, Credential credential);

    /**
     * Overwrites an existing dataset.
     *
     * @throws DatasetNotFoundException  if there is no such dataset
     * @throws ImmutableRemoteException  if the stored dataset is complete, static or superseded
     * @throws NotOwnerException         if the dataset belongs to another principal
     * @throws StaleWriteException       unless the submitted modification time is strictly later
     */
    Uni<DataContainer> replace(String uuid, DataContainer container, Credential credential);

    /**
     * Fetches a dataset, or the uuid of the dataset that superseded it.
     *
     * @throws DatasetNotFoundException if there is no such dataset
     */
    Uni<RemoteLookup> get(String uuid, Credential credential);

    /**
     * Looks up a static dataset by container type name and content hash.
     */
    Uni<Optional<DataContainer>> findStatic(String typeName, String hash, Credential credential);
}
