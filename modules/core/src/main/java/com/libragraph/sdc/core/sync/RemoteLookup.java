package com.libragraph.sdc.core.sync;

import com.libragraph.sdc.core.container.DataContainer;

/**
 * Result of fetching a dataset by uuid: either the stored container, or a
 * pointer to the dataset that superseded it.
 */
public sealed interface RemoteLookup permits RemoteLookup.Found, RemoteLookup.Redirect {

    record Found(DataContainer container) implements RemoteLookup {
    }

    record Redirect(String uuid) implements RemoteLookup {
    }
}
