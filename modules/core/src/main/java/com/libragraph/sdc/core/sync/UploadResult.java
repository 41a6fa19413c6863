package com.libragraph.sdc.core.sync;

import com.libragraph.sdc.core.container.DataContainer;

/**
 * Outcome of an upload together with the container state the store accepted.
 */
public record UploadResult(Outcome outcome, DataContainer container) {

    public enum Outcome {
        /** New remote dataset. */
        CREATED,
        /** Existing remote dataset updated. */
        REPLACED,
        /** Identical static dataset already stored; its state was adopted. */
        DEDUPLICATED
    }
}
