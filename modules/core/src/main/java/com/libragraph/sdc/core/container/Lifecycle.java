package com.libragraph.sdc.core.container;

/**
 * Mutable/immutable state machine of a container.
 *
 * <p>{@code MUTABLE -> IMMUTABLE} is fired by serialize, hash, freeze and upload
 * and is idempotent. {@code IMMUTABLE -> MUTABLE} only happens through
 * {@link DataContainer#release()}.
 */
public class Lifecycle {

    private ContainerState state;

    Lifecycle(ContainerState initial) {
        this.state = initial;
    }

    public ContainerState state() {
        return state;
    }

    public boolean isMutable() {
        return state == ContainerState.MUTABLE;
    }

    /**
     * @throws ImmutableContainerException unless the container is mutable
     */
    void requireMutable(String uuid, String operation) {
        if (state != ContainerState.MUTABLE) {
            throw new ImmutableContainerException(uuid, operation);
        }
    }

    /** Returns true if this call performed the transition. */
    boolean seal() {
        if (state == ContainerState.IMMUTABLE) {
            return false;
        }
        state = ContainerState.IMMUTABLE;
        return true;
    }

    void release() {
        state = ContainerState.MUTABLE;
    }
}
