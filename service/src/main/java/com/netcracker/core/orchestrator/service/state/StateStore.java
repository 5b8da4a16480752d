package com.netcracker.core.orchestrator.service.state;

import com.netcracker.core.orchestrator.model.ResourceId;

/**
 * Persists the last applied state of every resource.
 * <p>
 * Each {@link #commit} and {@link #remove} is a single atomic write keyed by the resource identity,
 * so callers may write different resources concurrently without further locking.
 */
public interface StateStore {

    StateSnapshot load();

    void commit(ResourceId id, ResourceState state);

    void remove(ResourceId id);
}
