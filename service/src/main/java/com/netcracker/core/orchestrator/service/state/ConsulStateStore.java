package com.netcracker.core.orchestrator.service.state;

import com.netcracker.core.orchestrator.client.consul.ConsulKvClient;
import com.netcracker.core.orchestrator.client.consul.ConsulKvException;
import com.netcracker.core.orchestrator.model.ResourceId;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Stores every resource as one Consul KV key: {@code <prefix>/<type>.<name>}.
 */
@Slf4j
public class ConsulStateStore implements StateStore {
    private final ConsulKvClient kvClient;
    private final StateSerializer serializer;
    private final String prefix;

    public ConsulStateStore(ConsulKvClient kvClient, StateSerializer serializer, String prefix) {
        this.kvClient = kvClient;
        this.serializer = serializer;
        this.prefix = prefix.endsWith("/") ? prefix.substring(0, prefix.length() - 1) : prefix;
    }

    @Override
    public StateSnapshot load() {
        Map<String, String> values;
        try {
            values = kvClient.getValues(prefix + "/");
        } catch (ConsulKvException e) {
            throw new StateStoreException("Failed to read state under '" + prefix + "'", e);
        }
        List<ResourceState> states = new ArrayList<>(values.size());
        values.forEach((key, json) -> {
            if (json == null || json.isBlank()) {
                log.debug("Skipping empty Consul key '{}'", key);
                return;
            }
            ResourceState state = serializer.deserialize(json, key);
            if (!key.equals(keyOf(state.id()))) {
                throw new StateCorruptionException("Consul key '" + key + "' describes '" + state.id() + "'");
            }
            states.add(state);
        });
        return new StateSnapshot(states);
    }

    @Override
    public void commit(ResourceId id, ResourceState state) {
        String json = serializer.serialize(state);
        try {
            kvClient.put(keyOf(id), json);
        } catch (ConsulKvException e) {
            throw new StateStoreException("Failed to commit state of '" + id + "' to Consul", e);
        }
    }

    @Override
    public void remove(ResourceId id) {
        try {
            kvClient.delete(keyOf(id));
        } catch (ConsulKvException e) {
            throw new StateStoreException("Failed to remove state of '" + id + "' from Consul", e);
        }
    }

    String keyOf(ResourceId id) {
        return prefix + "/" + id;
    }
}
