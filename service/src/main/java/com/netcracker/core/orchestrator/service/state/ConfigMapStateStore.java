package com.netcracker.core.orchestrator.service.state;

import com.netcracker.core.orchestrator.client.k8s.ConfigMapClient;
import com.netcracker.core.orchestrator.model.ResourceId;
import io.fabric8.kubernetes.client.KubernetesClientException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Stores every resource under its own data key ({@code <type>.<name>}) of one ConfigMap.
 */
@Slf4j
public class ConfigMapStateStore implements StateStore {
    private final ConfigMapClient configMapClient;
    private final StateSerializer serializer;
    private final String configMapName;
    private final String namespace;

    public ConfigMapStateStore(ConfigMapClient configMapClient,
                               StateSerializer serializer,
                               String configMapName,
                               String namespace) {
        this.configMapClient = configMapClient;
        this.serializer = serializer;
        this.configMapName = configMapName;
        this.namespace = namespace;
    }

    @Override
    public StateSnapshot load() {
        Map<String, String> data;
        try {
            data = configMapClient.getData(configMapName, namespace);
        } catch (KubernetesClientException e) {
            throw new StateStoreException("Failed to read state config map '" + configMapName + "'", e);
        }
        List<ResourceState> states = new ArrayList<>(data.size());
        data.forEach((key, json) -> {
            ResourceState state = serializer.deserialize(json, configMapName + "/" + key);
            if (!state.id().toString().equals(key)) {
                throw new StateCorruptionException("State entry '" + key + "' in config map '" + configMapName
                                                   + "' describes '" + state.id() + "'");
            }
            states.add(state);
        });
        log.debug("Loaded {} state entries from config map '{}'", states.size(), configMapName);
        return new StateSnapshot(states);
    }

    @Override
    public void commit(ResourceId id, ResourceState state) {
        String json = serializer.serialize(state);
        try {
            configMapClient.putEntry(configMapName, namespace, id.toString(), json);
        } catch (KubernetesClientException e) {
            throw new StateStoreException("Failed to commit state of '" + id + "' to config map '" + configMapName + "'", e);
        }
    }

    @Override
    public void remove(ResourceId id) {
        try {
            configMapClient.removeEntry(configMapName, namespace, id.toString());
        } catch (KubernetesClientException e) {
            throw new StateStoreException("Failed to remove state of '" + id + "' from config map '" + configMapName + "'", e);
        }
    }
}
