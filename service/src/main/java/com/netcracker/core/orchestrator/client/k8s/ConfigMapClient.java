package com.netcracker.core.orchestrator.client.k8s;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.ConfigMapBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.Resource;
import lombok.extern.slf4j.Slf4j;

import java.net.HttpURLConnection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Key level access to a single ConfigMap. Writes touch one data key at a time so that
 * concurrent writers of different keys do not overwrite each other, including the writers racing
 * to create the ConfigMap.
 */
@Slf4j
public class ConfigMapClient {
    static final String PART_OF_LABEL = "app.kubernetes.io/part-of";
    static final String MANAGED_BY_LABEL = "app.kubernetes.io/managed-by";
    static final String PART_OF = "Cloud-Core";
    static final String MANAGED_BY = "resource-orchestrator";

    private final KubernetesClient client;

    public ConfigMapClient(KubernetesClient client) {
        this.client = client;
    }

    public Map<String, String> getData(String name, String namespace) {
        ConfigMap configMap = configMap(name, namespace).get();
        if (configMap == null || configMap.getData() == null) {
            log.debug("Config map '{}' in namespace '{}' is absent or empty", name, namespace);
            return Map.of();
        }
        return Map.copyOf(configMap.getData());
    }

    public void putEntry(String name, String namespace, String key, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Resource<ConfigMap> resource = configMap(name, namespace);
        if (resource.get() == null && create(name, namespace, Map.of(key, value))) {
            return;
        }
        resource.edit(configMap -> {
            Map<String, String> data = configMap.getData() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(configMap.getData());
            data.put(key, value);
            configMap.setData(data);
            return configMap;
        });
    }

    public void removeEntry(String name, String namespace, String key) {
        Resource<ConfigMap> resource = configMap(name, namespace);
        ConfigMap existing = resource.get();
        if (existing == null || existing.getData() == null || !existing.getData().containsKey(key)) {
            log.debug("Key '{}' is not present in config map '{}', nothing to remove", key, name);
            return;
        }
        resource.edit(configMap -> {
            Map<String, String> data = new LinkedHashMap<>(configMap.getData());
            data.remove(key);
            configMap.setData(data);
            return configMap;
        });
    }

    /**
     * Creates the config map holding {@code data}.
     *
     * @return {@code false} if another writer created it first
     */
    private boolean create(String name, String namespace, Map<String, String> data) {
        ConfigMap configMap = new ConfigMapBuilder()
                .withNewMetadata()
                .withName(name)
                .withNamespace(namespace)
                .withLabels(managedLabels())
                .endMetadata()
                .withData(data)
                .build();
        try {
            client.configMaps()
                    .inNamespace(namespace)
                    .resource(configMap).create();
            log.debug("Created config map '{}' in namespace '{}' with keys {}", name, namespace, data.keySet());
            return true;
        } catch (KubernetesClientException e) {
            if (e.getCode() != HttpURLConnection.HTTP_CONFLICT) {
                throw e;
            }
            log.debug("Config map '{}' in namespace '{}' was created concurrently, editing it instead", name, namespace);
            return false;
        }
    }

    private Resource<ConfigMap> configMap(String name, String namespace) {
        return client.configMaps()
                .inNamespace(namespace)
                .withName(name);
    }

    private static Map<String, String> managedLabels() {
        Map<String, String> labels = new HashMap<>();
        labels.put(PART_OF_LABEL, PART_OF);
        labels.put(MANAGED_BY_LABEL, MANAGED_BY);
        return labels;
    }
}
