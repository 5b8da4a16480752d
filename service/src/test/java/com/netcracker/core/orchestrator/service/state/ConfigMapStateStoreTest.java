package com.netcracker.core.orchestrator.service.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netcracker.core.orchestrator.client.k8s.ConfigMapClient;
import com.netcracker.core.orchestrator.model.ResourceId;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConfigMapStateStoreTest {

    private static final String NAME = "orchestrator-state";
    private static final String NAMESPACE = "ops";
    private static final ResourceId REGISTRY = ResourceId.parse("registry.app");
    private static final ResourceState STATE = new ResourceState(REGISTRY, "ops/app-x1y2z",
            Map.of("host", "registry.local"), Map.of("id", "ops/app-x1y2z"), Set.of(), List.of());

    private final ConfigMapClient configMapClient = mock(ConfigMapClient.class);
    private final StateSerializer serializer = new StateSerializer(new ObjectMapper());
    private final ConfigMapStateStore store = new ConfigMapStateStore(configMapClient, serializer, NAME, NAMESPACE);

    @Test
    void commitShouldWriteOneKeyPerResource() {
        store.commit(REGISTRY, STATE);

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(configMapClient).putEntry(eq(NAME), eq(NAMESPACE), eq("registry.app"), json.capture());
        assertThat(serializer.deserialize(json.getValue(), "test")).isEqualTo(STATE);
    }

    @Test
    void loadShouldDecodeEveryKey() {
        when(configMapClient.getData(NAME, NAMESPACE)).thenReturn(Map.of("registry.app", serializer.serialize(STATE)));

        StateSnapshot snapshot = store.load();

        assertThat(snapshot.find(REGISTRY)).contains(STATE);
    }

    @Test
    void loadShouldRejectEntryStoredUnderForeignKey() {
        when(configMapClient.getData(NAME, NAMESPACE)).thenReturn(Map.of("network.main", serializer.serialize(STATE)));

        assertThatThrownBy(store::load)
                .isInstanceOf(StateCorruptionException.class)
                .hasMessageContaining("network.main");
    }

    @Test
    void loadShouldRejectUndecodableEntry() {
        when(configMapClient.getData(NAME, NAMESPACE)).thenReturn(Map.of("registry.app", "not json"));

        assertThatThrownBy(store::load).isInstanceOf(StateCorruptionException.class);
    }

    @Test
    void clientFailuresShouldBecomeStoreExceptions() {
        doThrow(new KubernetesClientException("conflict"))
                .when(configMapClient).removeEntry(anyString(), anyString(), anyString());

        assertThatThrownBy(() -> store.remove(REGISTRY))
                .isInstanceOf(StateStoreException.class)
                .hasCauseInstanceOf(KubernetesClientException.class);
    }
}
