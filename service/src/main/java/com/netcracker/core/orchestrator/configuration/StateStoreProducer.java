package com.netcracker.core.orchestrator.configuration;

import com.netcracker.core.orchestrator.client.consul.ConsulKvClient;
import com.netcracker.core.orchestrator.client.k8s.ConfigMapClient;
import com.netcracker.core.orchestrator.service.state.ConfigMapStateStore;
import com.netcracker.core.orchestrator.service.state.ConsulStateStore;
import com.netcracker.core.orchestrator.service.state.FileStateStore;
import com.netcracker.core.orchestrator.service.state.RetryingStateStore;
import com.netcracker.core.orchestrator.service.state.StateSerializer;
import com.netcracker.core.orchestrator.service.state.StateStore;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.vertx.core.Vertx;
import io.vertx.ext.consul.ConsulClient;
import io.vertx.ext.consul.ConsulClientOptions;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Selects the state backend from {@code orchestrator.state.backend}: {@code file}, {@code configmap} or {@code consul}.
 * Remote backends are wrapped with write retries.
 */
@Slf4j
@ApplicationScoped
public class StateStoreProducer {

    @ConfigProperty(name = "orchestrator.state.backend", defaultValue = "file")
    String backend;

    @ConfigProperty(name = "orchestrator.state.file", defaultValue = "orchestrator-state.json")
    String stateFile;

    @ConfigProperty(name = "orchestrator.state.configmap.name", defaultValue = "orchestrator-state")
    String configMapName;

    @ConfigProperty(name = "orchestrator.state.configmap.namespace", defaultValue = "default")
    String configMapNamespace;

    @ConfigProperty(name = "orchestrator.state.consul.host", defaultValue = "localhost")
    String consulHost;

    @ConfigProperty(name = "orchestrator.state.consul.port", defaultValue = "8500")
    int consulPort;

    @ConfigProperty(name = "orchestrator.state.consul.token")
    Optional<String> consulToken;

    @ConfigProperty(name = "orchestrator.state.consul.prefix", defaultValue = "orchestrator/state")
    String consulPrefix;

    @ConfigProperty(name = "orchestrator.state.consul.timeout", defaultValue = "10S")
    Duration consulTimeout;

    @ConfigProperty(name = "orchestrator.state.retry.max-attempts", defaultValue = "5")
    int retryMaxAttempts;

    @ConfigProperty(name = "orchestrator.state.retry.initial-delay", defaultValue = "1S")
    Duration retryInitialDelay;

    @ConfigProperty(name = "orchestrator.state.retry.max-delay", defaultValue = "30S")
    Duration retryMaxDelay;

    @Produces
    @ApplicationScoped
    StateStore stateStore(StateSerializer serializer,
                          Instance<KubernetesClient> kubernetesClient,
                          Instance<Vertx> vertx) {
        String selected = backend.trim().toLowerCase(Locale.ROOT);
        log.debug("Using '{}' state backend", selected);
        return switch (selected) {
            case "file" -> new FileStateStore(Path.of(stateFile), serializer);
            case "configmap" -> retrying(new ConfigMapStateStore(
                    new ConfigMapClient(kubernetesClient.get()), serializer, configMapName, configMapNamespace));
            case "consul" -> retrying(new ConsulStateStore(
                    new ConsulKvClient(consulClient(vertx.get()), consulTimeout), serializer, consulPrefix));
            default -> throw new IllegalArgumentException("Unsupported state backend '" + backend
                                                          + "', expected one of: file, configmap, consul");
        };
    }

    private StateStore retrying(StateStore delegate) {
        return new RetryingStateStore(delegate, retryMaxAttempts, retryInitialDelay, retryMaxDelay);
    }

    private ConsulClient consulClient(Vertx vertx) {
        ConsulClientOptions options = new ConsulClientOptions()
                .setHost(consulHost)
                .setPort(consulPort);
        consulToken.ifPresent(options::setAclToken);
        return ConsulClient.create(vertx, options);
    }
}
