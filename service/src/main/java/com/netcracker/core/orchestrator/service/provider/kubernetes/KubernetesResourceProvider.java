package com.netcracker.core.orchestrator.service.provider.kubernetes;

import com.netcracker.core.orchestrator.model.ResourceKind;
import com.netcracker.core.orchestrator.service.provider.ProviderActionException;
import com.netcracker.core.orchestrator.service.provider.ProviderAttributes;
import com.netcracker.core.orchestrator.service.provider.ResourceProvider;
import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceAccount;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.networking.v1.NetworkPolicy;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.security.SecureRandom;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link ResourceProvider} that provisions resources as Kubernetes objects.
 * <p>
 * Instance ids are {@code <namespace>/<name>} for namespaced objects and the bare name for networks.
 * Names are generated from the {@code name} attribute (or the kind) plus a random suffix, so a replacement
 * can be created while the instance it replaces still exists. Namespaced objects live in the namespace
 * given by {@code network_id}, then {@code namespace}, then the configured default.
 */
@ApplicationScoped
@Slf4j
public class KubernetesResourceProvider implements ResourceProvider {
    private static final int MAX_BASE_NAME_LENGTH = 50;
    private static final String SUFFIX_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

    private final KubernetesClient client;
    private final String defaultNamespace;
    private final Supplier<String> suffixGenerator;

    @Inject
    public KubernetesResourceProvider(KubernetesClient client,
                                      @ConfigProperty(name = "orchestrator.provider.kubernetes.namespace", defaultValue = "default")
                                      String defaultNamespace) {
        this(client, defaultNamespace, randomSuffix());
    }

    KubernetesResourceProvider(KubernetesClient client, String defaultNamespace, Supplier<String> suffixGenerator) {
        this.client = client;
        this.defaultNamespace = defaultNamespace;
        this.suffixGenerator = suffixGenerator;
    }

    @Override
    public Map<String, Object> create(ResourceKind kind, Map<String, Object> attributes) {
        ProviderAttributes typed = new ProviderAttributes(kind, attributes);
        String name = generateName(kind, typed);
        String namespace = kind == ResourceKind.NETWORK ? null : resolveNamespace(typed);
        String id = namespace == null ? name : namespace + "/" + name;
        log.info("Creating {} '{}'", kind, id);
        apply(kind, id, KubernetesManifests.build(kind, name, namespace, typed));
        return KubernetesManifests.outputs(kind, id, name, namespace, typed);
    }

    @Override
    public Map<String, Object> update(String id, ResourceKind kind, Map<String, Object> attributes) {
        ProviderAttributes typed = new ProviderAttributes(kind, attributes);
        InstanceRef ref = InstanceRef.parse(id);
        if (get(kind, ref).isEmpty()) {
            throw new ProviderActionException(kind + " '" + id + "' does not exist");
        }
        log.info("Updating {} '{}'", kind, id);
        apply(kind, id, KubernetesManifests.build(kind, ref.name(), ref.namespace(), typed));
        return KubernetesManifests.outputs(kind, id, ref.name(), ref.namespace(), typed);
    }

    @Override
    public void destroy(String id, ResourceKind kind) {
        InstanceRef ref = InstanceRef.parse(id);
        log.info("Destroying {} '{}'", kind, id);
        try {
            for (Class<? extends HasMetadata> type : objectTypes(kind)) {
                if (ref.namespace() == null) {
                    client.resources(type).withName(ref.name()).delete();
                } else {
                    client.resources(type).inNamespace(ref.namespace()).withName(ref.name()).delete();
                }
            }
        } catch (KubernetesClientException e) {
            throw new ProviderActionException("Failed to destroy " + kind + " '" + id + "': " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<Map<String, Object>> describe(String id, ResourceKind kind) {
        return get(kind, InstanceRef.parse(id)).map(object -> {
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("name", object.getMetadata().getName());
            if (object.getMetadata().getNamespace() != null) {
                attributes.put("namespace", object.getMetadata().getNamespace());
            }
            if (object.getMetadata().getLabels() != null) {
                attributes.put("labels", Map.copyOf(object.getMetadata().getLabels()));
            }
            return attributes;
        });
    }

    private Optional<HasMetadata> get(ResourceKind kind, InstanceRef ref) {
        Class<? extends HasMetadata> primaryType = objectTypes(kind).get(0);
        try {
            HasMetadata object = ref.namespace() == null
                    ? client.resources(primaryType).withName(ref.name()).get()
                    : client.resources(primaryType).inNamespace(ref.namespace()).withName(ref.name()).get();
            return Optional.ofNullable(object);
        } catch (KubernetesClientException e) {
            throw new ProviderActionException("Failed to read " + kind + " '" + ref + "': " + e.getMessage(), e);
        }
    }

    private void apply(ResourceKind kind, String id, List<HasMetadata> objects) {
        try {
            for (HasMetadata object : objects) {
                client.resource(object).serverSideApply();
            }
        } catch (KubernetesClientException e) {
            throw new ProviderActionException("Failed to apply " + kind + " '" + id + "': " + e.getMessage(), e);
        }
    }

    private String resolveNamespace(ProviderAttributes attributes) {
        return attributes.optionalString("network_id", attributes.optionalString("namespace", defaultNamespace));
    }

    private String generateName(ResourceKind kind, ProviderAttributes attributes) {
        String base = attributes.optionalString("name", kind.typeName())
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9-]", "-")
                .replaceAll("^-+|-+$", "");
        if (base.isEmpty()) {
            base = kind.typeName();
        }
        if (base.length() > MAX_BASE_NAME_LENGTH) {
            base = base.substring(0, MAX_BASE_NAME_LENGTH);
        }
        return base + "-" + suffixGenerator.get();
    }

    static List<Class<? extends HasMetadata>> objectTypes(ResourceKind kind) {
        return switch (kind) {
            case NETWORK -> List.of(Namespace.class);
            case SECURITY_POLICY -> List.of(NetworkPolicy.class);
            case IDENTITY_ROLE -> List.of(ServiceAccount.class);
            case REGISTRY -> List.of(ConfigMap.class);
            case COMPUTE_SERVICE -> List.of(Deployment.class, Service.class);
        };
    }

    private static Supplier<String> randomSuffix() {
        SecureRandom random = new SecureRandom();
        return () -> {
            StringBuilder suffix = new StringBuilder(5);
            for (int i = 0; i < 5; i++) {
                suffix.append(SUFFIX_ALPHABET.charAt(random.nextInt(SUFFIX_ALPHABET.length())));
            }
            return suffix.toString();
        };
    }

    record InstanceRef(String namespace, String name) {

        static InstanceRef parse(String id) {
            int separator = id.indexOf('/');
            if (separator < 0) {
                return new InstanceRef(null, id);
            }
            if (separator == 0 || separator == id.length() - 1) {
                throw new ProviderActionException("Malformed instance id '" + id + "'");
            }
            return new InstanceRef(id.substring(0, separator), id.substring(separator + 1));
        }

        @Override
        public String toString() {
            return namespace == null ? name : namespace + "/" + name;
        }
    }
}
