package com.netcracker.core.orchestrator.service.provider.kubernetes;

import com.netcracker.core.orchestrator.model.ResourceKind;
import com.netcracker.core.orchestrator.service.provider.ProviderAttributes;
import io.fabric8.kubernetes.api.model.ConfigMapBuilder;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.IntOrString;
import io.fabric8.kubernetes.api.model.NamespaceBuilder;
import io.fabric8.kubernetes.api.model.ServiceAccountBuilder;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import io.fabric8.kubernetes.api.model.apps.DeploymentBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.NetworkPolicyBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.NetworkPolicyIngressRuleBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.NetworkPolicyPort;
import io.fabric8.kubernetes.api.model.networking.v1.NetworkPolicyPortBuilder;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps resource kinds onto Kubernetes objects.
 * <p>
 * network: Namespace; security-policy: NetworkPolicy admitting TCP ingress on {@code ingress_ports} to pods
 * labelled with the policy name; identity-role: ServiceAccount; registry: ConfigMap describing the image
 * repository; compute-service: Deployment plus Service running {@code image} on {@code port}.
 */
final class KubernetesManifests {
    static final String MANAGED_BY_LABEL = "app.kubernetes.io/managed-by";
    static final String MANAGED_BY = "resource-orchestrator";
    static final String KIND_LABEL = "orchestrator.netcracker.com/kind";
    static final String POLICY_LABEL = "orchestrator.netcracker.com/policy";
    static final String APP_LABEL = "app.kubernetes.io/name";
    static final String CIDR_ANNOTATION = "orchestrator.netcracker.com/cidr-block";
    static final int DEFAULT_PORT = 3000;

    private KubernetesManifests() {
    }

    static List<HasMetadata> build(ResourceKind kind, String name, String namespace, ProviderAttributes attributes) {
        Map<String, String> labels = labels(kind, attributes);
        return switch (kind) {
            case NETWORK -> List.of(new NamespaceBuilder()
                    .withNewMetadata()
                    .withName(name)
                    .withLabels(labels)
                    .withAnnotations(cidrAnnotation(attributes))
                    .endMetadata()
                    .build());
            case SECURITY_POLICY -> List.of(new NetworkPolicyBuilder()
                    .withNewMetadata()
                    .withName(name)
                    .withNamespace(namespace)
                    .withLabels(labels)
                    .endMetadata()
                    .withNewSpec()
                    .withNewPodSelector()
                    .withMatchLabels(Map.of(POLICY_LABEL, name))
                    .endPodSelector()
                    .withPolicyTypes("Ingress")
                    .withIngress(new NetworkPolicyIngressRuleBuilder()
                            .withPorts(ingressPorts(attributes))
                            .build())
                    .endSpec()
                    .build());
            case IDENTITY_ROLE -> List.of(new ServiceAccountBuilder()
                    .withNewMetadata()
                    .withName(name)
                    .withNamespace(namespace)
                    .withLabels(labels)
                    .endMetadata()
                    .build());
            case REGISTRY -> List.of(new ConfigMapBuilder()
                    .withNewMetadata()
                    .withName(name)
                    .withNamespace(namespace)
                    .withLabels(labels)
                    .endMetadata()
                    .withData(Map.of(
                            "host", attributes.requiredString("host"),
                            "repository", repository(name, attributes)))
                    .build());
            case COMPUTE_SERVICE -> computeService(name, namespace, labels, attributes);
        };
    }

    static Map<String, Object> outputs(ResourceKind kind, String id, String name, String namespace,
                                       ProviderAttributes attributes) {
        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("id", id);
        outputs.put("name", name);
        if (namespace != null) {
            outputs.put("namespace", namespace);
        }
        switch (kind) {
            case IDENTITY_ROLE -> outputs.put("principal", "system:serviceaccount:" + namespace + ":" + name);
            case REGISTRY -> outputs.put("repository_url",
                    attributes.requiredString("host") + "/" + repository(name, attributes));
            case COMPUTE_SERVICE -> outputs.put("endpoint",
                    "http://" + name + "." + namespace + ".svc.cluster.local:" + attributes.intValue("port", DEFAULT_PORT));
            default -> {
                // no kind specific outputs
            }
        }
        return outputs;
    }

    private static List<HasMetadata> computeService(String name, String namespace, Map<String, String> labels,
                                                    ProviderAttributes attributes) {
        int port = attributes.intValue("port", DEFAULT_PORT);
        Map<String, String> selector = Map.of(APP_LABEL, name);
        Map<String, String> podLabels = new HashMap<>(selector);
        String policy = attributes.optionalString("security_policy", null);
        if (policy != null) {
            podLabels.put(POLICY_LABEL, policy);
        }

        HasMetadata deployment = new DeploymentBuilder()
                .withNewMetadata()
                .withName(name)
                .withNamespace(namespace)
                .withLabels(labels)
                .endMetadata()
                .withNewSpec()
                .withReplicas(attributes.intValue("replicas", 1))
                .withNewSelector()
                .withMatchLabels(selector)
                .endSelector()
                .withNewTemplate()
                .withNewMetadata()
                .withLabels(podLabels)
                .endMetadata()
                .withNewSpec()
                .withServiceAccountName(attributes.optionalString("identity_role", null))
                .addNewContainer()
                .withName("app")
                .withImage(attributes.requiredString("image"))
                .addNewPort()
                .withContainerPort(port)
                .endPort()
                .addNewEnv()
                .withName("PORT")
                .withValue(String.valueOf(port))
                .endEnv()
                .endContainer()
                .endSpec()
                .endTemplate()
                .endSpec()
                .build();

        HasMetadata service = new ServiceBuilder()
                .withNewMetadata()
                .withName(name)
                .withNamespace(namespace)
                .withLabels(labels)
                .endMetadata()
                .withNewSpec()
                .withSelector(selector)
                .addNewPort()
                .withPort(port)
                .withTargetPort(new IntOrString(port))
                .endPort()
                .endSpec()
                .build();

        return List.of(deployment, service);
    }

    private static Map<String, String> labels(ResourceKind kind, ProviderAttributes attributes) {
        Map<String, String> labels = new HashMap<>(attributes.stringMap("tags"));
        labels.put(MANAGED_BY_LABEL, MANAGED_BY);
        labels.put(KIND_LABEL, kind.typeName());
        return labels;
    }

    private static Map<String, String> cidrAnnotation(ProviderAttributes attributes) {
        String cidr = attributes.optionalString("cidr_block", null);
        return cidr == null ? Map.of() : Map.of(CIDR_ANNOTATION, cidr);
    }

    private static List<NetworkPolicyPort> ingressPorts(ProviderAttributes attributes) {
        return attributes.intList("ingress_ports").stream()
                .map(port -> new NetworkPolicyPortBuilder()
                        .withProtocol("TCP")
                        .withPort(new IntOrString(port))
                        .build())
                .toList();
    }

    private static String repository(String name, ProviderAttributes attributes) {
        return attributes.optionalString("repository", name);
    }
}
