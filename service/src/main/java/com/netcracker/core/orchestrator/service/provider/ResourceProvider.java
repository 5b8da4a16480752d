package com.netcracker.core.orchestrator.service.provider;

import com.netcracker.core.orchestrator.model.ResourceKind;

import java.util.Map;
import java.util.Optional;

/**
 * Remote API that actually provisions resources.
 * <p>
 * Attributes handed to a provider never contain references; they are substituted beforehand.
 * Outputs returned from {@link #create} and {@link #update} must contain {@value #ID_OUTPUT},
 * the identifier later passed back to {@link #update}, {@link #destroy} and {@link #describe}.
 * Failures are reported with {@link ProviderActionException}.
 */
public interface ResourceProvider {
    String ID_OUTPUT = "id";

    Map<String, Object> create(ResourceKind kind, Map<String, Object> attributes);

    Map<String, Object> update(String id, ResourceKind kind, Map<String, Object> attributes);

    void destroy(String id, ResourceKind kind);

    /**
     * Current attributes of a live instance, or empty when the provider does not know the instance.
     */
    Optional<Map<String, Object>> describe(String id, ResourceKind kind);
}
