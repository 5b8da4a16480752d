package com.netcracker.core.orchestrator.service.provider;

import com.netcracker.core.orchestrator.model.ResourceKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Provider keeping instances in memory. Ids are {@code <type>-<sequence>}; a registry's
 * {@code repository_url} follows its {@code host} attribute.
 */
public class FakeResourceProvider implements ResourceProvider {
    private final Map<String, Map<String, Object>> instances = new ConcurrentHashMap<>();
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    private final Set<ResourceKind> failingCreates = Collections.synchronizedSet(EnumSet.noneOf(ResourceKind.class));
    private final Set<String> failingDestroys = ConcurrentHashMap.newKeySet();
    private final AtomicInteger sequence = new AtomicInteger();

    @Override
    public Map<String, Object> create(ResourceKind kind, Map<String, Object> attributes) {
        calls.add("create " + kind);
        if (failingCreates.contains(kind)) {
            throw new IllegalStateException("quota exceeded for " + kind);
        }
        String id = kind.typeName() + "-" + sequence.incrementAndGet();
        instances.put(id, Map.copyOf(attributes));
        return outputs(kind, id, attributes);
    }

    @Override
    public Map<String, Object> update(String id, ResourceKind kind, Map<String, Object> attributes) {
        calls.add("update " + id);
        instances.put(id, Map.copyOf(attributes));
        return outputs(kind, id, attributes);
    }

    @Override
    public void destroy(String id, ResourceKind kind) {
        calls.add("destroy " + id);
        if (failingDestroys.contains(id)) {
            throw new ProviderActionException("cannot destroy " + id);
        }
        instances.remove(id);
    }

    @Override
    public Optional<Map<String, Object>> describe(String id, ResourceKind kind) {
        return Optional.ofNullable(instances.get(id));
    }

    public FakeResourceProvider failCreate(ResourceKind kind) {
        failingCreates.add(kind);
        return this;
    }

    public FakeResourceProvider failDestroy(String id) {
        failingDestroys.add(id);
        return this;
    }

    public void forget(String id) {
        instances.remove(id);
    }

    public void reset() {
        failingCreates.clear();
        failingDestroys.clear();
        calls.clear();
    }

    public List<String> calls() {
        return List.copyOf(calls);
    }

    public Set<String> instanceIds() {
        return Set.copyOf(instances.keySet());
    }

    private static Map<String, Object> outputs(ResourceKind kind, String id, Map<String, Object> attributes) {
        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put(ID_OUTPUT, id);
        outputs.put("name", id);
        switch (kind) {
            case IDENTITY_ROLE -> outputs.put("principal", "principal:" + id);
            case REGISTRY -> outputs.put("repository_url", attributes.getOrDefault("host", "registry.local") + "/" + id);
            case COMPUTE_SERVICE -> outputs.put("endpoint", "http://" + id + ":3000");
            default -> {
            }
        }
        return outputs;
    }
}
