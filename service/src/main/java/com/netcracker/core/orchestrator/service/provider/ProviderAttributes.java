package com.netcracker.core.orchestrator.service.provider;

import com.netcracker.core.orchestrator.model.ResourceKind;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed access to resolved attribute values for provider implementations.
 */
public final class ProviderAttributes {
    private final ResourceKind kind;
    private final Map<String, Object> values;

    public ProviderAttributes(ResourceKind kind, Map<String, Object> values) {
        this.kind = kind;
        this.values = values;
    }

    public String requiredString(String name) {
        String value = optionalString(name, null);
        if (value == null || value.isBlank()) {
            throw new ProviderActionException(kind + " requires attribute '" + name + "'");
        }
        return value;
    }

    public String optionalString(String name, String defaultValue) {
        Object value = values.get(name);
        return value == null ? defaultValue : String.valueOf(value);
    }

    public int intValue(String name, int defaultValue) {
        Object value = values.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new ProviderActionException(kind + " attribute '" + name + "' must be an integer, got '" + value + "'", e);
        }
    }

    public List<Integer> intList(String name) {
        Object value = values.get(name);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            return List.of(intValue(name, 0));
        }
        return list.stream()
                .map(item -> new ProviderAttributes(kind, Map.of(name, item)).intValue(name, 0))
                .toList();
    }

    public Map<String, String> stringMap(String name) {
        Object value = values.get(name);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new ProviderActionException(kind + " attribute '" + name + "' must be a map");
        }
        Map<String, String> result = new LinkedHashMap<>();
        map.forEach((key, item) -> result.put(String.valueOf(key), String.valueOf(item)));
        return result;
    }
}
