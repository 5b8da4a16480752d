package com.netcracker.core.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Identity of a resource inside a graph: its kind plus the logical name given in the declaration.
 * The textual form is {@code <type>.<name>}, e.g. {@code network.main}.
 */
public record ResourceId(ResourceKind kind, String name) {
    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z0-9_-]+");

    public ResourceId {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid resource name '" + name + "'");
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ResourceId parse(String value) {
        int separator = value.indexOf('.');
        if (separator <= 0 || separator == value.length() - 1) {
            throw new IllegalArgumentException("Invalid resource id '" + value + "', expected <type>.<name>");
        }
        ResourceKind kind = ResourceKind.fromTypeName(value.substring(0, separator))
                .orElseThrow(() -> new IllegalArgumentException("Unknown resource type in '" + value + "'"));
        return new ResourceId(kind, value.substring(separator + 1));
    }

    @JsonValue
    @Override
    public String toString() {
        return kind.typeName() + "." + name;
    }
}
