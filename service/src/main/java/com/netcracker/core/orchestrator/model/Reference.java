package com.netcracker.core.orchestrator.model;

/**
 * A {@code ${type.name.attribute}} expression found in an attribute value.
 * The target is kept as written; it is matched against declared resources by the graph builder.
 */
public record Reference(String targetType, String targetName, String attribute) {

    public String targetKey() {
        return targetType + "." + targetName;
    }

    public String expression() {
        return "${" + targetKey() + "." + attribute + "}";
    }

    @Override
    public String toString() {
        return targetKey() + "." + attribute;
    }
}
