package com.netcracker.core.orchestrator.model;

import java.util.Collection;
import java.util.Set;

/**
 * Decides whether a set of changed attributes can be applied in place or
 * requires the resource to be replaced.
 *
 * @param replaceByDefault when {@code true} every change replaces the resource except changes limited
 *                         to {@code exceptions}; when {@code false} every change is applied in place
 *                         unless it touches one of {@code exceptions}
 * @param exceptions       attribute names that invert the default behaviour
 */
public record UpdatePolicy(boolean replaceByDefault, Set<String> exceptions) {

    public UpdatePolicy {
        exceptions = Set.copyOf(exceptions);
    }

    public static UpdatePolicy replaceExcept(String... inPlaceAttributes) {
        return new UpdatePolicy(true, Set.of(inPlaceAttributes));
    }

    public static UpdatePolicy inPlaceExcept(String... forceNewAttributes) {
        return new UpdatePolicy(false, Set.of(forceNewAttributes));
    }

    public boolean requiresReplacement(Collection<String> changedAttributes) {
        if (replaceByDefault) {
            return changedAttributes.stream().anyMatch(name -> !exceptions.contains(name));
        }
        return changedAttributes.stream().anyMatch(exceptions::contains);
    }
}
