package com.netcracker.core.orchestrator.service.graph;

import com.netcracker.core.orchestrator.model.Reference;
import com.netcracker.core.orchestrator.model.References;
import com.netcracker.core.orchestrator.model.Resource;
import com.netcracker.core.orchestrator.model.ResourceId;
import com.netcracker.core.orchestrator.model.ResourceKind;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns declarations into a {@link ResourceGraph}.
 * <p>
 * Edges come from {@code ${type.name.attribute}} references in attribute values and from
 * {@code depends_on} entries. Duplicate identities and references to resources that are not
 * declared are rejected here, before anything is planned.
 */
@ApplicationScoped
@Slf4j
public class ResourceGraphBuilder {

    public ResourceGraph build(DeclarationDocument document) {
        Map<ResourceId, Resource> resources = new LinkedHashMap<>();
        Map<String, ResourceId> idsByKey = new LinkedHashMap<>();

        List<ResourceDeclaration> declarations = document.resources();
        for (int index = 0; index < declarations.size(); index++) {
            ResourceDeclaration declaration = declarations.get(index);
            ResourceId id = toResourceId(declaration, index);
            if (idsByKey.putIfAbsent(id.toString(), id) != null) {
                throw new DuplicateResourceException(id);
            }
            resources.put(id, new Resource(id, declaration.attributes(),
                    resolveExplicitDependencies(id, declaration.dependsOn(), declarations), index));
        }

        Map<ResourceId, Set<ResourceId>> dependencies = new LinkedHashMap<>();
        for (Resource resource : resources.values()) {
            Set<ResourceId> edges = new LinkedHashSet<>();
            resource.attributes().forEach((attribute, value) -> {
                for (Reference reference : References.collect(value)) {
                    edges.add(lookup(idsByKey, resource.id() + "." + attribute, reference.targetKey()));
                }
            });
            for (ResourceId explicit : resource.dependsOn()) {
                edges.add(lookup(idsByKey, resource.id() + ".depends_on", explicit.toString()));
            }
            dependencies.put(resource.id(), Set.copyOf(edges));
        }

        document.outputs().forEach((name, value) -> {
            for (Reference reference : References.collect(value)) {
                lookup(idsByKey, "output." + name, reference.targetKey());
            }
        });

        log.debug("Built resource graph with {} resources", resources.size());
        return new ResourceGraph(resources, dependencies, document.outputs());
    }

    private ResourceId toResourceId(ResourceDeclaration declaration, int index) {
        if (declaration.type() == null || declaration.name() == null) {
            throw new DeclarationParseException("Resource declaration #" + (index + 1) + " must have a type and a name");
        }
        ResourceKind kind = ResourceKind.fromTypeName(declaration.type())
                .orElseThrow(() -> new DeclarationParseException(
                        "Unknown resource type '" + declaration.type() + "' for '" + declaration.name() + "'"));
        try {
            return new ResourceId(kind, declaration.name());
        } catch (IllegalArgumentException e) {
            throw new DeclarationParseException(e.getMessage(), e);
        }
    }

    private Set<ResourceId> resolveExplicitDependencies(ResourceId id,
                                                        List<String> dependsOn,
                                                        List<ResourceDeclaration> declarations) {
        Set<ResourceId> result = new LinkedHashSet<>();
        for (String target : dependsOn) {
            ResourceId targetId;
            try {
                targetId = ResourceId.parse(target);
            } catch (IllegalArgumentException e) {
                throw new UndeclaredReferenceException(id + ".depends_on", target);
            }
            boolean declared = declarations.stream()
                    .anyMatch(other -> targetId.kind().typeName().equals(other.type())
                                       && targetId.name().equals(other.name()));
            if (!declared) {
                throw new UndeclaredReferenceException(id + ".depends_on", target);
            }
            result.add(targetId);
        }
        return result;
    }

    private static ResourceId lookup(Map<String, ResourceId> idsByKey, String source, String targetKey) {
        ResourceId target = idsByKey.get(targetKey);
        if (target == null) {
            throw new UndeclaredReferenceException(source, targetKey);
        }
        return target;
    }
}
