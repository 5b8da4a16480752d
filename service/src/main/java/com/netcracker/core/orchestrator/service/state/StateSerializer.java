package com.netcracker.core.orchestrator.service.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Collection;
import java.util.List;

/**
 * JSON encoding of state entries shared by all backends.
 */
@ApplicationScoped
public class StateSerializer {
    private final ObjectMapper objectMapper;

    @Inject
    public StateSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public String serialize(ResourceState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Failed to serialize state of '" + state.id() + "'", e);
        }
    }

    public ResourceState deserialize(String json, String source) {
        try {
            ResourceState state = objectMapper.readValue(json, ResourceState.class);
            if (state == null) {
                throw new StateCorruptionException("State entry '" + source + "' is empty");
            }
            return state;
        } catch (JsonProcessingException e) {
            throw new StateCorruptionException("State entry '" + source + "' cannot be decoded", e);
        }
    }

    String serializeDocument(Collection<ResourceState> states) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(new StateDocument(StateDocument.CURRENT_VERSION, List.copyOf(states)));
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Failed to serialize state document", e);
        }
    }

    List<ResourceState> deserializeDocument(String json, String source) {
        try {
            StateDocument document = objectMapper.readValue(json, StateDocument.class);
            if (document == null) {
                return List.of();
            }
            if (document.version() > StateDocument.CURRENT_VERSION) {
                throw new StateCorruptionException("State document '" + source + "' has unsupported version "
                                                   + document.version());
            }
            return document.resources();
        } catch (JsonProcessingException e) {
            throw new StateCorruptionException("State document '" + source + "' cannot be decoded", e);
        }
    }
}
