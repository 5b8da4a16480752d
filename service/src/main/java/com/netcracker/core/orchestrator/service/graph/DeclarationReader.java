package com.netcracker.core.orchestrator.service.graph;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads declaration documents. Files ending in {@code .yaml} or {@code .yml} are read as YAML,
 * everything else as JSON.
 */
@ApplicationScoped
@Slf4j
public class DeclarationReader {
    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    @Inject
    public DeclarationReader(ObjectMapper objectMapper) {
        this.jsonMapper = objectMapper.copy()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.yamlMapper = YAMLMapper.builder()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public DeclarationDocument read(Path path) {
        log.debug("Reading declarations from {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            DeclarationDocument document = mapperFor(path).readValue(in, DeclarationDocument.class);
            if (document == null) {
                throw new DeclarationParseException("Declaration file '" + path + "' is empty");
            }
            return document;
        } catch (NoSuchFileException e) {
            throw new DeclarationParseException("Declaration file '" + path + "' does not exist", e);
        } catch (IOException e) {
            throw new DeclarationParseException("Failed to parse declaration file '" + path + "': " + e.getMessage(), e);
        }
    }

    private ObjectMapper mapperFor(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".yaml") || fileName.endsWith(".yml") ? yamlMapper : jsonMapper;
    }
}
