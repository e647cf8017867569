package com.infragraph.core.generator.impl;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.infragraph.core.generator.DiagramGenerator;
import com.infragraph.core.generator.GeneratedDiagram;
import com.infragraph.core.generator.GeneratorConfig;
import com.infragraph.core.model.LayoutReadyGraph;

/**
 * Serializes the layout-ready graph as JSON for rendering backends in other tools.
 *
 * <p>Record components are written as they are; {@code isX()} helper methods are not.
 */
public class JsonGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(JsonGenerator.class);

    private static final String GENERATOR_ID = "json";
    private static final String GENERATOR_DISPLAY_NAME = "Layout-Ready Graph JSON";
    private static final String FILE_EXTENSION = "json";
    private static final String DIAGRAM_NAME = "infrastructure";

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .setVisibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE);

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public GeneratedDiagram generate(LayoutReadyGraph graph, GeneratorConfig config) {
        Objects.requireNonNull(graph, "graph must not be null");
        try {
            String json = MAPPER.writeValueAsString(graph);
            log.debug("Serialized graph to {} characters of JSON", json.length());
            return new GeneratedDiagram(DIAGRAM_NAME, json + "\n", getFileExtension());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize graph: " + e.getOriginalMessage(), e);
        }
    }
}
