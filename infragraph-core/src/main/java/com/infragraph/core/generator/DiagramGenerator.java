package com.infragraph.core.generator;

import com.infragraph.core.model.LayoutReadyGraph;

/**
 * Interface for generators that turn a {@link LayoutReadyGraph} into a text diagram.
 *
 * <p>Generators consume the graph as it is: nodes, styled edges, the cluster forest and
 * the derived {@link com.infragraph.core.model.LayoutParams}. They never change layout
 * decisions.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.infragraph.core.generator.DiagramGenerator}
 *
 * @see GeneratorConfig
 * @see GeneratedDiagram
 */
public interface DiagramGenerator {

    /**
     * Returns unique identifier for this generator.
     *
     * <p>Used for selecting the generator on the command line and in configuration
     * (e.g., "mermaid", "dot").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for generated diagrams.
     *
     * @return file extension without leading dot
     */
    String getFileExtension();

    /**
     * Generates a diagram.
     *
     * <p>An empty graph yields a meaningful placeholder diagram, never an error.
     *
     * @param graph layout-ready graph
     * @param config generation settings
     * @return generated diagram content
     */
    GeneratedDiagram generate(LayoutReadyGraph graph, GeneratorConfig config);
}
