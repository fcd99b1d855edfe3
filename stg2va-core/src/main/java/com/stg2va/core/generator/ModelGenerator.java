package com.stg2va.core.generator;

import com.stg2va.core.analysis.StateGraph;
import com.stg2va.core.logic.PhaseTransitionTable;
import com.stg2va.core.model.PetriNet;

/**
 * Turns a compiled net into text.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.stg2va.core.generator.ModelGenerator}
 *
 * @see GeneratorConfig
 * @see GeneratedModel
 */
public interface ModelGenerator {

    /**
     * Returns unique identifier for this generator, e.g. {@code "veriloga"}.
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
     * Returns file extension for generated text.
     *
     * @return file extension without leading dot
     */
    String getFileExtension();

    /**
     * Generates text from the results of the earlier pipeline stages.
     *
     * <p>Implementations must be deterministic: the same inputs always yield the same text.
     *
     * @param net parsed net
     * @param graph reachable state graph of {@code net}
     * @param table phase transition table derived from {@code graph}
     * @param config generation settings
     * @return generated content
     */
    GeneratedModel generate(PetriNet net, StateGraph graph, PhaseTransitionTable table, GeneratorConfig config);
}
