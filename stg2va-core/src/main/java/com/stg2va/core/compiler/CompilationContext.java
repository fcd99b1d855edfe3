package com.stg2va.core.compiler;

import java.util.Objects;

import com.stg2va.core.analysis.StateGraph;
import com.stg2va.core.generator.GeneratedModel;
import com.stg2va.core.generator.GeneratorConfig;
import com.stg2va.core.logic.PhaseTransitionTable;
import com.stg2va.core.model.PetriNet;

/**
 * State of one compilation, handed from stage to stage.
 *
 * <p>Each stage returns a new context with its own result filled in; results of stages that did
 * not run yet are {@code null}.
 *
 * @param sourceName name of the compiled source, used in diagnostics
 * @param config generation settings
 * @param maxPhases phase ceiling of the reachability analysis
 * @param net parsed net
 * @param graph reachable state graph
 * @param table phase transition table
 * @param model generated text
 */
public record CompilationContext(
    String sourceName,
    GeneratorConfig config,
    int maxPhases,
    PetriNet net,
    StateGraph graph,
    PhaseTransitionTable table,
    GeneratedModel model
) {
    /**
     * Compact constructor with validation.
     */
    public CompilationContext {
        Objects.requireNonNull(sourceName, "sourceName must not be null");
        Objects.requireNonNull(config, "config must not be null");
        if (maxPhases <= 0) {
            throw new IllegalArgumentException("maxPhases must be positive");
        }
    }

    /**
     * Creates the context of a compilation that has not run any stage yet.
     *
     * @param sourceName name of the compiled source
     * @param config generation settings
     * @param maxPhases phase ceiling
     * @return empty context
     */
    public static CompilationContext start(String sourceName, GeneratorConfig config, int maxPhases) {
        return new CompilationContext(sourceName, config, maxPhases, null, null, null, null);
    }

    public CompilationContext withNet(PetriNet value) {
        return new CompilationContext(sourceName, config, maxPhases, value, graph, table, model);
    }

    public CompilationContext withGraph(StateGraph value) {
        return new CompilationContext(sourceName, config, maxPhases, net, value, table, model);
    }

    public CompilationContext withTable(PhaseTransitionTable value) {
        return new CompilationContext(sourceName, config, maxPhases, net, graph, value, model);
    }

    public CompilationContext withModel(GeneratedModel value) {
        return new CompilationContext(sourceName, config, maxPhases, net, graph, table, value);
    }
}
