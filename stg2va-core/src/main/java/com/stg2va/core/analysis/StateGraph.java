package com.stg2va.core.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.stg2va.core.model.Marking;

/**
 * Explicit reachable state space of a net.
 *
 * <p>Phase {@code i} is the {@code i}-th distinct marking discovered by breadth-first
 * exploration; phase {@code 0} is always the initial marking. Edges are kept in discovery
 * order and indexed by source phase once, on construction.
 */
public final class StateGraph {

    /** Phase of the initial marking. */
    public static final int INITIAL_PHASE = 0;

    private final List<Marking> phases;
    private final List<StateEdge> edges;
    private final List<List<StateEdge>> outgoing;

    /**
     * Creates a state graph.
     *
     * @param phases reachable markings, indexed by phase
     * @param edges every observed firing
     */
    public StateGraph(List<Marking> phases, List<StateEdge> edges) {
        Objects.requireNonNull(phases, "phases must not be null");
        Objects.requireNonNull(edges, "edges must not be null");
        if (phases.isEmpty()) {
            throw new IllegalArgumentException("a state graph has at least the initial phase");
        }
        this.phases = List.copyOf(phases);
        this.edges = List.copyOf(edges);

        List<List<StateEdge>> bySource = new ArrayList<>(this.phases.size());
        for (int phase = 0; phase < this.phases.size(); phase++) {
            bySource.add(new ArrayList<>());
        }
        for (StateEdge edge : this.edges) {
            if (edge.source() >= this.phases.size() || edge.destination() >= this.phases.size()) {
                throw new IllegalArgumentException("edge " + edge + " leaves the phase range");
            }
            bySource.get(edge.source()).add(edge);
        }
        this.outgoing = bySource.stream().map(Collections::unmodifiableList).toList();
    }

    public List<Marking> phases() {
        return phases;
    }

    public List<StateEdge> edges() {
        return edges;
    }

    public int phaseCount() {
        return phases.size();
    }

    public int initialPhase() {
        return INITIAL_PHASE;
    }

    /**
     * Returns the marking of a phase.
     *
     * @param phase phase identifier
     * @return marking
     */
    public Marking marking(int phase) {
        return phases.get(phase);
    }

    /**
     * Returns the edges leaving a phase.
     *
     * @param phase phase identifier
     * @return outgoing edges in discovery order
     */
    public List<StateEdge> outgoing(int phase) {
        return outgoing.get(phase);
    }

    /**
     * Returns phases without any outgoing edge.
     *
     * @return dead-end phases in ascending order
     */
    public List<Integer> deadEndPhases() {
        List<Integer> deadEnds = new ArrayList<>();
        for (int phase = 0; phase < outgoing.size(); phase++) {
            if (outgoing.get(phase).isEmpty()) {
                deadEnds.add(phase);
            }
        }
        return Collections.unmodifiableList(deadEnds);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StateGraph other)) {
            return false;
        }
        return phases.equals(other.phases) && edges.equals(other.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(phases, edges);
    }

    @Override
    public String toString() {
        return "StateGraph{phases=" + phases.size() + ", edges=" + edges.size() + "}";
    }
}
