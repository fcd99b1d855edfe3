package com.stg2va.core.analysis;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.stg2va.core.error.StateExplosionException;
import com.stg2va.core.error.UnsafeNetException;
import com.stg2va.core.model.Marking;
import com.stg2va.core.model.PetriNet;
import com.stg2va.core.model.Transition;

/**
 * Plays the token game of a 1-safe net and records its reachable state space.
 *
 * <p>A transition is enabled when all of its input places are marked. Before the firing is
 * applied every output place that is not also consumed by the transition must be empty;
 * otherwise the net is not 1-safe and an {@link UnsafeNetException} is raised. No marking with
 * two tokens on a place is ever built, and no edge is recorded for the offending firing.
 *
 * <p>Exploration is breadth-first from the initial marking. Transitions are tried in arena
 * order, so phase numbers only depend on the net text. Conflicting edges that share a label
 * from one phase are all kept.
 */
public class ReachabilityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ReachabilityAnalyzer.class);

    /** Default phase ceiling. */
    public static final int DEFAULT_MAX_PHASES = 100_000;

    private final int maxPhases;

    public ReachabilityAnalyzer() {
        this(DEFAULT_MAX_PHASES);
    }

    /**
     * Creates an analyzer with a phase ceiling.
     *
     * @param maxPhases largest number of phases that may be discovered
     */
    public ReachabilityAnalyzer(int maxPhases) {
        if (maxPhases < 1) {
            throw new IllegalArgumentException("maxPhases must be positive");
        }
        this.maxPhases = maxPhases;
    }

    public int getMaxPhases() {
        return maxPhases;
    }

    /**
     * Builds the state graph of a net.
     *
     * @param net parsed net
     * @return reachable state graph
     * @throws UnsafeNetException if a firing would violate 1-safety
     * @throws StateExplosionException if more than {@code maxPhases} phases are reachable
     */
    public StateGraph analyze(PetriNet net) {
        Objects.requireNonNull(net, "net must not be null");

        List<Marking> phases = new ArrayList<>();
        Map<Marking, Integer> phaseOf = new HashMap<>();
        List<StateEdge> edges = new ArrayList<>();
        Deque<Integer> frontier = new ArrayDeque<>();

        phases.add(net.initialMarking());
        phaseOf.put(net.initialMarking(), StateGraph.INITIAL_PHASE);
        frontier.add(StateGraph.INITIAL_PHASE);

        while (!frontier.isEmpty()) {
            int source = frontier.poll();
            BitSet tokens = phases.get(source).tokens();

            for (Transition transition : net.transitions()) {
                if (!isEnabled(transition, tokens)) {
                    continue;
                }
                Marking next = fire(net, source, transition, tokens);
                Integer destination = phaseOf.get(next);
                if (destination == null) {
                    if (phases.size() >= maxPhases) {
                        log.error("State space of '{}' exceeds {} phases", net.name(), maxPhases);
                        throw new StateExplosionException(maxPhases);
                    }
                    destination = phases.size();
                    phases.add(next);
                    phaseOf.put(next, destination);
                    frontier.add(destination);
                }
                edges.add(new StateEdge(source, transition.index(), transition.label(), destination));
            }
        }

        StateGraph graph = new StateGraph(phases, edges);
        log.info("Explored '{}': {} phases, {} edges", net.name(), graph.phaseCount(), edges.size());
        List<Integer> deadEnds = graph.deadEndPhases();
        if (!deadEnds.isEmpty()) {
            log.warn("Phases without any enabled transition: {}", deadEnds);
        }
        return graph;
    }

    private static boolean isEnabled(Transition transition, BitSet tokens) {
        for (int place : transition.inputPlaces()) {
            if (!tokens.get(place)) {
                return false;
            }
        }
        return true;
    }

    private static Marking fire(PetriNet net, int phase, Transition transition, BitSet tokens) {
        BitSet next = (BitSet) tokens.clone();
        for (int place : transition.inputPlaces()) {
            next.clear(place);
        }
        for (int place : transition.outputPlaces()) {
            if (next.get(place)) {
                throw new UnsafeNetException(phase, transition.name(),
                    net.places().get(place).name(), net.describe(new Marking(tokens)));
            }
            next.set(place);
        }
        return new Marking(next);
    }
}
