package com.stg2va.core.logic;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.stg2va.core.analysis.StateEdge;
import com.stg2va.core.analysis.StateGraph;
import com.stg2va.core.model.Direction;

/**
 * Derives the {@link PhaseTransitionTable} from a finished {@link StateGraph}.
 *
 * <p>Every phase is its own state; no attempt is made to merge phases with equal futures.
 * Each edge of the graph contributes exactly one (phase, label) to destination entry.
 */
public class SignalLogicDeriver {

    private static final Logger log = LoggerFactory.getLogger(SignalLogicDeriver.class);

    /**
     * Projects the state graph edges onto a phase transition table.
     *
     * @param graph reachable state graph
     * @return phase transition table
     */
    public PhaseTransitionTable derive(StateGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");

        SortedMap<PhaseKey, SortedSet<Integer>> entries = new TreeMap<>();
        for (StateEdge edge : graph.edges()) {
            entries.computeIfAbsent(PhaseKey.of(edge.source(), edge.label()), key -> new TreeSet<>())
                .add(edge.destination());
        }

        PhaseTransitionTable table = new PhaseTransitionTable(
            graph.phaseCount(), graph.initialPhase(), entries, graph.deadEndPhases(),
            initialLevels(graph));

        log.debug("Derived phase table with {} entries", entries.size());
        if (!table.isDeterministic()) {
            table.nondeterministicEntries().forEach((key, destinations) ->
                log.warn("{} in phase {} leads to several phases {}; left to the runtime check",
                    key.label(), key.phase(), destinations));
        }
        return table;
    }

    private Map<String, Integer> initialLevels(StateGraph graph) {
        Set<String> signals = new TreeSet<>();
        graph.edges().forEach(edge -> signals.add(edge.label().signal()));

        Map<String, Integer> levels = new TreeMap<>();
        for (String signal : signals) {
            Set<Direction> firstEdges = firstEdgesOf(graph, signal);
            if (firstEdges.equals(EnumSet.of(Direction.RISE))) {
                levels.put(signal, 0);
            } else if (firstEdges.equals(EnumSet.of(Direction.FALL))) {
                levels.put(signal, 1);
            } else if (firstEdges.contains(Direction.RISE) && firstEdges.contains(Direction.FALL)) {
                log.warn("Initial level of '{}' is ambiguous: both {}+ and {}- can occur first",
                    signal, signal, signal);
            }
        }
        return levels;
    }

    /**
     * Collects the directions of the edges of a signal reachable from the initial phase
     * without passing through another edge of that signal.
     */
    private static Set<Direction> firstEdgesOf(StateGraph graph, String signal) {
        Set<Direction> found = EnumSet.noneOf(Direction.class);
        boolean[] visited = new boolean[graph.phaseCount()];
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(graph.initialPhase());
        visited[graph.initialPhase()] = true;

        while (!queue.isEmpty()) {
            int phase = queue.poll();
            for (StateEdge edge : graph.outgoing(phase)) {
                if (edge.label().signal().equals(signal)) {
                    found.add(edge.label().direction());
                } else if (!visited[edge.destination()]) {
                    visited[edge.destination()] = true;
                    queue.add(edge.destination());
                }
            }
        }
        return found;
    }
}
