package com.stg2va.core.logic;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import com.stg2va.core.model.Direction;
import com.stg2va.core.model.TransitionLabel;

/**
 * Set-valued mapping from (phase, signal, direction) to destination phases.
 *
 * <p>For a deterministic net every key has exactly one destination. Keys with several
 * destinations are kept as they are so the generated model can reject them at run time.
 * All views are sorted, which keeps generated text stable between runs.
 */
public final class PhaseTransitionTable {

    private final int phaseCount;
    private final int initialPhase;
    private final SortedMap<PhaseKey, SortedSet<Integer>> entries;
    private final List<Integer> deadEndPhases;
    private final SortedMap<String, Integer> initialLevels;

    PhaseTransitionTable(int phaseCount, int initialPhase,
                         SortedMap<PhaseKey, SortedSet<Integer>> entries,
                         List<Integer> deadEndPhases,
                         Map<String, Integer> initialLevels) {
        this.phaseCount = phaseCount;
        this.initialPhase = initialPhase;
        SortedMap<PhaseKey, SortedSet<Integer>> copy = new TreeMap<>();
        entries.forEach((key, destinations) ->
            copy.put(key, Collections.unmodifiableSortedSet(new TreeSet<>(destinations))));
        this.entries = Collections.unmodifiableSortedMap(copy);
        this.deadEndPhases = List.copyOf(deadEndPhases);
        this.initialLevels = Collections.unmodifiableSortedMap(new TreeMap<>(initialLevels));
    }

    public int phaseCount() {
        return phaseCount;
    }

    public int initialPhase() {
        return initialPhase;
    }

    /**
     * Returns every entry of the table.
     *
     * @return key to destinations, sorted by signal, direction and phase
     */
    public SortedMap<PhaseKey, SortedSet<Integer>> entries() {
        return entries;
    }

    /**
     * Looks up the destinations of an edge observed in a phase.
     *
     * @param phase current phase
     * @param signal signal name
     * @param direction edge direction
     * @return destination phases; empty when the edge is not enabled
     */
    public SortedSet<Integer> destinations(int phase, String signal, Direction direction) {
        SortedSet<Integer> destinations = entries.get(new PhaseKey(phase, signal, direction));
        return destinations != null ? destinations : Collections.emptySortedSet();
    }

    /**
     * Returns the (source, destination) pairs of one label.
     *
     * @param label signal event
     * @return pairs in ascending order
     */
    public NavigableSet<PhasePair> projection(TransitionLabel label) {
        NavigableSet<PhasePair> pairs = new TreeSet<>();
        entries.forEach((key, destinations) -> {
            if (key.signal().equals(label.signal()) && key.direction() == label.direction()) {
                destinations.forEach(destination -> pairs.add(new PhasePair(key.phase(), destination)));
            }
        });
        return Collections.unmodifiableNavigableSet(pairs);
    }

    /**
     * Returns the phases in which a signal has any outgoing edge.
     *
     * @param signal signal name
     * @return enabling phases in ascending order
     */
    public NavigableSet<Integer> enablingPhases(String signal) {
        NavigableSet<Integer> phases = new TreeSet<>();
        entries.keySet().stream()
            .filter(key -> key.signal().equals(signal))
            .forEach(key -> phases.add(key.phase()));
        return Collections.unmodifiableNavigableSet(phases);
    }

    /**
     * Returns the phases in which one edge of a signal is enabled.
     *
     * @param signal signal name
     * @param direction edge direction
     * @return enabling phases in ascending order
     */
    public NavigableSet<Integer> enablingPhases(String signal, Direction direction) {
        NavigableSet<Integer> phases = new TreeSet<>();
        entries.keySet().stream()
            .filter(key -> key.signal().equals(signal) && key.direction() == direction)
            .forEach(key -> phases.add(key.phase()));
        return Collections.unmodifiableNavigableSet(phases);
    }

    /**
     * Checks whether a signal has an outgoing edge in a phase.
     *
     * @param phase phase identifier
     * @param signal signal name
     * @return true if some edge of the signal is enabled
     */
    public boolean isEnabled(int phase, String signal) {
        for (Direction direction : Direction.values()) {
            if (entries.containsKey(new PhaseKey(phase, signal, direction))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns keys that lead to more than one destination.
     *
     * @return non-deterministic entries
     */
    public SortedMap<PhaseKey, SortedSet<Integer>> nondeterministicEntries() {
        SortedMap<PhaseKey, SortedSet<Integer>> ambiguous = new TreeMap<>();
        for (Map.Entry<PhaseKey, SortedSet<Integer>> entry : entries.entrySet()) {
            if (entry.getValue().size() > 1) {
                ambiguous.put(entry.getKey(), entry.getValue());
            }
        }
        return Collections.unmodifiableSortedMap(ambiguous);
    }

    public boolean isDeterministic() {
        return entries.values().stream().allMatch(destinations -> destinations.size() == 1);
    }

    /**
     * Returns phases without any outgoing edge.
     *
     * @return dead-end phases in ascending order
     */
    public List<Integer> deadEndPhases() {
        return deadEndPhases;
    }

    /**
     * Returns the logic level of a signal in the initial phase, when the graph determines it.
     *
     * <p>A signal whose first reachable edge is a rise starts low; one whose first edge is a
     * fall starts high. Signals reached only through toggles, or through both rises and falls,
     * have no inferred level.
     *
     * @param signal signal name
     * @return 0 or 1, or empty when unknown
     */
    public OptionalInt initialLevel(String signal) {
        Integer level = initialLevels.get(signal);
        return level != null ? OptionalInt.of(level) : OptionalInt.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PhaseTransitionTable other)) {
            return false;
        }
        return phaseCount == other.phaseCount
            && initialPhase == other.initialPhase
            && entries.equals(other.entries)
            && initialLevels.equals(other.initialLevels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(phaseCount, initialPhase, entries, initialLevels);
    }

    @Override
    public String toString() {
        return "PhaseTransitionTable{phases=" + phaseCount + ", entries=" + entries.size() + "}";
    }
}
