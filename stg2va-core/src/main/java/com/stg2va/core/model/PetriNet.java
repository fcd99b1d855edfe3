package com.stg2va.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Parsed Signal Transition Graph.
 *
 * <p>Places and transitions live in flat lists and refer to each other by index only.
 * The initial marking is part of the net and never changes.
 *
 * @param name model name from the {@code .model} line
 * @param signals declared signals in declaration order (dummies included)
 * @param places place arena
 * @param transitions transition arena
 * @param initialMarking tokened places before any firing
 */
public record PetriNet(
    String name,
    List<Signal> signals,
    List<Place> places,
    List<Transition> transitions,
    Marking initialMarking
) {
    /**
     * Compact constructor with validation.
     */
    public PetriNet {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(initialMarking, "initialMarking must not be null");
        signals = signals == null ? List.of() : List.copyOf(signals);
        places = places == null ? List.of() : List.copyOf(places);
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
    }

    /**
     * Looks up a signal by name.
     *
     * @param signalName signal name
     * @return the signal, or empty if undeclared
     */
    public Optional<Signal> signal(String signalName) {
        return signals.stream()
            .filter(signal -> signal.name().equals(signalName))
            .findFirst();
    }

    /**
     * Returns the declared signals of one role, in declaration order.
     *
     * @param role signal role
     * @return matching signals
     */
    public List<Signal> signalsWithRole(SignalRole role) {
        return signals.stream()
            .filter(signal -> signal.role() == role)
            .toList();
    }

    /**
     * Returns signals that have a wire (everything but dummies).
     *
     * @return physical signals in declaration order
     */
    public List<Signal> physicalSignals() {
        return signals.stream()
            .filter(signal -> signal.role().isPhysical())
            .toList();
    }

    /**
     * Groups transition indices by label.
     *
     * @return label to transition indices, labels sorted
     */
    public SortedMap<TransitionLabel, List<Integer>> transitionsByLabel() {
        Map<TransitionLabel, List<Integer>> grouped = new LinkedHashMap<>();
        for (Transition transition : transitions) {
            grouped.computeIfAbsent(transition.label(), label -> new ArrayList<>()).add(transition.index());
        }
        SortedMap<TransitionLabel, List<Integer>> sorted = new TreeMap<>();
        grouped.forEach((label, ids) -> sorted.put(label, Collections.unmodifiableList(ids)));
        return Collections.unmodifiableSortedMap(sorted);
    }

    /**
     * Renders a marking with place names, e.g. {@code {p0, <a+,b->}}.
     *
     * @param marking marking over this net
     * @return readable marking
     */
    public String describe(Marking marking) {
        List<String> names = marking.markedPlaces().stream()
            .map(index -> places.get(index).name())
            .toList();
        return "{" + String.join(", ", names) + "}";
    }
}
