package com.stg2va.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A labeled net transition, addressed by its index in {@link PetriNet#transitions()}.
 *
 * @param index arena index
 * @param name transition identity as written in the source, e.g. {@code req+/2}
 * @param label signal event
 * @param inputPlaces indices of the preset places, in arc order
 * @param outputPlaces indices of the postset places, in arc order
 */
public record Transition(
    int index,
    String name,
    TransitionLabel label,
    List<Integer> inputPlaces,
    List<Integer> outputPlaces
) {
    /**
     * Compact constructor with validation.
     */
    public Transition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(label, "label must not be null");
        inputPlaces = inputPlaces == null ? List.of() : List.copyOf(inputPlaces);
        outputPlaces = outputPlaces == null ? List.of() : List.copyOf(outputPlaces);
    }
}
