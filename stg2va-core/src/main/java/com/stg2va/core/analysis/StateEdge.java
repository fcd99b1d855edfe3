package com.stg2va.core.analysis;

import java.util.Objects;

import com.stg2va.core.model.TransitionLabel;

/**
 * One transition firing between two phases of a {@link StateGraph}.
 *
 * @param source phase the firing starts from
 * @param transition index of the fired transition in the net
 * @param label signal event of the fired transition
 * @param destination phase reached by the firing
 */
public record StateEdge(
    int source,
    int transition,
    TransitionLabel label,
    int destination
) {
    /**
     * Compact constructor with validation.
     */
    public StateEdge {
        Objects.requireNonNull(label, "label must not be null");
        if (source < 0 || destination < 0 || transition < 0) {
            throw new IllegalArgumentException("phase and transition indices must not be negative");
        }
    }
}
