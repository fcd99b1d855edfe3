package com.stg2va.core.logic;

import java.util.Comparator;
import java.util.Objects;

import com.stg2va.core.model.Direction;
import com.stg2va.core.model.TransitionLabel;

/**
 * Lookup key of the phase transition table: an edge of a signal observed in a phase.
 *
 * @param phase source phase
 * @param signal signal name
 * @param direction edge direction
 */
public record PhaseKey(
    int phase,
    String signal,
    Direction direction
) implements Comparable<PhaseKey> {

    private static final Comparator<PhaseKey> ORDER = Comparator
        .comparing(PhaseKey::signal)
        .thenComparing(PhaseKey::direction)
        .thenComparingInt(PhaseKey::phase);

    /**
     * Compact constructor with validation.
     */
    public PhaseKey {
        Objects.requireNonNull(signal, "signal must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
    }

    /**
     * Creates a key for a label in a phase.
     *
     * @param phase source phase
     * @param label transition label
     * @return key
     */
    public static PhaseKey of(int phase, TransitionLabel label) {
        return new PhaseKey(phase, label.signal(), label.direction());
    }

    public TransitionLabel label() {
        return new TransitionLabel(signal, direction);
    }

    @Override
    public int compareTo(PhaseKey other) {
        return ORDER.compare(this, other);
    }
}
