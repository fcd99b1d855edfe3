package com.stg2va.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * The signal event a transition stands for, e.g. {@code req+}.
 *
 * <p>Several transitions of a net may share one label ({@code req+}, {@code req+/1}, ...).
 *
 * @param signal signal name
 * @param direction edge direction
 */
public record TransitionLabel(
    String signal,
    Direction direction
) implements Comparable<TransitionLabel> {

    private static final Comparator<TransitionLabel> ORDER = Comparator
        .comparing(TransitionLabel::signal)
        .thenComparing(TransitionLabel::direction);

    /**
     * Compact constructor with validation.
     */
    public TransitionLabel {
        Objects.requireNonNull(signal, "signal must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
    }

    @Override
    public int compareTo(TransitionLabel other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return signal + direction.symbol();
    }
}
