package com.stg2va.core.logic;

import java.util.Comparator;

/**
 * A (source, destination) phase pair of one signal edge.
 *
 * @param source phase the edge is observed in
 * @param destination phase committed after the edge
 */
public record PhasePair(
    int source,
    int destination
) implements Comparable<PhasePair> {

    private static final Comparator<PhasePair> ORDER = Comparator
        .comparingInt(PhasePair::source)
        .thenComparingInt(PhasePair::destination);

    @Override
    public int compareTo(PhasePair other) {
        return ORDER.compare(this, other);
    }
}
