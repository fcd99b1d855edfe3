package com.stg2va.core.model;

import java.util.Objects;

/**
 * A place of a 1-safe net, addressed by its index in {@link PetriNet#places()}.
 *
 * @param index arena index
 * @param name place name as written in the source (implicit places use {@code <t1,t2>})
 * @param implicit whether the place was created by a transition-to-transition arc
 */
public record Place(
    int index,
    String name,
    boolean implicit
) {
    /**
     * Compact constructor with validation.
     */
    public Place {
        Objects.requireNonNull(name, "name must not be null");
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative");
        }
    }
}
