package com.stg2va.core.model;

import java.util.Objects;

/**
 * A signal declared in the net header.
 *
 * @param name unique signal name
 * @param role declared role
 */
public record Signal(
    String name,
    SignalRole role
) {
    /**
     * Compact constructor with validation.
     */
    public Signal {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(role, "role must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }
}
