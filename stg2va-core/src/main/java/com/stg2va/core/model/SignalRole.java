package com.stg2va.core.model;

/**
 * Role of a signal declared in an STG.
 */
public enum SignalRole {
    /** Driven by the environment, observed by the model */
    INPUT,

    /** Driven by the model, visible on a port */
    OUTPUT,

    /** Driven by the model, kept on an internal node unless exposed */
    INTERNAL,

    /** Instantaneous transition without a physical wire */
    DUMMY;

    /**
     * Returns whether signals of this role have a physical wire.
     *
     * @return false only for {@link #DUMMY}
     */
    public boolean isPhysical() {
        return this != DUMMY;
    }
}
