package com.stg2va.core.error;

/**
 * A firing would put a second token on a place.
 */
public class UnsafeNetException extends StgCompilationException {

    private final int phase;
    private final String transition;
    private final String place;

    public UnsafeNetException(int phase, String transition, String place, String markingDescription) {
        super(String.format(
            "Net is not 1-safe: firing %s in phase %d %s would put a second token on place %s",
            transition, phase, markingDescription, place));
        this.phase = phase;
        this.transition = transition;
        this.place = place;
    }

    public int getPhase() {
        return phase;
    }

    public String getTransition() {
        return transition;
    }

    public String getPlace() {
        return place;
    }
}
