package com.stg2va.core.error;

/**
 * The reachable state space exceeds the configured phase ceiling.
 */
public class StateExplosionException extends StgCompilationException {

    private final int maxPhases;

    public StateExplosionException(int maxPhases) {
        super("Reachable state space exceeds the limit of " + maxPhases
            + " phases; raise maxPhases or simplify the net");
        this.maxPhases = maxPhases;
    }

    public int getMaxPhases() {
        return maxPhases;
    }
}
