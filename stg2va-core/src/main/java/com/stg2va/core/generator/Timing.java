package com.stg2va.core.generator;

/**
 * Analog timing and loading of one signal, in SI units.
 *
 * @param riseTime rise time in seconds
 * @param fallTime fall time in seconds
 * @param delay delay between an edge becoming enabled and the edge starting, in seconds
 * @param inputCapacitance capacitance presented by the pin, in farads
 * @param outputResistance series resistance of the driver, in ohms
 */
public record Timing(
    double riseTime,
    double fallTime,
    double delay,
    double inputCapacitance,
    double outputResistance
) {
    /**
     * Compact constructor with validation.
     */
    public Timing {
        requireNonNegative(riseTime, "riseTime");
        requireNonNegative(fallTime, "fallTime");
        requireNonNegative(delay, "delay");
        requireNonNegative(inputCapacitance, "inputCapacitance");
        if (!(outputResistance > 0) || Double.isInfinite(outputResistance)) {
            throw new IllegalArgumentException("outputResistance must be positive and finite");
        }
    }

    /**
     * Default timing: 100 ps edges and delay, 10 fF load, 10 kOhm driver.
     *
     * @return default timing
     */
    public static Timing defaults() {
        return new Timing(100e-12, 100e-12, 100e-12, 10e-15, 10e3);
    }

    /**
     * Replaces the non-null values of a partial override.
     *
     * @param riseTime new rise time or null
     * @param fallTime new fall time or null
     * @param delay new delay or null
     * @param inputCapacitance new input capacitance or null
     * @param outputResistance new output resistance or null
     * @return merged timing
     */
    public Timing merge(Double riseTime, Double fallTime, Double delay,
                        Double inputCapacitance, Double outputResistance) {
        return new Timing(
            riseTime != null ? riseTime : this.riseTime,
            fallTime != null ? fallTime : this.fallTime,
            delay != null ? delay : this.delay,
            inputCapacitance != null ? inputCapacitance : this.inputCapacitance,
            outputResistance != null ? outputResistance : this.outputResistance
        );
    }

    private static void requireNonNegative(double value, String name) {
        if (!(value >= 0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " must be finite and not negative");
        }
    }
}
