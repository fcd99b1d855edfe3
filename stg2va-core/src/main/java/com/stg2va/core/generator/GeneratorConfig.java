package com.stg2va.core.generator;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for model generation.
 *
 * @param forceAllInputs turn outputs (and exposed internal signals) into observed input ports; internal
 *     signals that are not exposed stay internal nodes and are still driven
 * @param exposeInternalSignals turn internal signals into ports
 * @param namingOverrides signal name to identifier used for its port and parameters
 * @param vddName supply port name
 * @param vssName ground port name
 * @param resetName active-low reset port name
 * @param defaultTiming timing of signals without an explicit entry
 * @param signalTiming per-signal timing
 * @param initialValues per-signal reset value overrides (0 or 1)
 * @param maxSettleIterations bound on consecutive dummy firings after one commit
 */
public record GeneratorConfig(
    boolean forceAllInputs,
    boolean exposeInternalSignals,
    Map<String, String> namingOverrides,
    String vddName,
    String vssName,
    String resetName,
    Timing defaultTiming,
    Map<String, Timing> signalTiming,
    Map<String, Integer> initialValues,
    int maxSettleIterations
) {
    public static final String DEFAULT_VDD = "VDD";
    public static final String DEFAULT_VSS = "VSS";
    public static final String DEFAULT_RESET = "RST";
    public static final int DEFAULT_MAX_SETTLE_ITERATIONS = 500;

    /**
     * Compact constructor with validation.
     */
    public GeneratorConfig {
        namingOverrides = namingOverrides == null ? Map.of() : Map.copyOf(namingOverrides);
        signalTiming = signalTiming == null ? Map.of() : Map.copyOf(signalTiming);
        initialValues = initialValues == null ? Map.of() : Map.copyOf(initialValues);
        vddName = vddName == null ? DEFAULT_VDD : vddName;
        vssName = vssName == null ? DEFAULT_VSS : vssName;
        resetName = resetName == null ? DEFAULT_RESET : resetName;
        defaultTiming = defaultTiming == null ? Timing.defaults() : defaultTiming;
        if (maxSettleIterations <= 0) {
            maxSettleIterations = DEFAULT_MAX_SETTLE_ITERATIONS;
        }
        initialValues.forEach((signal, value) -> {
            if (value != 0 && value != 1) {
                throw new IllegalArgumentException("initial value of " + signal + " must be 0 or 1");
            }
        });
    }

    /**
     * Creates a default configuration.
     *
     * @return default generator config
     */
    public static GeneratorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-filled with this configuration.
     *
     * @return builder
     */
    public Builder toBuilder() {
        Builder builder = new Builder()
            .forceAllInputs(forceAllInputs)
            .exposeInternalSignals(exposeInternalSignals)
            .vddName(vddName)
            .vssName(vssName)
            .resetName(resetName)
            .defaultTiming(defaultTiming)
            .maxSettleIterations(maxSettleIterations);
        namingOverrides.forEach(builder::rename);
        signalTiming.forEach(builder::signalTiming);
        initialValues.forEach(builder::initialValue);
        return builder;
    }

    /**
     * Returns the identifier emitted for a signal.
     *
     * @param signal signal name
     * @return override, or the signal name itself
     */
    public String identifierFor(String signal) {
        return namingOverrides.getOrDefault(signal, signal);
    }

    /**
     * Returns the timing of a signal.
     *
     * @param signal signal name
     * @return explicit timing, or the default timing
     */
    public Timing timingFor(String signal) {
        return signalTiming.getOrDefault(signal, defaultTiming);
    }

    /**
     * Fluent builder for {@link GeneratorConfig}.
     */
    public static final class Builder {
        private boolean forceAllInputs;
        private boolean exposeInternalSignals;
        private final Map<String, String> namingOverrides = new LinkedHashMap<>();
        private String vddName = DEFAULT_VDD;
        private String vssName = DEFAULT_VSS;
        private String resetName = DEFAULT_RESET;
        private Timing defaultTiming = Timing.defaults();
        private final Map<String, Timing> signalTiming = new LinkedHashMap<>();
        private final Map<String, Integer> initialValues = new LinkedHashMap<>();
        private int maxSettleIterations = DEFAULT_MAX_SETTLE_ITERATIONS;

        private Builder() {
        }

        public Builder forceAllInputs(boolean value) {
            this.forceAllInputs = value;
            return this;
        }

        public Builder exposeInternalSignals(boolean value) {
            this.exposeInternalSignals = value;
            return this;
        }

        public Builder rename(String signal, String identifier) {
            namingOverrides.put(Objects.requireNonNull(signal), Objects.requireNonNull(identifier));
            return this;
        }

        public Builder vddName(String value) {
            this.vddName = value;
            return this;
        }

        public Builder vssName(String value) {
            this.vssName = value;
            return this;
        }

        public Builder resetName(String value) {
            this.resetName = value;
            return this;
        }

        public Builder defaultTiming(Timing value) {
            this.defaultTiming = value;
            return this;
        }

        public Builder signalTiming(String signal, Timing timing) {
            signalTiming.put(Objects.requireNonNull(signal), Objects.requireNonNull(timing));
            return this;
        }

        public Builder initialValue(String signal, int value) {
            initialValues.put(Objects.requireNonNull(signal), value);
            return this;
        }

        public Builder maxSettleIterations(int value) {
            this.maxSettleIterations = value;
            return this;
        }

        public GeneratorConfig build() {
            return new GeneratorConfig(forceAllInputs, exposeInternalSignals, namingOverrides,
                vddName, vssName, resetName, defaultTiming, signalTiming, initialValues,
                maxSettleIterations);
        }
    }
}
