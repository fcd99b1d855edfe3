package com.stg2va.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.stg2va.core.analysis.ReachabilityAnalyzer;
import com.stg2va.core.generator.GeneratorConfig;
import com.stg2va.core.generator.Timing;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Root configuration of a compilation.
 *
 * <p>Loaded from {@code stg2va.yaml}. Every section is optional; absent values fall back to the
 * built-in defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * timing:
 *   riseTime: 50e-12
 *   fallTime: 50e-12
 *
 * supplies:
 *   vdd: VDDA
 *   vss: GND
 *   reset: RSTN
 *
 * ports:
 *   allInputs: false
 *   seeInternals: true
 *
 * analysis:
 *   maxPhases: 20000
 *   maxSettleIterations: 200
 *
 * signals:
 *   ack:
 *     rename: ack_o
 *     initialValue: 0
 *     timing:
 *       delay: 1e-9
 * }</pre>
 *
 * @param timing default timing of every signal
 * @param supplies supply and reset port names
 * @param ports port mapping switches
 * @param analysis analysis limits
 * @param signals per-signal settings keyed by signal name
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Stg2VaConfig(
    @JsonProperty("timing") TimingSettings timing,
    @JsonProperty("supplies") SupplySettings supplies,
    @JsonProperty("ports") PortSettings ports,
    @JsonProperty("analysis") AnalysisSettings analysis,
    @JsonProperty("signals") Map<String, SignalSettings> signals
) {
    /**
     * Compact constructor; replaces absent sections with empty ones.
     */
    public Stg2VaConfig {
        timing = timing == null ? TimingSettings.empty() : timing;
        supplies = supplies == null ? new SupplySettings(null, null, null) : supplies;
        ports = ports == null ? new PortSettings(null, null) : ports;
        analysis = analysis == null ? new AnalysisSettings(null, null) : analysis;
        signals = signals == null ? Map.of() : withoutEmptyEntries(signals);
    }

    /**
     * Creates a configuration where every value is the built-in default.
     *
     * @return default configuration
     */
    public static Stg2VaConfig defaults() {
        return new Stg2VaConfig(null, null, null, null, null);
    }

    // a signal key without a body in YAML arrives as a null value
    private static Map<String, SignalSettings> withoutEmptyEntries(Map<String, SignalSettings> signals) {
        Map<String, SignalSettings> present = new HashMap<>();
        signals.forEach((signal, settings) -> {
            if (settings != null) {
                present.put(signal, settings);
            }
        });
        return Map.copyOf(present);
    }

    /**
     * Returns the phase ceiling of the reachability analysis.
     *
     * @return configured ceiling, or {@link ReachabilityAnalyzer#DEFAULT_MAX_PHASES}
     */
    public int maxPhases() {
        return analysis.maxPhases() != null ? analysis.maxPhases() : ReachabilityAnalyzer.DEFAULT_MAX_PHASES;
    }

    /**
     * Converts this configuration into generator settings.
     *
     * @return builder pre-filled from this configuration, for command-line overrides
     */
    public GeneratorConfig.Builder toGeneratorConfig() {
        Timing defaultTiming = timing.applyTo(Timing.defaults());
        GeneratorConfig.Builder builder = GeneratorConfig.builder()
            .forceAllInputs(Boolean.TRUE.equals(ports.allInputs()))
            .exposeInternalSignals(Boolean.TRUE.equals(ports.seeInternals()))
            .defaultTiming(defaultTiming);
        if (supplies.vdd() != null) {
            builder.vddName(supplies.vdd());
        }
        if (supplies.vss() != null) {
            builder.vssName(supplies.vss());
        }
        if (supplies.reset() != null) {
            builder.resetName(supplies.reset());
        }
        if (analysis.maxSettleIterations() != null) {
            builder.maxSettleIterations(analysis.maxSettleIterations());
        }

        // sorted so that equal files always produce equal builders
        new TreeMap<>(signals).forEach((signal, settings) -> {
            if (settings.rename() != null) {
                builder.rename(signal, settings.rename());
            }
            if (settings.initialValue() != null) {
                builder.initialValue(signal, settings.initialValue());
            }
            if (settings.timing() != null) {
                builder.signalTiming(signal, settings.timing().applyTo(defaultTiming));
            }
        });
        return builder;
    }

    /**
     * Partial timing; null values keep the value they are applied to.
     *
     * @param riseTime rise time in seconds
     * @param fallTime fall time in seconds
     * @param delay delay in seconds
     * @param inputCapacitance input capacitance in farads
     * @param outputResistance output resistance in ohms
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TimingSettings(
        @JsonProperty("riseTime") Double riseTime,
        @JsonProperty("fallTime") Double fallTime,
        @JsonProperty("delay") Double delay,
        @JsonProperty("inputCapacitance") Double inputCapacitance,
        @JsonProperty("outputResistance") Double outputResistance
    ) {
        static TimingSettings empty() {
            return new TimingSettings(null, null, null, null, null);
        }

        Timing applyTo(Timing base) {
            return base.merge(riseTime, fallTime, delay, inputCapacitance, outputResistance);
        }
    }

    /**
     * Supply and reset port names.
     *
     * @param vdd supply port
     * @param vss ground port
     * @param reset active-low reset port
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SupplySettings(
        @JsonProperty("vdd") String vdd,
        @JsonProperty("vss") String vss,
        @JsonProperty("reset") String reset
    ) {}

    /**
     * Port mapping switches.
     *
     * @param allInputs observe every port signal as an input; hidden internal signals are still driven
     * @param seeInternals turn internal signals into ports
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PortSettings(
        @JsonProperty("allInputs") Boolean allInputs,
        @JsonProperty("seeInternals") Boolean seeInternals
    ) {}

    /**
     * Analysis limits.
     *
     * @param maxPhases phase ceiling of the reachability analysis
     * @param maxSettleIterations bound on consecutive dummy firings in the generated model
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnalysisSettings(
        @JsonProperty("maxPhases") Integer maxPhases,
        @JsonProperty("maxSettleIterations") Integer maxSettleIterations
    ) {}

    /**
     * Settings of one signal.
     *
     * @param rename identifier used for the signal's port and parameters
     * @param initialValue reset value, 0 or 1
     * @param timing timing overrides on top of the default timing
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SignalSettings(
        @JsonProperty("rename") String rename,
        @JsonProperty("initialValue") Integer initialValue,
        @JsonProperty("timing") TimingSettings timing
    ) {}
}
