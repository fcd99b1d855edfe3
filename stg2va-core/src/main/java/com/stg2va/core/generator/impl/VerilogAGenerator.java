package com.stg2va.core.generator.impl;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.stg2va.core.analysis.StateGraph;
import com.stg2va.core.generator.GeneratedModel;
import com.stg2va.core.generator.GeneratorConfig;
import com.stg2va.core.generator.ModelGenerator;
import com.stg2va.core.generator.Timing;
import com.stg2va.core.logic.PhaseKey;
import com.stg2va.core.logic.PhaseTransitionTable;
import com.stg2va.core.model.Direction;
import com.stg2va.core.model.PetriNet;
import com.stg2va.core.model.Signal;
import com.stg2va.core.model.SignalRole;

/**
 * Generates a Verilog-A behavioral model that follows the phases of an STG.
 *
 * <h2>Generated structure</h2>
 * <ul>
 *   <li><b>Ports:</b> supply, ground, active-low reset, then one port per visible signal</li>
 *   <li><b>Parameters:</b> {@code <sig>_RISE_PAR}, {@code <sig>_FALL_PAR}, {@code <sig>_DELAY_PAR},
 *       {@code <sig>_IN_CAP_PAR}, {@code <sig>_OUT_RES_PAR} for every signal and
 *       {@code <sig>_RST_VALUE_PAR} for every driven signal</li>
 *   <li><b>State:</b> one {@code integer phase}, set to the initial phase on start-up and on reset</li>
 *   <li><b>Observation:</b> one {@code @(cross(...))} block per signal and direction; the block looks
 *       up the current phase and either commits the destination phase or calls {@code $fatal}</li>
 *   <li><b>Drive:</b> for outputs and internal signals the logic target follows the phases in which
 *       the signal's own edge is enabled and is applied through {@code transition()} with the
 *       configured delay and edge times, then through the output resistance</li>
 * </ul>
 *
 * <p>Dummy transitions are resolved by an {@code analog function} that follows dummy edges from a
 * freshly committed phase until none is enabled.
 *
 * <p>All phase reads and writes happen inside one event block, so each observed edge is checked
 * against the phase committed by the previous event.
 */
public class VerilogAGenerator implements ModelGenerator {

    private static final Logger log = LoggerFactory.getLogger(VerilogAGenerator.class);

    // Generator identification
    private static final String GENERATOR_ID = "veriloga";
    private static final String GENERATOR_DISPLAY_NAME = "Verilog-A Behavioral Model Generator";
    private static final String FILE_EXTENSION = "va";

    // Parameter suffixes
    static final String RISE_SUFFIX = "_RISE_PAR";
    static final String FALL_SUFFIX = "_FALL_PAR";
    static final String DELAY_SUFFIX = "_DELAY_PAR";
    static final String IN_CAP_SUFFIX = "_IN_CAP_PAR";
    static final String OUT_RES_SUFFIX = "_OUT_RES_PAR";
    static final String RST_VALUE_SUFFIX = "_RST_VALUE_PAR";

    // Lookup results
    private static final int NOT_ENABLED = -1;
    private static final int AMBIGUOUS = -2;
    private static final int UNSETTLED = -3;

    static final String ERROR_PREFIX = "STG consistency error: ";
    private static final String INDENT = "    ";
    private static final String NEWLINE = "\n";
    private static final double SUPPLY_ON_THRESHOLD = 0.05;

    /**
     * How a signal appears in the generated module.
     */
    enum PinKind {
        /** Port driven from outside, only observed */
        INPUT_PORT,
        /** Port driven by the model */
        OUTPUT_PORT,
        /** Internal node driven by the model */
        INTERNAL_NODE;

        boolean isDriven() {
            return this != INPUT_PORT;
        }

        boolean isPort() {
            return this != INTERNAL_NODE;
        }
    }

    /**
     * A physical signal with its resolved identifier and pin kind.
     */
    record Pin(Signal signal, String id, PinKind kind, Timing timing) {}

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public GeneratedModel generate(PetriNet net, StateGraph graph, PhaseTransitionTable table, GeneratorConfig config) {
        Objects.requireNonNull(net, "net must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(config, "config must not be null");

        String moduleName = sanitize(net.name());
        List<Pin> pins = resolvePins(net, config);
        boolean hasDummies = !net.signalsWithRole(SignalRole.DUMMY).isEmpty();
        log.debug("Generating Verilog-A module '{}' with {} pins over {} phases",
            moduleName, pins.size(), table.phaseCount());

        StringBuilder va = new StringBuilder();
        appendHeader(va, net, graph, table);
        appendModuleDeclaration(va, moduleName, pins, config);
        appendParameters(va, pins, table, config);
        appendVariables(va, pins);
        if (hasDummies) {
            appendSettleFunction(va, net, table, config);
        }
        appendAnalogBlock(va, pins, table, config, hasDummies);
        va.append("endmodule").append(NEWLINE);

        return new GeneratedModel(moduleName, va.toString(), FILE_EXTENSION);
    }

    // ==================== Pin resolution ====================

    private List<Pin> resolvePins(PetriNet net, GeneratorConfig config) {
        List<Pin> pins = new ArrayList<>();
        Map<String, String> usedIds = new HashMap<>();
        usedIds.put(config.vddName(), "supply");
        usedIds.put(config.vssName(), "ground");
        usedIds.put(config.resetName(), "reset");

        for (Signal signal : net.physicalSignals()) {
            String id = sanitize(config.identifierFor(signal.name()));
            String clash = usedIds.putIfAbsent(id, signal.name());
            if (clash != null) {
                throw new IllegalArgumentException(
                    "Identifier '" + id + "' of signal " + signal.name() + " clashes with " + clash);
            }
            pins.add(new Pin(signal, id, pinKind(signal.role(), config), config.timingFor(signal.name())));
        }
        return pins;
    }

    static PinKind pinKind(SignalRole role, GeneratorConfig config) {
        return switch (role) {
            case INPUT -> PinKind.INPUT_PORT;
            case OUTPUT -> config.forceAllInputs() ? PinKind.INPUT_PORT : PinKind.OUTPUT_PORT;
            case INTERNAL -> {
                if (!config.exposeInternalSignals()) {
                    yield PinKind.INTERNAL_NODE;
                }
                yield config.forceAllInputs() ? PinKind.INPUT_PORT : PinKind.OUTPUT_PORT;
            }
            case DUMMY -> throw new IllegalArgumentException("Dummy signals have no pin");
        };
    }

    // ==================== Declarations ====================

    private void appendHeader(StringBuilder va, PetriNet net, StateGraph graph, PhaseTransitionTable table) {
        va.append("// Verilog-A behavioral model of STG '").append(net.name()).append("'").append(NEWLINE);
        va.append("// Generated by stg2va: ").append(table.phaseCount()).append(" phases, ")
            .append(graph.edges().size()).append(" edges, initial phase ")
            .append(table.initialPhase()).append(NEWLINE);
        va.append("// An edge observed in a phase where the STG does not allow it stops the simulation.")
            .append(NEWLINE);
        va.append("//").append(NEWLINE);
        for (int phase = 0; phase < graph.phaseCount(); phase++) {
            va.append("// phase ").append(phase).append(": ")
                .append(net.describe(graph.marking(phase))).append(NEWLINE);
        }
        va.append(NEWLINE);
        va.append("`include \"constants.vams\"").append(NEWLINE);
        va.append("`include \"disciplines.vams\"").append(NEWLINE);
        va.append(NEWLINE);
    }

    private void appendModuleDeclaration(StringBuilder va, String moduleName, List<Pin> pins, GeneratorConfig config) {
        List<String> ports = new ArrayList<>(List.of(config.vddName(), config.vssName(), config.resetName()));
        pins.stream().filter(pin -> pin.kind().isPort()).forEach(pin -> ports.add(pin.id()));

        va.append("module ").append(moduleName).append("(").append(String.join(", ", ports)).append(");")
            .append(NEWLINE);
        va.append(INDENT).append("inout ").append(config.vddName()).append(", ").append(config.vssName())
            .append(";").append(NEWLINE);
        va.append(INDENT).append("input ").append(config.resetName()).append(";").append(NEWLINE);
        for (Pin pin : pins) {
            if (pin.kind() == PinKind.INPUT_PORT) {
                va.append(INDENT).append("input ").append(pin.id()).append(";").append(NEWLINE);
            } else if (pin.kind() == PinKind.OUTPUT_PORT) {
                va.append(INDENT).append("output ").append(pin.id()).append(";").append(NEWLINE);
            }
        }

        List<String> nodes = new ArrayList<>(ports);
        for (Pin pin : pins) {
            if (!pin.kind().isPort()) {
                nodes.add(pin.id());
            }
            if (pin.kind().isDriven()) {
                nodes.add(driverNode(pin));
            }
        }
        va.append(INDENT).append("electrical ").append(String.join(", ", nodes)).append(";").append(NEWLINE);
        va.append(NEWLINE);
    }

    private void appendParameters(StringBuilder va, List<Pin> pins, PhaseTransitionTable table, GeneratorConfig config) {
        for (Pin pin : pins) {
            Timing timing = pin.timing();
            va.append(INDENT).append("// ").append(pin.signal().name()).append(" (")
                .append(pin.kind().name().toLowerCase().replace('_', ' ')).append(")").append(NEWLINE);
            appendRealParameter(va, pin.id() + RISE_SUFFIX, timing.riseTime(), "[0:inf)");
            appendRealParameter(va, pin.id() + FALL_SUFFIX, timing.fallTime(), "[0:inf)");
            appendRealParameter(va, pin.id() + DELAY_SUFFIX, timing.delay(), "[0:inf)");
            appendRealParameter(va, pin.id() + IN_CAP_SUFFIX, timing.inputCapacitance(), "[0:inf)");
            appendRealParameter(va, pin.id() + OUT_RES_SUFFIX, timing.outputResistance(), "(0:inf)");
            if (pin.kind().isDriven()) {
                va.append(INDENT).append("parameter integer ").append(pin.id()).append(RST_VALUE_SUFFIX)
                    .append(" = ").append(initialValue(pin.signal().name(), table, config))
                    .append(" from [0:1];").append(NEWLINE);
            }
        }
        va.append(NEWLINE);
    }

    private static void appendRealParameter(StringBuilder va, String name, double value, String range) {
        va.append(INDENT).append("parameter real ").append(name).append(" = ").append(Double.toString(value))
            .append(" from ").append(range).append(";").append(NEWLINE);
    }

    static int initialValue(String signal, PhaseTransitionTable table, GeneratorConfig config) {
        Integer override = config.initialValues().get(signal);
        if (override != null) {
            return override;
        }
        return table.initialLevel(signal).orElse(0);
    }

    private void appendVariables(StringBuilder va, List<Pin> pins) {
        va.append(INDENT).append("integer phase;").append(NEWLINE);
        va.append(INDENT).append("integer next_phase;").append(NEWLINE);
        va.append(INDENT).append("integer active;").append(NEWLINE);
        for (Pin pin : pins) {
            if (pin.kind().isDriven()) {
                va.append(INDENT).append("integer ").append(pin.id()).append("_target;").append(NEWLINE);
                va.append(INDENT).append("integer ").append(pin.id()).append("_level;").append(NEWLINE);
            }
        }
        va.append(NEWLINE);
    }

    // ==================== Dummy settling ====================

    private void appendSettleFunction(StringBuilder va, PetriNet net, PhaseTransitionTable table, GeneratorConfig config) {
        SortedMap<Integer, SortedSet<Integer>> dummySteps = new TreeMap<>();
        for (Signal dummy : net.signalsWithRole(SignalRole.DUMMY)) {
            table.entries().forEach((key, destinations) -> {
                if (key.signal().equals(dummy.name())) {
                    dummySteps.computeIfAbsent(key.phase(), phase -> new TreeSet<>()).addAll(destinations);
                }
            });
        }

        String i1 = INDENT;
        String i2 = INDENT.repeat(2);
        String i3 = INDENT.repeat(3);
        String i4 = INDENT.repeat(4);
        String i5 = INDENT.repeat(5);
        va.append(i1).append("// Follows dummy transitions from a committed phase.").append(NEWLINE);
        va.append(i1).append("// Returns ").append(AMBIGUOUS).append(" on a dummy choice and ")
            .append(UNSETTLED).append(" when no stable phase is reached.").append(NEWLINE);
        va.append(i1).append("analog function integer settle;").append(NEWLINE);
        va.append(i2).append("input start;").append(NEWLINE);
        va.append(i2).append("integer start;").append(NEWLINE);
        va.append(i2).append("integer p, moved, steps;").append(NEWLINE);
        va.append(i2).append("begin").append(NEWLINE);
        va.append(i3).append("p = start;").append(NEWLINE);
        va.append(i3).append("moved = 1;").append(NEWLINE);
        va.append(i3).append("steps = 0;").append(NEWLINE);
        va.append(i3).append("while (moved && steps < ").append(config.maxSettleIterations()).append(") begin")
            .append(NEWLINE);
        va.append(i4).append("moved = 0;").append(NEWLINE);
        va.append(i4).append("case (p)").append(NEWLINE);
        dummySteps.forEach((phase, destinations) -> {
            if (destinations.size() == 1) {
                va.append(i5).append(phase).append(": begin p = ").append(destinations.first())
                    .append("; moved = 1; end").append(NEWLINE);
            } else {
                va.append(i5).append(phase).append(": p = ").append(AMBIGUOUS).append("; // ")
                    .append(destinations).append(NEWLINE);
            }
        });
        va.append(i5).append("default: moved = 0;").append(NEWLINE);
        va.append(i4).append("endcase").append(NEWLINE);
        va.append(i4).append("steps = steps + 1;").append(NEWLINE);
        va.append(i3).append("end").append(NEWLINE);
        va.append(i3).append("if (moved)").append(NEWLINE);
        va.append(i4).append("p = ").append(UNSETTLED).append(";").append(NEWLINE);
        va.append(i3).append("settle = p;").append(NEWLINE);
        va.append(i2).append("end").append(NEWLINE);
        va.append(i1).append("endfunction").append(NEWLINE);
        va.append(NEWLINE);
    }

    // ==================== Analog block ====================

    private void appendAnalogBlock(StringBuilder va, List<Pin> pins, PhaseTransitionTable table,
                                   GeneratorConfig config, boolean hasDummies) {
        String vdd = config.vddName();
        String vss = config.vssName();
        String i1 = INDENT;
        String i2 = INDENT.repeat(2);

        va.append(i1).append("analog begin").append(NEWLINE);
        va.append(i2).append("active = (V(").append(config.resetName()).append(", ").append(vss)
            .append(") > 0.5 * V(").append(vdd).append(", ").append(vss).append(")) && (V(")
            .append(vdd).append(", ").append(vss).append(") > ").append(SUPPLY_ON_THRESHOLD).append(");")
            .append(NEWLINE);
        va.append(NEWLINE);

        va.append(i2).append("@(initial_step) begin").append(NEWLINE);
        appendReset(va, pins, table, hasDummies, "initial_step");
        va.append(i2).append("end").append(NEWLINE);
        va.append(NEWLINE);
        va.append(i2).append("// Reset is active low").append(NEWLINE);
        va.append(i2).append("@(cross(").append(threshold(config.resetName(), config)).append(", -1)) begin")
            .append(NEWLINE);
        appendReset(va, pins, table, hasDummies, "reset");
        va.append(i2).append("end").append(NEWLINE);
        va.append(NEWLINE);

        for (Pin pin : pins) {
            appendObservation(va, pin, Direction.RISE, table, config, hasDummies);
            appendObservation(va, pin, Direction.FALL, table, config, hasDummies);
        }

        for (Pin pin : pins) {
            if (pin.kind().isDriven()) {
                appendDrive(va, pin, table, config);
            }
        }

        va.append(i2).append("// Pin loading").append(NEWLINE);
        for (Pin pin : pins) {
            va.append(i2).append("I(").append(pin.id()).append(", ").append(vss).append(") <+ ")
                .append(pin.id()).append(IN_CAP_SUFFIX).append(" * ddt(V(").append(pin.id()).append(", ")
                .append(vss).append("));").append(NEWLINE);
        }
        va.append(i1).append("end").append(NEWLINE);
    }

    private void appendReset(StringBuilder va, List<Pin> pins, PhaseTransitionTable table,
                             boolean hasDummies, String cause) {
        String i3 = INDENT.repeat(3);
        String i4 = INDENT.repeat(4);
        if (hasDummies) {
            va.append(i3).append("phase = settle(").append(table.initialPhase()).append(");").append(NEWLINE);
            va.append(i3).append("if (phase < 0)").append(NEWLINE);
            va.append(i4).append("$fatal(1, \"").append(ERROR_PREFIX)
                .append("dummy transitions do not settle from the initial phase at ").append(cause)
                .append("\");").append(NEWLINE);
        } else {
            va.append(i3).append("phase = ").append(table.initialPhase()).append(";").append(NEWLINE);
        }
        for (Pin pin : pins) {
            if (pin.kind().isDriven()) {
                va.append(i3).append(pin.id()).append("_target = ").append(pin.id()).append(RST_VALUE_SUFFIX)
                    .append(";").append(NEWLINE);
                va.append(i3).append(pin.id()).append("_level = ").append(pin.id()).append(RST_VALUE_SUFFIX)
                    .append(";").append(NEWLINE);
            }
        }
    }

    private void appendObservation(StringBuilder va, Pin pin, Direction direction, PhaseTransitionTable table,
                                   GeneratorConfig config, boolean hasDummies) {
        String signal = pin.signal().name();
        String event = signal + direction.symbol();
        SortedMap<Integer, SortedSet<Integer>> lookup = observationLookup(signal, direction, table);

        String i2 = INDENT.repeat(2);
        String i3 = INDENT.repeat(3);
        String i4 = INDENT.repeat(4);
        String i5 = INDENT.repeat(5);
        String i6 = INDENT.repeat(6);
        int crossDirection = direction == Direction.RISE ? 1 : -1;

        va.append(i2).append("// ").append(event).append(NEWLINE);
        va.append(i2).append("@(cross(").append(threshold(pin.id(), config)).append(", ")
            .append(crossDirection > 0 ? "+1" : "-1").append(")) begin").append(NEWLINE);
        va.append(i3).append("if (active) begin").append(NEWLINE);
        va.append(i4).append("case (phase)").append(NEWLINE);
        boolean ambiguous = false;
        for (Map.Entry<Integer, SortedSet<Integer>> entry : lookup.entrySet()) {
            SortedSet<Integer> destinations = entry.getValue();
            if (destinations.size() == 1) {
                va.append(i5).append(entry.getKey()).append(": next_phase = ").append(destinations.first())
                    .append(";").append(NEWLINE);
            } else {
                ambiguous = true;
                va.append(i5).append(entry.getKey()).append(": next_phase = ").append(AMBIGUOUS)
                    .append("; // ").append(destinations).append(NEWLINE);
            }
        }
        va.append(i5).append("default: next_phase = ").append(NOT_ENABLED).append(";").append(NEWLINE);
        va.append(i4).append("endcase").append(NEWLINE);

        va.append(i4).append("if (next_phase == ").append(NOT_ENABLED).append(")").append(NEWLINE);
        va.append(i5).append("$fatal(1, \"").append(ERROR_PREFIX).append(event)
            .append(" is not enabled in phase %d\", phase);").append(NEWLINE);
        if (ambiguous) {
            va.append(i4).append("else if (next_phase == ").append(AMBIGUOUS).append(")").append(NEWLINE);
            va.append(i5).append("$fatal(1, \"").append(ERROR_PREFIX).append(event)
                .append(" is ambiguous in phase %d\", phase);").append(NEWLINE);
        }
        va.append(i4).append("else begin").append(NEWLINE);
        if (hasDummies) {
            va.append(i5).append("next_phase = settle(next_phase);").append(NEWLINE);
            va.append(i5).append("if (next_phase == ").append(AMBIGUOUS).append(")").append(NEWLINE);
            va.append(i6).append("$fatal(1, \"").append(ERROR_PREFIX)
                .append("ambiguous dummy transition after ").append(event).append(" in phase %d\", phase);")
                .append(NEWLINE);
            va.append(i5).append("else if (next_phase == ").append(UNSETTLED).append(")").append(NEWLINE);
            va.append(i6).append("$fatal(1, \"").append(ERROR_PREFIX)
                .append("dummy transitions do not settle after ").append(event).append(" in phase %d\", phase);")
                .append(NEWLINE);
        }
        va.append(i5).append("phase = next_phase;").append(NEWLINE);
        if (pin.kind().isDriven()) {
            va.append(i5).append(pin.id()).append("_level = ").append(crossDirection > 0 ? 1 : 0).append(";")
                .append(NEWLINE);
        }
        va.append(i4).append("end").append(NEWLINE);
        va.append(i3).append("end").append(NEWLINE);
        va.append(i2).append("end").append(NEWLINE);
        va.append(NEWLINE);
    }

    /**
     * Destinations of an observed crossing: a rise matches {@code +} and {@code ~} entries,
     * a fall matches {@code -} and {@code ~} entries.
     */
    static SortedMap<Integer, SortedSet<Integer>> observationLookup(String signal, Direction crossing,
                                                                    PhaseTransitionTable table) {
        SortedMap<Integer, SortedSet<Integer>> lookup = new TreeMap<>();
        for (Map.Entry<PhaseKey, SortedSet<Integer>> entry : table.entries().entrySet()) {
            PhaseKey key = entry.getKey();
            if (key.signal().equals(signal)
                && (key.direction() == crossing || key.direction() == Direction.TOGGLE)) {
                lookup.computeIfAbsent(key.phase(), phase -> new TreeSet<>()).addAll(entry.getValue());
            }
        }
        return lookup;
    }

    private void appendDrive(StringBuilder va, Pin pin, PhaseTransitionTable table, GeneratorConfig config) {
        String signal = pin.signal().name();
        String i2 = INDENT.repeat(2);
        String i3 = INDENT.repeat(3);

        Map<Integer, Set<Direction>> enabled = new TreeMap<>();
        for (Direction direction : Direction.values()) {
            for (int phase : table.enablingPhases(signal, direction)) {
                enabled.computeIfAbsent(phase, p -> EnumSet.noneOf(Direction.class)).add(direction);
            }
        }

        Map<Direction, List<Integer>> phasesByDirection = new EnumMap<>(Direction.class);
        enabled.forEach((phase, directions) -> {
            if (directions.size() > 1) {
                log.warn("Both edges of '{}' are enabled in phase {}; no drive is generated there", signal, phase);
                return;
            }
            phasesByDirection.computeIfAbsent(directions.iterator().next(), d -> new ArrayList<>()).add(phase);
        });

        String id = pin.id();
        String i4 = INDENT.repeat(4);
        String i5 = INDENT.repeat(5);
        va.append(i2).append("// ").append(signal).append(" drive").append(NEWLINE);
        va.append(i2).append("case (phase)").append(NEWLINE);
        phasesByDirection.forEach((direction, phases) -> {
            String label = joinPhases(phases);
            if (direction == Direction.TOGGLE) {
                va.append(i3).append(label).append(": ").append(id).append("_target = 1 - ").append(id)
                    .append("_level;").append(NEWLINE);
                return;
            }
            int target = direction == Direction.RISE ? 1 : 0;
            // an edge enabled on a pin already at its level can never cross
            va.append(i3).append(label).append(": begin").append(NEWLINE);
            va.append(i4).append(id).append("_target = ").append(target).append(";").append(NEWLINE);
            va.append(i4).append("if (active && ").append(id).append("_level == ").append(target).append(")")
                .append(NEWLINE);
            va.append(i5).append("$fatal(1, \"").append(ERROR_PREFIX).append(signal).append(direction.symbol())
                .append(" is enabled in phase %d but ").append(signal).append(" is already ")
                .append(target == 1 ? "high" : "low").append("\", phase);").append(NEWLINE);
            va.append(i3).append("end").append(NEWLINE);
        });
        va.append(i3).append("default: ;").append(NEWLINE);
        va.append(i2).append("endcase").append(NEWLINE);

        String driver = driverNode(pin);
        va.append(i2).append("V(").append(driver).append(", ").append(config.vssName()).append(") <+ V(")
            .append(config.vddName()).append(", ").append(config.vssName()).append(") * transition(")
            .append(id).append("_target, ").append(id).append(DELAY_SUFFIX).append(", ")
            .append(id).append(RISE_SUFFIX).append(", ").append(id).append(FALL_SUFFIX).append(");")
            .append(NEWLINE);
        va.append(i2).append("I(").append(driver).append(", ").append(id).append(") <+ V(").append(driver)
            .append(", ").append(id).append(") / ").append(id).append(OUT_RES_SUFFIX).append(";").append(NEWLINE);
        va.append(NEWLINE);
    }

    // ==================== Helpers ====================

    private static String threshold(String node, GeneratorConfig config) {
        return "V(" + node + ", " + config.vssName() + ") - 0.5 * V(" + config.vddName() + ", "
            + config.vssName() + ")";
    }

    private static String driverNode(Pin pin) {
        return pin.id() + "_drv";
    }

    private static String joinPhases(List<Integer> phases) {
        List<String> labels = new ArrayList<>(phases.size());
        phases.forEach(phase -> labels.add(Integer.toString(phase)));
        return String.join(", ", labels);
    }

    /**
     * Turns a name into a legal Verilog-A identifier.
     *
     * @param name raw name
     * @return identifier with illegal characters replaced by underscores
     */
    static String sanitize(String name) {
        String id = name.replaceAll("[^A-Za-z0-9_]", "_");
        if (id.isEmpty() || Character.isDigit(id.charAt(0))) {
            id = "_" + id;
        }
        return id;
    }
}
