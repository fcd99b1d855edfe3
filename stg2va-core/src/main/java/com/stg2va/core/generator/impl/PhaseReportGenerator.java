package com.stg2va.core.generator.impl;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.stg2va.core.analysis.StateEdge;
import com.stg2va.core.analysis.StateGraph;
import com.stg2va.core.generator.GeneratedModel;
import com.stg2va.core.generator.GeneratorConfig;
import com.stg2va.core.generator.ModelGenerator;
import com.stg2va.core.logic.PhaseKey;
import com.stg2va.core.logic.PhaseTransitionTable;
import com.stg2va.core.model.PetriNet;
import com.stg2va.core.model.Signal;
import com.stg2va.core.model.SignalRole;

/**
 * Generates a Markdown report of the phases of a net.
 *
 * <h2>Sections</h2>
 * <ul>
 *   <li><b>Summary:</b> signal, place, transition and phase counts</li>
 *   <li><b>Signals:</b> role and inferred initial level of each signal</li>
 *   <li><b>Phases:</b> marking, enabled events and successors of every phase</li>
 *   <li><b>Phase Transition Table:</b> one row per (phase, signal, direction) entry</li>
 *   <li><b>Findings:</b> non-deterministic entries and dead-end phases</li>
 * </ul>
 */
public class PhaseReportGenerator implements ModelGenerator {

    private static final Logger log = LoggerFactory.getLogger(PhaseReportGenerator.class);

    // Markdown formatting constants
    private static final String H1 = "# ";
    private static final String H2 = "## ";
    private static final String CODE = "`";
    private static final String PIPE = "|";
    private static final String SPACE = " ";
    private static final String NEWLINE = "\n";
    private static final String DOUBLE_NEWLINE = "\n\n";
    private static final String DASH_VALUE = "-";

    // Section headers
    private static final String REPORT_SUFFIX = " - Phase Report";
    private static final String SUMMARY = "Summary";
    private static final String SIGNALS = "Signals";
    private static final String PHASES = "Phases";
    private static final String TABLE = "Phase Transition Table";
    private static final String NONDETERMINISM = "Non-deterministic Entries";
    private static final String DEAD_ENDS = "Dead-end Phases";

    // Table headers
    private static final String METRIC = "Metric";
    private static final String COUNT = "Count";
    private static final String SIGNAL = "Signal";
    private static final String ROLE = "Role";
    private static final String INITIAL_LEVEL = "Initial Level";
    private static final String PHASE = "Phase";
    private static final String MARKING = "Marking";
    private static final String ENABLED = "Enabled";
    private static final String SUCCESSORS = "Successors";
    private static final String EVENT = "Event";
    private static final String DESTINATIONS = "Destinations";

    private static final String NONE_FOUND = "None.";

    @Override
    public String getId() {
        return "report";
    }

    @Override
    public String getDisplayName() {
        return "Markdown Phase Report Generator";
    }

    @Override
    public String getFileExtension() {
        return "md";
    }

    @Override
    public GeneratedModel generate(PetriNet net, StateGraph graph, PhaseTransitionTable table, GeneratorConfig config) {
        Objects.requireNonNull(net, "net must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(config, "config must not be null");

        log.debug("Generating phase report for '{}'", net.name());

        StringBuilder sb = new StringBuilder();
        sb.append(H1).append(net.name()).append(REPORT_SUFFIX).append(DOUBLE_NEWLINE);
        appendSummary(sb, net, graph, table);
        appendSignals(sb, net, table);
        appendPhases(sb, net, graph);
        appendTable(sb, table);
        appendFindings(sb, table);

        return new GeneratedModel(VerilogAGenerator.sanitize(net.name()), sb.toString(), getFileExtension());
    }

    private void appendSummary(StringBuilder sb, PetriNet net, StateGraph graph, PhaseTransitionTable table) {
        sb.append(H2).append(SUMMARY).append(DOUBLE_NEWLINE);
        appendTableRow(sb, METRIC, COUNT);
        appendTableDivider(sb, 2);
        for (SignalRole role : SignalRole.values()) {
            appendTableRow(sb, capitalize(role.name()) + " signals",
                Integer.toString(net.signalsWithRole(role).size()));
        }
        appendTableRow(sb, "Places", Integer.toString(net.places().size()));
        appendTableRow(sb, "Transitions", Integer.toString(net.transitions().size()));
        appendTableRow(sb, "Phases", Integer.toString(graph.phaseCount()));
        appendTableRow(sb, "Edges", Integer.toString(graph.edges().size()));
        appendTableRow(sb, "Table entries", Integer.toString(table.entries().size()));
        appendTableRow(sb, "Initial phase", Integer.toString(table.initialPhase()));
        sb.append(NEWLINE);
    }

    private void appendSignals(StringBuilder sb, PetriNet net, PhaseTransitionTable table) {
        sb.append(H2).append(SIGNALS).append(DOUBLE_NEWLINE);
        appendTableRow(sb, SIGNAL, ROLE, INITIAL_LEVEL);
        appendTableDivider(sb, 3);
        for (Signal signal : net.signals()) {
            String level = table.initialLevel(signal.name()).isPresent()
                ? Integer.toString(table.initialLevel(signal.name()).getAsInt())
                : DASH_VALUE;
            appendTableRow(sb, code(signal.name()), signal.role().name().toLowerCase(), level);
        }
        sb.append(NEWLINE);
    }

    private void appendPhases(StringBuilder sb, PetriNet net, StateGraph graph) {
        sb.append(H2).append(PHASES).append(DOUBLE_NEWLINE);
        appendTableRow(sb, PHASE, MARKING, ENABLED, SUCCESSORS);
        appendTableDivider(sb, 4);
        for (int phase = 0; phase < graph.phaseCount(); phase++) {
            List<StateEdge> outgoing = graph.outgoing(phase);
            String enabled = outgoing.isEmpty() ? DASH_VALUE : outgoing.stream()
                .map(edge -> code(edge.label().toString()))
                .distinct()
                .collect(Collectors.joining(", "));
            String successors = outgoing.isEmpty() ? DASH_VALUE : outgoing.stream()
                .map(edge -> Integer.toString(edge.destination()))
                .distinct()
                .collect(Collectors.joining(", "));
            appendTableRow(sb, Integer.toString(phase), escapeMarkdown(net.describe(graph.marking(phase))),
                enabled, successors);
        }
        sb.append(NEWLINE);
    }

    private void appendTable(StringBuilder sb, PhaseTransitionTable table) {
        sb.append(H2).append(TABLE).append(DOUBLE_NEWLINE);
        appendTableRow(sb, PHASE, EVENT, DESTINATIONS);
        appendTableDivider(sb, 3);
        for (Map.Entry<PhaseKey, SortedSet<Integer>> entry : table.entries().entrySet()) {
            appendEntryRow(sb, entry.getKey(), entry.getValue());
        }
        sb.append(NEWLINE);
    }

    private void appendFindings(StringBuilder sb, PhaseTransitionTable table) {
        sb.append(H2).append(NONDETERMINISM).append(DOUBLE_NEWLINE);
        SortedMap<PhaseKey, SortedSet<Integer>> nondeterministic = table.nondeterministicEntries();
        if (nondeterministic.isEmpty()) {
            sb.append(NONE_FOUND).append(DOUBLE_NEWLINE);
        } else {
            appendTableRow(sb, PHASE, EVENT, DESTINATIONS);
            appendTableDivider(sb, 3);
            nondeterministic.forEach((key, destinations) -> appendEntryRow(sb, key, destinations));
            sb.append(NEWLINE);
        }

        sb.append(H2).append(DEAD_ENDS).append(DOUBLE_NEWLINE);
        List<Integer> deadEnds = table.deadEndPhases();
        if (deadEnds.isEmpty()) {
            sb.append(NONE_FOUND).append(NEWLINE);
        } else {
            sb.append(deadEnds.stream().map(String::valueOf).collect(Collectors.joining(", "))).append(NEWLINE);
        }
    }

    private void appendEntryRow(StringBuilder sb, PhaseKey key, SortedSet<Integer> destinations) {
        appendTableRow(sb,
            Integer.toString(key.phase()),
            code(key.label().toString()),
            destinations.stream().map(String::valueOf).collect(Collectors.joining(", ")));
    }

    private String code(String text) {
        return CODE + text + CODE;
    }

    private String capitalize(String text) {
        return text.charAt(0) + text.substring(1).toLowerCase();
    }

    /**
     * Escapes markdown special characters.
     */
    private String escapeMarkdown(String text) {
        return text.replace("|", "\\|").replace("<", "&lt;").replace(">", "&gt;");
    }

    private void appendTableRow(StringBuilder sb, String... columns) {
        sb.append(PIPE);
        for (String col : columns) {
            sb.append(SPACE).append(col).append(SPACE).append(PIPE);
        }
        sb.append(NEWLINE);
    }

    private void appendTableDivider(StringBuilder sb, int columnCount) {
        sb.append(PIPE);
        for (int i = 0; i < columnCount; i++) {
            sb.append("---").append(PIPE);
        }
        sb.append(NEWLINE);
    }
}
