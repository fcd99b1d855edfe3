package com.stg2va.core.logic;

import com.stg2va.core.NetFixtures;
import com.stg2va.core.analysis.ReachabilityAnalyzer;
import com.stg2va.core.analysis.StateEdge;
import com.stg2va.core.analysis.StateGraph;
import com.stg2va.core.model.Direction;
import com.stg2va.core.model.TransitionLabel;
import com.stg2va.core.parser.StgParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link SignalLogicDeriver} and {@link PhaseTransitionTable}.
 */
class SignalLogicDeriverTest {

    private SignalLogicDeriver deriver;

    @BeforeEach
    void setUp() {
        deriver = new SignalLogicDeriver();
    }

    @Test
    void derive_twoPlaceNet_mapsRiseAndFall() {
        PhaseTransitionTable table = deriver.derive(NetFixtures.graph("scenario_a"));

        assertThat(table.phaseCount()).isEqualTo(2);
        assertThat(table.entries()).hasSize(2);
        assertThat(table.destinations(0, "a", Direction.RISE)).containsExactly(1);
        assertThat(table.destinations(1, "a", Direction.FALL)).containsExactly(0);
        assertThat(table.destinations(0, "a", Direction.FALL)).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"scenario_a", "handshake", "choice", "dummy", "roles"})
    void derive_projectionOfEachLabel_equalsEdgesOfThatLabel(String fixture) {
        StateGraph graph = NetFixtures.graph(fixture);
        PhaseTransitionTable table = deriver.derive(graph);

        Set<TransitionLabel> labels = graph.edges().stream()
            .map(StateEdge::label)
            .collect(Collectors.toSet());
        for (TransitionLabel label : labels) {
            Set<PhasePair> expected = graph.edges().stream()
                .filter(edge -> edge.label().equals(label))
                .map(edge -> new PhasePair(edge.source(), edge.destination()))
                .collect(Collectors.toCollection(TreeSet::new));

            assertThat(table.projection(label)).as("projection of %s", label).isEqualTo(expected);
        }
    }

    @Test
    void derive_deterministicNet_hasNoAmbiguousEntries() {
        PhaseTransitionTable table = NetFixtures.table("handshake");

        assertThat(table.isDeterministic()).isTrue();
        assertThat(table.nondeterministicEntries()).isEmpty();
    }

    @Test
    void derive_twoInstancesFromOnePhase_keepsBothDestinations() {
        PhaseTransitionTable table = NetFixtures.table("choice");

        assertThat(table.isDeterministic()).isFalse();
        assertThat(table.nondeterministicEntries())
            .containsOnlyKeys(new PhaseKey(0, "a", Direction.RISE));
        assertThat(table.destinations(0, "a", Direction.RISE)).containsExactly(1, 2);
    }

    @Test
    void enablingPhases_listsSourcePhasesOfASignal() {
        PhaseTransitionTable table = NetFixtures.table("handshake");

        assertThat(table.enablingPhases("ack")).containsExactly(1, 3);
        assertThat(table.enablingPhases("ack", Direction.RISE)).containsExactly(1);
        assertThat(table.enablingPhases("ack", Direction.FALL)).containsExactly(3);
        assertThat(table.isEnabled(0, "req")).isTrue();
        assertThat(table.isEnabled(0, "ack")).isFalse();
    }

    @Test
    void initialLevel_firstEdgeRise_isLow() {
        PhaseTransitionTable table = NetFixtures.table("handshake");

        assertThat(table.initialLevel("req")).hasValue(0);
        assertThat(table.initialLevel("ack")).hasValue(0);
    }

    @Test
    void initialLevel_firstEdgeFall_isHigh() {
        StateGraph graph = new ReachabilityAnalyzer().analyze(new StgParser().parse("""
            .model starts_high
            .outputs a
            .graph
            a- a+
            a+ a-
            .marking { <a+,a-> }
            .end
            """));

        assertThat(deriver.derive(graph).initialLevel("a")).hasValue(1);
    }

    @Test
    void initialLevel_toggleOnly_isUnknown() {
        PhaseTransitionTable table = NetFixtures.table("roles");

        assertThat(table.initialLevel("a")).isEmpty();
        assertThat(table.initialLevel("b")).hasValue(0);
        assertThat(table.initialLevel("c")).hasValue(0);
    }

    @Test
    void deadEndPhases_followsStateGraph() {
        StateGraph graph = new ReachabilityAnalyzer().analyze(new StgParser().parse("""
            .model sink
            .inputs a
            .graph
            p0 a+
            a+ p1
            p1 a-
            .marking { p0 }
            .end
            """));

        assertThat(deriver.derive(graph).deadEndPhases()).containsExactly(2);
    }

    @Test
    void derive_sameGraphTwice_producesEqualTables() {
        StateGraph graph = NetFixtures.graph("choice");

        assertThat(deriver.derive(graph)).isEqualTo(deriver.derive(graph));
        assertThat(deriver.derive(graph).hashCode()).isEqualTo(deriver.derive(graph).hashCode());
    }

    @Test
    void entries_areUnmodifiable() {
        PhaseTransitionTable table = NetFixtures.table("handshake");

        assertThatThrownBy(() -> table.entries().clear())
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> table.destinations(0, "req", Direction.RISE).add(7))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
