package com.stg2va.core.analysis;

import com.stg2va.core.NetFixtures;
import com.stg2va.core.error.StateExplosionException;
import com.stg2va.core.error.UnsafeNetException;
import com.stg2va.core.model.Direction;
import com.stg2va.core.model.PetriNet;
import com.stg2va.core.model.TransitionLabel;
import com.stg2va.core.parser.StgParser;
import org.junit.jupiter.api.Test;

import java.util.HashSet;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link ReachabilityAnalyzer}.
 */
class ReachabilityAnalyzerTest {

    @Test
    void analyze_twoPlaceNet_findsTwoPhasesAndTwoEdges() {
        StateGraph graph = NetFixtures.graph("scenario_a");

        assertThat(graph.phaseCount()).isEqualTo(2);
        assertThat(graph.edges()).containsExactly(
            new StateEdge(0, 0, new TransitionLabel("a", Direction.RISE), 1),
            new StateEdge(1, 1, new TransitionLabel("a", Direction.FALL), 0));
        assertThat(graph.deadEndPhases()).isEmpty();
    }

    @Test
    void analyze_initialMarking_isPhaseZero() {
        PetriNet net = NetFixtures.net("handshake");
        StateGraph graph = new ReachabilityAnalyzer().analyze(net);

        assertThat(graph.initialPhase()).isZero();
        assertThat(graph.marking(graph.initialPhase())).isEqualTo(net.initialMarking());
    }

    @Test
    void analyze_handshake_visitsPhasesInFiringOrder() {
        StateGraph graph = NetFixtures.graph("handshake");

        assertThat(graph.phaseCount()).isEqualTo(4);
        assertThat(graph.edges()).extracting(edge -> edge.label().toString())
            .containsExactly("req+", "ack+", "req-", "ack-");
        assertThat(graph.outgoing(3)).singleElement()
            .satisfies(edge -> assertThat(edge.destination()).isZero());
    }

    @Test
    void analyze_independentToggles_phaseCountIsNumberOfDistinctMarkings() {
        StateGraph graph = NetFixtures.graph("counter");

        assertThat(graph.phaseCount()).isEqualTo(256);
        assertThat(new HashSet<>(graph.phases())).hasSize(256);
        // every phase enables one edge of each of the eight signals
        assertThat(graph.edges()).hasSize(256 * 8);
    }

    @Test
    void analyze_sameNetTwice_producesSameGraph() {
        PetriNet net = NetFixtures.net("choice");
        ReachabilityAnalyzer analyzer = new ReachabilityAnalyzer();

        assertThat(analyzer.analyze(net)).isEqualTo(analyzer.analyze(net));
    }

    @Test
    void analyze_phaseCeilingExceeded_throwsStateExplosion() {
        PetriNet net = NetFixtures.net("counter");

        assertThatThrownBy(() -> new ReachabilityAnalyzer(100).analyze(net))
            .isInstanceOf(StateExplosionException.class)
            .hasMessageContaining("100")
            .satisfies(e -> assertThat(((StateExplosionException) e).getMaxPhases()).isEqualTo(100));
    }

    @Test
    void analyze_phaseCeilingReachedExactly_succeeds() {
        assertThat(new ReachabilityAnalyzer(256).analyze(NetFixtures.net("counter")).phaseCount())
            .isEqualTo(256);
    }

    @Test
    void analyze_secondTokenOnPlace_throwsUnsafeNet() {
        PetriNet net = NetFixtures.net("unsafe");

        assertThatThrownBy(() -> new ReachabilityAnalyzer().analyze(net))
            .isInstanceOf(UnsafeNetException.class)
            .hasMessageContaining("a+")
            .hasMessageContaining("p1")
            .satisfies(e -> {
                UnsafeNetException unsafe = (UnsafeNetException) e;
                assertThat(unsafe.getPhase()).isZero();
                assertThat(unsafe.getTransition()).isEqualTo("a+");
                assertThat(unsafe.getPlace()).isEqualTo("p1");
            });
    }

    @Test
    void analyze_transitionWithoutOutputs_leavesDeadEndPhase() {
        PetriNet net = new StgParser().parse("""
            .model sink
            .inputs a
            .graph
            p0 a+
            a+ p1
            p1 a-
            .marking { p0 }
            .end
            """);

        StateGraph graph = new ReachabilityAnalyzer().analyze(net);

        assertThat(graph.phaseCount()).isEqualTo(3);
        assertThat(graph.deadEndPhases()).containsExactly(2);
        assertThat(graph.marking(2).tokenCount()).isZero();
    }

    @Test
    void constructor_withNonPositiveCeiling_throwsException() {
        assertThatThrownBy(() -> new ReachabilityAnalyzer(0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void analyze_withNullNet_throwsException() {
        assertThatThrownBy(() -> new ReachabilityAnalyzer().analyze(null))
            .isInstanceOf(NullPointerException.class);
    }
}
