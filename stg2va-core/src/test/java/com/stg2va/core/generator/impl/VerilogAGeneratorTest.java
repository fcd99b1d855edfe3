package com.stg2va.core.generator.impl;

import com.stg2va.core.NetFixtures;
import com.stg2va.core.analysis.ReachabilityAnalyzer;
import com.stg2va.core.analysis.StateGraph;
import com.stg2va.core.generator.GeneratedModel;
import com.stg2va.core.generator.GeneratorConfig;
import com.stg2va.core.generator.Timing;
import com.stg2va.core.logic.PhaseTransitionTable;
import com.stg2va.core.logic.SignalLogicDeriver;
import com.stg2va.core.model.PetriNet;
import com.stg2va.core.parser.StgParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link VerilogAGenerator}.
 */
class VerilogAGeneratorTest {

    private VerilogAGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new VerilogAGenerator();
    }

    @Test
    void getId_returnsCorrectId() {
        assertThat(generator.getId()).isEqualTo("veriloga");
    }

    @Test
    void getDisplayName_returnsCorrectName() {
        assertThat(generator.getDisplayName()).isEqualTo("Verilog-A Behavioral Model Generator");
    }

    @Test
    void getFileExtension_returnsVa() {
        assertThat(generator.getFileExtension()).isEqualTo("va");
    }

    @Test
    void generate_withNullNet_throwsException() {
        StateGraph graph = NetFixtures.graph("handshake");
        PhaseTransitionTable table = NetFixtures.table("handshake");

        assertThatThrownBy(() -> generator.generate(null, graph, table, GeneratorConfig.defaults()))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void generate_handshake_declaresModuleAndPorts() {
        GeneratedModel model = generate(NetFixtures.source("handshake"), GeneratorConfig.defaults());

        assertThat(model.name()).isEqualTo("handshake");
        assertThat(model.fileName()).isEqualTo("handshake.va");
        assertThat(model.content())
            .contains("`include \"disciplines.vams\"")
            .contains("module handshake(VDD, VSS, RST, req, ack);")
            .contains("    inout VDD, VSS;")
            .contains("    input RST;")
            .contains("    input req;")
            .contains("    output ack;")
            .contains("    electrical VDD, VSS, RST, req, ack, ack_drv;")
            .contains("    integer phase;")
            .endsWith("endmodule\n");
    }

    @Test
    void generate_handshake_declaresTimingParametersPerSignal() {
        String va = generate(NetFixtures.source("handshake"), GeneratorConfig.defaults()).content();

        assertThat(va)
            .contains("parameter real req_RISE_PAR = 1.0E-10 from [0:inf);")
            .contains("parameter real req_FALL_PAR = 1.0E-10 from [0:inf);")
            .contains("parameter real req_DELAY_PAR = 1.0E-10 from [0:inf);")
            .contains("parameter real req_IN_CAP_PAR = 1.0E-14 from [0:inf);")
            .contains("parameter real req_OUT_RES_PAR = 10000.0 from (0:inf);")
            .contains("parameter integer ack_RST_VALUE_PAR = 0 from [0:1];")
            .doesNotContain("req_RST_VALUE_PAR");
    }

    @Test
    void generate_handshake_checksEveryObservedEdge() {
        String va = generate(NetFixtures.source("handshake"), GeneratorConfig.defaults()).content();

        assertThat(va)
            .contains("@(cross(V(req, VSS) - 0.5 * V(VDD, VSS), +1)) begin")
            .contains("@(cross(V(ack, VSS) - 0.5 * V(VDD, VSS), -1)) begin")
            .contains("0: next_phase = 1;")
            .contains("$fatal(1, \"STG consistency error: req+ is not enabled in phase %d\", phase);")
            .contains("$fatal(1, \"STG consistency error: ack- is not enabled in phase %d\", phase);")
            .doesNotContain("is ambiguous")
            .doesNotContain("settle");
        assertThat(va.split("is not enabled in phase", -1)).hasSize(5);
    }

    @Test
    void generate_handshake_drivesOutputFromEnablingPhases() {
        String va = generate(NetFixtures.source("handshake"), GeneratorConfig.defaults()).content();

        assertThat(va)
            .contains("1: begin\n                ack_target = 1;")
            .contains("3: begin\n                ack_target = 0;")
            .contains("V(ack_drv, VSS) <+ V(VDD, VSS) * transition(ack_target, ack_DELAY_PAR, ack_RISE_PAR, ack_FALL_PAR);")
            .contains("I(ack_drv, ack) <+ V(ack_drv, ack) / ack_OUT_RES_PAR;")
            .contains("I(req, VSS) <+ req_IN_CAP_PAR * ddt(V(req, VSS));")
            .doesNotContain("req_target");
    }

    @Test
    void generate_resetAndStartup_returnToInitialPhase() {
        String va = generate(NetFixtures.source("handshake"), GeneratorConfig.defaults()).content();

        assertThat(va)
            .contains("@(initial_step) begin")
            .contains("@(cross(V(RST, VSS) - 0.5 * V(VDD, VSS), -1)) begin")
            .contains("phase = 0;")
            .contains("ack_target = ack_RST_VALUE_PAR;");
    }

    @Test
    void generate_sameInputTwice_isByteIdentical() {
        GeneratorConfig config = GeneratorConfig.builder().exposeInternalSignals(true).build();

        String first = generate(NetFixtures.source("choice"), config).content();
        String second = generate(NetFixtures.source("choice"), config).content();

        assertThat(first).isEqualTo(second);
    }

    @Test
    void generate_ambiguousEntry_emitsAmbiguityCheck() {
        String va = generate(NetFixtures.source("choice"), GeneratorConfig.defaults()).content();

        assertThat(va)
            .contains("0: next_phase = -2; // [1, 2]")
            .contains("$fatal(1, \"STG consistency error: a+ is ambiguous in phase %d\", phase);");
    }

    @Test
    void generate_dummyTransitions_emitSettleFunction() {
        String va = generate(NetFixtures.source("dummy"), GeneratorConfig.defaults()).content();

        assertThat(va)
            .contains("analog function integer settle;")
            .contains("1: begin p = 2; moved = 1; end")
            .contains("while (moved && steps < 500) begin")
            .contains("next_phase = settle(next_phase);")
            .contains("phase = settle(0);")
            .contains("dummy transitions do not settle after a+")
            .doesNotContain("input d;");
    }

    @Test
    void generate_maxSettleIterations_boundsSettleLoop() {
        GeneratorConfig config = GeneratorConfig.builder().maxSettleIterations(42).build();

        assertThat(generate(NetFixtures.source("dummy"), config).content())
            .contains("while (moved && steps < 42) begin");
    }

    @Test
    void generate_defaultRoles_keepInternalSignalAsDrivenNode() {
        String va = generate(NetFixtures.source("roles"), GeneratorConfig.defaults()).content();

        assertThat(va)
            .contains("module roles(VDD, VSS, RST, a, b);")
            .contains("    electrical VDD, VSS, RST, a, b, b_drv, c, c_drv;")
            .contains("parameter integer c_RST_VALUE_PAR = 0 from [0:1];")
            .contains("V(c_drv, VSS) <+");
    }

    @Test
    void generate_exposeInternalSignals_makesInternalAnOutput() {
        GeneratorConfig config = GeneratorConfig.builder().exposeInternalSignals(true).build();

        assertThat(generate(NetFixtures.source("roles"), config).content())
            .contains("module roles(VDD, VSS, RST, a, b, c);")
            .contains("    output c;");
    }

    @Test
    void generate_forceAllInputs_observesOutputsAndStillDrivesHiddenInternals() {
        GeneratorConfig config = GeneratorConfig.builder().forceAllInputs(true).build();

        String va = generate(NetFixtures.source("roles"), config).content();

        assertThat(va)
            .contains("module roles(VDD, VSS, RST, a, b);")
            .contains("    input b;")
            .doesNotContain("b_drv")
            .doesNotContain("b_RST_VALUE_PAR")
            .contains("c_drv")
            .contains("parameter integer c_RST_VALUE_PAR")
            .contains("// c drive");
    }

    @Test
    void generate_forceAllInputsAndExposeInternals_makesInternalAnInput() {
        GeneratorConfig config = GeneratorConfig.builder()
            .forceAllInputs(true)
            .exposeInternalSignals(true)
            .build();

        String va = generate(NetFixtures.source("roles"), config).content();

        assertThat(va)
            .contains("module roles(VDD, VSS, RST, a, b, c);")
            .contains("    input c;")
            .doesNotContain("_drv");
    }

    @Test
    void generate_toggleOnInput_matchesBothCrossings() {
        String va = generate(NetFixtures.source("roles"), GeneratorConfig.defaults()).content();

        int rise = va.indexOf("@(cross(V(a, VSS) - 0.5 * V(VDD, VSS), +1))");
        int fall = va.indexOf("@(cross(V(a, VSS) - 0.5 * V(VDD, VSS), -1))");
        assertThat(rise).isNotNegative();
        assertThat(fall).isGreaterThan(rise);
        assertThat(va.substring(rise, fall)).contains("0: next_phase = 1;");
        assertThat(va.substring(fall)).contains("0: next_phase = 1;");
    }

    @Test
    void generate_toggleOnOutput_invertsLastLevel() {
        String va = generate("""
            .model blink
            .outputs x
            .graph
            x~ x~/2
            x~/2 x~
            .marking { <x~/2,x~> }
            .end
            """, GeneratorConfig.defaults()).content();

        assertThat(va)
            .contains("0, 1: x_target = 1 - x_level;")
            .contains("x_level = 1;")
            .contains("x_level = 0;")
            .doesNotContain("is already");
    }

    @Test
    void generate_renamedSignal_usesIdentifierForPortsAndParameters() {
        GeneratorConfig config = GeneratorConfig.builder().rename("req", "req_i").build();

        String va = generate(NetFixtures.source("handshake"), config).content();

        assertThat(va)
            .contains("module handshake(VDD, VSS, RST, req_i, ack);")
            .contains("req_i_RISE_PAR")
            .contains("STG consistency error: req+ is not enabled")
            .doesNotContain("V(req, VSS)");
    }

    @Test
    void generate_renameOntoExistingSignal_throwsException() {
        GeneratorConfig config = GeneratorConfig.builder().rename("req", "ack").build();

        assertThatThrownBy(() -> generate(NetFixtures.source("handshake"), config))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("clashes");
    }

    @Test
    void generate_customSupplyNames_areUsedEverywhere() {
        GeneratorConfig config = GeneratorConfig.builder()
            .vddName("VDDA")
            .vssName("GND")
            .resetName("RSTN")
            .build();

        String va = generate(NetFixtures.source("handshake"), config).content();

        assertThat(va)
            .contains("module handshake(VDDA, GND, RSTN, req, ack);")
            .contains("@(cross(V(req, GND) - 0.5 * V(VDDA, GND), +1))")
            .doesNotContain("VDD,");
    }

    @Test
    void generate_initialValueOverride_setsResetParameter() {
        GeneratorConfig config = GeneratorConfig.builder().initialValue("ack", 1).build();

        assertThat(generate(NetFixtures.source("handshake"), config).content())
            .contains("parameter integer ack_RST_VALUE_PAR = 1 from [0:1];");
    }

    @Test
    void generate_signalTiming_overridesDefaultTiming() {
        Timing slow = Timing.defaults().merge(2.5e-9, null, null, null, null);
        GeneratorConfig config = GeneratorConfig.builder().signalTiming("ack", slow).build();

        assertThat(generate(NetFixtures.source("handshake"), config).content())
            .contains("parameter real ack_RISE_PAR = 2.5E-9 from [0:inf);")
            .contains("parameter real req_RISE_PAR = 1.0E-10 from [0:inf);");
    }

    @Test
    void generate_dottedModelName_isSanitized() {
        GeneratedModel model = generate("""
            .model lib.cell
            .inputs a
            .graph
            a+ a-
            a- a+
            .marking { <a-,a+> }
            .end
            """, GeneratorConfig.defaults());

        assertThat(model.name()).isEqualTo("lib_cell");
        assertThat(model.content()).contains("module lib_cell(");
    }

    @Test
    void sanitize_replacesIllegalCharacters() {
        assertThat(VerilogAGenerator.sanitize("a.b")).isEqualTo("a_b");
        assertThat(VerilogAGenerator.sanitize("1x")).isEqualTo("_1x");
        assertThat(VerilogAGenerator.sanitize("ok_1")).isEqualTo("ok_1");
    }

    @Test
    void generate_drivenSignal_stopsWhenEnabledEdgeFindsPinAtTargetLevel() {
        String va = generate(NetFixtures.source("handshake"), GeneratorConfig.defaults()).content();

        assertThat(va)
            .contains("if (active && ack_level == 1)\n"
                + "                    $fatal(1, \"STG consistency error: ack+ is enabled in phase %d but ack is already high\", phase);")
            .contains("if (active && ack_level == 0)\n"
                + "                    $fatal(1, \"STG consistency error: ack- is enabled in phase %d but ack is already low\", phase);")
            .doesNotContain("req is already");
    }

    @Test
    void generate_resetValueContradictingGraph_keepsLevelCheck() {
        GeneratorConfig config = GeneratorConfig.builder().initialValue("ack", 1).build();

        String va = generate(NetFixtures.source("handshake"), config).content();

        assertThat(va)
            .contains("parameter integer ack_RST_VALUE_PAR = 1 from [0:1];")
            .contains("ack_level = ack_RST_VALUE_PAR;")
            .contains("ack+ is enabled in phase %d but ack is already high");
    }

    private GeneratedModel generate(String source, GeneratorConfig config) {
        PetriNet net = new StgParser().parse(source);
        StateGraph graph = new ReachabilityAnalyzer().analyze(net);
        PhaseTransitionTable table = new SignalLogicDeriver().derive(graph);
        return generator.generate(net, graph, table, config);
    }
}
