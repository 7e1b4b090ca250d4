package com.vidnyan.spicebridge.domain.netlist;

import com.vidnyan.spicebridge.domain.model.Circuit;
import com.vidnyan.spicebridge.domain.model.Statement;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PrefixEngineTest {

    private final NetlistParser parser = new NetlistParser();
    private final PrefixEngine engine = new PrefixEngine();

    @Test
    void prefix_ShouldRenameInstancesNodesAndParameters() {
        Circuit circuit = parser.parse(Netlists.RC_LOWPASS);

        Circuit prefixed = engine.prefix(circuit, "S1");

        assertEquals("S1", prefixed.tag());
        Statement.ComponentInstance r1 = prefixed.component("RS1_1").orElseThrow();
        assertEquals(List.of("S1_in", "S1_out"), r1.nodes());
        assertEquals("{S1_R1}", r1.value());
        assertEquals(List.of("VS1_1", "RS1_1", "CS1_1"),
                prefixed.components().stream().map(Statement.ComponentInstance::name).toList());
        assertEquals(new Statement.Directive("param", ".param S1_R1=10k"), prefixed.statements().get(1));
        assertEquals(circuit.title(), prefixed.title());
    }

    @Test
    void prefix_GroundIsFixed() {
        Circuit circuit = parser.parse("* t\nR1 a 0 1k\nR2 a GND 1k\nR3 a gnd 1k\n.end\n");

        Circuit prefixed = engine.prefix(circuit, "A");

        assertEquals(Set.of("A_a", "0"), prefixed.nodes());
        assertEquals("0", PrefixEngine.prefixNode("0", "A", Set.of()));
    }

    @Test
    void prefix_ShouldKeepPreservedNodes() {
        Circuit circuit = parser.parse("* t\nR1 vcc out 1k\n.end\n");

        Circuit prefixed = engine.prefix(circuit, "A", Set.of("vcc"));

        assertEquals(List.of("vcc", "A_out"), prefixed.components().get(0).nodes());
    }

    @Test
    void prefix_ShouldRewritePorts() {
        Circuit circuit = parser.parse(Netlists.RC_LOWPASS)
                .withPorts(Map.of("in", "in", "out", "out", "gnd", "0"));

        Circuit prefixed = engine.prefix(circuit, "F");

        assertEquals(Map.of("in", "F_in", "out", "F_out", "gnd", "0"), prefixed.ports());
    }

    @Test
    void prefix_IsInjectiveOnNodes() {
        Circuit circuit = parser.parse("* t\nR1 a b_c 1k\nR2 a_b c 1k\nR3 c 0 1k\n.end\n");

        Circuit prefixed = engine.prefix(circuit, "T");

        Set<String> before = circuit.nodes();
        Set<String> after = new HashSet<>();
        for (String node : before) {
            after.add(PrefixEngine.prefixNode(node, "T", Set.of()));
        }
        assertEquals(before.size(), after.size());
        assertEquals(after, prefixed.nodes());
    }

    @Test
    void prefix_ShouldRenameControllingReferences() {
        Circuit circuit = parser.parse("""
                * t
                Vsense a 0 dc 0
                F1 b 0 Vsense 2
                L1 a 0 1u
                L2 b 0 1u
                K1 L1 L2 0.99
                .end
                """);

        Circuit prefixed = engine.prefix(circuit, "S2");

        assertEquals(List.of("VS2_sense"), prefixed.component("FS2_1").orElseThrow().references());
        assertEquals(List.of("LS2_1", "LS2_2"), prefixed.component("KS2_1").orElseThrow().references());
    }

    @Test
    void prefix_ShouldRewriteBracedExpressions() {
        Circuit circuit = parser.parse("""
                * t
                .param Rf=100k Rin=10k
                .param gain={Rf/Rin}
                R1 in out {Rf}
                .end
                """);

        Circuit prefixed = engine.prefix(circuit, "A");

        assertEquals(".param A_Rf=100k A_Rin=10k", ((Statement.Directive) prefixed.statements().get(1)).text());
        assertEquals(".param A_gain={A_Rf/A_Rin}", ((Statement.Directive) prefixed.statements().get(2)).text());
        assertEquals("{A_Rf}", prefixed.component("RA_1").orElseThrow().value());
    }

    @Test
    void prefix_ShouldLeaveSubcircuitsAndIncludesAlone() {
        Circuit circuit = parser.parse(".title amp\n.include models/opamp.lib\n" + Netlists.INVERTING_AMP.substring(
                Netlists.INVERTING_AMP.indexOf('\n') + 1));

        Circuit prefixed = engine.prefix(circuit, "AMP");

        assertEquals(Statement.Directive.of(".include models/opamp.lib"), prefixed.statements().get(1));
        assertTrue(prefixed.statements().stream().anyMatch(s -> s instanceof Statement.Block b
                && b.name().equals("ideal_opamp") && b.lines().get(1).equals("E1 out 0 inp inn 100k")));
        Statement.ComponentInstance x1 = prefixed.component("XAMP_1").orElseThrow();
        assertEquals("ideal_opamp", x1.subcircuitName());
        assertEquals(List.of("0", "AMP_vminus", "AMP_out"), x1.nodes());
    }

    @Test
    void prefix_ShouldRenameOutputFunctionsAndTagComments() {
        Circuit circuit = parser.parse("* t\n* bias network\nR1 in out 1k\n.ic V(out)=0\n.end\n");

        Circuit prefixed = engine.prefix(circuit, "B");

        assertEquals(new Statement.Comment("* [B] bias network"), prefixed.statements().get(1));
        assertEquals(".ic V(B_out)=0", ((Statement.Directive) prefixed.statements().get(3)).text());
    }

    @Test
    void prefix_ShouldRenameDecibelAndPhaseForms() {
        Circuit circuit = parser.parse("* t\nR1 in out 1k\nV1 in 0 AC 1\n"
                + ".print ac vdb(out) VP(out) vm(in,out)\n.meas ac peak MAX vdb(out)\n.save ip(V1)\n.end\n");

        Circuit prefixed = engine.prefix(circuit, "B");

        assertEquals(".print ac vdb(B_out) VP(B_out) vm(B_in,B_out)",
                ((Statement.Directive) prefixed.statements().get(3)).text());
        assertEquals(".meas ac peak MAX vdb(B_out)", ((Statement.Directive) prefixed.statements().get(4)).text());
        assertEquals(".save ip(VB_1)", ((Statement.Directive) prefixed.statements().get(5)).text());
    }

    @Test
    void prefix_InvalidTag_ShouldFail() {
        Circuit circuit = parser.parse(Netlists.SINGLE_RESISTOR);

        assertThrows(IllegalArgumentException.class, () -> engine.prefix(circuit, "bad tag"));
        assertThrows(IllegalArgumentException.class, () -> engine.prefix(circuit, ""));
        assertThrows(IllegalArgumentException.class, () -> engine.prefix(circuit, "A_B"));
    }

    @Test
    void prefix_ShouldNotModifyInput() {
        Circuit circuit = parser.parse(Netlists.RC_LOWPASS);
        String before = NetlistWriter.write(circuit);

        engine.prefix(circuit, "S1");

        assertEquals(before, NetlistWriter.write(circuit));
    }
}
