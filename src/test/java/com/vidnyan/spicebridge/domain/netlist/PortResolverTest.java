package com.vidnyan.spicebridge.domain.netlist;

import com.vidnyan.spicebridge.domain.error.AmbiguousPortException;
import com.vidnyan.spicebridge.domain.model.Circuit;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PortResolverTest {

    private final NetlistParser parser = new NetlistParser();
    private final PortResolver resolver = new PortResolver();

    @Test
    void detect_ShouldFindConventionalPorts() {
        Map<String, String> ports = resolver.detect(parser.parse(Netlists.RC_LOWPASS));

        assertEquals(Map.of("in", "in", "out", "out", "gnd", "0"), ports);
        assertEquals(List.of("in", "out", "gnd"), List.copyOf(ports.keySet()));
    }

    @Test
    void detect_ShouldIgnoreSubcircuitInternals() {
        Map<String, String> ports = resolver.detect(parser.parse(Netlists.INVERTING_AMP));
        assertEquals(Map.of("in", "in", "out", "out", "gnd", "0"), ports);

        Circuit wrapped = parser.parse("""
                * block only
                .subckt buffer in out
                R1 in out 1k
                .ends buffer
                X1 a b buffer
                .end
                """);
        assertTrue(resolver.detect(wrapped).isEmpty());
    }

    @Test
    void detect_WithoutRecognisableNames_ShouldReturnNothing() {
        assertTrue(resolver.detect(parser.parse("* t\nR1 n1 n2 1k\n.end\n")).isEmpty());
    }

    @Test
    void detect_ShouldPreferSingleConnectionInput() {
        Circuit circuit = parser.parse("""
                * two inputs
                V1 in 0 ac 1
                R1 in mid 1k
                R2 inp mid 1k
                R3 mid out 1k
                .end
                """);

        assertEquals("inp", resolver.detect(circuit).get("in"));
    }

    @Test
    void detect_TiedInputs_ShouldTakeFirstOccurrence() {
        Circuit circuit = parser.parse("""
                * summing node
                R1 in1 x 1k
                R2 in2 x 1k
                R3 x out 1k
                .end
                """);

        assertEquals("in1", resolver.detect(circuit).get("in"));
    }

    @Test
    void detect_ShouldFallBackToSingleDanglingNode() {
        Circuit circuit = parser.parse("* t\nR1 a out 1k\nC1 out 0 1n\n.end\n");

        Map<String, String> ports = resolver.detect(circuit);
        assertEquals("a", ports.get("in"));
        assertEquals("out", ports.get("out"));
    }

    @Test
    void detect_ShouldExposeSupplyNodes() {
        Circuit circuit = parser.parse("* t\nR1 VCC out 1k\nR2 out 0 1k\n.end\n");

        Map<String, String> ports = resolver.detect(circuit);
        assertEquals("VCC", ports.get("vcc"));
        assertFalse(ports.containsKey("in"));
        assertEquals(List.of("out", "vcc", "gnd"), List.copyOf(ports.keySet()));
    }

    @Test
    void resolve_AmbiguousInput_ShouldFailInsteadOfGuessing() {
        Circuit circuit = parser.parse("* t\nR1 a mid 1k\nR2 b mid 1k\nR3 mid out 1k\n.end\n");

        // a and b are both dangling; neither is picked by position
        assertFalse(resolver.detect(circuit).containsKey("in"));
        AmbiguousPortException e = assertThrows(AmbiguousPortException.class,
                () -> resolver.resolve(circuit, null, Set.of("in")));
        assertEquals("in", e.getRole());
    }

    @Test
    void resolve_MissingOutput_ShouldFail() {
        Circuit circuit = parser.parse("* t\nR1 in n2 1k\n.end\n");

        AmbiguousPortException e = assertThrows(AmbiguousPortException.class,
                () -> resolver.resolve(circuit, Map.of(), Set.of("out")));
        assertEquals("out", e.getRole());
    }

    @Test
    void resolve_ShouldAcceptInputAlias() {
        Circuit circuit = parser.parse("* t\nR1 vin out 1k\n.end\n");

        Circuit resolved = resolver.resolve(circuit, null, Set.of("in", "out"));
        assertEquals("vin", resolved.ports().get("in"));
    }

    @Test
    void resolve_ExplicitPorts_ShouldBeUsedAsGiven() {
        Circuit circuit = parser.parse("* t\nR1 a mid 1k\nR2 mid out 1k\n.end\n");
        Map<String, String> explicit = new LinkedHashMap<>();
        explicit.put("out", "mid");
        explicit.put("gnd", "0");

        Circuit resolved = resolver.resolve(circuit, explicit, Set.of("out"));

        assertEquals(explicit, resolved.ports());
        assertFalse(resolved.ports().containsKey("in"));
    }

    @Test
    void resolve_ExplicitPortOnUnknownNode_ShouldFail() {
        Circuit circuit = parser.parse(Netlists.SINGLE_RESISTOR);

        AmbiguousPortException e = assertThrows(AmbiguousPortException.class,
                () -> resolver.resolve(circuit, Map.of("out", "nowhere"), Set.of()));
        assertEquals("out", e.getRole());
        assertTrue(e.getReason().contains("nowhere"));
    }

    @Test
    void resolve_ExplicitPortWithInvalidName_ShouldFail() {
        Circuit circuit = parser.parse(Netlists.SINGLE_RESISTOR);

        assertThrows(AmbiguousPortException.class,
                () -> resolver.resolve(circuit, Map.of("bad role", "in"), Set.of()));
        assertThrows(AmbiguousPortException.class,
                () -> resolver.resolve(circuit, Map.of("in", "in!"), Set.of()));
    }

    @Test
    void resolve_ExplicitPortsMissingRequiredRole_ShouldFail() {
        Circuit circuit = parser.parse(Netlists.SINGLE_RESISTOR);

        AmbiguousPortException e = assertThrows(AmbiguousPortException.class,
                () -> resolver.resolve(circuit, Map.of("in", "in"), Set.of("out")));
        assertEquals("out", e.getRole());
    }

    @Test
    void resolve_ExplicitGround_IsAlwaysConnected() {
        Circuit circuit = parser.parse(Netlists.SINGLE_RESISTOR);

        Circuit resolved = resolver.resolve(circuit, Map.of("in", "in", "gnd", "0"), Set.of());
        assertEquals("0", resolved.ports().get("gnd"));
    }

    @Test
    void resolve_ShouldNotChangeStatements() {
        Circuit circuit = parser.parse(Netlists.RC_LOWPASS);

        Circuit resolved = resolver.resolve(circuit, null, Set.of("in", "out"));
        assertEquals(circuit.statements(), resolved.statements());
        assertTrue(circuit.ports().isEmpty());
    }
}
