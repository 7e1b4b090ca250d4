package com.vidnyan.spicebridge.application.service;

import com.vidnyan.spicebridge.SpiceBridgeProperties;
import com.vidnyan.spicebridge.adapter.out.store.InMemoryCircuitStore;
import com.vidnyan.spicebridge.application.port.in.ManageCircuitsUseCase.CircuitListing;
import com.vidnyan.spicebridge.application.port.in.ManageCircuitsUseCase.CircuitSummary;
import com.vidnyan.spicebridge.application.port.in.ManageCircuitsUseCase.PortsView;
import com.vidnyan.spicebridge.domain.error.AmbiguousPortException;
import com.vidnyan.spicebridge.domain.error.CircuitNotFoundException;
import com.vidnyan.spicebridge.domain.error.MalformedNetlistException;
import com.vidnyan.spicebridge.domain.error.UnsafeNetlistException;
import com.vidnyan.spicebridge.domain.netlist.NetlistParser;
import com.vidnyan.spicebridge.domain.netlist.NetlistSanitizer;
import com.vidnyan.spicebridge.domain.netlist.Netlists;
import com.vidnyan.spicebridge.domain.netlist.PortResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CircuitApplicationServiceTest {

    private InMemoryCircuitStore store;
    private CircuitApplicationService service;

    @BeforeEach
    void setUp() {
        SpiceBridgeProperties properties = new SpiceBridgeProperties();
        store = new InMemoryCircuitStore(properties);
        service = new CircuitApplicationService(store, new NetlistSanitizer(properties.getMaxNetlistSize()),
                new NetlistParser(), new PortResolver(), properties);
    }

    @Test
    void create_ShouldStoreNetlistWithDetectedPorts() {
        CircuitSummary summary = service.create(Netlists.RC_LOWPASS);

        assertEquals(Map.of("in", "in", "out", "out", "gnd", "0"), summary.ports());
        assertEquals(8, summary.numLines());
        assertEquals("* 1st-Order RC Low-Pass Filter", summary.preview().get(0));
        assertEquals(summary.ports(), store.findById(summary.circuitId()).orElseThrow().ports());
    }

    @Test
    void create_WithoutDetectablePorts_ShouldStoreNoPorts() {
        CircuitSummary summary = service.create("* t\nR1 n1 n2 1k\n.end\n");

        assertTrue(summary.ports().isEmpty());
        assertNull(store.findById(summary.circuitId()).orElseThrow().ports());

        PortsView view = service.getPorts(summary.circuitId());
        assertTrue(view.detected());
        assertTrue(view.ports().isEmpty());
    }

    @Test
    void create_ShouldRejectUnsafeOrMalformedNetlists() {
        assertThrows(UnsafeNetlistException.class,
                () -> service.create("* t\n.include /etc/passwd\nR1 in out 1k\n.end\n"));
        assertThrows(MalformedNetlistException.class,
                () -> service.create("* t\nR1 in out 1k\n"));

        assertTrue(store.findAll().isEmpty());
    }

    @Test
    void setPorts_ShouldValidateAndStore() {
        String id = service.create("* t\nR1 n1 n2 1k\n.end\n").circuitId();

        PortsView view = service.setPorts(id, Map.of("in", "n1", "out", "n2"));

        assertFalse(view.detected());
        assertEquals(Map.of("in", "n1", "out", "n2"), view.ports());
        assertEquals(view.ports(), service.getPorts(id).ports());
        assertFalse(service.getPorts(id).detected());
    }

    @Test
    void setPorts_OnUnknownNode_ShouldKeepPreviousPorts() {
        String id = service.create(Netlists.RC_LOWPASS).circuitId();

        assertThrows(AmbiguousPortException.class, () -> service.setPorts(id, Map.of("out", "nowhere")));

        assertEquals("out", service.getPorts(id).ports().get("out"));
    }

    @Test
    void unknownCircuit_ShouldFail() {
        assertThrows(CircuitNotFoundException.class, () -> service.getPorts("missing"));
        assertThrows(CircuitNotFoundException.class, () -> service.setPorts("missing", Map.of("in", "a")));
        assertThrows(CircuitNotFoundException.class, () -> service.delete("missing"));
    }

    @Test
    void list_ShouldSummariseStoredCircuits() {
        String rc = service.create(Netlists.RC_LOWPASS).circuitId();
        String bare = service.create("* t\nR1 n1 n2 1k\n.end\n").circuitId();

        List<CircuitListing> listing = service.list();

        assertEquals(List.of(new CircuitListing(rc, 3, true), new CircuitListing(bare, 1, false)), listing);
    }

    @Test
    void delete_ShouldRemoveCircuit() {
        String id = service.create(Netlists.RC_LOWPASS).circuitId();

        service.delete(id);

        assertTrue(service.list().isEmpty());
    }
}
