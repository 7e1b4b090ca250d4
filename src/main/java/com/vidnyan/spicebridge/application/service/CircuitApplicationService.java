package com.vidnyan.spicebridge.application.service;

import com.vidnyan.spicebridge.SpiceBridgeProperties;
import com.vidnyan.spicebridge.application.port.in.ManageCircuitsUseCase;
import com.vidnyan.spicebridge.application.port.out.CircuitStore;
import com.vidnyan.spicebridge.application.port.out.CircuitStore.StoredCircuit;
import com.vidnyan.spicebridge.domain.error.CircuitNotFoundException;
import com.vidnyan.spicebridge.domain.model.Circuit;
import com.vidnyan.spicebridge.domain.netlist.NetlistParser;
import com.vidnyan.spicebridge.domain.netlist.NetlistSanitizer;
import com.vidnyan.spicebridge.domain.netlist.NetlistWriter;
import com.vidnyan.spicebridge.domain.netlist.PortResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Application service for storing circuits and managing their ports.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CircuitApplicationService implements ManageCircuitsUseCase {

    private final CircuitStore circuitStore;
    private final NetlistSanitizer sanitizer;
    private final NetlistParser parser;
    private final PortResolver portResolver;
    private final SpiceBridgeProperties properties;

    @Override
    public CircuitSummary create(String netlist) {
        sanitizer.sanitize(netlist);
        Circuit circuit = parser.parse(netlist);

        Map<String, String> detected = portResolver.detect(circuit);
        StoredCircuit stored = circuitStore.save(netlist, detected.isEmpty() ? null : detected);
        log.info("Created circuit {}: {} components, ports {}",
                stored.id(), circuit.stats().componentCount(), detected);

        return new CircuitSummary(
                stored.id(),
                NetlistWriter.preview(netlist, properties.getPreviewLines()),
                (int) netlist.strip().lines().count(),
                detected);
    }

    @Override
    public PortsView getPorts(String circuitId) {
        StoredCircuit stored = load(circuitId);
        if (stored.ports() != null) {
            return new PortsView(circuitId, stored.ports(), false);
        }
        Map<String, String> detected = portResolver.detect(parser.parse(stored.netlist()));
        return new PortsView(circuitId, detected, true);
    }

    @Override
    public PortsView setPorts(String circuitId, Map<String, String> ports) {
        StoredCircuit stored = load(circuitId);
        Circuit circuit = portResolver.resolve(parser.parse(stored.netlist()), ports, Set.of());
        StoredCircuit updated = circuitStore.updatePorts(circuitId, circuit.ports());
        log.info("Set ports of circuit {}: {}", circuitId, updated.ports());
        return new PortsView(circuitId, updated.ports(), false);
    }

    @Override
    public List<CircuitListing> list() {
        return circuitStore.findAll().stream()
                .map(c -> new CircuitListing(
                        c.id(),
                        parser.parse(c.netlist()).stats().componentCount(),
                        c.hasPorts()))
                .toList();
    }

    @Override
    public void delete(String circuitId) {
        circuitStore.delete(circuitId);
        log.info("Deleted circuit {}", circuitId);
    }

    private StoredCircuit load(String circuitId) {
        return circuitStore.findById(circuitId)
                .orElseThrow(() -> new CircuitNotFoundException(circuitId));
    }
}
