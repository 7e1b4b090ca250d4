package com.vidnyan.spicebridge.application.port.in;

import java.util.List;
import java.util.Map;

/**
 * Store, inspect and annotate individual circuits.
 */
public interface ManageCircuitsUseCase {

    /**
     * Sanitise, parse and store a netlist. Ports are auto-detected where possible.
     */
    CircuitSummary create(String netlist);

    /**
     * Stored ports, or auto-detected ones when none were set.
     */
    PortsView getPorts(String circuitId);

    /**
     * Validate and store an explicit port map.
     */
    PortsView setPorts(String circuitId, Map<String, String> ports);

    List<CircuitListing> list();

    void delete(String circuitId);

    record CircuitSummary(
        String circuitId,
        List<String> preview,
        int numLines,
        Map<String, String> ports
    ) {}

    record PortsView(
        String circuitId,
        Map<String, String> ports,
        boolean detected
    ) {}

    record CircuitListing(
        String circuitId,
        int componentCount,
        boolean hasPorts
    ) {}
}
