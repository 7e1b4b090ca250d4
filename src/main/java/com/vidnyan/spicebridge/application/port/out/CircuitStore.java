package com.vidnyan.spicebridge.application.port.out;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Port for persisting circuits by identifier.
 * Implemented by adapters (e.g., an in-memory store).
 */
public interface CircuitStore {

    /**
     * Store a netlist and assign it a new identifier.
     * @param ports port map, or {@code null} when none is known yet
     */
    StoredCircuit save(String netlist, Map<String, String> ports);

    Optional<StoredCircuit> findById(String circuitId);

    /**
     * Replace the port map of a stored circuit.
     * @throws com.vidnyan.spicebridge.domain.error.CircuitNotFoundException if the id is unknown
     */
    StoredCircuit updatePorts(String circuitId, Map<String, String> ports);

    /**
     * All circuits, oldest first.
     */
    List<StoredCircuit> findAll();

    /**
     * @throws com.vidnyan.spicebridge.domain.error.CircuitNotFoundException if the id is unknown
     */
    void delete(String circuitId);

    /**
     * A stored circuit. {@code ports} is {@code null} until ports are set or detected.
     */
    record StoredCircuit(
        String id,
        String netlist,
        Map<String, String> ports,
        Instant createdAt
    ) {
        public boolean hasPorts() {
            return ports != null && !ports.isEmpty();
        }
    }
}
