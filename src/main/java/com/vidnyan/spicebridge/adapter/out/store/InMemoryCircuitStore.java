package com.vidnyan.spicebridge.adapter.out.store;

import com.vidnyan.spicebridge.SpiceBridgeProperties;
import com.vidnyan.spicebridge.application.port.out.CircuitStore;
import com.vidnyan.spicebridge.domain.error.CircuitNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Process-local circuit store.
 * Keeps at most {@code spicebridge.max-circuits} entries and evicts the oldest.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InMemoryCircuitStore implements CircuitStore {

    private final SpiceBridgeProperties properties;

    // insertion order = age; guarded by this
    private final Map<String, StoredCircuit> circuits = new LinkedHashMap<>();

    @Override
    public synchronized StoredCircuit save(String netlist, Map<String, String> ports) {
        if (circuits.size() >= properties.getMaxCircuits()) {
            String oldest = circuits.keySet().iterator().next();
            log.warn("Circuit limit reached ({}); evicting circuit '{}'", properties.getMaxCircuits(), oldest);
            circuits.remove(oldest);
        }
        String id = newId();
        StoredCircuit circuit = new StoredCircuit(id, netlist, copy(ports), Instant.now());
        circuits.put(id, circuit);
        log.debug("Stored circuit {} ({} chars)", id, netlist.length());
        return circuit;
    }

    @Override
    public synchronized Optional<StoredCircuit> findById(String circuitId) {
        return Optional.ofNullable(circuits.get(circuitId));
    }

    @Override
    public synchronized StoredCircuit updatePorts(String circuitId, Map<String, String> ports) {
        StoredCircuit existing = circuits.get(circuitId);
        if (existing == null) {
            throw new CircuitNotFoundException(circuitId);
        }
        StoredCircuit updated = new StoredCircuit(existing.id(), existing.netlist(), copy(ports), existing.createdAt());
        circuits.put(circuitId, updated);
        return updated;
    }

    @Override
    public synchronized List<StoredCircuit> findAll() {
        return List.copyOf(circuits.values());
    }

    @Override
    public synchronized void delete(String circuitId) {
        if (circuits.remove(circuitId) == null) {
            throw new CircuitNotFoundException(circuitId);
        }
        log.debug("Deleted circuit {}", circuitId);
    }

    private String newId() {
        String id;
        do {
            id = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        } while (circuits.containsKey(id));
        return id;
    }

    private static Map<String, String> copy(Map<String, String> ports) {
        return ports == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(ports));
    }
}
