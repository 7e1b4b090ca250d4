package com.vidnyan.spicebridge.application.service;

import com.vidnyan.spicebridge.SpiceBridgeProperties;
import com.vidnyan.spicebridge.application.port.in.ComposeStagesUseCase;
import com.vidnyan.spicebridge.application.port.out.CircuitStore;
import com.vidnyan.spicebridge.application.port.out.CircuitStore.StoredCircuit;
import com.vidnyan.spicebridge.domain.error.CircuitNotFoundException;
import com.vidnyan.spicebridge.domain.error.NetlistException;
import com.vidnyan.spicebridge.domain.model.ComposedNetlist;
import com.vidnyan.spicebridge.domain.model.Stage;
import com.vidnyan.spicebridge.domain.netlist.NetlistParser;
import com.vidnyan.spicebridge.domain.netlist.NetlistSanitizer;
import com.vidnyan.spicebridge.domain.netlist.NetlistWriter;
import com.vidnyan.spicebridge.domain.netlist.StageComposer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Main application service that orchestrates multi-stage composition.
 * Implements the composition use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompositionApplicationService implements ComposeStagesUseCase {

    private final CircuitStore circuitStore;
    private final NetlistParser parser;
    private final StageComposer composer;
    private final NetlistSanitizer sanitizer;
    private final SpiceBridgeProperties properties;

    @Override
    public CompositionResult compose(CompositionRequest request) {
        Instant startTime = Instant.now();
        List<StageRef> refs = request.stages() == null ? List.of() : request.stages();
        if (refs.size() > properties.getMaxStages()) {
            throw new IllegalArgumentException("Too many stages (" + refs.size()
                    + "); limit is " + properties.getMaxStages());
        }
        log.info("Composing {} stage(s)", refs.size());

        // Step 1: Load and parse stages
        log.debug("Step 1: Loading stages...");
        List<Stage> stages = new ArrayList<>();
        for (int i = 0; i < refs.size(); i++) {
            StageRef ref = refs.get(i);
            if (ref.circuitId() == null || ref.circuitId().isBlank()) {
                throw new IllegalArgumentException("Stage " + i + " missing circuit id");
            }
            StoredCircuit stored = circuitStore.findById(ref.circuitId())
                    .orElseThrow(() -> new CircuitNotFoundException(ref.circuitId()));
            stages.add(new Stage(parser.parse(stored.netlist()), stored.ports(), ref.label()));
            log.debug("  Stage {}: circuit {} ports {}", i, stored.id(),
                    stored.hasPorts() ? stored.ports() : "(auto)");
        }

        // Step 2: Compose
        log.debug("Step 2: Composing...");
        Set<String> sharedRoles = new LinkedHashSet<>(
                request.sharedRoles() != null ? request.sharedRoles() : properties.getSharedRoles());
        ComposedNetlist composed;
        try {
            composed = composer.compose(stages, request.connections(), sharedRoles);
        } catch (NetlistException e) {
            log.warn("Composition failed: {}", e.getMessage());
            throw e;
        }

        // Step 3: Validate and store
        log.debug("Step 3: Storing composed circuit...");
        String netlist = composed.toText();
        sanitizer.sanitizeComposed(netlist);
        StoredCircuit stored = circuitStore.save(netlist, composed.ports());

        long durationMs = Duration.between(startTime, Instant.now()).toMillis();
        log.info("Composed circuit {}: {} stages, {} components, ports {} in {}ms",
                stored.id(), stages.size(), composed.circuit().stats().componentCount(),
                composed.ports(), durationMs);

        return new CompositionResult(
                stored.id(),
                stages.size(),
                composed.stages(),
                composed.ports(),
                NetlistWriter.preview(netlist, properties.getPreviewLines()),
                netlist);
    }
}
