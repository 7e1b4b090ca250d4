package com.vidnyan.spicebridge.application.port.in;

import com.vidnyan.spicebridge.domain.model.Connection;
import com.vidnyan.spicebridge.domain.model.StageInfo;

import java.util.List;
import java.util.Map;

/**
 * Compose stored circuits into a new multi-stage circuit.
 */
public interface ComposeStagesUseCase {

    /**
     * Compose the requested stages and store the result as a new circuit.
     * @param request stages in order, optional wiring and shared roles
     * @return the new circuit id with its composite ports
     */
    CompositionResult compose(CompositionRequest request);

    /**
     * One stage: a stored circuit and an optional label (default {@code S<n>}).
     */
    record StageRef(
        String circuitId,
        String label
    ) {
        public static StageRef of(String circuitId) {
            return new StageRef(circuitId, null);
        }
    }

    /**
     * Composition request.
     */
    record CompositionRequest(
        List<StageRef> stages,
        List<Connection> connections,    // null = auto-wire out -> in
        List<String> sharedRoles         // null = configured default
    ) {
        public static CompositionRequest chain(List<StageRef> stages) {
            return new CompositionRequest(stages, null, null);
        }
    }

    /**
     * Composition result.
     */
    record CompositionResult(
        String circuitId,
        int numStages,
        List<StageInfo> stages,
        Map<String, String> ports,
        List<String> netlistPreview,
        String netlist
    ) {}
}
