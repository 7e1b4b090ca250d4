package com.vidnyan.spicebridge.adapter.in.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.spicebridge.domain.model.Connection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads a JSON composition plan. Netlist and output paths are resolved
 * against the plan file's directory.
 *
 * <pre>
 * {
 *   "stages": [ { "file": "filter.cir", "label": "FLT", "ports": { "in": "in", "out": "out" } } ],
 *   "connections": [ { "fromStage": 0, "fromPort": "out", "toStage": 1, "toPort": "in" } ],
 *   "sharedRoles": [ "gnd" ],
 *   "output": "composed.cir"
 * }
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CompositionPlanReader {

    private final ObjectMapper objectMapper;

    public CompositionPlan read(Path planFile) throws IOException {
        PlanDto dto = objectMapper.readValue(planFile.toFile(), PlanDto.class);
        Path base = planFile.toAbsolutePath().getParent();

        if (dto.stages == null || dto.stages.isEmpty()) {
            throw new IllegalArgumentException("Plan " + planFile + " declares no stages");
        }
        List<PlannedStage> stages = new ArrayList<>();
        for (int i = 0; i < dto.stages.size(); i++) {
            StageDto stage = dto.stages.get(i);
            if (stage.file == null || stage.file.isBlank()) {
                throw new IllegalArgumentException("Stage " + i + " of plan " + planFile + " has no file");
            }
            Path file = base.resolve(stage.file);
            String netlist = Files.readString(file);
            stages.add(new PlannedStage(file, netlist, stage.label,
                    stage.ports != null ? stage.ports : Map.of()));
            log.debug("Plan stage {}: {} ({} chars)", i, file, netlist.length());
        }

        List<Connection> connections = null;
        if (dto.connections != null) {
            connections = dto.connections.stream()
                    .map(c -> new Connection(c.fromStage, c.fromPort, c.toStage, c.toPort))
                    .toList();
        }
        Path output = dto.output != null && !dto.output.isBlank() ? base.resolve(dto.output) : null;

        log.info("Loaded plan {}: {} stages, {} connections", planFile, stages.size(),
                connections != null ? connections.size() : "auto");
        return new CompositionPlan(stages, connections, dto.sharedRoles, output);
    }

    /**
     * A parsed plan.
     */
    public record CompositionPlan(
        List<PlannedStage> stages,
        List<Connection> connections,    // null = auto-wire
        List<String> sharedRoles,        // null = configured default
        Path output                      // null = log only
    ) {}

    public record PlannedStage(
        Path file,
        String netlist,
        String label,
        Map<String, String> ports
    ) {}

    // DTO classes for JSON deserialization
    static class PlanDto {
        public List<StageDto> stages;
        public List<ConnectionDto> connections;
        public List<String> sharedRoles;
        public String output;
    }

    static class StageDto {
        public String file;
        public String label;
        public Map<String, String> ports;
    }

    static class ConnectionDto {
        public int fromStage;
        public String fromPort;
        public int toStage;
        public String toPort;
    }
}
