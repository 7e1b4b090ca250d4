package com.vidnyan.spicebridge.adapter.in.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.spicebridge.adapter.in.cli.CompositionPlanReader.CompositionPlan;
import com.vidnyan.spicebridge.adapter.in.cli.CompositionPlanReader.PlannedStage;
import com.vidnyan.spicebridge.application.port.in.ComposeStagesUseCase;
import com.vidnyan.spicebridge.application.port.in.ComposeStagesUseCase.CompositionRequest;
import com.vidnyan.spicebridge.application.port.in.ComposeStagesUseCase.CompositionResult;
import com.vidnyan.spicebridge.application.port.in.ComposeStagesUseCase.StageRef;
import com.vidnyan.spicebridge.application.port.in.ManageCircuitsUseCase;
import com.vidnyan.spicebridge.domain.model.StageInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * CLI Runner for standalone composition.
 * Runs a composition plan when spicebridge.compose.plan is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CompositionCliRunner implements CommandLineRunner {

    private final CompositionPlanReader planReader;
    private final ManageCircuitsUseCase circuits;
    private final ComposeStagesUseCase composer;
    private final ObjectMapper objectMapper;
    private final ConfigurableApplicationContext context;

    @Value("${spicebridge.compose.plan:}")
    private String planPath;

    @Override
    public void run(String... args) throws Exception {
        if (planPath == null || planPath.isBlank()) {
            log.info("No composition plan specified. Set spicebridge.compose.plan property.");
            return;
        }

        try {
            log.info("════════════════════════════════════════════════════════════");
            log.info(" SPICEBridge composer");
            log.info(" Plan: {}", planPath);
            log.info("════════════════════════════════════════════════════════════");

            CompositionResult result = execute(Path.of(planPath));
            printResult(result);
        } finally {
            // Ensure application shuts down after composing
            SpringApplication.exit(context, () -> 0);
        }
    }

    /**
     * Store every stage of the plan, compose them and write the output file if one is named.
     */
    public CompositionResult execute(Path planFile) throws IOException {
        CompositionPlan plan = planReader.read(planFile);

        List<StageRef> refs = new ArrayList<>();
        for (PlannedStage stage : plan.stages()) {
            String id = circuits.create(stage.netlist()).circuitId();
            if (!stage.ports().isEmpty()) {
                circuits.setPorts(id, stage.ports());
            }
            refs.add(new StageRef(id, stage.label()));
        }

        CompositionResult result = composer.compose(
                new CompositionRequest(refs, plan.connections(), plan.sharedRoles()));

        if (plan.output() != null) {
            Files.writeString(plan.output(), result.netlist());
            log.info("Wrote composed netlist to {}", plan.output());
        }
        return result;
    }

    private void printResult(CompositionResult result) throws IOException {
        log.info("");
        log.info("════════════════════════════════════════════════════════════");
        log.info(" COMPOSITION RESULT");
        log.info("════════════════════════════════════════════════════════════");
        log.info(" Circuit id: {}", result.circuitId());
        log.info(" Stages:     {}", result.numStages());
        log.info(" Ports:      {}", objectMapper.writeValueAsString(result.ports()));
        log.info("────────────────────────────────────────────────────────────");
        for (StageInfo stage : result.stages()) {
            log.info(" [{}] {} -> {}", stage.index(), stage.label(), stage.ports());
        }
        log.info("────────────────────────────────────────────────────────────");
        result.netlistPreview().forEach(line -> log.info(" {}", line));
        log.info("");
        log.info("Composition complete!");
    }
}
