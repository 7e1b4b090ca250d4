package com.vidnyan.spicebridge;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for circuit storage and composition.
 * Can be configured via application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "spicebridge")
public class SpiceBridgeProperties {

    /**
     * Largest netlist accepted, in characters.
     */
    private int maxNetlistSize = 1_000_000;

    /**
     * Most stages allowed in one composition.
     */
    private int maxStages = 20;

    /**
     * Circuits kept in the store before the oldest is evicted.
     */
    private int maxCircuits = 100;

    /**
     * Lines of netlist returned as a preview.
     */
    private int previewLines = 10;

    /**
     * Port roles whose nodes are shared by every stage and never prefixed.
     */
    private List<String> sharedRoles = new ArrayList<>(List.of("gnd"));
}
