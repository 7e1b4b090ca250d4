package com.vidnyan.spicebridge.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.spicebridge.SpiceBridgeProperties;
import com.vidnyan.spicebridge.domain.netlist.NetlistParser;
import com.vidnyan.spicebridge.domain.netlist.NetlistSanitizer;
import com.vidnyan.spicebridge.domain.netlist.PortResolver;
import com.vidnyan.spicebridge.domain.netlist.PrefixEngine;
import com.vidnyan.spicebridge.domain.netlist.StageComposer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for SPICEBridge components.
 * The netlist engines are plain domain classes; this wires them as beans.
 */
@Slf4j
@Configuration
public class SpiceBridgeConfiguration {

    /**
     * ObjectMapper for composition plans and result output.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public NetlistParser netlistParser() {
        return new NetlistParser();
    }

    @Bean
    public PortResolver portResolver() {
        return new PortResolver();
    }

    @Bean
    public PrefixEngine prefixEngine() {
        return new PrefixEngine();
    }

    @Bean
    public StageComposer stageComposer(PortResolver portResolver, PrefixEngine prefixEngine) {
        return new StageComposer(portResolver, prefixEngine);
    }

    @Bean
    public NetlistSanitizer netlistSanitizer(SpiceBridgeProperties properties) {
        log.info("Netlist limits: {} chars, {} stages, {} stored circuits, shared roles {}",
                properties.getMaxNetlistSize(), properties.getMaxStages(),
                properties.getMaxCircuits(), properties.getSharedRoles());
        return new NetlistSanitizer(properties.getMaxNetlistSize());
    }
}
