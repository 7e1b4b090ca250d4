package com.vidnyan.spicebridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * SPICEBridge - netlist composition service
 * 
 * Parses SPICE netlists, resolves their ports and stitches stages into one
 * flat circuit for the simulator.
 */
@SpringBootApplication
public class SpiceBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpiceBridgeApplication.class, args);
    }
}
