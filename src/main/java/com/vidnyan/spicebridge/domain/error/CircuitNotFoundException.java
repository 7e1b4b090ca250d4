package com.vidnyan.spicebridge.domain.error;

import lombok.Getter;

@Getter
public class CircuitNotFoundException extends NetlistException {

    private final String circuitId;

    public CircuitNotFoundException(String circuitId) {
        super("Circuit '" + circuitId + "' not found");
        this.circuitId = circuitId;
    }
}
