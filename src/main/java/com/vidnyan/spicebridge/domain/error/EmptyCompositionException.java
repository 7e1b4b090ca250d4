package com.vidnyan.spicebridge.domain.error;

public class EmptyCompositionException extends NetlistException {

    public EmptyCompositionException() {
        super("At least one stage is required");
    }
}
