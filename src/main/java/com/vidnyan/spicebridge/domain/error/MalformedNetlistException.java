package com.vidnyan.spicebridge.domain.error;

import lombok.Getter;

/**
 * The netlist text could not be parsed.
 */
@Getter
public class MalformedNetlistException extends NetlistException {

    private final int lineNumber;
    private final String reason;

    public MalformedNetlistException(int lineNumber, String reason) {
        super("Malformed netlist at line " + lineNumber + ": " + reason);
        this.lineNumber = lineNumber;
        this.reason = reason;
    }
}
