package com.vidnyan.spicebridge.domain.error;

import lombok.Getter;

/**
 * The netlist contains content that must not reach the simulator.
 * A line number of 0 means the netlist as a whole was rejected.
 */
@Getter
public class UnsafeNetlistException extends NetlistException {

    private final int lineNumber;
    private final String reason;

    public UnsafeNetlistException(int lineNumber, String reason) {
        super(lineNumber > 0 ? reason + " (line " + lineNumber + ")" : reason);
        this.lineNumber = lineNumber;
        this.reason = reason;
    }
}
