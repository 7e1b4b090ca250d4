package com.vidnyan.spicebridge.domain.error;

import lombok.Getter;

/**
 * A connection names a stage or a port role that does not exist.
 */
@Getter
public class WiringMismatchException extends NetlistException {

    private final int stageIndex;
    private final String role;

    public WiringMismatchException(int stageIndex, String role, String detail) {
        super("Wiring mismatch on stage " + stageIndex + " port '" + role + "': " + detail);
        this.stageIndex = stageIndex;
        this.role = role;
    }
}
