package com.vidnyan.spicebridge.domain.error;

import lombok.Getter;

/**
 * Port resolution failed for one stage of a composition.
 */
@Getter
public class PortResolutionFailedException extends NetlistException {

    private final int stageIndex;
    private final String role;

    public PortResolutionFailedException(int stageIndex, AmbiguousPortException cause) {
        super("Stage " + stageIndex + ": " + cause.getMessage(), cause);
        this.stageIndex = stageIndex;
        this.role = cause.getRole();
    }
}
