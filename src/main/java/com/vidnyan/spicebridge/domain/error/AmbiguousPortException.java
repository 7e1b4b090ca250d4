package com.vidnyan.spicebridge.domain.error;

import lombok.Getter;

/**
 * A port role could not be bound to a node.
 */
@Getter
public class AmbiguousPortException extends NetlistException {

    private final String role;
    private final String reason;

    public AmbiguousPortException(String role, String reason) {
        super("Cannot resolve port '" + role + "': " + reason);
        this.role = role;
        this.reason = reason;
    }
}
