package com.vidnyan.spicebridge.domain.error;

import lombok.Getter;

/**
 * Two identifiers would share a name after prefixing.
 */
@Getter
public class PrefixCollisionException extends NetlistException {

    private final String name;

    public PrefixCollisionException(String name, String detail) {
        super("Prefix collision on '" + name + "': " + detail);
        this.name = name;
    }
}
