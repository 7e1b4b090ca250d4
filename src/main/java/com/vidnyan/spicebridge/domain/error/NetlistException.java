package com.vidnyan.spicebridge.domain.error;

/**
 * Base type for every failure raised while parsing, resolving, prefixing or
 * composing netlists.
 */
public abstract class NetlistException extends RuntimeException {

    protected NetlistException(String message) {
        super(message);
    }

    protected NetlistException(String message, Throwable cause) {
        super(message, cause);
    }
}
