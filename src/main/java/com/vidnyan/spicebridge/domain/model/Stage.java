package com.vidnyan.spicebridge.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of a composition: a parsed circuit, optional explicit ports and
 * an optional label used as its prefix tag.
 */
public record Stage(
    Circuit circuit,
    Map<String, String> ports,
    String label
) {

    public Stage {
        Objects.requireNonNull(circuit, "circuit");
        ports = ports == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(ports));
    }

    public static Stage of(Circuit circuit) {
        return new Stage(circuit, Map.of(), null);
    }

    public static Stage labeled(Circuit circuit, String label) {
        return new Stage(circuit, Map.of(), label);
    }
}
