package com.vidnyan.spicebridge.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Where a stage's ports ended up in a composed netlist.
 */
public record StageInfo(
    String label,
    int index,
    Map<String, String> ports
) {

    public StageInfo {
        ports = Collections.unmodifiableMap(new LinkedHashMap<>(ports));
    }
}
