package com.vidnyan.spicebridge.domain.model;

import com.vidnyan.spicebridge.domain.netlist.NetlistWriter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a composition: one flat circuit plus the ports of the assembly.
 */
public record ComposedNetlist(
    Circuit circuit,
    Map<String, String> ports,
    List<StageInfo> stages
) {

    public ComposedNetlist {
        ports = Collections.unmodifiableMap(new LinkedHashMap<>(ports));
        stages = List.copyOf(stages);
    }

    /**
     * Render the flat netlist text handed to the simulator.
     */
    public String toText() {
        return NetlistWriter.write(circuit);
    }
}
