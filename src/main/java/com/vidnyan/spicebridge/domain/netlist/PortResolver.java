package com.vidnyan.spicebridge.domain.netlist;

import com.vidnyan.spicebridge.domain.error.AmbiguousPortException;
import com.vidnyan.spicebridge.domain.model.Circuit;
import com.vidnyan.spicebridge.domain.model.Ports;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Decides which nodes of a circuit are its external ports.
 *
 * <p>Explicit port maps are validated and used as given. Without one, ports
 * are inferred from node naming conventions; a required role that cannot be
 * inferred is an error, never a guess.
 */
public final class PortResolver {

    /**
     * Best-effort detection: returns whatever roles can be inferred.
     */
    public Map<String, String> detect(Circuit circuit) {
        return autoDetect(circuit);
    }

    /**
     * Resolve ports, preferring {@code explicitPorts} when non-empty.
     *
     * @param requiredRoles roles that must be bound; {@code in} and {@code out}
     *                      are satisfied by any of their accepted aliases
     * @return the circuit carrying its resolved port map
     * @throws AmbiguousPortException when a port is invalid or a required role is unbound
     */
    public Circuit resolve(Circuit circuit, Map<String, String> explicitPorts, Set<String> requiredRoles) {
        Map<String, String> ports;
        boolean explicit = explicitPorts != null && !explicitPorts.isEmpty();
        if (explicit) {
            validateExplicit(circuit, explicitPorts);
            ports = new LinkedHashMap<>(explicitPorts);
        } else {
            ports = autoDetect(circuit);
        }

        for (String role : requiredRoles) {
            if (!satisfies(ports, role)) {
                throw new AmbiguousPortException(role, explicit
                        ? "not declared in the explicit port map " + ports.keySet()
                        : missingReason(circuit, role));
            }
        }
        return circuit.withPorts(ports);
    }

    private static void validateExplicit(Circuit circuit, Map<String, String> explicitPorts) {
        for (Map.Entry<String, String> entry : explicitPorts.entrySet()) {
            String role = entry.getKey();
            String node = entry.getValue();
            if (!Ports.isValidName(role)) {
                throw new AmbiguousPortException(String.valueOf(role),
                        "invalid port name; must match [A-Za-z0-9_.$#-]+");
            }
            if (!Ports.isValidName(node)) {
                throw new AmbiguousPortException(role,
                        "invalid node name '" + node + "'; must match [A-Za-z0-9_.$#-]+");
            }
            if (!Circuit.isGround(node) && !circuit.references(node)) {
                throw new AmbiguousPortException(role,
                        "node '" + node + "' is not connected to any component");
            }
        }
    }

    private static Map<String, String> autoDetect(Circuit circuit) {
        Map<String, Integer> degrees = circuit.nodeDegrees();

        String output = null;
        for (String node : degrees.keySet()) {
            if (!Circuit.isGround(node) && Ports.looksLikeOutput(node)) {
                output = node;
                break;
            }
        }

        String input = null;
        List<String> candidates = new ArrayList<>();
        for (String node : degrees.keySet()) {
            if (!Circuit.isGround(node) && !node.equals(output) && Ports.looksLikeInput(node)) {
                candidates.add(node);
            }
        }
        for (String candidate : candidates) {
            if (degrees.get(candidate) == 1) {
                input = candidate;
                break;
            }
        }
        if (input == null && !candidates.isEmpty()) {
            input = candidates.get(0);
        }
        if (input == null && output != null) {
            List<String> dangling = danglingNodes(degrees, output);
            if (dangling.size() == 1) {
                input = dangling.get(0);
            }
        }

        Map<String, String> ports = new LinkedHashMap<>();
        if (input != null) {
            ports.put(Ports.INPUT, input);
        }
        if (output != null) {
            ports.put(Ports.OUTPUT, output);
        }
        for (String node : degrees.keySet()) {
            if (Ports.looksLikePower(node)) {
                ports.putIfAbsent(node.toLowerCase(Locale.ROOT), node);
            }
        }
        for (String node : degrees.keySet()) {
            if (Circuit.isGround(node)) {
                ports.put(Ports.GROUND, node);
                break;
            }
        }
        return ports;
    }

    /**
     * Non-ground nodes touched by exactly one component, excluding output and supplies.
     */
    private static List<String> danglingNodes(Map<String, Integer> degrees, String output) {
        List<String> dangling = new ArrayList<>();
        degrees.forEach((node, degree) -> {
            if (degree == 1 && !Circuit.isGround(node) && !node.equals(output) && !Ports.looksLikePower(node)) {
                dangling.add(node);
            }
        });
        return dangling;
    }

    static boolean satisfies(Map<String, String> ports, String role) {
        if (Ports.OUTPUT.equals(role)) {
            return Ports.OUTPUT_ROLES.stream().anyMatch(ports::containsKey);
        }
        if (Ports.INPUT.equals(role)) {
            return Ports.INPUT_ROLES.stream().anyMatch(ports::containsKey);
        }
        return ports.containsKey(role);
    }

    private static String missingReason(Circuit circuit, String role) {
        if (Ports.OUTPUT.equals(role)) {
            return "no node named out, vout or output; supply an explicit port map";
        }
        if (Ports.INPUT.equals(role)) {
            int dangling = danglingNodes(circuit.nodeDegrees(), null).size();
            return "no node named like an input and " + dangling
                    + " unconnected candidate node(s); supply an explicit port map";
        }
        return "no node matches this role; supply an explicit port map";
    }
}
