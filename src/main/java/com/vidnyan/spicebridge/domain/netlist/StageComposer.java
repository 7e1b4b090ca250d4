package com.vidnyan.spicebridge.domain.netlist;

import com.vidnyan.spicebridge.domain.error.AmbiguousPortException;
import com.vidnyan.spicebridge.domain.error.EmptyCompositionException;
import com.vidnyan.spicebridge.domain.error.PortResolutionFailedException;
import com.vidnyan.spicebridge.domain.error.PrefixCollisionException;
import com.vidnyan.spicebridge.domain.error.WiringMismatchException;
import com.vidnyan.spicebridge.domain.model.Circuit;
import com.vidnyan.spicebridge.domain.model.ComposedNetlist;
import com.vidnyan.spicebridge.domain.model.Connection;
import com.vidnyan.spicebridge.domain.model.Ports;
import com.vidnyan.spicebridge.domain.model.Stage;
import com.vidnyan.spicebridge.domain.model.StageInfo;
import com.vidnyan.spicebridge.domain.model.Statement;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Stitches independently designed stages into one flat netlist.
 *
 * <p>Each stage is port-resolved, prefixed with its label and wired to its
 * neighbours by node unification. Ground stays {@code 0} in every stage.
 * Input circuits are never modified; the first failure aborts the whole
 * composition.
 */
@Slf4j
public final class StageComposer {

    public static final String TITLE = "* Composed multi-stage circuit";

    // no underscore: it separates a tag from the name it prefixes
    private static final Pattern LABEL = Pattern.compile("[A-Za-z0-9]+");
    private static final String WIRE = "wire";

    private final PortResolver portResolver;
    private final PrefixEngine prefixEngine;

    public StageComposer(PortResolver portResolver, PrefixEngine prefixEngine) {
        this.portResolver = portResolver;
        this.prefixEngine = prefixEngine;
    }

    /**
     * Compose with auto-wiring and ground as the only shared role.
     */
    public ComposedNetlist compose(List<Stage> stages) {
        return compose(stages, null, Set.of(Ports.GROUND));
    }

    /**
     * @param connections explicit wiring, or {@code null} to wire each stage's
     *                    output to the next stage's input
     * @param sharedRoles port roles whose nodes are common to all stages and never prefixed
     */
    public ComposedNetlist compose(List<Stage> stages, List<Connection> connections, Set<String> sharedRoles) {
        if (stages == null || stages.isEmpty()) {
            throw new EmptyCompositionException();
        }
        List<String> labels = assignLabels(stages);
        boolean autoWire = connections == null;

        // Step 1: ports
        List<Circuit> resolved = new ArrayList<>();
        for (int i = 0; i < stages.size(); i++) {
            Stage stage = stages.get(i);
            Set<String> required = autoWire ? requiredRoles(i, stages.size()) : Set.of();
            try {
                resolved.add(portResolver.resolve(stage.circuit(), stage.ports(), required));
            } catch (AmbiguousPortException e) {
                throw new PortResolutionFailedException(i, e);
            }
            log.debug("Stage {} ({}) ports: {}", i, labels.get(i), resolved.get(i).ports());
        }

        List<Connection> wiring = autoWire ? autoConnections(resolved) : List.copyOf(connections);
        validateConnections(wiring, resolved);

        // Step 2: prefix
        Set<String> sharedNodes = sharedNodes(resolved, sharedRoles == null ? Set.of() : sharedRoles);
        List<Circuit> prefixed = new ArrayList<>();
        Map<String, Integer> owners = new HashMap<>();
        for (int i = 0; i < resolved.size(); i++) {
            Circuit circuit = prefixEngine.prefix(resolved.get(i), labels.get(i), sharedNodes);
            for (Statement.ComponentInstance component : circuit.components()) {
                Integer owner = owners.putIfAbsent(component.name(), i);
                if (owner != null) {
                    throw new PrefixCollisionException(component.name(),
                            "produced by stages " + owner + " and " + i);
                }
            }
            prefixed.add(circuit);
        }

        checkNodeNamespaces(resolved, labels, sharedNodes);

        // Step 3: wire
        prefixed = stripDrivenInputs(prefixed, wiring);
        NodeUnion union = new NodeUnion(sharedNodes, allNodes(prefixed));
        for (Connection connection : wiring) {
            String from = prefixed.get(connection.fromStage()).ports().get(connection.fromPort());
            String to = prefixed.get(connection.toStage()).ports().get(connection.toPort());
            String wire = WIRE + "_" + labels.get(connection.fromStage()) + "_" + labels.get(connection.toStage());
            union.join(from, to, wire, connection);
        }
        List<Circuit> wired = new ArrayList<>();
        for (Circuit circuit : prefixed) {
            wired.add(union.applyTo(circuit));
        }
        log.debug("Wired {} connection(s) across {} stage(s)", wiring.size(), wired.size());

        // Steps 4 and 5: assemble and expose ports
        Circuit flat = assemble(wired, labels);
        Map<String, String> ports = compositePorts(wired, wiring);
        List<StageInfo> infos = new ArrayList<>();
        for (int i = 0; i < wired.size(); i++) {
            infos.add(new StageInfo(labels.get(i), i, wired.get(i).ports()));
        }
        return new ComposedNetlist(flat.withPorts(ports), ports, infos);
    }

    private static List<String> assignLabels(List<Stage> stages) {
        List<String> labels = new ArrayList<>();
        Map<String, Integer> seen = new HashMap<>();
        for (int i = 0; i < stages.size(); i++) {
            String label = stages.get(i).label();
            if (label == null || label.isBlank()) {
                label = "S" + (i + 1);
            }
            if (!LABEL.matcher(label).matches()) {
                throw new IllegalArgumentException("Invalid stage label '" + label + "': must match [A-Za-z0-9]+");
            }
            if (label.equalsIgnoreCase(WIRE)) {
                throw new IllegalArgumentException("Invalid stage label '" + label + "': reserved for wire nodes");
            }
            // the simulator folds case, so A and a would share every node
            Integer previous = seen.putIfAbsent(label.toLowerCase(Locale.ROOT), i);
            if (previous != null) {
                throw new PrefixCollisionException(label,
                        "stage tag used by stages " + previous + " and " + i);
            }
            labels.add(label);
        }
        return labels;
    }

    /**
     * Fail when a prefixed internal node lands on a name another stage, or a shared node, already owns.
     */
    private static void checkNodeNamespaces(List<Circuit> resolved, List<String> labels, Set<String> sharedNodes) {
        Map<String, Integer> owners = new HashMap<>();
        for (String shared : sharedNodes) {
            owners.put(shared.toLowerCase(Locale.ROOT), -1);
        }
        for (int i = 0; i < resolved.size(); i++) {
            for (String node : resolved.get(i).nodes()) {
                if (Circuit.isGround(node) || sharedNodes.contains(node)) {
                    continue;
                }
                String renamed = PrefixEngine.prefixNode(node, labels.get(i), sharedNodes);
                Integer owner = owners.putIfAbsent(renamed.toLowerCase(Locale.ROOT), i);
                if (owner != null && owner != i) {
                    throw new PrefixCollisionException(renamed, "node " + node + " of stage " + i
                            + (owner < 0 ? " lands on a shared node" : " lands on a node of stage " + owner));
                }
            }
        }
    }

    private static Set<String> allNodes(List<Circuit> circuits) {
        Set<String> nodes = new HashSet<>();
        for (Circuit circuit : circuits) {
            nodes.addAll(circuit.nodes());
        }
        return nodes;
    }

    private static Set<String> requiredRoles(int index, int count) {
        Set<String> required = new LinkedHashSet<>();
        if (index > 0) {
            required.add(Ports.INPUT);
        }
        if (index < count - 1) {
            required.add(Ports.OUTPUT);
        }
        return required;
    }

    private static List<Connection> autoConnections(List<Circuit> resolved) {
        List<Connection> connections = new ArrayList<>();
        for (int i = 0; i < resolved.size() - 1; i++) {
            String from = firstPresent(resolved.get(i).ports(), Ports.OUTPUT_ROLES);
            String to = firstPresent(resolved.get(i + 1).ports(), Ports.INPUT_ROLES);
            connections.add(Connection.between(i, from, i + 1, to));
        }
        return connections;
    }

    private static String firstPresent(Map<String, String> ports, List<String> roles) {
        return roles.stream()
                .filter(ports::containsKey)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Resolved ports lack one of " + roles));
    }

    private static void validateConnections(List<Connection> connections, List<Circuit> resolved) {
        for (Connection connection : connections) {
            checkEndpoint(connection.fromStage(), connection.fromPort(), resolved);
            checkEndpoint(connection.toStage(), connection.toPort(), resolved);
        }
    }

    private static void checkEndpoint(int stage, String role, List<Circuit> resolved) {
        if (stage < 0 || stage >= resolved.size()) {
            throw new WiringMismatchException(stage, role,
                    "stage index out of range (" + resolved.size() + " stages)");
        }
        Map<String, String> ports = resolved.get(stage).ports();
        if (role == null || !ports.containsKey(role)) {
            throw new WiringMismatchException(stage, role,
                    "port not defined; available ports: " + ports.keySet());
        }
    }

    private static Set<String> sharedNodes(List<Circuit> resolved, Set<String> sharedRoles) {
        Set<String> shared = new LinkedHashSet<>();
        shared.add(Circuit.GROUND);
        for (Circuit circuit : resolved) {
            for (String role : sharedRoles) {
                circuit.port(role).ifPresent(node -> shared.add(Circuit.isGround(node) ? Circuit.GROUND : node));
            }
        }
        return shared;
    }

    /**
     * Drop independent sources that drive a node now fed by an upstream stage.
     */
    private static List<Circuit> stripDrivenInputs(List<Circuit> prefixed, List<Connection> wiring) {
        Map<Integer, Set<String>> driven = new HashMap<>();
        for (Connection connection : wiring) {
            String node = prefixed.get(connection.toStage()).ports().get(connection.toPort());
            if (!Circuit.isGround(node)) {
                driven.computeIfAbsent(connection.toStage(), k -> new HashSet<>()).add(node);
            }
        }

        List<Circuit> result = new ArrayList<>();
        for (int i = 0; i < prefixed.size(); i++) {
            Circuit circuit = prefixed.get(i);
            Set<String> nodes = driven.getOrDefault(i, Set.of());
            if (nodes.isEmpty()) {
                result.add(circuit);
                continue;
            }
            Set<String> referenced = referencedInstances(circuit);
            List<Statement> kept = new ArrayList<>();
            for (Statement statement : circuit.statements()) {
                if (statement instanceof Statement.ComponentInstance component
                        && component.kind().isIndependentSource()
                        && nodes.contains(component.nodes().get(0))) {
                    if (referenced.contains(component.name())) {
                        log.warn("Keeping source {} on wired input {}: other elements refer to it",
                                component.name(), component.nodes().get(0));
                    } else {
                        log.debug("Dropping source {} on wired input {}", component.name(), component.nodes().get(0));
                        continue;
                    }
                }
                kept.add(statement);
            }
            result.add(circuit.withStatements(kept));
        }
        return result;
    }

    private static Set<String> referencedInstances(Circuit circuit) {
        Set<String> referenced = new HashSet<>();
        for (Statement.ComponentInstance component : circuit.components()) {
            referenced.addAll(component.references());
        }
        return referenced;
    }

    private Circuit assemble(List<Circuit> wired, List<String> labels) {
        Map<String, Statement.Block> subcircuits = new LinkedHashMap<>();
        Map<String, Statement.Directive> models = new LinkedHashMap<>();
        Set<String> includes = new LinkedHashSet<>();
        List<List<Statement>> bodies = new ArrayList<>();

        for (Circuit circuit : wired) {
            List<Statement> body = new ArrayList<>();
            for (Statement statement : circuit.statements()) {
                if (statement instanceof Statement.Title || statement instanceof Statement.Terminator) {
                    continue;
                }
                if (statement instanceof Statement.Block block) {
                    if (block.kind() == Statement.Block.BlockKind.SUBCIRCUIT) {
                        keepFirst(subcircuits, block.name().toLowerCase(Locale.ROOT), block, ".subckt");
                    }
                    continue;
                }
                if (statement instanceof Statement.Directive directive) {
                    if (directive.isAnalysis()) {
                        continue;
                    }
                    if (directive.isInclude()) {
                        includes.add(directive.text());
                        continue;
                    }
                    if (directive.isModel()) {
                        keepFirst(models, modelName(directive), directive, ".model");
                        continue;
                    }
                }
                body.add(statement);
            }
            bodies.add(body);
        }

        List<Statement> statements = new ArrayList<>();
        statements.add(new Statement.Title(TITLE));
        if (!subcircuits.isEmpty()) {
            statements.add(new Statement.Blank());
            statements.addAll(subcircuits.values());
        }
        if (!includes.isEmpty()) {
            statements.add(new Statement.Blank());
            includes.forEach(text -> statements.add(Statement.Directive.of(text)));
        }
        if (!models.isEmpty()) {
            statements.add(new Statement.Blank());
            statements.addAll(models.values());
        }
        for (int i = 0; i < bodies.size(); i++) {
            statements.add(new Statement.Blank());
            statements.add(new Statement.Comment("* --- Stage: " + labels.get(i) + " ---"));
            statements.addAll(bodies.get(i));
        }
        statements.add(new Statement.Terminator());
        return Circuit.of(statements);
    }

    private static <T extends Statement> void keepFirst(Map<String, T> seen, String name, T candidate, String what) {
        T existing = seen.putIfAbsent(name, candidate);
        if (existing != null && !existing.equals(candidate)) {
            log.warn("Duplicate {} '{}' with different content; keeping first occurrence", what, name);
        }
    }

    private static String modelName(Statement.Directive directive) {
        String[] tokens = directive.text().split("\\s+");
        return tokens.length > 1 ? tokens[1].toLowerCase(Locale.ROOT) : directive.text();
    }

    private static Map<String, String> compositePorts(List<Circuit> wired, List<Connection> wiring) {
        int last = wired.size() - 1;
        Set<String> consumedInputs = new HashSet<>();
        Set<String> consumedOutputs = new HashSet<>();
        for (Connection connection : wiring) {
            if (connection.toStage() == 0) {
                consumedInputs.add(connection.toPort());
            }
            if (connection.fromStage() == last) {
                consumedOutputs.add(connection.fromPort());
            }
        }

        Map<String, String> ports = new LinkedHashMap<>();
        Map<String, String> first = wired.get(0).ports();
        for (String role : Ports.EXPOSED_INPUT_ROLES) {
            if (first.containsKey(role) && !consumedInputs.contains(role)) {
                ports.put(role, first.get(role));
            }
        }
        Map<String, String> tail = wired.get(last).ports();
        for (String role : Ports.EXPOSED_OUTPUT_ROLES) {
            if (tail.containsKey(role) && !consumedOutputs.contains(role)) {
                ports.put(role, tail.get(role));
            }
        }
        ports.put(Ports.GROUND, Circuit.GROUND);
        return ports;
    }

    /**
     * Union-find over node names. Each set is named after the shared node it
     * contains, otherwise after the first connection that created it. Set
     * names are unique: a second set wired between the same two stages gets
     * a numeric suffix ({@code wire_S1_S2_2}) instead of merging with the first.
     */
    private static final class NodeUnion {
        private final Set<String> sharedNodes;
        private final Set<String> taken = new HashSet<>();
        private final Map<String, String> parent = new HashMap<>();
        private final Map<String, String> names = new HashMap<>();

        NodeUnion(Set<String> sharedNodes, Set<String> existingNodes) {
            this.sharedNodes = sharedNodes;
            sharedNodes.forEach(node -> taken.add(node.toLowerCase(Locale.ROOT)));
            existingNodes.forEach(node -> taken.add(node.toLowerCase(Locale.ROOT)));
        }

        private String freshName(String base) {
            String candidate = base;
            for (int n = 2; !taken.add(candidate.toLowerCase(Locale.ROOT)); n++) {
                candidate = base + "_" + n;
            }
            return candidate;
        }

        private String find(String node) {
            String root = parent.computeIfAbsent(node, k -> k);
            if (root.equals(node)) {
                return node;
            }
            String top = find(root);
            parent.put(node, top);
            return top;
        }

        private boolean isShared(String root) {
            return sharedNodes.contains(names.getOrDefault(root, root));
        }

        void join(String a, String b, String wire, Connection connection) {
            String ra = find(a);
            String rb = find(b);
            if (ra.equals(rb)) {
                return;
            }
            String name;
            if (isShared(ra) && isShared(rb)) {
                String na = names.getOrDefault(ra, ra);
                String nb = names.getOrDefault(rb, rb);
                throw new WiringMismatchException(connection.toStage(), connection.toPort(),
                        "connection " + connection.format() + " would short shared nodes " + na + " and " + nb);
            } else if (isShared(ra)) {
                name = names.getOrDefault(ra, ra);
            } else if (isShared(rb)) {
                name = names.getOrDefault(rb, rb);
            } else if (names.containsKey(ra)) {
                name = names.get(ra);
            } else if (names.containsKey(rb)) {
                name = names.get(rb);
            } else {
                name = freshName(wire);
            }
            parent.put(rb, ra);
            names.put(ra, name);
        }

        String rename(String node) {
            if (!parent.containsKey(node)) {
                return node;
            }
            String root = find(node);
            return names.getOrDefault(root, root);
        }

        Circuit applyTo(Circuit circuit) {
            List<Statement> statements = new ArrayList<>();
            for (Statement statement : circuit.statements()) {
                if (statement instanceof Statement.ComponentInstance component) {
                    statements.add(component.withNames(component.name(),
                            component.nodes().stream().map(this::rename).toList(),
                            component.references()));
                } else if (statement instanceof Statement.Directive directive && directive.referencesNodes()) {
                    statements.add(new Statement.Directive(directive.keyword(),
                            PrefixEngine.renameOutputFunctions(directive.text(), this::rename, name -> name)));
                } else {
                    statements.add(statement);
                }
            }
            Map<String, String> ports = new LinkedHashMap<>();
            circuit.ports().forEach((role, node) -> ports.put(role, rename(node)));
            return new Circuit(statements, ports, circuit.tag());
        }
    }
}
