package com.vidnyan.spicebridge.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A parsed netlist together with its port map and stage tag.
 * Immutable value: every transformation returns a new instance.
 */
public record Circuit(
    List<Statement> statements,
    Map<String, String> ports,
    String tag
) {

    /** The single global ground reference. */
    public static final String GROUND = "0";

    public Circuit {
        statements = List.copyOf(statements);
        ports = Collections.unmodifiableMap(new LinkedHashMap<>(ports));
    }

    public static Circuit of(List<Statement> statements) {
        return new Circuit(statements, Map.of(), null);
    }

    public static boolean isGround(String node) {
        return GROUND.equals(node) || "gnd".equals(node.toLowerCase(Locale.ROOT));
    }

    public Circuit withStatements(List<Statement> newStatements) {
        return new Circuit(newStatements, ports, tag);
    }

    public Circuit withPorts(Map<String, String> newPorts) {
        return new Circuit(statements, newPorts, tag);
    }

    public Optional<String> title() {
        return statements.stream()
                .filter(Statement.Title.class::isInstance)
                .map(s -> ((Statement.Title) s).text())
                .findFirst();
    }

    public List<Statement.ComponentInstance> components() {
        List<Statement.ComponentInstance> result = new ArrayList<>();
        for (Statement statement : statements) {
            if (statement instanceof Statement.ComponentInstance component) {
                result.add(component);
            }
        }
        return result;
    }

    public Optional<Statement.ComponentInstance> component(String name) {
        return components().stream()
                .filter(c -> c.name().equals(name))
                .findFirst();
    }

    /**
     * All nodes referenced by components, in order of first occurrence.
     */
    public Set<String> nodes() {
        Set<String> nodes = new LinkedHashSet<>();
        for (Statement.ComponentInstance component : components()) {
            nodes.addAll(component.nodes());
        }
        return nodes;
    }

    /**
     * Number of components attached to each node, in order of first occurrence.
     */
    public Map<String, Integer> nodeDegrees() {
        Map<String, Integer> degrees = new LinkedHashMap<>();
        for (Statement.ComponentInstance component : components()) {
            for (String node : new LinkedHashSet<>(component.nodes())) {
                degrees.merge(node, 1, Integer::sum);
            }
        }
        return degrees;
    }

    public boolean references(String node) {
        return nodes().contains(node);
    }

    public Optional<String> port(String role) {
        return Optional.ofNullable(ports.get(role));
    }

    public Stats stats() {
        int components = 0;
        int directives = 0;
        int blocks = 0;
        for (Statement statement : statements) {
            if (statement instanceof Statement.ComponentInstance) {
                components++;
            } else if (statement instanceof Statement.Directive) {
                directives++;
            } else if (statement instanceof Statement.Block) {
                blocks++;
            }
        }
        return new Stats(statements.size(), components, directives, blocks, nodes().size());
    }

    public record Stats(
        int statementCount,
        int componentCount,
        int directiveCount,
        int blockCount,
        int nodeCount
    ) {}
}
