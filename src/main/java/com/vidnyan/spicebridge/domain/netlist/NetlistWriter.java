package com.vidnyan.spicebridge.domain.netlist;

import com.vidnyan.spicebridge.domain.model.Circuit;
import com.vidnyan.spicebridge.domain.model.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * Canonical text emission for parsed circuits.
 * Output of {@link #write(Circuit)} parses back to an equal statement list.
 */
public final class NetlistWriter {

    private NetlistWriter() {
    }

    public static String write(Circuit circuit) {
        StringBuilder out = new StringBuilder();
        for (Statement statement : circuit.statements()) {
            out.append(line(statement)).append('\n');
        }
        return out.toString();
    }

    public static String line(Statement statement) {
        if (statement instanceof Statement.Title title) {
            return title.text();
        } else if (statement instanceof Statement.Comment comment) {
            return comment.text();
        } else if (statement instanceof Statement.Blank) {
            return "";
        } else if (statement instanceof Statement.ComponentInstance component) {
            return component(component);
        } else if (statement instanceof Statement.Directive directive) {
            return directive.text();
        } else if (statement instanceof Statement.Block block) {
            return String.join("\n", block.lines());
        } else if (statement instanceof Statement.Opaque opaque) {
            return opaque.text();
        } else if (statement instanceof Statement.Terminator) {
            return ".end";
        }
        throw new IllegalArgumentException("Unknown statement: " + statement);
    }

    private static String component(Statement.ComponentInstance component) {
        List<String> tokens = new ArrayList<>();
        tokens.add(component.name());
        tokens.addAll(component.nodes());
        tokens.addAll(component.references());
        if (!component.value().isEmpty()) {
            tokens.add(component.value());
        }
        return String.join(" ", tokens);
    }

    /**
     * First {@code maxLines} lines of the rendered netlist.
     */
    public static List<String> preview(String netlist, int maxLines) {
        return netlist.strip().lines().limit(maxLines).toList();
    }
}
