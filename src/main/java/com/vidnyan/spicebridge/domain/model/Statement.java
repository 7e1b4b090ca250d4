package com.vidnyan.spicebridge.domain.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One logical line (or verbatim block) of a netlist.
 * Closed set of immutable variants.
 */
public sealed interface Statement {

    /**
     * First non-blank line of every netlist.
     */
    record Title(String text) implements Statement {
        public Title {
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * Full-line comment, kept verbatim including the leading '*'.
     */
    record Comment(String text) implements Statement {
        public Comment {
            Objects.requireNonNull(text, "text");
        }
    }

    record Blank() implements Statement {
    }

    /**
     * An element line such as {@code R1 in out 1k} or {@code X1 a b opamp}.
     *
     * @param kind       component kind taken from the leading letter
     * @param name       full reference designator, unique within a circuit
     * @param nodes      connected nodes in terminal order
     * @param references other instance names this element refers to
     * @param value      opaque trailing text (value, model, sub-circuit name and parameters)
     */
    record ComponentInstance(
        ComponentKind kind,
        String name,
        List<String> nodes,
        List<String> references,
        String value
    ) implements Statement {

        public ComponentInstance {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(name, "name");
            nodes = List.copyOf(nodes);
            references = List.copyOf(references);
            value = value == null ? "" : value;
        }

        /**
         * Sub-circuit name for X instances (first token of the value field).
         */
        public String subcircuitName() {
            if (kind != ComponentKind.SUBCIRCUIT || value.isEmpty()) {
                return null;
            }
            return value.split("\\s+", 2)[0];
        }

        public ComponentInstance withNames(String newName, List<String> newNodes, List<String> newReferences) {
            return new ComponentInstance(kind, newName, newNodes, newReferences, value);
        }

        public ComponentInstance withValue(String newValue) {
            return new ComponentInstance(kind, name, nodes, references, newValue);
        }
    }

    /**
     * A dot-line other than {@code .end} and block delimiters.
     *
     * @param keyword lower-cased keyword without the dot, e.g. {@code param}
     * @param text    the full line
     */
    record Directive(String keyword, String text) implements Statement {

        public Directive {
            Objects.requireNonNull(keyword, "keyword");
            Objects.requireNonNull(text, "text");
        }

        public static Directive of(String text) {
            String trimmed = text.strip();
            String head = trimmed.split("\\s+", 2)[0];
            return new Directive(head.substring(1).toLowerCase(Locale.ROOT), trimmed);
        }

        public boolean isAnalysis() {
            return switch (keyword) {
                case "ac", "tran", "op", "dc", "noise", "tf", "sens", "pz", "disto" -> true;
                default -> false;
            };
        }

        public boolean isInclude() {
            return keyword.equals("include") || keyword.equals("lib");
        }

        public boolean isParam() {
            return keyword.equals("param");
        }

        public boolean isModel() {
            return keyword.equals("model");
        }

        /**
         * Whether the directive may name nodes through {@code V(node)} output functions.
         */
        public boolean referencesNodes() {
            return switch (keyword) {
                case "ic", "nodeset", "save", "print", "plot", "probe", "meas", "measure", "four" -> true;
                default -> false;
            };
        }
    }

    /**
     * A verbatim {@code .subckt}/{@code .ends} or {@code .control}/{@code .endc} block.
     */
    record Block(BlockKind kind, String name, List<String> lines) implements Statement {

        public Block {
            Objects.requireNonNull(kind, "kind");
            lines = List.copyOf(lines);
        }

        public enum BlockKind {
            SUBCIRCUIT,
            CONTROL
        }
    }

    /**
     * Any line whose leading token is not a known component kind.
     */
    record Opaque(String text) implements Statement {
        public Opaque {
            Objects.requireNonNull(text, "text");
        }
    }

    record Terminator() implements Statement {
    }
}
