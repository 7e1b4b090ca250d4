package com.vidnyan.spicebridge.domain.netlist;

import com.vidnyan.spicebridge.domain.error.PrefixCollisionException;
import com.vidnyan.spicebridge.domain.model.Circuit;
import com.vidnyan.spicebridge.domain.model.Statement;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renames a circuit's instances, internal nodes and parameters with a stage tag.
 *
 * <p>{@code R1} becomes {@code R<tag>_1} (the kind letter stays first so the
 * simulator still recognises the element) and node {@code mid} becomes
 * {@code <tag>_mid}. Ground is always {@code 0}; preserved nodes are left as is.
 */
public final class PrefixEngine {

    private static final Pattern TAG = Pattern.compile("[A-Za-z0-9]+");
    private static final Pattern PARAM_KEY = Pattern.compile("(^|\\s)([A-Za-z_]\\w*)(\\s*=)");
    private static final Pattern BRACED = Pattern.compile("\\{([^}]*)}");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_]\\w*");
    // V(...) and I(...) plus the magnitude, phase, dB, real and imaginary forms: VDB(out), IP(Vs)
    private static final Pattern OUTPUT_FUNCTION = Pattern.compile("(?i)\\b([vi](?:db|m|p|r|i)?)\\(([^)]*)\\)");

    public Circuit prefix(Circuit circuit, String tag) {
        return prefix(circuit, tag, Set.of());
    }

    /**
     * @param preservedNodes nodes shared across stages that keep their name
     * @throws PrefixCollisionException if two instances end up with the same name
     */
    public Circuit prefix(Circuit circuit, String tag, Set<String> preservedNodes) {
        if (tag == null || !TAG.matcher(tag).matches()) {
            throw new IllegalArgumentException("Invalid stage tag '" + tag + "': must match [A-Za-z0-9]+");
        }
        Renamer renamer = new Renamer(tag, preservedNodes, parameterNames(circuit));

        List<Statement> statements = new ArrayList<>();
        Set<String> instanceNames = new HashSet<>();
        for (Statement statement : circuit.statements()) {
            Statement renamed = renamer.apply(statement);
            if (renamed instanceof Statement.ComponentInstance component && !instanceNames.add(component.name())) {
                throw new PrefixCollisionException(component.name(),
                        "two instances map to the same name under tag '" + tag + "'");
            }
            statements.add(renamed);
        }

        Map<String, String> ports = new LinkedHashMap<>();
        circuit.ports().forEach((role, node) -> ports.put(role, renamer.node(node)));
        return new Circuit(statements, ports, tag);
    }

    public static String prefixNode(String node, String tag, Set<String> preservedNodes) {
        if (Circuit.isGround(node)) {
            return Circuit.GROUND;
        }
        if (preservedNodes.contains(node)) {
            return node;
        }
        return tag + "_" + node;
    }

    public static String prefixInstance(String name, String tag) {
        return name.charAt(0) + tag + "_" + name.substring(1);
    }

    /**
     * Rewrite node arguments of {@code V(a,b)} and {@code VDB(a)} style functions and
     * instance arguments of {@code I(Vx)} style functions.
     */
    static String renameOutputFunctions(String text, UnaryOperator<String> nodes, UnaryOperator<String> instances) {
        return OUTPUT_FUNCTION.matcher(text).replaceAll(m -> {
            boolean voltage = m.group(1).toLowerCase(Locale.ROOT).startsWith("v");
            UnaryOperator<String> rename = voltage ? nodes : instances;
            List<String> args = new ArrayList<>();
            for (String arg : m.group(2).split(",")) {
                String trimmed = arg.strip();
                args.add(trimmed.isEmpty() ? trimmed : rename.apply(trimmed));
            }
            return Matcher.quoteReplacement(m.group(1) + "(" + String.join(",", args) + ")");
        });
    }

    private static Set<String> parameterNames(Circuit circuit) {
        Set<String> names = new HashSet<>();
        for (Statement statement : circuit.statements()) {
            if (statement instanceof Statement.Directive directive && directive.isParam()) {
                Matcher matcher = PARAM_KEY.matcher(withoutBraces(afterKeyword(directive.text())));
                while (matcher.find()) {
                    names.add(matcher.group(2));
                }
            }
        }
        return names;
    }

    private static String afterKeyword(String text) {
        int space = text.indexOf(' ');
        return space < 0 ? "" : text.substring(space);
    }

    private static String withoutBraces(String text) {
        return BRACED.matcher(text).replaceAll(m -> " ".repeat(m.group().length()));
    }

    private static final class Renamer {
        private final String tag;
        private final Set<String> preservedNodes;
        private final Set<String> parameters;

        Renamer(String tag, Set<String> preservedNodes, Set<String> parameters) {
            this.tag = tag;
            this.preservedNodes = preservedNodes;
            this.parameters = parameters;
        }

        String node(String node) {
            return prefixNode(node, tag, preservedNodes);
        }

        String instance(String name) {
            return prefixInstance(name, tag);
        }

        Statement apply(Statement statement) {
            if (statement instanceof Statement.ComponentInstance component) {
                return component.withNames(
                                instance(component.name()),
                                component.nodes().stream().map(this::node).toList(),
                                component.references().stream().map(this::instance).toList())
                        .withValue(parameterReferences(component.value()));
            }
            if (statement instanceof Statement.Directive directive) {
                return directive(directive);
            }
            if (statement instanceof Statement.Comment comment) {
                String body = comment.text().replaceFirst("^\\*+\\s*", "");
                return new Statement.Comment("* [" + tag + "] " + body);
            }
            return statement;
        }

        private Statement directive(Statement.Directive directive) {
            if (directive.isInclude()) {
                return directive;
            }
            String text = directive.text();
            if (directive.isParam()) {
                int split = text.indexOf(' ');
                if (split > 0) {
                    String head = text.substring(0, split);
                    String body = renameKeys(text.substring(split));
                    text = head + body;
                }
            }
            if (directive.referencesNodes()) {
                text = outputFunctions(text);
            }
            return new Statement.Directive(directive.keyword(), parameterReferences(text));
        }

        /**
         * Rename {@code KEY=} assignments outside of brace expressions.
         */
        private String renameKeys(String body) {
            String masked = withoutBraces(body);
            StringBuilder out = new StringBuilder(body);
            Matcher matcher = PARAM_KEY.matcher(masked);
            int shift = 0;
            while (matcher.find()) {
                int at = matcher.start(2) + shift;
                out.insert(at, tag + "_");
                shift += tag.length() + 1;
            }
            return out.toString();
        }

        private String parameterReferences(String text) {
            if (parameters.isEmpty() || text.indexOf('{') < 0) {
                return text;
            }
            return BRACED.matcher(text).replaceAll(m -> Matcher.quoteReplacement(
                    "{" + replaceIdentifiers(m.group(1), id -> parameters.contains(id) ? tag + "_" + id : id) + "}"));
        }

        private String outputFunctions(String text) {
            return renameOutputFunctions(text, this::node, this::instance);
        }

        private static String replaceIdentifiers(String expression, UnaryOperator<String> rename) {
            return IDENTIFIER.matcher(expression).replaceAll(m -> Matcher.quoteReplacement(rename.apply(m.group())));
        }
    }
}
