package com.vidnyan.spicebridge.domain.netlist;

import com.vidnyan.spicebridge.domain.error.MalformedNetlistException;
import com.vidnyan.spicebridge.domain.model.Circuit;
import com.vidnyan.spicebridge.domain.model.ComponentKind;
import com.vidnyan.spicebridge.domain.model.Statement;
import com.vidnyan.spicebridge.domain.model.Statement.Block.BlockKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Converts SPICE netlist text into an ordered statement sequence.
 * Stateless and thread-safe.
 */
public final class NetlistParser {

    /**
     * Parse netlist text.
     * @throws MalformedNetlistException on the first offending line
     */
    public Circuit parse(String text) {
        if (text == null || text.isBlank()) {
            throw new MalformedNetlistException(1, "netlist is empty");
        }
        return new Run(joinContinuations(text.lines().toList())).parse();
    }

    /**
     * A logical line: a physical line with its '+' continuations appended.
     */
    private record Line(int number, String text) {
        String stripped() {
            return text.strip();
        }
    }

    private static List<Line> joinContinuations(List<String> physical) {
        List<Line> logical = new ArrayList<>();
        int titleIndex = -1;
        for (int i = 0; i < physical.size(); i++) {
            String raw = physical.get(i);
            String stripped = raw.strip();
            if (titleIndex >= 0 && stripped.startsWith("+")) {
                int previousIndex = logical.size() - 1;
                Line previous = logical.get(previousIndex);
                if (previousIndex == titleIndex || isInert(previous.stripped())) {
                    throw new MalformedNetlistException(i + 1,
                            "continuation line without a preceding statement");
                }
                logical.set(logical.size() - 1, new Line(previous.number(),
                        previous.text() + " " + stripped.substring(1).strip()));
                continue;
            }
            if (titleIndex < 0 && !stripped.isEmpty()) {
                titleIndex = logical.size();
            }
            logical.add(new Line(i + 1, raw));
        }
        return logical;
    }

    private static boolean isInert(String stripped) {
        return stripped.isEmpty() || stripped.startsWith("*");
    }

    /**
     * Mutable state for one parse call.
     */
    private static final class Run {
        private final List<Line> lines;
        private final List<Statement> statements = new ArrayList<>();
        private final Map<String, Integer> componentLines = new HashMap<>();

        private boolean titleSeen;
        private int terminatorLine;
        private int lastStatementLine;

        private BlockKind openBlock;
        private String openBlockName;
        private int openBlockLine;
        private int blockDepth;
        private List<String> blockLines;

        Run(List<Line> lines) {
            this.lines = lines;
        }

        Circuit parse() {
            for (Line line : lines) {
                accept(line);
            }
            if (openBlock != null) {
                throw new MalformedNetlistException(openBlockLine,
                        "unterminated " + blockStart(openBlock) + " block"
                                + (openBlockName != null ? " '" + openBlockName + "'" : ""));
            }
            if (terminatorLine == 0) {
                throw new MalformedNetlistException(lastStatementLine + 1, "missing .end terminator");
            }
            return Circuit.of(statements);
        }

        private void accept(Line line) {
            String stripped = line.stripped();
            if (stripped.isEmpty()) {
                if (titleSeen && openBlock != null) {
                    blockLines.add("");
                } else if (titleSeen && terminatorLine == 0) {
                    statements.add(new Statement.Blank());
                }
                return;
            }
            lastStatementLine = line.number();

            if (!titleSeen) {
                titleSeen = true;
                statements.add(new Statement.Title(stripped));
                return;
            }
            if (terminatorLine != 0) {
                if (isTerminator(stripped)) {
                    throw new MalformedNetlistException(line.number(),
                            "multiple .end terminators (first on line " + terminatorLine + ")");
                }
                throw new MalformedNetlistException(line.number(), "statement after .end terminator");
            }
            if (openBlock != null) {
                continueBlock(line);
                return;
            }
            if (stripped.startsWith("*")) {
                statements.add(new Statement.Comment(stripped));
                return;
            }
            if (stripped.startsWith(".")) {
                acceptDotLine(line, stripped);
                return;
            }
            acceptElement(line, stripped);
        }

        private void acceptDotLine(Line line, String stripped) {
            String[] tokens = stripped.split("\\s+");
            String keyword = tokens[0].substring(1).toLowerCase(Locale.ROOT);
            switch (keyword) {
                case "end" -> {
                    if (tokens.length > 1) {
                        throw new MalformedNetlistException(line.number(), "unexpected text after .end");
                    }
                    terminatorLine = line.number();
                    statements.add(new Statement.Terminator());
                }
                case "subckt" -> {
                    if (tokens.length < 2) {
                        throw new MalformedNetlistException(line.number(), ".subckt without a name");
                    }
                    openBlock(BlockKind.SUBCIRCUIT, tokens[1], line);
                }
                case "control" -> openBlock(BlockKind.CONTROL, null, line);
                case "ends" -> throw new MalformedNetlistException(line.number(),
                        ".ends without a matching .subckt");
                case "endc" -> throw new MalformedNetlistException(line.number(),
                        ".endc without a matching .control");
                case "" -> throw new MalformedNetlistException(line.number(), "empty directive");
                default -> statements.add(Statement.Directive.of(stripped));
            }
        }

        private void openBlock(BlockKind kind, String name, Line line) {
            openBlock = kind;
            openBlockName = name;
            openBlockLine = line.number();
            blockDepth = 1;
            blockLines = new ArrayList<>();
            blockLines.add(line.text().stripTrailing());
        }

        private void continueBlock(Line line) {
            blockLines.add(line.text().stripTrailing());
            String keyword = line.stripped().split("\\s+")[0].toLowerCase(Locale.ROOT);
            if (keyword.equals(blockStart(openBlock))) {
                blockDepth++;
            } else if (keyword.equals(blockEnd(openBlock))) {
                blockDepth--;
            }
            if (blockDepth == 0) {
                statements.add(new Statement.Block(openBlock, openBlockName, blockLines));
                openBlock = null;
                openBlockName = null;
                blockLines = null;
            }
        }

        private void acceptElement(Line line, String stripped) {
            int semicolon = stripped.indexOf(';');
            String body = semicolon >= 0 ? stripped.substring(0, semicolon).strip() : stripped;
            String[] tokens = body.split("\\s+");
            Optional<ComponentKind> kind = ComponentKind.forName(tokens[0]);
            if (kind.isEmpty()) {
                statements.add(new Statement.Opaque(stripped));
                return;
            }
            Statement.ComponentInstance component = parseComponent(kind.get(), tokens, line.number());
            Integer previous = componentLines.putIfAbsent(component.name(), line.number());
            if (previous != null) {
                throw new MalformedNetlistException(line.number(),
                        "duplicate component name '" + component.name() + "' (first defined on line "
                                + previous + ")");
            }
            statements.add(component);
        }

        private static Statement.ComponentInstance parseComponent(ComponentKind kind, String[] tokens, int lineNumber) {
            String name = tokens[0];
            if (name.length() < 2) {
                throw new MalformedNetlistException(lineNumber, "empty component name '" + name + "'");
            }
            if (kind.hasVariableNodes()) {
                return parseSubcircuitCall(kind, tokens, lineNumber);
            }

            int nodeCount = nodeCountFor(kind, tokens);
            int available = tokens.length - 1;
            if (available < nodeCount) {
                throw new MalformedNetlistException(lineNumber, String.format(
                        "%s '%s' needs %d nodes, found %d",
                        describe(kind), name, nodeCount, available));
            }
            int referencesEnd = 1 + nodeCount + kind.referenceCount();
            if (tokens.length < referencesEnd) {
                throw new MalformedNetlistException(lineNumber, String.format(
                        "%s '%s' needs %d element reference(s) after its nodes",
                        describe(kind), name, kind.referenceCount()));
            }
            if (kind.valueRequired() && tokens.length == referencesEnd) {
                throw new MalformedNetlistException(lineNumber, String.format(
                        "%s '%s' is missing its value or model", describe(kind), name));
            }

            List<String> nodes = Arrays.asList(tokens).subList(1, 1 + nodeCount);
            List<String> references = Arrays.asList(tokens).subList(1 + nodeCount, referencesEnd);
            String value = String.join(" ", Arrays.asList(tokens).subList(referencesEnd, tokens.length));
            return new Statement.ComponentInstance(kind, name, nodes, references, value);
        }

        private static Statement.ComponentInstance parseSubcircuitCall(ComponentKind kind, String[] tokens, int lineNumber) {
            int end = tokens.length;
            while (end > 2 && isParameterToken(tokens[end - 1])) {
                end--;
            }
            int subcircuitIndex = end - 1;
            if (tokens.length < 3 || subcircuitIndex < 2 || isParameterToken(tokens[subcircuitIndex])) {
                throw new MalformedNetlistException(lineNumber, "sub-circuit call '" + tokens[0]
                        + "' needs at least one node and a sub-circuit name");
            }
            List<String> nodes = Arrays.asList(tokens).subList(1, subcircuitIndex);
            String value = String.join(" ", Arrays.asList(tokens).subList(subcircuitIndex, tokens.length));
            return new Statement.ComponentInstance(kind, tokens[0], nodes, List.of(), value);
        }

        private static boolean isParameterToken(String token) {
            return token.contains("=") || token.equalsIgnoreCase("params:");
        }

        /**
         * E and G sources written in behavioural form ({@code E1 out 0 value={...}})
         * carry only the two output nodes.
         */
        private static int nodeCountFor(ComponentKind kind, String[] tokens) {
            if ((kind == ComponentKind.VCVS || kind == ComponentKind.VCCS) && tokens.length > 3) {
                String third = tokens[3].toLowerCase(Locale.ROOT);
                if (third.startsWith("value") || third.startsWith("vol") || third.startsWith("cur")) {
                    return 2;
                }
            }
            return kind.nodeCount();
        }

        private static String describe(ComponentKind kind) {
            return kind.name().toLowerCase(Locale.ROOT).replace('_', ' ');
        }

        private static boolean isTerminator(String stripped) {
            return stripped.equalsIgnoreCase(".end");
        }

        private static String blockStart(BlockKind kind) {
            return kind == BlockKind.SUBCIRCUIT ? ".subckt" : ".control";
        }

        private static String blockEnd(BlockKind kind) {
            return kind == BlockKind.SUBCIRCUIT ? ".ends" : ".endc";
        }
    }
}
