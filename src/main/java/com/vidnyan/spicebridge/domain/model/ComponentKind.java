package com.vidnyan.spicebridge.domain.model;

import java.util.Optional;

/**
 * Component kinds recognised by their leading reference letter.
 */
public enum ComponentKind {
    RESISTOR('R', 2, 0, true),
    CAPACITOR('C', 2, 0, true),
    INDUCTOR('L', 2, 0, true),
    VOLTAGE_SOURCE('V', 2, 0, false),
    CURRENT_SOURCE('I', 2, 0, false),
    DIODE('D', 2, 0, true),
    BJT('Q', 3, 0, true),
    JFET('J', 3, 0, true),
    MOSFET('M', 4, 0, true),
    VCVS('E', 4, 0, true),
    VCCS('G', 4, 0, true),
    CCCS('F', 2, 1, true),
    CCVS('H', 2, 1, true),
    BEHAVIORAL_SOURCE('B', 2, 0, true),
    MUTUAL_INDUCTANCE('K', 0, 2, true),
    SUBCIRCUIT('X', -1, 0, true);

    private final char letter;
    private final int nodeCount;
    private final int referenceCount;
    private final boolean valueRequired;

    ComponentKind(char letter, int nodeCount, int referenceCount, boolean valueRequired) {
        this.letter = letter;
        this.nodeCount = nodeCount;
        this.referenceCount = referenceCount;
        this.valueRequired = valueRequired;
    }

    /**
     * Fixed number of node tokens after the name, or -1 for sub-circuit calls.
     */
    public int nodeCount() {
        return nodeCount;
    }

    /**
     * Number of other instance names that follow the nodes (F/H controlling
     * source, K coupled inductors).
     */
    public int referenceCount() {
        return referenceCount;
    }

    public boolean valueRequired() {
        return valueRequired;
    }

    public boolean hasVariableNodes() {
        return nodeCount < 0;
    }

    public boolean isIndependentSource() {
        return this == VOLTAGE_SOURCE || this == CURRENT_SOURCE;
    }

    /**
     * Look up the kind for a reference designator such as {@code R12}.
     */
    public static Optional<ComponentKind> forName(String name) {
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }
        char first = Character.toUpperCase(name.charAt(0));
        for (ComponentKind kind : values()) {
            if (kind.letter == first) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
