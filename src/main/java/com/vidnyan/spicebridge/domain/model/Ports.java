package com.vidnyan.spicebridge.domain.model;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Well-known port roles and node spellings.
 */
public final class Ports {

    public static final String INPUT = "in";
    public static final String OUTPUT = "out";
    public static final String GROUND = "gnd";

    /** Roles tried, in order, when auto-wiring into a stage. */
    public static final List<String> INPUT_ROLES = List.of("in", "inp", "input", "in1", "vin");

    /** Roles tried, in order, when auto-wiring out of a stage. */
    public static final List<String> OUTPUT_ROLES = List.of("out", "vout", "output");

    /** Roles exposed on the composite circuit from its first stage. */
    public static final List<String> EXPOSED_INPUT_ROLES =
            List.of("in", "inp", "input", "vin", "in1", "in2", "in3", "inp1", "inp2");

    /** Roles exposed on the composite circuit from its last stage. */
    public static final List<String> EXPOSED_OUTPUT_ROLES = List.of("out", "vout", "output");

    static final Set<String> INPUT_SPELLINGS =
            Set.of("in", "inp", "input", "vin", "in1", "in2", "in3", "inp1", "inp2");

    static final Set<String> OUTPUT_SPELLINGS = Set.of("out", "vout", "output");

    static final Set<String> POWER_SPELLINGS = Set.of("vcc", "vdd", "vee", "vss");

    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_.$#-]+");

    private Ports() {
    }

    public static boolean isValidName(String name) {
        return name != null && NAME.matcher(name).matches();
    }

    public static boolean looksLikeInput(String node) {
        return INPUT_SPELLINGS.contains(node.toLowerCase(Locale.ROOT));
    }

    public static boolean looksLikeOutput(String node) {
        return OUTPUT_SPELLINGS.contains(node.toLowerCase(Locale.ROOT));
    }

    public static boolean looksLikePower(String node) {
        return POWER_SPELLINGS.contains(node.toLowerCase(Locale.ROOT));
    }
}
