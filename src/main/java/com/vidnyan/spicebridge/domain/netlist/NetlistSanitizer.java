package com.vidnyan.spicebridge.domain.netlist;

import com.vidnyan.spicebridge.domain.error.UnsafeNetlistException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rejects netlists that could make the simulator do more than simulate:
 * oversized input, shell backticks and dot-directives outside an allow-list.
 */
public final class NetlistSanitizer {

    private static final Set<String> ALLOWED_DIRECTIVES = Set.of(
            "ac", "tran", "op", "dc", "noise", "tf",
            "param", "subckt", "ends", "model", "include", "lib", "global", "end",
            "ic", "nodeset", "options", "option", "temp", "save", "print", "meas", "measure",
            "control", "endc");

    private static final Pattern DOT_DIRECTIVE = Pattern.compile("^\\.(\\w+)");

    private final int maxNetlistSize;

    public NetlistSanitizer(int maxNetlistSize) {
        this.maxNetlistSize = maxNetlistSize;
    }

    /**
     * Validate a user-supplied netlist; {@code .include} and {@code .lib} are refused.
     */
    public String sanitize(String netlist) {
        return check(netlist, false);
    }

    /**
     * Validate a netlist produced by composition, which may carry hoisted includes.
     */
    public String sanitizeComposed(String netlist) {
        return check(netlist, true);
    }

    private String check(String netlist, boolean allowIncludes) {
        if (netlist == null) {
            throw new UnsafeNetlistException(0, "Netlist must not be null");
        }
        if (netlist.length() > maxNetlistSize) {
            throw new UnsafeNetlistException(0,
                    "Netlist too large: " + netlist.length() + " chars (max " + maxNetlistSize + ")");
        }

        List<String> lines = reassemble(netlist);
        boolean inControl = false;
        for (int i = 0; i < lines.size(); i++) {
            int lineNumber = i + 1;
            String stripped = lines.get(i).strip();
            if (stripped.isEmpty() || stripped.startsWith("*")) {
                continue;
            }
            if (stripped.indexOf('`') >= 0) {
                throw new UnsafeNetlistException(lineNumber, "Backtick execution is not allowed");
            }
            Matcher matcher = DOT_DIRECTIVE.matcher(stripped);
            if (matcher.find()) {
                String name = matcher.group(1).toLowerCase(Locale.ROOT);
                String directive = stripped.split("\\s+")[0];
                if ((name.equals("include") || name.equals("lib")) && !allowIncludes) {
                    throw new UnsafeNetlistException(lineNumber, "Directive '" + directive
                            + "' is not allowed in user-supplied netlists");
                }
                if (!ALLOWED_DIRECTIVES.contains(name)) {
                    throw new UnsafeNetlistException(lineNumber,
                            "Disallowed SPICE directive '" + directive + "'");
                }
                inControl = name.equals("control") || (inControl && !name.equals("endc"));
            } else if (inControl && stripped.toLowerCase(Locale.ROOT).startsWith("shell")) {
                throw new UnsafeNetlistException(lineNumber, "Shell commands are not allowed in .control blocks");
            }
        }
        return netlist;
    }

    /**
     * Fold '+' continuation lines into their predecessor so split directives are still seen.
     */
    private static List<String> reassemble(String netlist) {
        List<String> lines = new ArrayList<>();
        for (String line : netlist.lines().toList()) {
            String stripped = line.strip();
            if (stripped.startsWith("+") && !lines.isEmpty()) {
                lines.set(lines.size() - 1, lines.get(lines.size() - 1) + " " + stripped.substring(1));
            } else {
                lines.add(line);
            }
        }
        return lines;
    }
}
