package com.vidnyan.spicebridge.domain.netlist;

import com.vidnyan.spicebridge.domain.error.UnsafeNetlistException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NetlistSanitizerTest {

    private final NetlistSanitizer sanitizer = new NetlistSanitizer(10_000);

    @Test
    void sanitize_ShouldAcceptOrdinaryNetlists() {
        assertEquals(Netlists.RC_LOWPASS, sanitizer.sanitize(Netlists.RC_LOWPASS));
        assertEquals(Netlists.INVERTING_AMP, sanitizer.sanitize(Netlists.INVERTING_AMP));
    }

    @Test
    void sanitize_ShouldRejectOversizedInput() {
        String huge = "* big\n" + "R1 a 0 1k\n".repeat(2_000) + ".end\n";

        UnsafeNetlistException e = assertThrows(UnsafeNetlistException.class, () -> sanitizer.sanitize(huge));
        assertEquals(0, e.getLineNumber());
    }

    @Test
    void sanitize_ShouldRejectNull() {
        assertThrows(UnsafeNetlistException.class, () -> sanitizer.sanitize(null));
    }

    @Test
    void sanitize_ShouldRejectBackticks() {
        UnsafeNetlistException e = assertThrows(UnsafeNetlistException.class,
                () -> sanitizer.sanitize("* t\nR1 a 0 `rm -rf /`\n.end\n"));

        assertEquals(2, e.getLineNumber());
    }

    @Test
    void sanitize_ShouldRejectDirectivesOutsideAllowList() {
        UnsafeNetlistException e = assertThrows(UnsafeNetlistException.class,
                () -> sanitizer.sanitize("* t\nR1 a 0 1k\n.system ls\n.end\n"));

        assertEquals(3, e.getLineNumber());
        assertTrue(e.getReason().contains(".system"));
    }

    @Test
    void sanitize_ShouldRejectIncludesOnlyForUserInput() {
        String netlist = "* t\n.include /etc/passwd\nR1 a 0 1k\n.end\n";

        assertThrows(UnsafeNetlistException.class, () -> sanitizer.sanitize(netlist));
        assertEquals(netlist, sanitizer.sanitizeComposed(netlist));
    }

    @Test
    void sanitize_ShouldRejectShellInControlBlock() {
        String netlist = "* t\nR1 a 0 1k\n.control\nshell rm -rf /\n.endc\n.end\n";

        assertThrows(UnsafeNetlistException.class, () -> sanitizer.sanitize(netlist));
    }

    @Test
    void sanitize_ShouldAllowRunInControlBlock() {
        String netlist = "* t\nR1 a 0 1k\n.control\nrun\n.endc\nshell_node a 0\n.end\n";

        assertEquals(netlist, sanitizer.sanitize(netlist));
    }
}
