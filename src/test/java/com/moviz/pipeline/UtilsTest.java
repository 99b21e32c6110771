package com.moviz.pipeline;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class UtilsTest {

    @Test
    void testBlankToNull() {
        assertNull(Utils.blankToNull(null));
        assertNull(Utils.blankToNull("   "));
        assertNull(Utils.blankToNull("NaN"));
        assertEquals("Heat", Utils.blankToNull("  Heat "));
    }

    @Test
    void testParseLong() throws MalformedFieldException {
        assertEquals(160_000_000L, Utils.parseLong("$160,000,000", "budget"));
        assertEquals(160_000_000L, Utils.parseLong("160000000.0", "budget"));
        assertEquals(3L, Utils.parseLong("2.5", "votes"));
        assertNull(Utils.parseLong("", "budget"));
        MalformedFieldException e = assertThrows(MalformedFieldException.class, () -> Utils.parseLong("ten", "budget"));
        assertTrue(e.getMessage().contains("budget"));
    }

    @Test
    void testParseRuntime() throws MalformedFieldException {
        assertEquals(142, Utils.parseRuntime("142 min", "runtime"));
        assertEquals(90, Utils.parseRuntime("90", "runtime"));
        assertThrows(MalformedFieldException.class, () -> Utils.parseRuntime("2h 22m", "runtime"));
    }

    @Test
    void testParseFlag() {
        assertTrue(Utils.parseFlag("True"));
        assertTrue(Utils.parseFlag("1"));
        assertFalse(Utils.parseFlag("False"));
        assertFalse(Utils.parseFlag(null));
    }

    @Test
    void testIsZeroOrBlank() {
        assertTrue(Utils.isZeroOrBlank("0"));
        assertTrue(Utils.isZeroOrBlank("$0"));
        assertTrue(Utils.isZeroOrBlank("0.0"));
        assertTrue(Utils.isZeroOrBlank(null));
        assertFalse(Utils.isZeroOrBlank("136"));
        assertFalse(Utils.isZeroOrBlank("unknown"));
    }
}
