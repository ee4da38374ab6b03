package com.astrepr.codegen;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class IdentifiersTest {

    @Test
    void testSanitize() {
        assertEquals("foo__bar", Identifiers.sanitize("foo-bar"));
        assertEquals("dollar_x", Identifiers.sanitize("$x"));
        assertEquals("a__b__dollar_c", Identifiers.sanitize("a-b-$c"));
    }

    @Test
    void testPlainNamesAreUnchanged() {
        assertEquals("plain_name", Identifiers.sanitize("plain_name"));
        assertEquals("", Identifiers.sanitize(""));
        assertNull(Identifiers.sanitize(null));
    }
}
