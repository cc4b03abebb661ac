package org.pikematch.regex;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PatternOptionsTest {

    @Test
    void testFactories() {
        PatternOptions strict = PatternOptions.strict();
        assertFalse(strict.lenient());
        assertFalse(strict.debugEnabled());

        PatternOptions lenient = PatternOptions.lenientMode();
        assertTrue(lenient.lenient());
        assertFalse(lenient.debugEnabled());
    }

    @Test
    void testFlagString() {
        assertEquals("", PatternOptions.strict().toFlagString());
        assertEquals("l", PatternOptions.lenientMode().toFlagString());
        assertEquals("ld", new PatternOptions(true, true).toFlagString());
        assertEquals("d", new PatternOptions(false, true).toFlagString());
    }
}
