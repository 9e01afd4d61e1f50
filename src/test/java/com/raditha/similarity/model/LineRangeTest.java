package com.raditha.similarity.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LineRangeTest {

    @Test
    void testLineCount() {
        assertEquals(1, new LineRange(5, 5).lineCount());
        assertEquals(8, new LineRange(45, 52).lineCount());
    }

    @Test
    void testDisplayString() {
        assertEquals("L7", new LineRange(7, 7).toDisplayString());
        assertEquals("L45-52", new LineRange(45, 52).toDisplayString());
    }

    @Test
    void testRejectsZeroStartLine() {
        assertThrows(IllegalArgumentException.class, () -> new LineRange(0, 3));
    }

    @Test
    void testRejectsEndBeforeStart() {
        assertThrows(IllegalArgumentException.class, () -> new LineRange(10, 9));
    }
}
