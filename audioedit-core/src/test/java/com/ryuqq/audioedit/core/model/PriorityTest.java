package com.ryuqq.audioedit.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PriorityTest {

    @Test
    void of_ValidRange_ReturnsCachedInstance() {
        assertSame(Priority.of(1), Priority.HIGHEST);
        assertSame(Priority.of(3), Priority.DEFAULT);
        assertSame(Priority.of(5), Priority.LOWEST);
        assertEquals(0, Priority.of(1).tierIndex());
        assertEquals(4, Priority.of(5).tierIndex());
    }

    @Test
    void of_OutOfRange_ThrowsException() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class, () -> Priority.of(6));
        assertTrue(exception.getMessage().contains("current: 6"));
        assertThrows(IllegalArgumentException.class, () -> Priority.of(0));
    }

    @Test
    void fromLabel_KnownLabels_MapToTiers() {
        assertEquals(1, Priority.fromLabel("urgent").getValue());
        assertEquals(2, Priority.fromLabel("HIGH").getValue());
        assertEquals(3, Priority.fromLabel(" normal ").getValue());
        assertEquals(4, Priority.fromLabel("low").getValue());
        assertEquals(5, Priority.fromLabel("background").getValue());
        assertEquals(2, Priority.fromLabel("2").getValue());
    }

    @Test
    void fromLabel_Unknown_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Priority.fromLabel("asap"));
        assertThrows(IllegalArgumentException.class, () -> Priority.fromLabel("9"));
    }

    @Test
    void compareTo_LowerValueIsHigherPriority() {
        assertTrue(Priority.of(1).compareTo(Priority.of(2)) < 0);
    }
}
