package com.lmsagents.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SeverityTest {

    @Test
    @DisplayName("score below 30 → danger")
    void belowBoundary_isDanger() {
        assertEquals(Severity.DANGER, Severity.fromScore(29.9));
        assertEquals(Severity.DANGER, Severity.fromScore(0.0));
    }

    @Test
    @DisplayName("score of exactly 30 → warning")
    void atBoundary_isWarning() {
        assertEquals(Severity.WARNING, Severity.fromScore(30.0));
        assertEquals(Severity.WARNING, Severity.fromScore(49.9));
    }

    @Test
    @DisplayName("wire names parse case-insensitively and reject unknown values")
    void wireNames() {
        assertEquals(Severity.DANGER, Severity.fromWireName("danger"));
        assertEquals(Severity.WARNING, Severity.fromWireName("WARNING"));
        assertThrows(IllegalArgumentException.class, () -> Severity.fromWireName("critical"));
    }
}
