package com.corvus.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProgressEventTest {

    @Test
    void toStatus_shouldMapEachEventType() {
        assertEquals(TaskStatus.inProgress(0.25f), ProgressEvent.update(0.25f).toStatus());
        assertEquals(TaskStatus.completed(), ProgressEvent.completed().toStatus());
        assertEquals(TaskStatus.failed("boom"), ProgressEvent.error("boom").toStatus());
    }

    @Test
    void isTerminal_shouldBeFalseOnlyForUpdates() {
        assertFalse(ProgressEvent.update(0.1f).isTerminal());
        assertTrue(ProgressEvent.completed().isTerminal());
        assertTrue(ProgressEvent.error("x").isTerminal());
    }

    @Test
    void error_shouldRequireMessage() {
        assertThrows(NullPointerException.class, () -> ProgressEvent.error(null));
    }
}
