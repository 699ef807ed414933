package com.yizhaoqi.kb.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DocumentStatusTest {

    @Test
    void testAllowedTransitions() {
        assertTrue(DocumentStatus.PENDING.canTransitionTo(DocumentStatus.PROCESSING));
        assertTrue(DocumentStatus.PROCESSING.canTransitionTo(DocumentStatus.READY));
        assertTrue(DocumentStatus.PROCESSING.canTransitionTo(DocumentStatus.FAILED));
        assertTrue(DocumentStatus.READY.canTransitionTo(DocumentStatus.PENDING));
        assertTrue(DocumentStatus.FAILED.canTransitionTo(DocumentStatus.PENDING));
    }

    @Test
    void testRejectedTransitions() {
        assertFalse(DocumentStatus.PENDING.canTransitionTo(DocumentStatus.READY));
        assertFalse(DocumentStatus.PENDING.canTransitionTo(DocumentStatus.FAILED));
        assertFalse(DocumentStatus.PROCESSING.canTransitionTo(DocumentStatus.PENDING));
        assertFalse(DocumentStatus.READY.canTransitionTo(DocumentStatus.PROCESSING));
        assertFalse(DocumentStatus.FAILED.canTransitionTo(DocumentStatus.READY));
        assertFalse(DocumentStatus.READY.canTransitionTo(null));
    }

    @Test
    void testWireValue() {
        assertEquals("processing", DocumentStatus.PROCESSING.wireValue());
        assertEquals("pending", DocumentStatus.PENDING.wireValue());
    }
}
