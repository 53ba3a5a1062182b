package com.hoslog.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CycleStateTest {

    @Test
    void testRemainingAndPercentage() {
        CycleState state = new CycleState(63.0, 70.0);

        assertEquals(7.0, state.hoursRemaining());
        assertEquals(90.0, state.percentUsed(), 1e-9);
        assertTrue(state.isNearLimit(0.8));
        assertFalse(new CycleState(50.0, 70.0).isNearLimit(0.8));
    }

    @Test
    void testInvariantIsEnforced() {
        assertThrows(IllegalArgumentException.class, () -> new CycleState(-1.0, 70.0));
        assertThrows(IllegalArgumentException.class, () -> new CycleState(70.5, 70.0));
        assertThrows(IllegalArgumentException.class, () -> new CycleState(0.0, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new CycleState(Double.NaN, 70.0));
    }
}
