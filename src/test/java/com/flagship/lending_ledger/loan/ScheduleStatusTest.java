package com.flagship.lending_ledger.loan;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleStatusTest {

    @Test
    @DisplayName("Installment status only moves forward")
    void testForwardOnlyTransitions() {
        assertTrue(ScheduleStatus.PENDING.canTransitionTo(ScheduleStatus.PARTIAL));
        assertTrue(ScheduleStatus.PENDING.canTransitionTo(ScheduleStatus.OVERDUE));
        assertTrue(ScheduleStatus.PARTIAL.canTransitionTo(ScheduleStatus.OVERDUE));
        assertTrue(ScheduleStatus.PARTIAL.canTransitionTo(ScheduleStatus.PAID));
        assertTrue(ScheduleStatus.OVERDUE.canTransitionTo(ScheduleStatus.PAID));

        assertFalse(ScheduleStatus.PARTIAL.canTransitionTo(ScheduleStatus.PENDING));
        assertFalse(ScheduleStatus.OVERDUE.canTransitionTo(ScheduleStatus.PARTIAL));
        assertFalse(ScheduleStatus.PAID.canTransitionTo(ScheduleStatus.PARTIAL));
        assertFalse(ScheduleStatus.PAID.canTransitionTo(ScheduleStatus.OVERDUE));
    }

    @Test
    @DisplayName("Only PAID is closed")
    void testOpenStatuses() {
        assertTrue(ScheduleStatus.PENDING.isOpen());
        assertTrue(ScheduleStatus.PARTIAL.isOpen());
        assertTrue(ScheduleStatus.OVERDUE.isOpen());
        assertFalse(ScheduleStatus.PAID.isOpen());
    }
}
