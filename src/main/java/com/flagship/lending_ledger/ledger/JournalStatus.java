package com.flagship.lending_ledger.ledger;

/**
 * Lifecycle of a journal entry.
 *
 * Valid transitions:
 * - DRAFT -> PENDING_APPROVAL
 * - DRAFT -> POSTED
 * - PENDING_APPROVAL -> POSTED
 *
 * POSTED is terminal. A posted entry is corrected only by a reversal entry.
 */
public enum JournalStatus {
    DRAFT,
    PENDING_APPROVAL,
    POSTED;

    public boolean canBePosted() {
        return this == DRAFT || this == PENDING_APPROVAL;
    }

    public boolean affectsBalances() {
        return this == POSTED;
    }
}
