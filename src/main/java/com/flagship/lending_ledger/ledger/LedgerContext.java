package com.flagship.lending_ledger.ledger;

import lombok.Getter;
import org.springframework.transaction.TransactionStatus;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Explicit per-call context for ledger work.
 *
 * Carries the acting identity, the business date and instant used for period
 * checks and timestamps, and the transaction the work runs in. Engine
 * operations take a context instead of reading ambient state, so every
 * posting is tied to exactly one bounded transaction.
 */
@Getter
public class LedgerContext {

    private final ActorIdentity actor;
    private final LocalDate businessDate;
    private final Instant now;
    private final TransactionStatus transaction;

    LedgerContext(ActorIdentity actor, LocalDate businessDate, Instant now, TransactionStatus transaction) {
        this.actor = actor;
        this.businessDate = businessDate;
        this.now = now;
        this.transaction = transaction;
    }

    public String getActorId() {
        return actor.getId();
    }

    /**
     * Discards everything written in this unit when the transaction ends.
     */
    public void markRollbackOnly() {
        transaction.setRollbackOnly();
    }

    public boolean isRollbackOnly() {
        return transaction.isRollbackOnly();
    }
}
