package com.flagship.lending_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Who is acting on the ledger, as supplied by the identity collaborator.
 *
 * A {@code null} approval limit means no limit.
 */
@Value
public class ActorIdentity {

    public static final String SYSTEM_ID = "SYSTEM";

    String id;
    int roleLevel;
    BigDecimal approvalLimit;

    public static ActorIdentity of(String id, int roleLevel, BigDecimal approvalLimit) {
        return new ActorIdentity(Objects.requireNonNull(id, "actor id"), roleLevel, approvalLimit);
    }

    /**
     * Identity used by batch jobs and automatic postings.
     */
    public static ActorIdentity system() {
        return new ActorIdentity(SYSTEM_ID, Integer.MAX_VALUE, null);
    }

    public boolean canApprove(BigDecimal amount) {
        return approvalLimit == null || amount.compareTo(approvalLimit) <= 0;
    }
}
