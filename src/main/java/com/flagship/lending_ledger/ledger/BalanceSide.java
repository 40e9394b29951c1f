package com.flagship.lending_ledger.ledger;

import java.math.BigDecimal;

/**
 * The side on which an account's balance naturally increases.
 *
 * This is the single sign rule of the ledger. Posting, reversal and every
 * read projection go through {@link #delta(BigDecimal, BigDecimal)} so a
 * cached balance and a replayed balance can never disagree on direction.
 */
public enum BalanceSide {
    DEBIT,
    CREDIT;

    /**
     * Signed change to an account of this side caused by the given debit and credit.
     */
    public BigDecimal delta(BigDecimal debit, BigDecimal credit) {
        return this == DEBIT ? debit.subtract(credit) : credit.subtract(debit);
    }

    public BalanceSide opposite() {
        return this == DEBIT ? CREDIT : DEBIT;
    }
}
