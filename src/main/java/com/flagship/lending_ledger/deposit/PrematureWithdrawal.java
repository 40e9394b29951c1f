package com.flagship.lending_ledger.deposit;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Settlement of a deposit closed before maturity.
 */
@Value
public class PrematureWithdrawal {
    UUID fixedDepositId;
    int daysHeld;
    BigDecimal principal;
    BigDecimal earnedInterest;
    BigDecimal penalty;
    /** Earned interest less penalty, never below zero. */
    BigDecimal netInterest;
    BigDecimal payout;
    UUID journalEntryId;
}
