package com.flagship.lending_ledger.reporting;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Cached running balance against the balance replayed from history.
 */
@Value
public class BalanceCheck {
    UUID accountId;
    String code;
    BigDecimal cachedBalance;
    BigDecimal replayedBalance;

    public boolean isConsistent() {
        return cachedBalance.compareTo(replayedBalance) == 0;
    }

    public BigDecimal getDrift() {
        return cachedBalance.subtract(replayedBalance);
    }
}
