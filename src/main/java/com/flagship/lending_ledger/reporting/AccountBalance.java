package com.flagship.lending_ledger.reporting;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Balance of one account replayed from posted lines.
 * {@code asOfDate} is null for the all-time balance.
 */
@Value
public class AccountBalance {
    UUID accountId;
    String code;
    String name;
    LocalDate asOfDate;
    BigDecimal openingBalance;
    BigDecimal debitTotal;
    BigDecimal creditTotal;
    BigDecimal balance;
}
