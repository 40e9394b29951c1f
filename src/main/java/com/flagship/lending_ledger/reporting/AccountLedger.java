package com.flagship.lending_ledger.reporting;

import com.flagship.lending_ledger.ledger.AccountType;
import com.flagship.lending_ledger.ledger.BalanceSide;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Posted activity of one account over a date range.
 *
 * Invariant: closingBalance = openingBalance + signed sum of the lines, and
 * equals the running balance of the last line when there is one.
 */
@Value
public class AccountLedger {
    UUID accountId;
    String code;
    String name;
    AccountType accountType;
    BalanceSide normalBalance;
    LocalDate startDate;
    LocalDate endDate;
    BigDecimal openingBalance;
    List<LedgerLine> lines;
    BigDecimal closingBalance;
}
