package com.flagship.lending_ledger.reporting;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A posted line in an account ledger with the balance after it.
 */
@Value
public class LedgerLine {
    UUID entryId;
    String entryNumber;
    LocalDate entryDate;
    String description;
    BigDecimal debit;
    BigDecimal credit;
    BigDecimal runningBalance;
}
