package com.flagship.lending_ledger.reporting;

import com.flagship.lending_ledger.ledger.AccountType;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One account in a trial balance. Exactly one of debit and credit is non-zero.
 */
@Value
public class TrialBalanceRow {
    String code;
    String name;
    AccountType accountType;
    BigDecimal debit;
    BigDecimal credit;
}
