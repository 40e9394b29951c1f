package com.flagship.lending_ledger.ledger;

/**
 * Accounts the lending workflows post to, by role. Each role is mapped to a
 * chart code in configuration and resolved once by {@link AccountRegistry}.
 */
public enum LedgerAccount {
    CASH_BANK,
    LOANS_RECEIVABLE,
    INTEREST_INCOME,
    FEE_INCOME,
    SAVINGS_LIABILITY,
    FIXED_DEPOSIT_LIABILITY,
    INTEREST_PAYABLE,
    DEPOSIT_INTEREST_EXPENSE,
    SAVINGS_INTEREST_EXPENSE
}
