package com.flagship.lending_ledger.ledger;

/**
 * Classification of an account in the chart of accounts.
 */
public enum AccountType {
    ASSET,
    LIABILITY,
    EQUITY,
    INCOME,
    EXPENSE
}
