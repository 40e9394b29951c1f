package com.flagship.lending_ledger.savings;

public enum SavingsTransactionType {
    DEPOSIT,
    WITHDRAWAL,
    INTEREST
}
