package com.flagship.lending_ledger.savings;

public enum SavingsAccountStatus {
    ACTIVE,
    DORMANT,
    CLOSED
}
