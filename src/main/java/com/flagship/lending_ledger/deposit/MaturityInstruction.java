package com.flagship.lending_ledger.deposit;

public enum MaturityInstruction {
    PAY_OUT,
    ROLLOVER_PRINCIPAL_AND_INTEREST
}
