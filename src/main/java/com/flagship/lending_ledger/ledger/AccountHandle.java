package com.flagship.lending_ledger.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * A resolved reference to a configured ledger account.
 */
@Value
public class AccountHandle {
    LedgerAccount role;
    String code;
    UUID accountId;
}
