package com.flagship.lending_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * An account in the chart of accounts.
 *
 * Header accounts group children for reporting and never receive postings.
 * {@code currentBalance} is the cached running balance maintained by the
 * posting engine; it always equals opening balance plus posted activity.
 */
@Value
public class Account {
    UUID id;
    String code;
    String name;
    AccountType accountType;
    BalanceSide normalBalance;
    String parentCode;
    boolean active;
    boolean header;
    BigDecimal openingBalance;
    BigDecimal currentBalance;

    public boolean isPostable() {
        return active && !header;
    }
}
