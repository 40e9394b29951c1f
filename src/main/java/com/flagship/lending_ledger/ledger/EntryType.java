package com.flagship.lending_ledger.ledger;

/**
 * Kind of journal entry. A REVERSAL mirrors exactly one posted STANDARD entry.
 */
public enum EntryType {
    STANDARD,
    REVERSAL
}
