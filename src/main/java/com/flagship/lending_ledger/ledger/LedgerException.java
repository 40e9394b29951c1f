package com.flagship.lending_ledger.ledger;

import lombok.Getter;

/**
 * Unchecked wrapper for a {@link LedgerError}.
 *
 * Raised for configuration failures at startup and by {@link LedgerResult#getOrThrow()}.
 * Ordinary business rejections travel as {@link LedgerResult} values instead.
 */
@Getter
public class LedgerException extends RuntimeException {

    private final LedgerError error;

    public LedgerException(LedgerError error) {
        super(error.getMessage());
        this.error = error;
    }

    public LedgerErrorKind getKind() {
        return error.getKind();
    }
}
