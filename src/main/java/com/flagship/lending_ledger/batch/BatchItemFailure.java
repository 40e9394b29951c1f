package com.flagship.lending_ledger.batch;

import lombok.Value;

import java.util.UUID;

@Value
public class BatchItemFailure {
    UUID itemId;
    /** Ledger error kind, or the exception class for unexpected failures. */
    String reason;
    String message;
}
