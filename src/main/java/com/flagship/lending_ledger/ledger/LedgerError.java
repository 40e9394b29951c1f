package com.flagship.lending_ledger.ledger;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An expected failure of a ledger operation.
 *
 * Details carry the structured facts behind the message (totals, offending
 * account codes, counts) so callers never have to parse text.
 */
@Value
public class LedgerError {
    LedgerErrorKind kind;
    String message;
    Map<String, Object> details;

    public static LedgerError of(LedgerErrorKind kind, String message) {
        return new LedgerError(kind, message, Collections.emptyMap());
    }

    public static LedgerError of(LedgerErrorKind kind, String message, Map<String, Object> details) {
        return new LedgerError(kind, message, Collections.unmodifiableMap(new LinkedHashMap<>(details)));
    }

    public Object detail(String key) {
        return details.get(key);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
