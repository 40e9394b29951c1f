package com.flagship.lending_ledger.ledger;

import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of a ledger operation: either a value or a {@link LedgerError}.
 *
 * Key principles:
 * - Expected rejections (unbalanced entry, closed period, ...) are values, not exceptions
 * - A failed result inside a ledger transaction rolls that transaction back
 * - Infrastructure failures still surface as exceptions
 */
public final class LedgerResult<T> {

    private final T value;
    private final LedgerError error;

    private LedgerResult(T value, LedgerError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> LedgerResult<T> ok(T value) {
        return new LedgerResult<>(value, null);
    }

    public static <T> LedgerResult<T> failure(LedgerError error) {
        return new LedgerResult<>(null, Objects.requireNonNull(error));
    }

    public static <T> LedgerResult<T> failure(LedgerErrorKind kind, String message) {
        return failure(LedgerError.of(kind, message));
    }

    public static <T> LedgerResult<T> failure(LedgerErrorKind kind, String message, Map<String, Object> details) {
        return failure(LedgerError.of(kind, message, details));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("No value on a failed result: " + error);
        }
        return value;
    }

    public LedgerError getError() {
        if (error == null) {
            throw new IllegalStateException("No error on a successful result");
        }
        return error;
    }

    public boolean hasErrorKind(LedgerErrorKind kind) {
        return error != null && error.getKind() == kind;
    }

    public <U> LedgerResult<U> map(Function<? super T, ? extends U> mapper) {
        if (error != null) {
            return failure(error);
        }
        return ok(mapper.apply(value));
    }

    public <U> LedgerResult<U> flatMap(Function<? super T, LedgerResult<U>> mapper) {
        if (error != null) {
            return failure(error);
        }
        return mapper.apply(value);
    }

    public LedgerResult<T> onFailure(Consumer<LedgerError> action) {
        if (error != null) {
            action.accept(error);
        }
        return this;
    }

    public T getOrThrow() {
        if (error != null) {
            throw new LedgerException(error);
        }
        return value;
    }

    @Override
    public String toString() {
        return error == null ? "Ok(" + value + ")" : "Failure(" + error + ")";
    }
}
