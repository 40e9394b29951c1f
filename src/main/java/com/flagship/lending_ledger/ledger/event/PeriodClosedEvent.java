package com.flagship.lending_ledger.ledger.event;

import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a financial period moves to SOFT_CLOSE or HARD_CLOSE.
 */
@Value
public class PeriodClosedEvent implements LedgerEvent {
    UUID eventId;
    int year;
    int month;
    String status;
    String closedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PeriodClosed";
    public static final String AGGREGATE_TYPE = "FinancialPeriod";

    /**
     * Stable per month, so all events of one period share a Kafka partition.
     */
    @Override
    public UUID getAggregateId() {
        return UUID.nameUUIDFromBytes(
            String.format("period:%d-%02d", year, month).getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
