package com.flagship.lending_ledger.ledger;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Generates reference numbers such as {@code JE20261018000042}.
 *
 * Format: prefix + yyyyMMdd of the business date + 6-digit sequence value.
 * Values come from database sequences, so a number is never handed out twice
 * even when the transaction that drew it rolls back.
 */
@Component
public class ReferenceGenerator {

    private static final DateTimeFormatter DATE_PART = DateTimeFormatter.BASIC_ISO_DATE;

    private final JdbcTemplate jdbcTemplate;

    public ReferenceGenerator(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public String next(ReferenceType type, LocalDate businessDate) {
        Long value = jdbcTemplate.queryForObject(
            "SELECT nextval('" + type.getSequenceName() + "')", Long.class);
        if (value == null) {
            throw new IllegalStateException("Sequence returned no value: " + type.getSequenceName());
        }
        return format(type, businessDate, value);
    }

    static String format(ReferenceType type, LocalDate businessDate, long value) {
        return type.getPrefix() + businessDate.format(DATE_PART) + String.format("%06d", value);
    }
}
