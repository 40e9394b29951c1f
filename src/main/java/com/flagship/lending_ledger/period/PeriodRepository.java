package com.flagship.lending_ledger.period;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;

/**
 * JDBC access to financial periods.
 *
 * Posting takes a shared lock on the period row, closing takes an exclusive
 * one. A close therefore waits for in-flight postings into the month, and a
 * posting that starts after the close sees the new status.
 */
@Repository
public class PeriodRepository {

    private static final String SELECT_PERIOD =
        "SELECT year, month, start_date, end_date, status, closed_by, closed_at, closing_notes " +
        "FROM financial_periods WHERE year = ? AND month = ?";

    private final JdbcTemplate jdbcTemplate;

    public PeriodRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void ensureExists(YearMonth yearMonth) {
        jdbcTemplate.update(
            "INSERT INTO financial_periods (year, month, start_date, end_date, status) " +
            "VALUES (?, ?, ?, ?, 'OPEN') ON CONFLICT (year, month) DO NOTHING",
            yearMonth.getYear(), yearMonth.getMonthValue(), yearMonth.atDay(1), yearMonth.atEndOfMonth());
    }

    public Optional<FinancialPeriod> find(YearMonth yearMonth) {
        return query(SELECT_PERIOD, yearMonth);
    }

    public Optional<FinancialPeriod> lockShared(YearMonth yearMonth) {
        return query(SELECT_PERIOD + " FOR SHARE", yearMonth);
    }

    public Optional<FinancialPeriod> lockForUpdate(YearMonth yearMonth) {
        return query(SELECT_PERIOD + " FOR UPDATE", yearMonth);
    }

    public void update(FinancialPeriod period) {
        jdbcTemplate.update(
            "UPDATE financial_periods SET status = ?, closed_by = ?, closed_at = ?, closing_notes = ? " +
            "WHERE year = ? AND month = ?",
            period.getStatus().name(),
            period.getClosedBy(),
            period.getClosedAt() != null ? Timestamp.from(period.getClosedAt()) : null,
            period.getClosingNotes(),
            period.getYear(),
            period.getMonth());
    }

    private Optional<FinancialPeriod> query(String sql, YearMonth yearMonth) {
        List<FinancialPeriod> periods = jdbcTemplate.query(sql, periodRowMapper(),
            yearMonth.getYear(), yearMonth.getMonthValue());
        return periods.stream().findFirst();
    }

    private RowMapper<FinancialPeriod> periodRowMapper() {
        return (rs, rowNum) -> {
            Timestamp closedAt = rs.getTimestamp("closed_at");
            return new FinancialPeriod(
                rs.getInt("year"),
                rs.getInt("month"),
                rs.getObject("start_date", LocalDate.class),
                rs.getObject("end_date", LocalDate.class),
                PeriodStatus.valueOf(rs.getString("status")),
                rs.getString("closed_by"),
                closedAt != null ? closedAt.toInstant() : null,
                rs.getString("closing_notes")
            );
        };
    }
}
