package com.flagship.lending_ledger.ledger;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to journal entries and lines.
 *
 * Lines are insert-only. The only updates on an entry are the posting
 * transition and the single reversal link, both guarded by triggers.
 */
@Repository
public class JournalRepository {

    private static final String SELECT_ENTRY =
        "SELECT id, entry_number, entry_date, entry_type, description, status, total_debit, total_credit, " +
        "source_module, source_type, source_id, external_reference, is_reversed, reversal_entry_id, " +
        "reverses_entry_id, reversal_reason, created_by, approved_by, created_at, posted_at " +
        "FROM journal_entries ";

    private final JdbcTemplate jdbcTemplate;

    public JournalRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insertEntry(UUID entryId, String entryNumber, JournalEntryRequest request,
                            JournalStatus status, String createdBy) {
        jdbcTemplate.update(
            "INSERT INTO journal_entries (id, entry_number, entry_date, entry_type, description, status, " +
            "total_debit, total_credit, source_module, source_type, source_id, external_reference, " +
            "reverses_entry_id, created_by, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            entryId,
            entryNumber,
            request.getEntryDate(),
            request.getEntryType().name(),
            request.getDescription(),
            status.name(),
            request.getDebitTotal(),
            request.getCreditTotal(),
            request.getSourceModule(),
            request.getSourceType(),
            request.getSourceId(),
            request.getExternalReference(),
            request.getReversesEntryId(),
            createdBy
        );
    }

    public void insertLines(UUID entryId, List<JournalEntryRequest.Line> lines, Map<String, Account> accountsByCode) {
        List<Object[]> batch = new ArrayList<>(lines.size());
        int lineNumber = 1;
        for (JournalEntryRequest.Line line : lines) {
            batch.add(new Object[] {
                UUID.randomUUID(),
                entryId,
                lineNumber++,
                accountsByCode.get(line.getAccountCode()).getId(),
                line.getDebit(),
                line.getCredit(),
                line.getDescription(),
                line.getCustomerId(),
                line.getReferenceType(),
                line.getReferenceId()
            });
        }
        jdbcTemplate.batchUpdate(
            "INSERT INTO journal_lines (id, journal_entry_id, line_number, account_id, debit_amount, " +
            "credit_amount, description, customer_id, reference_type, reference_id) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            batch);
    }

    public Optional<JournalEntry> findById(UUID entryId) {
        return findHeader(SELECT_ENTRY + "WHERE id = ?", entryId).map(this::withLines);
    }

    /**
     * Loads an entry while holding a row lock until the surrounding transaction ends.
     */
    public Optional<JournalEntry> lockById(UUID entryId) {
        return findHeader(SELECT_ENTRY + "WHERE id = ? FOR UPDATE", entryId).map(this::withLines);
    }

    public Optional<UUID> findIdByExternalReference(String externalReference) {
        List<UUID> ids = jdbcTemplate.query(
            "SELECT id FROM journal_entries WHERE external_reference = ?",
            (rs, rowNum) -> rs.getObject("id", UUID.class),
            externalReference);
        return ids.stream().findFirst();
    }

    public List<JournalEntry> findBySource(String sourceType, String sourceId) {
        return jdbcTemplate.query(
            SELECT_ENTRY + "WHERE source_type = ? AND source_id = ? ORDER BY created_at, entry_number",
            entryRowMapper(), sourceType, sourceId);
    }

    public List<JournalLine> findLines(UUID entryId) {
        return jdbcTemplate.query(
            "SELECT l.id, l.journal_entry_id, l.line_number, l.account_id, a.code, l.debit_amount, " +
            "l.credit_amount, l.description, l.customer_id, l.reference_type, l.reference_id " +
            "FROM journal_lines l JOIN accounts a ON a.id = l.account_id " +
            "WHERE l.journal_entry_id = ? ORDER BY l.line_number",
            lineRowMapper(), entryId);
    }

    public void updateStatus(UUID entryId, JournalStatus status) {
        jdbcTemplate.update("UPDATE journal_entries SET status = ? WHERE id = ?", status.name(), entryId);
    }

    public void markPosted(UUID entryId, String approvedBy, Instant postedAt) {
        jdbcTemplate.update(
            "UPDATE journal_entries SET status = ?, approved_by = ?, posted_at = ? WHERE id = ?",
            JournalStatus.POSTED.name(), approvedBy, Timestamp.from(postedAt), entryId);
    }

    public void markReversed(UUID entryId, UUID reversalEntryId, String reason, Instant reversedAt) {
        jdbcTemplate.update(
            "UPDATE journal_entries SET is_reversed = TRUE, reversal_entry_id = ?, reversal_reason = ?, " +
            "reversed_at = ? WHERE id = ?",
            reversalEntryId, reason, Timestamp.from(reversedAt), entryId);
    }

    /**
     * Counts DRAFT and PENDING_APPROVAL entries dated within the given range.
     */
    public long countUnposted(LocalDate from, LocalDate to) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM journal_entries WHERE status IN ('DRAFT', 'PENDING_APPROVAL') " +
            "AND entry_date BETWEEN ? AND ?",
            Long.class, from, to);
        return count != null ? count : 0L;
    }

    private Optional<JournalEntry> findHeader(String sql, UUID entryId) {
        return jdbcTemplate.query(sql, entryRowMapper(), entryId).stream().findFirst();
    }

    private JournalEntry withLines(JournalEntry entry) {
        return entry.withLines(findLines(entry.getId()));
    }

    private RowMapper<JournalEntry> entryRowMapper() {
        return (rs, rowNum) -> {
            Timestamp postedAt = rs.getTimestamp("posted_at");
            return new JournalEntry(
                rs.getObject("id", UUID.class),
                rs.getString("entry_number"),
                rs.getObject("entry_date", LocalDate.class),
                EntryType.valueOf(rs.getString("entry_type")),
                rs.getString("description"),
                JournalStatus.valueOf(rs.getString("status")),
                rs.getBigDecimal("total_debit"),
                rs.getBigDecimal("total_credit"),
                rs.getString("source_module"),
                rs.getString("source_type"),
                rs.getString("source_id"),
                rs.getString("external_reference"),
                rs.getBoolean("is_reversed"),
                rs.getObject("reversal_entry_id", UUID.class),
                rs.getObject("reverses_entry_id", UUID.class),
                rs.getString("reversal_reason"),
                rs.getString("created_by"),
                rs.getString("approved_by"),
                rs.getTimestamp("created_at").toInstant(),
                postedAt != null ? postedAt.toInstant() : null,
                List.of()
            );
        };
    }

    private RowMapper<JournalLine> lineRowMapper() {
        return (rs, rowNum) -> new JournalLine(
            rs.getObject("id", UUID.class),
            rs.getObject("journal_entry_id", UUID.class),
            rs.getInt("line_number"),
            rs.getObject("account_id", UUID.class),
            rs.getString("code"),
            rs.getBigDecimal("debit_amount"),
            rs.getBigDecimal("credit_amount"),
            rs.getString("description"),
            rs.getString("customer_id"),
            rs.getString("reference_type"),
            rs.getString("reference_id")
        );
    }
}
