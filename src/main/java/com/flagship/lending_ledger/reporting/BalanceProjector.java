package com.flagship.lending_ledger.reporting;

import com.flagship.lending_ledger.ledger.Account;
import com.flagship.lending_ledger.ledger.AccountRepository;
import com.flagship.lending_ledger.ledger.AccountType;
import com.flagship.lending_ledger.ledger.BalanceSide;
import com.flagship.lending_ledger.ledger.LedgerErrorKind;
import com.flagship.lending_ledger.ledger.LedgerResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read side of the ledger: balances, trial balance and account ledgers
 * recomputed from posted journal lines.
 *
 * Only POSTED entries count. Every signed amount goes through
 * {@link BalanceSide#delta}, the same rule the posting engine uses, which
 * makes the replayed balance a correctness oracle for the cached one.
 * Multi-query reads run at REPEATABLE READ so they see one snapshot.
 */
@Service
@Slf4j
public class BalanceProjector {

    private static final String POSTED_LINES_UP_TO =
        "(journal_lines l JOIN journal_entries e ON e.id = l.journal_entry_id " +
        "AND e.status = 'POSTED' AND e.entry_date <= ?) ON l.account_id = a.id ";

    private static final String ALL_POSTED_LINES =
        "(journal_lines l JOIN journal_entries e ON e.id = l.journal_entry_id " +
        "AND e.status = 'POSTED') ON l.account_id = a.id ";

    private static final String CACHE_CHECK_SELECT =
        "SELECT a.id, a.code, a.normal_balance, a.opening_balance, a.current_balance, " +
        "COALESCE(SUM(l.debit_amount), 0) AS debits, COALESCE(SUM(l.credit_amount), 0) AS credits " +
        "FROM accounts a LEFT JOIN " + ALL_POSTED_LINES;

    private static final String CACHE_CHECK_GROUP =
        "GROUP BY a.id, a.code, a.normal_balance, a.opening_balance, a.current_balance ORDER BY a.code";

    private final JdbcTemplate jdbcTemplate;
    private final AccountRepository accountRepository;

    public BalanceProjector(JdbcTemplate jdbcTemplate, AccountRepository accountRepository) {
        this.jdbcTemplate = jdbcTemplate;
        this.accountRepository = accountRepository;
    }

    /**
     * Opening balance plus posted activity dated on or before {@code asOfDate};
     * all posted activity when {@code asOfDate} is null.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public LedgerResult<AccountBalance> getAccountBalance(UUID accountId, LocalDate asOfDate) {
        Optional<Account> found = accountRepository.findById(accountId);
        if (found.isEmpty()) {
            return LedgerResult.failure(LedgerErrorKind.NOT_FOUND, "Account not found: " + accountId);
        }
        Account account = found.get();

        String sql = "SELECT COALESCE(SUM(l.debit_amount), 0) AS debits, COALESCE(SUM(l.credit_amount), 0) AS credits " +
            "FROM journal_lines l JOIN journal_entries e ON e.id = l.journal_entry_id " +
            "WHERE l.account_id = ? AND e.status = 'POSTED'" +
            (asOfDate != null ? " AND e.entry_date <= ?" : "");
        Object[] args = asOfDate != null ? new Object[] {accountId, asOfDate} : new Object[] {accountId};

        BigDecimal[] totals = jdbcTemplate.queryForObject(sql,
            (rs, rowNum) -> new BigDecimal[] {rs.getBigDecimal("debits"), rs.getBigDecimal("credits")}, args);

        BigDecimal balance = account.getOpeningBalance()
            .add(account.getNormalBalance().delta(totals[0], totals[1]));
        return LedgerResult.ok(new AccountBalance(account.getId(), account.getCode(), account.getName(), asOfDate,
            account.getOpeningBalance(), totals[0], totals[1], balance));
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public LedgerResult<BalanceCheck> verifyCachedBalance(UUID accountId) {
        List<BalanceCheck> checks = jdbcTemplate.query(
            CACHE_CHECK_SELECT + "WHERE a.id = ? " + CACHE_CHECK_GROUP,
            (rs, rowNum) -> toBalanceCheck(rs), accountId);
        if (checks.isEmpty()) {
            return LedgerResult.failure(LedgerErrorKind.NOT_FOUND, "Account not found: " + accountId);
        }
        return LedgerResult.ok(checks.get(0));
    }

    /**
     * Accounts whose cached balance disagrees with the replayed one. Empty on a healthy ledger.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public List<BalanceCheck> findDriftedAccounts() {
        List<BalanceCheck> drifted = jdbcTemplate.query(CACHE_CHECK_SELECT + CACHE_CHECK_GROUP,
                (rs, rowNum) -> toBalanceCheck(rs))
            .stream()
            .filter(check -> !check.isConsistent())
            .toList();
        if (!drifted.isEmpty()) {
            log.error("Cached balances drifted from ledger history on {} accounts: {}", drifted.size(), drifted);
        }
        return drifted;
    }

    /**
     * Trial balance over non-header accounts as of a date.
     *
     * An account switched off after the date still held its balance then, so
     * inactive accounts are listed whenever their balance as of the date is
     * non-zero. Only zero-balance accounts can be switched off, so for the
     * current date this is the set of active accounts.
     *
     * Each balance is shown on the account's normal side; a contra balance
     * (negative on its normal side) moves to the opposite column. Zero
     * balances are omitted. Rows are ordered by account code.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public TrialBalance generateTrialBalance(LocalDate asOfDate) {
        List<TrialBalanceRow> rows = new ArrayList<>();
        jdbcTemplate.query(
            "SELECT a.code, a.name, a.account_type, a.normal_balance, a.opening_balance, " +
            "COALESCE(SUM(l.debit_amount), 0) AS debits, COALESCE(SUM(l.credit_amount), 0) AS credits " +
            "FROM accounts a LEFT JOIN " + POSTED_LINES_UP_TO +
            "WHERE a.is_header = FALSE " +
            "GROUP BY a.code, a.name, a.account_type, a.normal_balance, a.opening_balance " +
            "ORDER BY a.code",
            rs -> {
                BalanceSide side = BalanceSide.valueOf(rs.getString("normal_balance"));
                BigDecimal balance = rs.getBigDecimal("opening_balance")
                    .add(side.delta(rs.getBigDecimal("debits"), rs.getBigDecimal("credits")));
                toTrialBalanceRow(rs.getString("code"), rs.getString("name"),
                    AccountType.valueOf(rs.getString("account_type")), side, balance)
                    .ifPresent(rows::add);
            },
            asOfDate);

        BigDecimal totalDebit = rows.stream().map(TrialBalanceRow::getDebit).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal totalCredit = rows.stream().map(TrialBalanceRow::getCredit).reduce(BigDecimal.ZERO, BigDecimal::add);

        if (totalDebit.compareTo(totalCredit) != 0) {
            log.error("Trial balance as of {} does not balance: debits={}, credits={}", asOfDate, totalDebit, totalCredit);
        }
        return new TrialBalance(asOfDate, List.copyOf(rows), totalDebit, totalCredit);
    }

    /**
     * Posted lines of one account dated within [startDate, endDate] with running balances.
     * The opening balance covers everything dated before {@code startDate}.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public LedgerResult<AccountLedger> getLedger(UUID accountId, LocalDate startDate, LocalDate endDate) {
        if (startDate.isAfter(endDate)) {
            return LedgerResult.failure(LedgerErrorKind.INVALID_LINE,
                "Ledger start date " + startDate + " is after end date " + endDate);
        }
        LedgerResult<AccountBalance> opening = getAccountBalance(accountId, startDate.minusDays(1));
        if (opening.isFailure()) {
            return LedgerResult.failure(opening.getError());
        }
        Account account = accountRepository.findById(accountId).orElseThrow();
        BalanceSide side = account.getNormalBalance();

        List<LedgerLine> lines = new ArrayList<>();
        BigDecimal[] running = {opening.getValue().getBalance()};
        jdbcTemplate.query(
            "SELECT e.id, e.entry_number, e.entry_date, COALESCE(l.description, e.description) AS description, " +
            "l.debit_amount, l.credit_amount " +
            "FROM journal_lines l JOIN journal_entries e ON e.id = l.journal_entry_id " +
            "WHERE l.account_id = ? AND e.status = 'POSTED' AND e.entry_date BETWEEN ? AND ? " +
            "ORDER BY e.entry_date, e.posted_at, e.entry_number, l.line_number",
            rs -> {
                BigDecimal debit = rs.getBigDecimal("debit_amount");
                BigDecimal credit = rs.getBigDecimal("credit_amount");
                running[0] = running[0].add(side.delta(debit, credit));
                lines.add(new LedgerLine(
                    rs.getObject("id", UUID.class),
                    rs.getString("entry_number"),
                    rs.getObject("entry_date", LocalDate.class),
                    rs.getString("description"),
                    debit,
                    credit,
                    running[0]));
            },
            accountId, startDate, endDate);

        return LedgerResult.ok(new AccountLedger(account.getId(), account.getCode(), account.getName(),
            account.getAccountType(), side, startDate, endDate, opening.getValue().getBalance(),
            List.copyOf(lines), running[0]));
    }

    /**
     * Places a signed balance in the trial balance column for its side.
     */
    static Optional<TrialBalanceRow> toTrialBalanceRow(String code, String name, AccountType type,
                                                      BalanceSide side, BigDecimal balance) {
        if (balance.signum() == 0) {
            return Optional.empty();
        }
        BalanceSide column = balance.signum() > 0 ? side : side.opposite();
        BigDecimal amount = balance.abs();
        return Optional.of(column == BalanceSide.DEBIT
            ? new TrialBalanceRow(code, name, type, amount, BigDecimal.ZERO)
            : new TrialBalanceRow(code, name, type, BigDecimal.ZERO, amount));
    }

    private static BalanceCheck toBalanceCheck(ResultSet rs) throws SQLException {
        BalanceSide side = BalanceSide.valueOf(rs.getString("normal_balance"));
        BigDecimal replayed = rs.getBigDecimal("opening_balance")
            .add(side.delta(rs.getBigDecimal("debits"), rs.getBigDecimal("credits")));
        return new BalanceCheck(rs.getObject("id", UUID.class), rs.getString("code"),
            rs.getBigDecimal("current_balance"), replayed);
    }
}
