package com.flagship.lending_ledger.ledger;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * JDBC access to the chart of accounts.
 *
 * Balance changes are applied as SQL increments so concurrent postings to the
 * same account never overwrite each other.
 */
@Repository
public class AccountRepository {

    private static final String SELECT_ACCOUNT =
        "SELECT id, code, name, account_type, normal_balance, parent_code, is_active, is_header, " +
        "opening_balance, current_balance FROM accounts ";

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;

    public AccountRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
    }

    public UUID insert(String code, String name, AccountType accountType, BalanceSide normalBalance,
                       String parentCode, boolean header, BigDecimal openingBalance) {
        UUID accountId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO accounts (id, code, name, account_type, normal_balance, parent_code, is_header, " +
            "opening_balance, current_balance) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
            accountId, code, name, accountType.name(), normalBalance.name(), parentCode, header,
            openingBalance, openingBalance
        );
        return accountId;
    }

    public Optional<Account> findById(UUID accountId) {
        List<Account> accounts = jdbcTemplate.query(SELECT_ACCOUNT + "WHERE id = ?", accountRowMapper(), accountId);
        return accounts.stream().findFirst();
    }

    public Optional<Account> findByCode(String code) {
        List<Account> accounts = jdbcTemplate.query(SELECT_ACCOUNT + "WHERE code = ?", accountRowMapper(), code);
        return accounts.stream().findFirst();
    }

    public Optional<Account> findByCodeForUpdate(String code) {
        List<Account> accounts = jdbcTemplate.query(SELECT_ACCOUNT + "WHERE code = ? FOR UPDATE", accountRowMapper(), code);
        return accounts.stream().findFirst();
    }

    public Map<String, Account> findByCodes(Collection<String> codes) {
        if (codes.isEmpty()) {
            return Map.of();
        }
        return namedJdbcTemplate.query(
                SELECT_ACCOUNT + "WHERE code IN (:codes)",
                new MapSqlParameterSource("codes", codes),
                accountRowMapper())
            .stream()
            .collect(Collectors.toMap(Account::getCode, Function.identity()));
    }

    /**
     * Active, postable accounts ordered by code.
     */
    public List<Account> findPostable() {
        return jdbcTemplate.query(
            SELECT_ACCOUNT + "WHERE is_active = TRUE AND is_header = FALSE ORDER BY code",
            accountRowMapper());
    }

    public void applyDelta(UUID accountId, BigDecimal delta) {
        int updated = jdbcTemplate.update(
            "UPDATE accounts SET current_balance = current_balance + ? WHERE id = ?",
            delta, accountId);
        if (updated != 1) {
            throw new IllegalStateException("Account not found while applying balance: " + accountId);
        }
    }

    public void setActive(String code, boolean active) {
        jdbcTemplate.update("UPDATE accounts SET is_active = ? WHERE code = ?", active, code);
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            rs.getObject("id", UUID.class),
            rs.getString("code"),
            rs.getString("name"),
            AccountType.valueOf(rs.getString("account_type")),
            BalanceSide.valueOf(rs.getString("normal_balance")),
            rs.getString("parent_code"),
            rs.getBoolean("is_active"),
            rs.getBoolean("is_header"),
            rs.getBigDecimal("opening_balance"),
            rs.getBigDecimal("current_balance")
        );
    }
}
