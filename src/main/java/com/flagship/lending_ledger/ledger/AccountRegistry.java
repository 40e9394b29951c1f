package com.flagship.lending_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves configured account codes into {@link AccountHandle}s once.
 *
 * Resolution fails with CONFIG_ERROR when any configured code is missing,
 * inactive or a header account. With {@code ledger.accounts.verify-on-startup}
 * the application refuses to start in that case; otherwise the first
 * {@link #require} call raises it.
 */
@Component
@Slf4j
public class AccountRegistry implements ApplicationRunner {

    private final AccountRepository accountRepository;
    private final LedgerAccountsProperties properties;

    private volatile Map<LedgerAccount, AccountHandle> handles;

    public AccountRegistry(AccountRepository accountRepository, LedgerAccountsProperties properties) {
        this.accountRepository = accountRepository;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (properties.isVerifyOnStartup()) {
            resolve();
        }
    }

    public AccountHandle require(LedgerAccount account) {
        Map<LedgerAccount, AccountHandle> resolved = handles;
        if (resolved == null) {
            resolved = resolve();
        }
        return resolved.get(account);
    }

    public String code(LedgerAccount account) {
        return require(account).getCode();
    }

    public boolean isResolved() {
        return handles != null;
    }

    /**
     * Loads every configured code and caches the handles.
     *
     * @throws LedgerException with CONFIG_ERROR listing each unusable role
     */
    public synchronized Map<LedgerAccount, AccountHandle> resolve() {
        if (handles != null) {
            return handles;
        }
        Map<String, Account> accounts = accountRepository.findByCodes(
            Arrays.stream(LedgerAccount.values()).map(properties::codeFor).distinct().toList());

        Map<LedgerAccount, AccountHandle> resolved = new EnumMap<>(LedgerAccount.class);
        List<String> problems = new ArrayList<>();
        for (LedgerAccount role : LedgerAccount.values()) {
            String code = properties.codeFor(role);
            Account account = accounts.get(code);
            if (account == null) {
                problems.add(role + "=" + code + " (missing)");
            } else if (!account.isPostable()) {
                problems.add(role + "=" + code + (account.isHeader() ? " (header)" : " (inactive)"));
            } else {
                resolved.put(role, new AccountHandle(role, code, account.getId()));
            }
        }

        if (!problems.isEmpty()) {
            throw new LedgerException(LedgerError.of(LedgerErrorKind.CONFIG_ERROR,
                "Configured ledger accounts are not usable: " + String.join(", ", problems),
                Map.of("accounts", List.copyOf(problems))));
        }

        handles = Collections.unmodifiableMap(resolved);
        log.info("Resolved {} configured ledger accounts", handles.size());
        return handles;
    }
}
