package com.flagship.lending_ledger.ledger;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Minimal chart-of-accounts maintenance.
 *
 * Full chart management belongs to an administration collaborator; this
 * covers what the ledger itself needs: opening an account with its opening
 * balance and switching an account off. Only an account with a zero balance
 * can be switched off.
 */
@Service
public class AccountService {

    private final AccountRepository accountRepository;

    public AccountService(AccountRepository accountRepository) {
        this.accountRepository = accountRepository;
    }

    @Transactional
    public UUID createAccount(String code, String name, AccountType accountType) {
        return createAccount(code, name, accountType, defaultSide(accountType), BigDecimal.ZERO);
    }

    @Transactional
    public UUID createAccount(String code, String name, AccountType accountType,
                              BalanceSide normalBalance, BigDecimal openingBalance) {
        return accountRepository.insert(code, name, accountType, normalBalance, null, false, openingBalance);
    }

    @Transactional
    public UUID createHeaderAccount(String code, String name, AccountType accountType) {
        return accountRepository.insert(code, name, accountType, defaultSide(accountType), null, true, BigDecimal.ZERO);
    }

    @Transactional
    public LedgerResult<Account> deactivate(String code) {
        Optional<Account> found = accountRepository.findByCodeForUpdate(code);
        if (found.isEmpty()) {
            return LedgerResult.failure(LedgerErrorKind.NOT_FOUND, "Account not found: " + code);
        }
        Account account = found.get();
        if (account.getCurrentBalance().signum() != 0) {
            return LedgerResult.failure(LedgerErrorKind.INVALID_STATUS,
                "Account " + code + " still holds a balance of " + account.getCurrentBalance(),
                Map.of("accountCode", code, "balance", account.getCurrentBalance()));
        }
        accountRepository.setActive(code, false);
        return LedgerResult.ok(accountRepository.findByCode(code).orElseThrow());
    }

    @Transactional(readOnly = true)
    public Optional<Account> findByCode(String code) {
        return accountRepository.findByCode(code);
    }

    static BalanceSide defaultSide(AccountType accountType) {
        return switch (accountType) {
            case ASSET, EXPENSE -> BalanceSide.DEBIT;
            case LIABILITY, EQUITY, INCOME -> BalanceSide.CREDIT;
        };
    }
}
