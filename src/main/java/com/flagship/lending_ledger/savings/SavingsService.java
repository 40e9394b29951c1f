package com.flagship.lending_ledger.savings;

import com.flagship.lending_ledger.ledger.AccountRegistry;
import com.flagship.lending_ledger.ledger.ActorIdentity;
import com.flagship.lending_ledger.ledger.JournalEntry;
import com.flagship.lending_ledger.ledger.JournalEntryRequest;
import com.flagship.lending_ledger.ledger.JournalPostingEngine;
import com.flagship.lending_ledger.ledger.LedgerAccount;
import com.flagship.lending_ledger.ledger.LedgerContext;
import com.flagship.lending_ledger.ledger.LedgerErrorKind;
import com.flagship.lending_ledger.ledger.LedgerResult;
import com.flagship.lending_ledger.ledger.LedgerTransactionRunner;
import com.flagship.lending_ledger.ledger.ReferenceGenerator;
import com.flagship.lending_ledger.ledger.ReferenceType;
import com.flagship.lending_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Savings deposits, withdrawals and monthly interest.
 *
 * The customer balance lives on the savings account row; the bank-side total
 * lives in the savings liability ledger account. Both change in the same unit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SavingsService {

    static final String SOURCE_MODULE = "SAVINGS";

    private static final BigDecimal MONTHLY_RATE_DIVISOR = new BigDecimal("1200");

    private final LedgerTransactionRunner transactionRunner;
    private final JournalPostingEngine postingEngine;
    private final AccountRegistry accountRegistry;
    private final ReferenceGenerator referenceGenerator;
    private final SavingsAccountRepository accountRepository;
    private final SavingsTransactionRepository transactionRepository;
    private final LedgerMetrics ledgerMetrics;

    public LedgerResult<SavingsAccount> openAccount(ActorIdentity actor, String customerId, BigDecimal minimumBalance) {
        return openAccount(actor, customerId, minimumBalance, BigDecimal.ZERO);
    }

    /**
     * @param interestRate yearly rate in percent credited monthly; zero for none
     */
    public LedgerResult<SavingsAccount> openAccount(ActorIdentity actor, String customerId, BigDecimal minimumBalance,
                                                    BigDecimal interestRate) {
        if (customerId == null || customerId.isBlank()) {
            return LedgerResult.failure(LedgerErrorKind.INVALID_LINE, "Customer id is required");
        }
        BigDecimal minimum = minimumBalance != null ? minimumBalance : BigDecimal.ZERO;
        if (minimum.signum() < 0) {
            return LedgerResult.failure(LedgerErrorKind.INVALID_AMOUNT, "Minimum balance must not be negative: " + minimum);
        }
        BigDecimal rate = interestRate != null ? interestRate : BigDecimal.ZERO;
        if (rate.signum() < 0) {
            return LedgerResult.failure(LedgerErrorKind.INVALID_AMOUNT, "Interest rate must not be negative: " + rate);
        }

        return transactionRunner.execute(actor, context -> {
            String accountNumber = referenceGenerator.next(ReferenceType.SAVINGS_ACCOUNT, context.getBusinessDate());
            SavingsAccountEntity saved = accountRepository.save(SavingsAccountEntity.open(accountNumber, customerId, minimum,
                rate, context.getBusinessDate()));
            ledgerMetrics.recordOperation("savings.opened");
            log.info("Opened savings account {} for customer {}", accountNumber, customerId);
            return LedgerResult.ok(saved.toDomain());
        });
    }

    /**
     * Debit cash, credit savings liability.
     */
    public LedgerResult<SavingsTransaction> deposit(ActorIdentity actor, UUID savingsAccountId, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            return LedgerResult.failure(LedgerErrorKind.INVALID_AMOUNT, "Deposit amount must be positive: " + amount);
        }
        return transactionRunner.execute(actor, context -> {
            Optional<SavingsAccountEntity> found = lockActive(savingsAccountId);
            if (found.isEmpty()) {
                return accountUnavailable(savingsAccountId);
            }
            SavingsAccountEntity account = found.get();

            return record(context, context.getBusinessDate(), account, SavingsTransactionType.DEPOSIT, amount,
                JournalEntryRequest.Line.debit(accountRegistry.code(LedgerAccount.CASH_BANK), amount,
                    "Cash received"),
                JournalEntryRequest.Line.credit(accountRegistry.code(LedgerAccount.SAVINGS_LIABILITY), amount,
                    "Deposit to " + account.getAccountNumber()).withCustomer(account.getCustomerId()));
        });
    }

    /**
     * Debit savings liability, credit cash. Fails with INSUFFICIENT_BALANCE
     * when the amount exceeds the balance or would leave less than the
     * account's minimum balance.
     */
    public LedgerResult<SavingsTransaction> withdraw(ActorIdentity actor, UUID savingsAccountId, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            return LedgerResult.failure(LedgerErrorKind.INVALID_AMOUNT, "Withdrawal amount must be positive: " + amount);
        }
        return transactionRunner.execute(actor, context -> {
            Optional<SavingsAccountEntity> found = lockActive(savingsAccountId);
            if (found.isEmpty()) {
                return accountUnavailable(savingsAccountId);
            }
            SavingsAccountEntity account = found.get();

            BigDecimal available = account.toDomain().getAvailableBalance();
            if (amount.compareTo(available) > 0) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("requested", amount);
                details.put("balance", account.getCurrentBalance());
                details.put("minimumBalance", account.getMinimumBalance());
                details.put("available", available);
                return LedgerResult.failure(LedgerErrorKind.INSUFFICIENT_BALANCE,
                    String.format("Withdrawal of %s exceeds available balance %s on %s",
                        amount, available, account.getAccountNumber()),
                    details);
            }

            return record(context, context.getBusinessDate(), account, SavingsTransactionType.WITHDRAWAL, amount,
                JournalEntryRequest.Line.debit(accountRegistry.code(LedgerAccount.SAVINGS_LIABILITY), amount,
                    "Withdrawal from " + account.getAccountNumber()).withCustomer(account.getCustomerId()),
                JournalEntryRequest.Line.credit(accountRegistry.code(LedgerAccount.CASH_BANK), amount,
                    "Cash paid out"));
        });
    }

    /**
     * Credits one month of interest, {@code balance × rate / 12}, for the month
     * before {@code processDate}: debit savings interest expense, credit savings
     * liability. An account already credited for that month is left alone and
     * a zero amount only records the month as done.
     *
     * @return the interest credited
     */
    public LedgerResult<BigDecimal> creditMonthlyInterest(ActorIdentity actor, UUID savingsAccountId,
                                                          LocalDate processDate) {
        LocalDate monthStart = processDate.withDayOfMonth(1);
        YearMonth interestMonth = YearMonth.from(processDate).minusMonths(1);
        return transactionRunner.execute(actor, context -> {
            Optional<SavingsAccountEntity> found = lockActive(savingsAccountId);
            if (found.isEmpty()) {
                return accountUnavailable(savingsAccountId);
            }
            SavingsAccountEntity account = found.get();
            if (!account.isDueForInterest(monthStart)) {
                log.debug("Savings account {} has no interest due for {}", account.getAccountNumber(), interestMonth);
                return LedgerResult.ok(BigDecimal.ZERO);
            }

            BigDecimal interest = monthlyInterest(account.getCurrentBalance(), account.getInterestRate());
            account.markInterestCredited(processDate);
            if (interest.signum() == 0) {
                return LedgerResult.ok(interest);
            }

            return record(context, processDate, account, SavingsTransactionType.INTEREST, interest,
                JournalEntryRequest.Line.debit(accountRegistry.code(LedgerAccount.SAVINGS_INTEREST_EXPENSE), interest,
                    "Savings interest " + interestMonth),
                JournalEntryRequest.Line.credit(accountRegistry.code(LedgerAccount.SAVINGS_LIABILITY), interest,
                    "Interest to " + account.getAccountNumber()).withCustomer(account.getCustomerId()))
                .map(SavingsTransaction::getAmount);
        });
    }

    @Transactional(readOnly = true)
    public List<UUID> findDueForInterest(LocalDate processDate) {
        return accountRepository.findIdsDueForInterest(processDate.withDayOfMonth(1));
    }

    static BigDecimal monthlyInterest(BigDecimal balance, BigDecimal annualRate) {
        return balance.multiply(annualRate).divide(MONTHLY_RATE_DIVISOR, 2, RoundingMode.HALF_UP);
    }

    @Transactional(readOnly = true)
    public Optional<SavingsAccount> getAccount(UUID savingsAccountId) {
        return accountRepository.findById(savingsAccountId).map(SavingsAccountEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<SavingsTransaction> getTransactions(UUID savingsAccountId) {
        return transactionRepository.findBySavingsAccountIdOrderByProcessedAtAsc(savingsAccountId).stream()
            .map(SavingsTransactionEntity::toDomain)
            .toList();
    }

    private LedgerResult<SavingsTransaction> record(LedgerContext context, LocalDate entryDate, SavingsAccountEntity account,
                                                    SavingsTransactionType type, BigDecimal amount,
                                                    JournalEntryRequest.Line debit, JournalEntryRequest.Line credit) {
        String transactionRef = referenceGenerator.next(ReferenceType.SAVINGS_TRANSACTION, context.getBusinessDate());
        JournalEntryRequest request = JournalEntryRequest.builder()
            .entryDate(entryDate)
            .description("Savings " + type.name().toLowerCase() + " " + transactionRef)
            .sourceModule(SOURCE_MODULE)
            .sourceType("SAVINGS_" + type.name())
            .sourceId(transactionRef)
            .line(debit)
            .line(credit)
            .build();

        LedgerResult<JournalEntry> posted = postingEngine.submit(context, request, true);
        if (posted.isFailure()) {
            return LedgerResult.failure(posted.getError());
        }

        BigDecimal before = account.getCurrentBalance();
        if (type == SavingsTransactionType.WITHDRAWAL) {
            account.debit(amount, context.getNow());
        } else {
            account.credit(amount, context.getNow());
        }
        SavingsTransactionEntity saved = transactionRepository.save(SavingsTransactionEntity.record(account.getId(),
            transactionRef, type, amount, before, account.getCurrentBalance(), posted.getValue().getId(),
            context.getActorId(), context.getNow()));

        ledgerMetrics.recordOperation("savings." + type.name().toLowerCase());
        log.info("Savings {} {} on {}: amount={}, balance {} -> {}, entry={}", type, transactionRef,
            account.getAccountNumber(), amount, before, account.getCurrentBalance(), posted.getValue().getEntryNumber());
        return LedgerResult.ok(saved.toDomain());
    }

    private Optional<SavingsAccountEntity> lockActive(UUID savingsAccountId) {
        return accountRepository.findByIdForUpdate(savingsAccountId)
            .filter(account -> account.getStatus() == SavingsAccountStatus.ACTIVE);
    }

    private static <T> LedgerResult<T> accountUnavailable(UUID savingsAccountId) {
        return LedgerResult.failure(LedgerErrorKind.NOT_FOUND,
            "No active savings account with id " + savingsAccountId);
    }
}
