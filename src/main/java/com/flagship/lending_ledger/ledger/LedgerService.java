package com.flagship.lending_ledger.ledger;

import com.flagship.lending_ledger.period.FinancialPeriod;
import com.flagship.lending_ledger.period.PeriodControl;
import com.flagship.lending_ledger.period.PeriodStatus;
import com.flagship.lending_ledger.reporting.AccountBalance;
import com.flagship.lending_ledger.reporting.AccountLedger;
import com.flagship.lending_ledger.reporting.BalanceProjector;
import com.flagship.lending_ledger.reporting.TrialBalance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for ledger operations that stand alone: manual journals,
 * approvals, reversals and period close.
 *
 * Each call runs the posting engine in its own bounded transaction. Lending
 * workflows that must combine their own writes with a posting open the unit
 * themselves through {@link LedgerTransactionRunner} and call the engine directly.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final LedgerTransactionRunner transactionRunner;
    private final JournalPostingEngine postingEngine;
    private final PeriodControl periodControl;
    private final IdempotencyService idempotencyService;
    private final BalanceProjector balanceProjector;

    /**
     * Records an entry, posting it immediately when {@code autoPost} is set.
     *
     * A request whose external reference was already used is answered with
     * DUPLICATE_REFERENCE and the id of the entry recorded the first time.
     */
    public LedgerResult<JournalEntry> submit(ActorIdentity actor, JournalEntryRequest request, boolean autoPost) {
        String externalReference = request.getExternalReference();
        if (externalReference != null) {
            Optional<UUID> existing = idempotencyService.findEntryId(externalReference);
            if (existing.isPresent()) {
                log.info("Duplicate external reference {} maps to entry {}", externalReference, existing.get());
                return duplicateReference(externalReference, existing.get());
            }
        }

        try {
            return transactionRunner.execute(actor, context -> {
                LedgerResult<JournalEntry> result = postingEngine.submit(context, request, autoPost);
                if (result.isSuccess()) {
                    idempotencyService.remember(externalReference, result.getValue().getId());
                }
                return result;
            });
        } catch (DuplicateKeyException e) {
            // A concurrent submit with the same reference committed first
            Optional<UUID> winner = externalReference != null
                ? idempotencyService.findEntryId(externalReference)
                : Optional.empty();
            if (winner.isEmpty()) {
                throw e;
            }
            log.warn("External reference {} was taken by concurrent entry {}", externalReference, winner.get());
            return duplicateReference(externalReference, winner.get());
        }
    }

    private static LedgerResult<JournalEntry> duplicateReference(String externalReference, UUID existingEntryId) {
        return LedgerResult.failure(LedgerErrorKind.DUPLICATE_REFERENCE,
            "External reference already used: " + externalReference,
            Map.of("externalReference", externalReference, "existingEntryId", existingEntryId));
    }

    public LedgerResult<JournalEntry> createDraft(ActorIdentity actor, JournalEntryRequest request) {
        return submit(actor, request, false);
    }

    public LedgerResult<JournalEntry> submitForApproval(ActorIdentity actor, UUID entryId) {
        return transactionRunner.execute(actor, context -> postingEngine.submitForApproval(context, entryId));
    }

    public LedgerResult<JournalEntry> post(ActorIdentity approver, UUID entryId) {
        return transactionRunner.execute(approver, context -> postingEngine.post(context, entryId));
    }

    public LedgerResult<JournalEntry> reverse(ActorIdentity actor, UUID entryId, String reason, LocalDate effectiveDate) {
        return transactionRunner.execute(actor, context -> postingEngine.reverse(context, entryId, reason, effectiveDate));
    }

    public LedgerResult<FinancialPeriod> closePeriod(ActorIdentity actor, int year, int month,
                                                     PeriodStatus closeType, String notes) {
        return transactionRunner.execute(actor, context -> periodControl.closePeriod(context, year, month, closeType, notes));
    }

    @Transactional(readOnly = true)
    public Optional<JournalEntry> findEntry(UUID entryId) {
        return postingEngine.findEntry(entryId);
    }

    @Transactional(readOnly = true)
    public FinancialPeriod getPeriod(int year, int month) {
        return periodControl.getPeriod(year, month);
    }

    public LedgerResult<AccountBalance> getAccountBalance(UUID accountId, LocalDate asOfDate) {
        return balanceProjector.getAccountBalance(accountId, asOfDate);
    }

    public TrialBalance generateTrialBalance(LocalDate asOfDate) {
        return balanceProjector.generateTrialBalance(asOfDate);
    }

    public LedgerResult<AccountLedger> getLedger(UUID accountId, LocalDate startDate, LocalDate endDate) {
        return balanceProjector.getLedger(accountId, startDate, endDate);
    }
}
