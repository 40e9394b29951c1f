package com.flagship.lending_ledger.ledger;

import com.flagship.lending_ledger.ledger.event.JournalEntryPostedEvent;
import com.flagship.lending_ledger.ledger.event.JournalEntryReversedEvent;
import com.flagship.lending_ledger.observability.CorrelationContext;
import com.flagship.lending_ledger.observability.LedgerMetrics;
import com.flagship.lending_ledger.outbox.OutboxService;
import com.flagship.lending_ledger.period.PeriodControl;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The only writer of journal entries and account balances.
 *
 * This engine enforces the core invariants:
 * 1. Every persisted entry balances and carries value
 * 2. Only active, non-header accounts receive lines
 * 3. Nothing is written into a hard-closed period
 * 4. Balances change only on the transition to POSTED, in the same
 *    transaction as the status change
 * 5. Posted entries are never edited; a reversal entry neutralises them
 *
 * Every operation takes a {@link LedgerContext}: it must run inside a unit
 * opened by {@link LedgerTransactionRunner}, so a workflow can combine its
 * own writes and a posting in one atomic unit. A database trigger checks the
 * balance again at commit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalPostingEngine {

    static final String REVERSAL_SOURCE_TYPE = "REVERSAL";

    private final JournalRepository journalRepository;
    private final AccountRepository accountRepository;
    private final PeriodControl periodControl;
    private final ReferenceGenerator referenceGenerator;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Validates and records an entry as DRAFT. Drafts have no balance effect.
     *
     * Validation order: period, structure (negative amounts, balance, value,
     * one-sided lines), accounts, external reference.
     */
    public LedgerResult<JournalEntry> createDraft(LedgerContext context, JournalEntryRequest request) {
        if (request.getEntryDate() == null) {
            return reject(LedgerError.of(LedgerErrorKind.INVALID_LINE, "Entry date is required"));
        }

        Optional<LedgerError> periodError = periodControl.checkOpenForPosting(request.getEntryDate());
        if (periodError.isPresent()) {
            return reject(periodError.get());
        }

        Optional<LedgerError> structureError = JournalValidator.validateStructure(request);
        if (structureError.isPresent()) {
            return reject(structureError.get());
        }

        Map<String, Account> accounts = accountRepository.findByCodes(request.getAccountCodes());
        Optional<LedgerError> accountError = JournalValidator.validateAccounts(request.getAccountCodes(), accounts);
        if (accountError.isPresent()) {
            return reject(accountError.get());
        }

        if (request.getExternalReference() != null) {
            Optional<UUID> existing = journalRepository.findIdByExternalReference(request.getExternalReference());
            if (existing.isPresent()) {
                return reject(LedgerError.of(LedgerErrorKind.DUPLICATE_REFERENCE,
                    "External reference already used: " + request.getExternalReference(),
                    Map.of("externalReference", request.getExternalReference(), "existingEntryId", existing.get())));
            }
        }

        UUID entryId = UUID.randomUUID();
        String entryNumber = referenceGenerator.next(ReferenceType.JOURNAL, context.getBusinessDate());
        journalRepository.insertEntry(entryId, entryNumber, request, JournalStatus.DRAFT, context.getActorId());
        journalRepository.insertLines(entryId, request.getLines(), accounts);
        ledgerMetrics.incrementEntriesCreated();

        log.debug("Created draft entry {} dated {} for {}", entryNumber, request.getEntryDate(), request.getDebitTotal());
        return LedgerResult.ok(load(entryId));
    }

    /**
     * DRAFT -> PENDING_APPROVAL.
     */
    public LedgerResult<JournalEntry> submitForApproval(LedgerContext context, UUID entryId) {
        Optional<JournalEntry> found = journalRepository.lockById(entryId);
        if (found.isEmpty()) {
            return reject(notFound(entryId));
        }
        JournalEntry entry = found.get();
        if (entry.getStatus() != JournalStatus.DRAFT) {
            return reject(LedgerError.of(LedgerErrorKind.INVALID_STATUS,
                String.format("Only DRAFT entries can be submitted for approval; %s is %s",
                    entry.getEntryNumber(), entry.getStatus())));
        }
        journalRepository.updateStatus(entryId, JournalStatus.PENDING_APPROVAL);
        log.info("Entry {} submitted for approval by {}", entry.getEntryNumber(), context.getActorId());
        return LedgerResult.ok(load(entryId));
    }

    /**
     * Approves and posts a DRAFT or PENDING_APPROVAL entry.
     *
     * The approver is the context actor. They must not be the entry's creator
     * and the entry total must be within their approval limit. The period is
     * checked again now, since it may have closed after the draft was created.
     */
    public LedgerResult<JournalEntry> post(LedgerContext context, UUID entryId) {
        Optional<JournalEntry> found = journalRepository.lockById(entryId);
        if (found.isEmpty()) {
            return reject(notFound(entryId));
        }
        JournalEntry entry = found.get();
        if (!entry.getStatus().canBePosted()) {
            return reject(LedgerError.of(LedgerErrorKind.INVALID_STATUS,
                String.format("Entry %s cannot be posted from %s", entry.getEntryNumber(), entry.getStatus())));
        }

        ActorIdentity approver = context.getActor();
        if (approver.getId().equals(entry.getCreatedBy())) {
            return reject(LedgerError.of(LedgerErrorKind.SELF_APPROVAL,
                "Entry " + entry.getEntryNumber() + " cannot be approved by its creator"));
        }
        if (!approver.canApprove(entry.getTotalDebit())) {
            return reject(LedgerError.of(LedgerErrorKind.APPROVAL_LIMIT_EXCEEDED,
                String.format("Entry total %s exceeds approval limit %s", entry.getTotalDebit(), approver.getApprovalLimit()),
                Map.of("amount", entry.getTotalDebit(), "approvalLimit", approver.getApprovalLimit())));
        }
        return applyPosting(context, entry);
    }

    /**
     * Records an entry and, when {@code autoPost} is set, posts it straight
     * away as a system posting through the same transition {@link #post} uses.
     */
    public LedgerResult<JournalEntry> submit(LedgerContext context, JournalEntryRequest request, boolean autoPost) {
        LedgerResult<JournalEntry> draft = createDraft(context, request);
        if (!autoPost) {
            return draft;
        }
        return draft.flatMap(entry -> applyPosting(context, entry));
    }

    /**
     * Neutralises a posted entry with a mirror entry dated {@code effectiveDate}
     * (default: the business date). Reversal entries themselves are final.
     */
    public LedgerResult<JournalEntry> reverse(LedgerContext context, UUID entryId, String reason,
                                              LocalDate effectiveDate) {
        Optional<JournalEntry> found = journalRepository.lockById(entryId);
        if (found.isEmpty()) {
            return reject(notFound(entryId));
        }
        JournalEntry original = found.get();
        if (!original.isPosted()) {
            return reject(LedgerError.of(LedgerErrorKind.NOT_POSTED,
                "Only posted entries can be reversed; " + original.getEntryNumber() + " is " + original.getStatus()));
        }
        if (original.isReversed()) {
            return reject(LedgerError.of(LedgerErrorKind.ALREADY_REVERSED,
                "Entry " + original.getEntryNumber() + " has already been reversed",
                Map.of("reversalEntryId", original.getReversalEntryId())));
        }
        if (original.isReversal()) {
            return reject(LedgerError.of(LedgerErrorKind.NOT_REVERSIBLE,
                "Entry " + original.getEntryNumber() + " is a reversal and cannot itself be reversed"));
        }

        LocalDate reversalDate = effectiveDate != null ? effectiveDate : context.getBusinessDate();
        JournalEntryRequest mirror = JournalEntryRequest.builder()
            .entryDate(reversalDate)
            .description("Reversal of " + original.getEntryNumber() + ": " + reason)
            .entryType(EntryType.REVERSAL)
            .sourceModule(original.getSourceModule())
            .sourceType(REVERSAL_SOURCE_TYPE)
            .sourceId(original.getId().toString())
            .reversesEntryId(original.getId())
            .lines(original.getLines().stream()
                .map(line -> line.toRequestLine().mirrored("Reversal: " + nullToEmpty(line.getDescription())))
                .toList())
            .build();

        LedgerResult<JournalEntry> reversal = submit(context, mirror, true);
        if (reversal.isFailure()) {
            return reversal;
        }

        UUID reversalId = reversal.getValue().getId();
        journalRepository.markReversed(original.getId(), reversalId, reason, context.getNow());
        outboxService.saveEvent(new JournalEntryReversedEvent(
            UUID.randomUUID(), original.getId(), reversalId, reason, reversalDate, context.getActorId(), context.getNow()));
        ledgerMetrics.incrementEntriesReversed();

        log.info("Entry {} reversed by {} on {}: {}",
            original.getEntryNumber(), reversal.getValue().getEntryNumber(), reversalDate, reason);
        return LedgerResult.ok(load(reversalId));
    }

    public Optional<JournalEntry> findEntry(UUID entryId) {
        return journalRepository.findById(entryId);
    }

    /**
     * The POSTED transition: re-checks period and accounts, applies balance
     * deltas in account-id order, stamps the entry and records the event.
     */
    private LedgerResult<JournalEntry> applyPosting(LedgerContext context, JournalEntry entry) {
        return ledgerMetrics.timePosting(() -> postEntry(context, entry));
    }

    private LedgerResult<JournalEntry> postEntry(LedgerContext context, JournalEntry entry) {
        Optional<LedgerError> periodError = periodControl.checkOpenForPosting(entry.getEntryDate());
        if (periodError.isPresent()) {
            return reject(periodError.get());
        }

        List<String> codes = entry.getLines().stream().map(JournalLine::getAccountCode).distinct().toList();
        Map<String, Account> accounts = accountRepository.findByCodes(codes);
        Optional<LedgerError> accountError = JournalValidator.validateAccounts(codes, accounts);
        if (accountError.isPresent()) {
            return reject(accountError.get());
        }

        Map<UUID, Account> accountsById = accounts.values().stream()
            .collect(Collectors.toMap(Account::getId, Function.identity()));
        balanceDeltas(entry.getLines(), accountsById)
            .forEach(accountRepository::applyDelta);

        journalRepository.markPosted(entry.getId(), context.getActorId(), context.getNow());

        JournalEntry posted = load(entry.getId());
        outboxService.saveEvent(JournalEntryPostedEvent.of(posted, context.getActorId(), context.getNow()));
        ledgerMetrics.incrementEntriesPosted();

        MDC.put(CorrelationContext.ENTRY_NUMBER_MDC_KEY, posted.getEntryNumber());
        try {
            log.info("Posted entry {} ({}) dated {} amount={} source={}/{}",
                posted.getEntryNumber(), posted.getEntryType(), posted.getEntryDate(),
                posted.getTotalDebit(), posted.getSourceType(), posted.getSourceId());
        } finally {
            MDC.remove(CorrelationContext.ENTRY_NUMBER_MDC_KEY);
        }
        return LedgerResult.ok(posted);
    }

    /**
     * Net signed change per account, ordered by account id so concurrent
     * postings lock account rows in the same order.
     */
    static Map<UUID, BigDecimal> balanceDeltas(List<JournalLine> lines, Map<UUID, Account> accountsById) {
        Map<UUID, BigDecimal> debits = new LinkedHashMap<>();
        Map<UUID, BigDecimal> credits = new LinkedHashMap<>();
        for (JournalLine line : lines) {
            debits.merge(line.getAccountId(), line.getDebit(), BigDecimal::add);
            credits.merge(line.getAccountId(), line.getCredit(), BigDecimal::add);
        }

        Map<UUID, BigDecimal> deltas = new TreeMap<>();
        for (UUID accountId : debits.keySet()) {
            BalanceSide side = accountsById.get(accountId).getNormalBalance();
            deltas.put(accountId, side.delta(debits.get(accountId), credits.get(accountId)));
        }
        return deltas;
    }

    private JournalEntry load(UUID entryId) {
        return journalRepository.findById(entryId)
            .orElseThrow(() -> new IllegalStateException("Entry vanished inside its own transaction: " + entryId));
    }

    private <T> LedgerResult<T> reject(LedgerError error) {
        ledgerMetrics.recordRejection(error.getKind().name());
        log.warn("Ledger operation rejected: {}", error);
        return LedgerResult.failure(error);
    }

    private static LedgerError notFound(UUID entryId) {
        return LedgerError.of(LedgerErrorKind.NOT_FOUND, "Journal entry not found: " + entryId,
            Map.of("entryId", entryId));
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
