package com.flagship.lending_ledger.loan;

import com.flagship.lending_ledger.ledger.ActorIdentity;
import com.flagship.lending_ledger.ledger.AccountRegistry;
import com.flagship.lending_ledger.ledger.IdempotencyService;
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
import com.flagship.lending_ledger.observability.CorrelationContext;
import com.flagship.lending_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Loan lifecycle: creation with its schedule, disbursement and repayment.
 *
 * Every call is one ledger unit: the loan row is locked, the journal entry
 * is posted and the loan/schedule/repayment rows are written together or
 * not at all. A repayment counts only if its entry posts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanService {

    static final String SOURCE_MODULE = "LOANS";
    static final String REPAYMENT_REFERENCE_PREFIX = "LOAN-REPAYMENT:";

    private final LedgerTransactionRunner transactionRunner;
    private final JournalPostingEngine postingEngine;
    private final AccountRegistry accountRegistry;
    private final ReferenceGenerator referenceGenerator;
    private final IdempotencyService idempotencyService;
    private final LoanRepository loanRepository;
    private final LoanScheduleRepository scheduleRepository;
    private final LoanRepaymentRepository repaymentRepository;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Computes the schedule and records the loan as PENDING_DISBURSEMENT.
     * No ledger effect until disbursement.
     */
    public LedgerResult<Loan> createLoan(ActorIdentity actor, LoanApplication application) {
        Optional<LedgerResult<Loan>> invalid = validate(application);
        if (invalid.isPresent()) {
            return invalid.get();
        }

        return transactionRunner.execute(actor, context -> {
            LocalDate startDate = application.getStartDate() != null
                ? application.getStartDate() : context.getBusinessDate();
            AmortizationSchedule schedule = AmortizationCalculator.calculate(application.getPrincipal(),
                application.getAnnualRate(), application.getTenureMonths(), startDate, application.getMethod());

            UUID loanId = UUID.randomUUID();
            String loanNumber = referenceGenerator.next(ReferenceType.LOAN, context.getBusinessDate());
            LoanEntity loan = loanRepository.save(LoanEntity.create(loanId, loanNumber, application.getCustomerId(),
                AmortizationCalculator.money(application.getProcessingFee()), startDate, schedule, context.getActorId()));
            scheduleRepository.saveAll(schedule.getInstallments().stream()
                .map(installment -> LoanScheduleEntity.fromInstallment(loanId, installment))
                .toList());

            ledgerMetrics.recordOperation("loan.created");
            log.info("Created loan {} for customer {}: principal={}, rate={}%, tenure={}m, method={}, installment={}",
                loanNumber, application.getCustomerId(), schedule.getPrincipal(), schedule.getAnnualRate(),
                schedule.getTenureMonths(), schedule.getMethod(), schedule.getInstallmentAmount());
            return LedgerResult.ok(loan.toDomain());
        });
    }

    /**
     * Pays out a pending loan: debit loans receivable with the principal,
     * credit cash with principal less fees and fee income with the fees.
     */
    public LedgerResult<Loan> disburse(ActorIdentity actor, UUID loanId, LocalDate disbursementDate) {
        return withLoanMdc(loanId, () -> transactionRunner.execute(actor, context -> {
            Optional<LoanEntity> found = loanRepository.findByIdForUpdate(loanId);
            if (found.isEmpty()) {
                return loanNotFound(loanId);
            }
            LoanEntity loan = found.get();
            if (loan.getStatus() != LoanStatus.PENDING_DISBURSEMENT) {
                return LedgerResult.failure(LedgerErrorKind.INVALID_STATUS,
                    "Loan " + loan.getLoanNumber() + " is " + loan.getStatus() + " and cannot be disbursed");
            }

            BigDecimal principal = loan.getPrincipalAmount();
            BigDecimal fee = loan.getProcessingFee();
            JournalEntryRequest.JournalEntryRequestBuilder request = JournalEntryRequest.builder()
                .entryDate(disbursementDate != null ? disbursementDate : context.getBusinessDate())
                .description("Loan disbursement " + loan.getLoanNumber())
                .sourceModule(SOURCE_MODULE)
                .sourceType("LOAN_DISBURSEMENT")
                .sourceId(loan.getId().toString())
                .line(JournalEntryRequest.Line.debit(accountRegistry.code(LedgerAccount.LOANS_RECEIVABLE), principal,
                    "Loan principal " + loan.getLoanNumber()).withCustomer(loan.getCustomerId()))
                .line(JournalEntryRequest.Line.credit(accountRegistry.code(LedgerAccount.CASH_BANK), principal.subtract(fee),
                    "Disbursed to customer"));
            if (fee.signum() > 0) {
                request.line(JournalEntryRequest.Line.credit(accountRegistry.code(LedgerAccount.FEE_INCOME), fee,
                    "Processing fee " + loan.getLoanNumber()));
            }

            LedgerResult<JournalEntry> posted = postingEngine.submit(context, request.build(), true);
            if (posted.isFailure()) {
                return LedgerResult.failure(posted.getError());
            }
            loan.markDisbursed(posted.getValue().getId(), context.getNow());

            ledgerMetrics.recordOperation("loan.disbursed");
            log.info("Disbursed loan {}: principal={}, fee={}, entry={}",
                loan.getLoanNumber(), principal, fee, posted.getValue().getEntryNumber());
            return LedgerResult.ok(loan.toDomain());
        }));
    }

    /**
     * Applies a payment oldest installment first, interest before principal,
     * and posts debit cash / credit loans receivable / credit interest income.
     *
     * A payment above the total outstanding is rejected with OVERPAYMENT.
     * A reused payment reference is rejected with DUPLICATE_REFERENCE.
     */
    public LedgerResult<RepaymentReceipt> repay(ActorIdentity actor, RepaymentRequest request) {
        if (request.getAmount() == null || request.getAmount().signum() <= 0) {
            return LedgerResult.failure(LedgerErrorKind.INVALID_AMOUNT,
                "Repayment amount must be positive: " + request.getAmount());
        }
        String externalReference = request.getPaymentReference() != null
            ? REPAYMENT_REFERENCE_PREFIX + request.getPaymentReference() : null;
        if (externalReference != null) {
            Optional<UUID> existing = idempotencyService.findEntryId(externalReference);
            if (existing.isPresent()) {
                log.info("Repayment reference {} already recorded as entry {}", request.getPaymentReference(), existing.get());
                return LedgerResult.failure(LedgerErrorKind.DUPLICATE_REFERENCE,
                    "Payment reference already used: " + request.getPaymentReference(),
                    Map.of("paymentReference", request.getPaymentReference(), "existingEntryId", existing.get()));
            }
        }

        return withLoanMdc(request.getLoanId(), () -> transactionRunner.execute(actor,
            context -> applyRepayment(context, request, externalReference)));
    }

    private LedgerResult<RepaymentReceipt> applyRepayment(LedgerContext context, RepaymentRequest request,
                                                          String externalReference) {
        Optional<LoanEntity> found = loanRepository.findByIdForUpdate(request.getLoanId());
        if (found.isEmpty()) {
            return loanNotFound(request.getLoanId());
        }
        LoanEntity loan = found.get();
        if (!loan.getStatus().acceptsRepayment()) {
            return LedgerResult.failure(LedgerErrorKind.INVALID_STATUS,
                "Loan " + loan.getLoanNumber() + " is " + loan.getStatus() + " and does not accept repayments");
        }

        List<LoanScheduleEntity> schedule = scheduleRepository.findByLoanIdOrderByInstallmentNumberAsc(loan.getId());
        LedgerResult<RepaymentAllocation> allocated = RepaymentAllocator.allocate(request.getAmount(),
            schedule.stream().map(LoanScheduleEntity::toOutstanding).toList());
        if (allocated.isFailure()) {
            return LedgerResult.failure(allocated.getError());
        }
        RepaymentAllocation allocation = allocated.getValue();

        LocalDate paymentDate = request.getPaymentDate() != null ? request.getPaymentDate() : context.getBusinessDate();
        JournalEntryRequest entryRequest = JournalEntryRequest.builder()
            .entryDate(paymentDate)
            .description("Loan repayment " + loan.getLoanNumber())
            .sourceModule(SOURCE_MODULE)
            .sourceType("LOAN_REPAYMENT")
            .sourceId(loan.getId().toString())
            .externalReference(externalReference)
            .lines(allocation.toJournalLines(
                accountRegistry.code(LedgerAccount.CASH_BANK),
                accountRegistry.code(LedgerAccount.LOANS_RECEIVABLE),
                accountRegistry.code(LedgerAccount.INTEREST_INCOME),
                "Repayment " + loan.getLoanNumber()))
            .build();

        LedgerResult<JournalEntry> posted = postingEngine.submit(context, entryRequest, true);
        if (posted.isFailure()) {
            return LedgerResult.failure(posted.getError());
        }
        JournalEntry entry = posted.getValue();

        Map<UUID, LoanScheduleEntity> byId = schedule.stream()
            .collect(Collectors.toMap(LoanScheduleEntity::getId, Function.identity()));
        for (InstallmentAllocation share : allocation.getInstallments()) {
            byId.get(share.getScheduleId()).applyPayment(share, paymentDate);
        }

        String receiptNumber = referenceGenerator.next(ReferenceType.RECEIPT, context.getBusinessDate());
        LoanRepaymentEntity repayment = repaymentRepository.save(LoanRepaymentEntity.record(loan.getId(), receiptNumber,
            request.getPaymentReference(), allocation, entry.getId(), paymentDate, context.getActorId()));

        if (schedule.stream().noneMatch(installment -> installment.getStatus().isOpen())) {
            loan.close(context.getNow());
            log.info("Loan {} fully repaid and closed", loan.getLoanNumber());
        } else if (loan.getStatus() == LoanStatus.OVERDUE
                && schedule.stream().noneMatch(installment -> installment.getStatus() == ScheduleStatus.OVERDUE)) {
            loan.markCurrent();
            log.info("Loan {} brought current", loan.getLoanNumber());
        }

        idempotencyService.remember(externalReference, entry.getId());
        ledgerMetrics.recordRepayment(allocation.getAmount());
        ledgerMetrics.recordOperation("loan.repayment");
        log.info("Repayment {} on loan {}: amount={}, principal={}, interest={}, entry={}",
            receiptNumber, loan.getLoanNumber(), allocation.getAmount(), allocation.getPrincipalPortion(),
            allocation.getInterestPortion(), entry.getEntryNumber());

        return LedgerResult.ok(new RepaymentReceipt(repayment.getId(), receiptNumber, loan.getId(), paymentDate,
            allocation.getAmount(), allocation.getPrincipalPortion(), allocation.getInterestPortion(),
            entry.getId(), entry.getEntryNumber(), loan.getStatus(), allocation));
    }

    /**
     * Marks installments due before {@code today} and still unpaid as OVERDUE,
     * and the loan with them. No ledger effect.
     *
     * @return the number of installments newly marked
     */
    public LedgerResult<Integer> markOverdueInstallments(ActorIdentity actor, UUID loanId, LocalDate today) {
        return withLoanMdc(loanId, () -> transactionRunner.execute(actor, context -> {
            Optional<LoanEntity> found = loanRepository.findByIdForUpdate(loanId);
            if (found.isEmpty()) {
                return loanNotFound(loanId);
            }
            LoanEntity loan = found.get();
            if (!loan.getStatus().acceptsRepayment()) {
                return LedgerResult.ok(0);
            }

            int marked = 0;
            for (LoanScheduleEntity installment : scheduleRepository.findByLoanIdOrderByInstallmentNumberAsc(loanId)) {
                if (installment.isOverdueOn(today)) {
                    installment.markOverdue();
                    marked++;
                }
            }
            if (marked > 0 && loan.getStatus() == LoanStatus.ACTIVE) {
                loan.markOverdue();
            }
            if (marked > 0) {
                log.info("Marked {} installments overdue on loan {} as of {}", marked, loan.getLoanNumber(), today);
            }
            return LedgerResult.ok(marked);
        }));
    }

    @Transactional(readOnly = true)
    public List<UUID> findLoansWithNewlyOverdueInstallments(LocalDate today) {
        return scheduleRepository.findLoanIdsWithNewlyOverdueInstallments(today);
    }

    @Transactional(readOnly = true)
    public Optional<Loan> getLoan(UUID loanId) {
        return loanRepository.findById(loanId).map(LoanEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<ScheduleEntry> getSchedule(UUID loanId) {
        return scheduleRepository.findByLoanIdOrderByInstallmentNumberAsc(loanId).stream()
            .map(LoanScheduleEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public BigDecimal getOutstanding(UUID loanId) {
        return RepaymentAllocator.totalOutstanding(scheduleRepository.findByLoanIdOrderByInstallmentNumberAsc(loanId)
            .stream()
            .map(LoanScheduleEntity::toOutstanding)
            .toList());
    }

    private static Optional<LedgerResult<Loan>> validate(LoanApplication application) {
        if (application.getCustomerId() == null || application.getCustomerId().isBlank()) {
            return Optional.of(LedgerResult.failure(LedgerErrorKind.INVALID_LINE, "Customer id is required"));
        }
        if (application.getPrincipal() == null || application.getPrincipal().signum() <= 0) {
            return Optional.of(LedgerResult.failure(LedgerErrorKind.INVALID_AMOUNT,
                "Principal must be positive: " + application.getPrincipal()));
        }
        if (application.getAnnualRate() == null || application.getAnnualRate().signum() < 0) {
            return Optional.of(LedgerResult.failure(LedgerErrorKind.INVALID_AMOUNT,
                "Interest rate must not be negative: " + application.getAnnualRate()));
        }
        if (application.getTenureMonths() < 1 || application.getTenureMonths() > AmortizationCalculator.MAX_TENURE_MONTHS) {
            return Optional.of(LedgerResult.failure(LedgerErrorKind.INVALID_AMOUNT,
                "Tenure must be between 1 and " + AmortizationCalculator.MAX_TENURE_MONTHS + " months"));
        }
        BigDecimal fee = application.getProcessingFee();
        if (fee == null || fee.signum() < 0 || fee.compareTo(application.getPrincipal()) >= 0) {
            return Optional.of(LedgerResult.failure(LedgerErrorKind.INVALID_AMOUNT,
                "Processing fee must be non-negative and below the principal: " + fee));
        }
        return Optional.empty();
    }

    private static <T> LedgerResult<T> loanNotFound(UUID loanId) {
        return LedgerResult.failure(LedgerErrorKind.NOT_FOUND, "Loan not found: " + loanId, Map.of("loanId", String.valueOf(loanId)));
    }

    private static <T> T withLoanMdc(UUID loanId, Supplier<T> work) {
        MDC.put(CorrelationContext.LOAN_ID_MDC_KEY, String.valueOf(loanId));
        try {
            return work.get();
        } finally {
            MDC.remove(CorrelationContext.LOAN_ID_MDC_KEY);
        }
    }
}
