package com.flagship.lending_ledger.deposit;

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
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Fixed deposit lifecycle: placement, interest accrual, premature withdrawal,
 * maturity and pay-out.
 *
 * Accounting:
 * - Placement: debit cash, credit FD liability
 * - Accrual: debit deposit interest expense, credit interest payable
 * - Pay-out and premature withdrawal clear the FD liability and the accrued
 *   payable against cash
 * - Rollover moves principal and interest into a new deposit's liability
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FixedDepositService {

    static final String SOURCE_MODULE = "FIXED_DEPOSITS";

    private final LedgerTransactionRunner transactionRunner;
    private final JournalPostingEngine postingEngine;
    private final AccountRegistry accountRegistry;
    private final ReferenceGenerator referenceGenerator;
    private final FixedDepositRepository depositRepository;
    private final LedgerMetrics ledgerMetrics;

    @Value("${ledger.fixed-deposit.premature-penalty-rate:2.0}")
    private BigDecimal prematurePenaltyRate;

    public LedgerResult<FixedDeposit> create(ActorIdentity actor, FixedDepositApplication application) {
        if (application.getCustomerId() == null || application.getCustomerId().isBlank()) {
            return LedgerResult.failure(LedgerErrorKind.INVALID_LINE, "Customer id is required");
        }
        if (application.getPrincipal() == null || application.getPrincipal().signum() <= 0) {
            return LedgerResult.failure(LedgerErrorKind.INVALID_AMOUNT,
                "Deposit principal must be positive: " + application.getPrincipal());
        }
        if (application.getAnnualRate() == null || application.getAnnualRate().signum() < 0) {
            return LedgerResult.failure(LedgerErrorKind.INVALID_AMOUNT,
                "Interest rate must not be negative: " + application.getAnnualRate());
        }
        if (application.getTenureDays() <= 0) {
            return LedgerResult.failure(LedgerErrorKind.INVALID_AMOUNT,
                "Tenure must be at least one day: " + application.getTenureDays());
        }

        return transactionRunner.execute(actor, context -> {
            LocalDate startDate = application.getStartDate() != null
                ? application.getStartDate() : context.getBusinessDate();
            FixedDepositEntity deposit = FixedDepositEntity.create(
                referenceGenerator.next(ReferenceType.FIXED_DEPOSIT, context.getBusinessDate()),
                application.getCustomerId(), application.getPrincipal().setScale(2, RoundingMode.HALF_UP),
                application.getAnnualRate(), application.getTenureDays(), startDate,
                application.getMaturityInstruction(), context.getActorId());

            JournalEntryRequest request = entry(deposit, "FD_PLACEMENT", "Fixed deposit placement", context.getBusinessDate())
                .line(JournalEntryRequest.Line.debit(code(LedgerAccount.CASH_BANK), deposit.getPrincipalAmount(),
                    "Fixed deposit received"))
                .line(JournalEntryRequest.Line.credit(code(LedgerAccount.FIXED_DEPOSIT_LIABILITY),
                        deposit.getPrincipalAmount(), "Fixed deposit liability")
                    .withCustomer(deposit.getCustomerId())
                    .withReference("FIXED_DEPOSIT", deposit.getId().toString()))
                .build();

            LedgerResult<JournalEntry> posted = postingEngine.submit(context, request, true);
            if (posted.isFailure()) {
                return LedgerResult.failure(posted.getError());
            }
            FixedDepositEntity saved = depositRepository.save(deposit);

            ledgerMetrics.recordOperation("fixed_deposit.created");
            log.info("Placed fixed deposit {} for customer {}: principal={}, rate={}%, days={}, maturity={} on {}",
                saved.getCertificateNumber(), saved.getCustomerId(), saved.getPrincipalAmount(),
                saved.getInterestRate(), saved.getTenureDays(), saved.getMaturityAmount(), saved.getMaturityDate());
            return LedgerResult.ok(saved.toDomain());
        });
    }

    /**
     * Brings accrued interest up to {@code asOf}, capped at maturity.
     *
     * @return the amount accrued by this call; zero when already up to date
     */
    public LedgerResult<BigDecimal> accrueInterest(ActorIdentity actor, UUID depositId, LocalDate asOf) {
        return transactionRunner.execute(actor, context -> {
            Optional<FixedDepositEntity> found = depositRepository.findByIdForUpdate(depositId);
            if (found.isEmpty()) {
                return notFound(depositId);
            }
            FixedDepositEntity deposit = found.get();
            if (deposit.getStatus() != FixedDepositStatus.ACTIVE) {
                return LedgerResult.failure(LedgerErrorKind.INVALID_STATUS,
                    "Fixed deposit " + deposit.getCertificateNumber() + " is " + deposit.getStatus());
            }
            return accrue(context, deposit, asOf);
        });
    }

    /**
     * Closes an active deposit before its maturity date. Interest earned for
     * the days held, less a penalty on principal, is paid with the principal;
     * the difference to what was accrued is trued up against interest expense.
     */
    public LedgerResult<PrematureWithdrawal> withdrawPremature(ActorIdentity actor, UUID depositId, String reason) {
        return transactionRunner.execute(actor, context -> {
            Optional<FixedDepositEntity> found = depositRepository.findByIdForUpdate(depositId);
            if (found.isEmpty()) {
                return notFound(depositId);
            }
            FixedDepositEntity deposit = found.get();
            LocalDate today = context.getBusinessDate();
            if (deposit.getStatus() != FixedDepositStatus.ACTIVE) {
                return LedgerResult.failure(LedgerErrorKind.INVALID_STATUS,
                    "Cannot withdraw fixed deposit " + deposit.getCertificateNumber() + " in status " + deposit.getStatus());
            }
            if (deposit.isMaturedOn(today)) {
                return LedgerResult.failure(LedgerErrorKind.INVALID_STATUS,
                    "Fixed deposit " + deposit.getCertificateNumber() + " has reached maturity; process maturity instead");
            }

            int daysHeld = (int) FixedDepositCalculator.daysBetween(deposit.getStartDate(), today);
            BigDecimal principal = deposit.getPrincipalAmount();
            BigDecimal earned = FixedDepositCalculator.interest(principal, deposit.getInterestRate(), daysHeld);
            BigDecimal penalty = FixedDepositCalculator.penalty(principal, prematurePenaltyRate);
            BigDecimal netInterest = earned.subtract(penalty).max(BigDecimal.ZERO);
            BigDecimal payout = principal.add(netInterest);
            BigDecimal accrued = deposit.getAccruedInterest();
            BigDecimal trueUp = netInterest.subtract(accrued);

            JournalEntryRequest.JournalEntryRequestBuilder request =
                entry(deposit, "FD_PREMATURE_WITHDRAWAL", "Fixed deposit premature withdrawal", today)
                    .line(JournalEntryRequest.Line.debit(code(LedgerAccount.FIXED_DEPOSIT_LIABILITY), principal,
                        "FD principal liability cleared").withCustomer(deposit.getCustomerId()));
            if (accrued.signum() > 0) {
                request.line(JournalEntryRequest.Line.debit(code(LedgerAccount.INTEREST_PAYABLE), accrued,
                    "Accrued interest cleared"));
            }
            if (trueUp.signum() > 0) {
                request.line(JournalEntryRequest.Line.debit(code(LedgerAccount.DEPOSIT_INTEREST_EXPENSE), trueUp,
                    "Interest paid on premature withdrawal"));
            } else if (trueUp.signum() < 0) {
                request.line(JournalEntryRequest.Line.credit(code(LedgerAccount.DEPOSIT_INTEREST_EXPENSE), trueUp.negate(),
                    "Accrued interest forfeited"));
            }
            request.line(JournalEntryRequest.Line.credit(code(LedgerAccount.CASH_BANK), payout,
                "Premature withdrawal payout"));

            LedgerResult<JournalEntry> posted = postingEngine.submit(context, request.build(), true);
            if (posted.isFailure()) {
                return LedgerResult.failure(posted.getError());
            }
            deposit.closePremature(penalty, payout, context.getNow());

            ledgerMetrics.recordOperation("fixed_deposit.premature_withdrawal");
            log.info("Fixed deposit {} withdrawn early after {} days ({}): earned={}, penalty={}, payout={}",
                deposit.getCertificateNumber(), daysHeld, reason, earned, penalty, payout);
            return LedgerResult.ok(new PrematureWithdrawal(deposit.getId(), daysHeld, principal, earned, penalty,
                netInterest, payout, posted.getValue().getId()));
        });
    }

    /**
     * Matures an active deposit whose maturity date is on or before {@code today}:
     * accrues the remaining interest, then either marks it MATURED for pay-out
     * or rolls principal and interest into a new deposit on the same terms.
     */
    public LedgerResult<FixedDeposit> processMaturity(ActorIdentity actor, UUID depositId, LocalDate today) {
        return transactionRunner.execute(actor, context -> {
            Optional<FixedDepositEntity> found = depositRepository.findByIdForUpdate(depositId);
            if (found.isEmpty()) {
                return notFound(depositId);
            }
            FixedDepositEntity deposit = found.get();
            if (deposit.getStatus() != FixedDepositStatus.ACTIVE || !deposit.isMaturedOn(today)) {
                return LedgerResult.failure(LedgerErrorKind.INVALID_STATUS,
                    "Fixed deposit " + deposit.getCertificateNumber() + " is " + deposit.getStatus()
                        + " maturing " + deposit.getMaturityDate());
            }

            LedgerResult<BigDecimal> accrued = accrue(context, deposit, deposit.getMaturityDate(), today);
            if (accrued.isFailure()) {
                return LedgerResult.failure(accrued.getError());
            }

            if (deposit.getMaturityInstruction() == MaturityInstruction.PAY_OUT) {
                deposit.mature();
                log.info("Fixed deposit {} matured: {} awaiting pay-out", deposit.getCertificateNumber(),
                    deposit.getMaturityAmount());
                return LedgerResult.ok(deposit.toDomain());
            }
            return rollOver(context, deposit, today);
        });
    }

    /**
     * Pays a MATURED deposit out in cash.
     */
    public LedgerResult<FixedDeposit> payOut(ActorIdentity actor, UUID depositId) {
        return transactionRunner.execute(actor, context -> {
            Optional<FixedDepositEntity> found = depositRepository.findByIdForUpdate(depositId);
            if (found.isEmpty()) {
                return notFound(depositId);
            }
            FixedDepositEntity deposit = found.get();
            if (deposit.getStatus() != FixedDepositStatus.MATURED) {
                return LedgerResult.failure(LedgerErrorKind.INVALID_STATUS,
                    "Only matured deposits can be paid out; " + deposit.getCertificateNumber() + " is " + deposit.getStatus());
            }

            BigDecimal principal = deposit.getPrincipalAmount();
            BigDecimal interest = deposit.getAccruedInterest();
            BigDecimal payout = principal.add(interest);
            JournalEntryRequest.JournalEntryRequestBuilder request =
                entry(deposit, "FD_PAYOUT", "Fixed deposit maturity pay-out", context.getBusinessDate())
                    .line(JournalEntryRequest.Line.debit(code(LedgerAccount.FIXED_DEPOSIT_LIABILITY), principal,
                        "FD principal liability cleared").withCustomer(deposit.getCustomerId()));
            if (interest.signum() > 0) {
                request.line(JournalEntryRequest.Line.debit(code(LedgerAccount.INTEREST_PAYABLE), interest,
                    "Matured interest paid"));
            }
            request.line(JournalEntryRequest.Line.credit(code(LedgerAccount.CASH_BANK), payout, "Maturity pay-out"));

            LedgerResult<JournalEntry> posted = postingEngine.submit(context, request.build(), true);
            if (posted.isFailure()) {
                return LedgerResult.failure(posted.getError());
            }
            deposit.payOut(payout, context.getNow());

            ledgerMetrics.recordOperation("fixed_deposit.paid_out");
            log.info("Fixed deposit {} paid out: {}", deposit.getCertificateNumber(), payout);
            return LedgerResult.ok(deposit.toDomain());
        });
    }

    @Transactional(readOnly = true)
    public Optional<FixedDeposit> getDeposit(UUID depositId) {
        return depositRepository.findById(depositId).map(FixedDepositEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<UUID> findDueForAccrual(LocalDate today) {
        return depositRepository.findIdsDueForAccrual(today);
    }

    @Transactional(readOnly = true)
    public List<UUID> findMaturedBy(LocalDate today) {
        return depositRepository.findIdsMaturedBy(today);
    }

    private LedgerResult<BigDecimal> accrue(LedgerContext context, FixedDepositEntity deposit, LocalDate asOf) {
        return accrue(context, deposit, asOf, asOf);
    }

    /**
     * Posts the gap between the interest earned up to {@code accrueTo} and what
     * is already accrued, dated {@code entryDate}.
     */
    private LedgerResult<BigDecimal> accrue(LedgerContext context, FixedDepositEntity deposit,
                                            LocalDate accrueTo, LocalDate entryDate) {
        BigDecimal target = FixedDepositCalculator.accruedTarget(deposit.getPrincipalAmount(), deposit.getInterestRate(),
            deposit.getStartDate(), deposit.getTenureDays(), accrueTo);
        BigDecimal delta = target.subtract(deposit.getAccruedInterest());
        if (delta.signum() <= 0) {
            deposit.accrue(BigDecimal.ZERO, accrueTo);
            return LedgerResult.ok(BigDecimal.ZERO.setScale(2));
        }

        JournalEntryRequest request = entry(deposit, "FD_INTEREST_ACCRUAL",
                "Fixed deposit interest accrual to " + accrueTo, entryDate)
            .line(JournalEntryRequest.Line.debit(code(LedgerAccount.DEPOSIT_INTEREST_EXPENSE), delta,
                "Interest expense"))
            .line(JournalEntryRequest.Line.credit(code(LedgerAccount.INTEREST_PAYABLE), delta,
                "Interest payable").withCustomer(deposit.getCustomerId()))
            .build();
        LedgerResult<JournalEntry> posted = postingEngine.submit(context, request, true);
        if (posted.isFailure()) {
            return LedgerResult.failure(posted.getError());
        }
        deposit.accrue(delta, accrueTo);

        log.debug("Accrued {} on fixed deposit {} up to {} (total {})",
            delta, deposit.getCertificateNumber(), accrueTo, deposit.getAccruedInterest());
        return LedgerResult.ok(delta);
    }

    private LedgerResult<FixedDeposit> rollOver(LedgerContext context, FixedDepositEntity deposit, LocalDate today) {
        BigDecimal principal = deposit.getPrincipalAmount();
        BigDecimal interest = deposit.getAccruedInterest();
        BigDecimal newPrincipal = principal.add(interest);

        FixedDepositEntity successor = FixedDepositEntity.create(
            referenceGenerator.next(ReferenceType.FIXED_DEPOSIT, context.getBusinessDate()),
            deposit.getCustomerId(), newPrincipal, deposit.getInterestRate(), deposit.getTenureDays(),
            deposit.getMaturityDate(), deposit.getMaturityInstruction(), context.getActorId());

        JournalEntryRequest.JournalEntryRequestBuilder request =
            entry(deposit, "FD_ROLLOVER", "Fixed deposit rollover to " + successor.getCertificateNumber(), today)
                .line(JournalEntryRequest.Line.debit(code(LedgerAccount.FIXED_DEPOSIT_LIABILITY), principal,
                    "Matured principal").withCustomer(deposit.getCustomerId()));
        if (interest.signum() > 0) {
            request.line(JournalEntryRequest.Line.debit(code(LedgerAccount.INTEREST_PAYABLE), interest,
                "Matured interest capitalised"));
        }
        request.line(JournalEntryRequest.Line.credit(code(LedgerAccount.FIXED_DEPOSIT_LIABILITY), newPrincipal,
                "Rolled over principal")
            .withCustomer(deposit.getCustomerId())
            .withReference("FIXED_DEPOSIT", successor.getId().toString()));

        LedgerResult<JournalEntry> posted = postingEngine.submit(context, request.build(), true);
        if (posted.isFailure()) {
            return LedgerResult.failure(posted.getError());
        }
        FixedDepositEntity saved = depositRepository.save(successor);
        deposit.rollOver(saved.getId(), context.getNow());

        ledgerMetrics.recordOperation("fixed_deposit.rolled_over");
        log.info("Fixed deposit {} rolled over into {}: principal {}", deposit.getCertificateNumber(),
            saved.getCertificateNumber(), newPrincipal);
        return LedgerResult.ok(deposit.toDomain());
    }

    private JournalEntryRequest.JournalEntryRequestBuilder entry(FixedDepositEntity deposit, String sourceType,
                                                                 String description, LocalDate entryDate) {
        return JournalEntryRequest.builder()
            .entryDate(entryDate)
            .description(description + " " + deposit.getCertificateNumber())
            .sourceModule(SOURCE_MODULE)
            .sourceType(sourceType)
            .sourceId(deposit.getId().toString());
    }

    private String code(LedgerAccount account) {
        return accountRegistry.code(account);
    }

    private static <T> LedgerResult<T> notFound(UUID depositId) {
        return LedgerResult.failure(LedgerErrorKind.NOT_FOUND, "Fixed deposit not found: " + depositId,
            Map.of("fixedDepositId", String.valueOf(depositId)));
    }
}
