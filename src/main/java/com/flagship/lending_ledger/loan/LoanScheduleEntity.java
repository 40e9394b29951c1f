package com.flagship.lending_ledger.loan;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA mapping of one installment row.
 *
 * Due amounts are written once. Paid amounts only grow and the status only
 * moves forward; {@link #applyPayment} and {@link #markOverdue} refuse anything else.
 */
@Entity
@Table(name = "loan_schedules")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LoanScheduleEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "loan_id", nullable = false, updatable = false)
    private UUID loanId;

    @Column(name = "installment_number", nullable = false, updatable = false)
    private int installmentNumber;

    @Column(name = "due_date", nullable = false, updatable = false)
    private LocalDate dueDate;

    @Column(name = "principal_due", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal principalDue;

    @Column(name = "interest_due", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal interestDue;

    @Column(name = "total_due", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal totalDue;

    @Column(name = "outstanding_balance", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal outstandingBalance;

    @Column(name = "principal_paid", nullable = false, precision = 19, scale = 2)
    private BigDecimal principalPaid;

    @Column(name = "interest_paid", nullable = false, precision = 19, scale = 2)
    private BigDecimal interestPaid;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ScheduleStatus status;

    @Column(name = "paid_date")
    private LocalDate paidDate;

    static LoanScheduleEntity fromInstallment(UUID loanId, Installment installment) {
        LoanScheduleEntity entity = new LoanScheduleEntity();
        entity.id = UUID.randomUUID();
        entity.loanId = loanId;
        entity.installmentNumber = installment.getInstallmentNumber();
        entity.dueDate = installment.getDueDate();
        entity.principalDue = installment.getPrincipalDue();
        entity.interestDue = installment.getInterestDue();
        entity.totalDue = installment.getTotalDue();
        entity.outstandingBalance = installment.getOutstandingBalance();
        entity.principalPaid = BigDecimal.ZERO;
        entity.interestPaid = BigDecimal.ZERO;
        entity.status = ScheduleStatus.PENDING;
        return entity;
    }

    public ScheduleEntry toDomain() {
        return new ScheduleEntry(id, loanId, installmentNumber, dueDate, principalDue, interestDue, totalDue,
            outstandingBalance, principalPaid, interestPaid, status, paidDate);
    }

    public OutstandingInstallment toOutstanding() {
        return new OutstandingInstallment(id, installmentNumber, dueDate, principalDue, interestDue,
            principalPaid, interestPaid, status);
    }

    void applyPayment(InstallmentAllocation allocation, LocalDate paymentDate) {
        if (allocation.getInterestApplied().signum() < 0 || allocation.getPrincipalApplied().signum() < 0) {
            throw new IllegalStateException("Negative allocation for installment " + installmentNumber);
        }
        BigDecimal newInterestPaid = interestPaid.add(allocation.getInterestApplied());
        BigDecimal newPrincipalPaid = principalPaid.add(allocation.getPrincipalApplied());
        if (newInterestPaid.compareTo(interestDue) > 0 || newPrincipalPaid.compareTo(principalDue) > 0) {
            throw new IllegalStateException("Allocation exceeds amount due on installment " + installmentNumber);
        }
        moveTo(allocation.getResultingStatus());
        this.interestPaid = newInterestPaid;
        this.principalPaid = newPrincipalPaid;
        if (status == ScheduleStatus.PAID) {
            this.paidDate = paymentDate;
        }
    }

    void markOverdue() {
        moveTo(ScheduleStatus.OVERDUE);
    }

    boolean isOverdueOn(LocalDate date) {
        return status.isOpen() && status != ScheduleStatus.OVERDUE && dueDate.isBefore(date);
    }

    private void moveTo(ScheduleStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                "Installment " + installmentNumber + " cannot move from " + status + " to " + target);
        }
        this.status = target;
    }
}
