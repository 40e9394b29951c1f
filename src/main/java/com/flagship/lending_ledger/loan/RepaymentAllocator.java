package com.flagship.lending_ledger.loan;

import com.flagship.lending_ledger.ledger.LedgerErrorKind;
import com.flagship.lending_ledger.ledger.LedgerResult;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a payment across outstanding installments. Pure, no I/O.
 *
 * Allocation rules:
 * 1. Oldest due installment first
 * 2. Within an installment, interest before principal
 * 3. PAID only when both interest and principal are fully paid, otherwise
 *    PARTIAL; an OVERDUE installment stays OVERDUE until fully paid
 * 4. Installments the payment does not reach are left untouched
 *
 * A payment larger than everything outstanding is rejected with OVERPAYMENT
 * before anything is allocated.
 */
public final class RepaymentAllocator {

    private static final Comparator<OutstandingInstallment> OLDEST_DUE_FIRST =
        Comparator.comparing(OutstandingInstallment::getDueDate)
            .thenComparingInt(OutstandingInstallment::getInstallmentNumber);

    private RepaymentAllocator() {
    }

    public static LedgerResult<RepaymentAllocation> allocate(BigDecimal amount, List<OutstandingInstallment> schedule) {
        if (amount == null || amount.signum() <= 0) {
            return LedgerResult.failure(LedgerErrorKind.INVALID_AMOUNT, "Payment amount must be positive: " + amount);
        }
        if (amount.stripTrailingZeros().scale() > 2) {
            return LedgerResult.failure(LedgerErrorKind.INVALID_AMOUNT, "Payment amount has more than 2 decimals: " + amount);
        }

        List<OutstandingInstallment> open = schedule.stream()
            .filter(installment -> installment.getStatus().isOpen())
            .filter(installment -> installment.getTotalOutstanding().signum() > 0)
            .sorted(OLDEST_DUE_FIRST)
            .toList();

        BigDecimal outstanding = totalOutstanding(open);
        if (amount.compareTo(outstanding) > 0) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("payment", amount);
            details.put("outstanding", outstanding);
            return LedgerResult.failure(LedgerErrorKind.OVERPAYMENT,
                String.format("Payment %s exceeds total outstanding %s", amount, outstanding), details);
        }

        BigDecimal remaining = amount;
        BigDecimal principalTotal = BigDecimal.ZERO;
        BigDecimal interestTotal = BigDecimal.ZERO;
        List<InstallmentAllocation> allocations = new ArrayList<>();

        for (OutstandingInstallment installment : open) {
            if (remaining.signum() == 0) {
                break;
            }
            BigDecimal toInterest = remaining.min(installment.getInterestOutstanding());
            remaining = remaining.subtract(toInterest);
            BigDecimal toPrincipal = remaining.min(installment.getPrincipalOutstanding());
            remaining = remaining.subtract(toPrincipal);

            boolean interestSettled = toInterest.compareTo(installment.getInterestOutstanding()) == 0;
            boolean principalSettled = toPrincipal.compareTo(installment.getPrincipalOutstanding()) == 0;
            ScheduleStatus status;
            if (interestSettled && principalSettled) {
                status = ScheduleStatus.PAID;
            } else if (installment.getStatus() == ScheduleStatus.OVERDUE) {
                // Installment status only moves forward, so OVERDUE never drops back to PARTIAL
                status = ScheduleStatus.OVERDUE;
            } else {
                status = ScheduleStatus.PARTIAL;
            }

            allocations.add(new InstallmentAllocation(installment.getScheduleId(), installment.getInstallmentNumber(),
                toInterest, toPrincipal, status));
            principalTotal = principalTotal.add(toPrincipal);
            interestTotal = interestTotal.add(toInterest);
        }

        return LedgerResult.ok(new RepaymentAllocation(amount, principalTotal, interestTotal, List.copyOf(allocations)));
    }

    public static BigDecimal totalOutstanding(List<OutstandingInstallment> schedule) {
        return schedule.stream()
            .filter(installment -> installment.getStatus().isOpen())
            .map(OutstandingInstallment::getTotalOutstanding)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
