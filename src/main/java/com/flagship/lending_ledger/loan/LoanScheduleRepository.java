package com.flagship.lending_ledger.loan;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Repository
public interface LoanScheduleRepository extends JpaRepository<LoanScheduleEntity, UUID> {

    List<LoanScheduleEntity> findByLoanIdOrderByInstallmentNumberAsc(UUID loanId);

    /**
     * Loans holding an unpaid installment due before {@code date} that is not yet marked OVERDUE.
     */
    @Query("SELECT DISTINCT s.loanId FROM LoanScheduleEntity s " +
           "WHERE s.dueDate < :date AND s.status IN (com.flagship.lending_ledger.loan.ScheduleStatus.PENDING, " +
           "com.flagship.lending_ledger.loan.ScheduleStatus.PARTIAL)")
    List<UUID> findLoanIdsWithNewlyOverdueInstallments(@Param("date") LocalDate date);
}
