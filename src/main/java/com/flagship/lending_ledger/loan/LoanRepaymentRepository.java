package com.flagship.lending_ledger.loan;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LoanRepaymentRepository extends JpaRepository<LoanRepaymentEntity, UUID> {

    Optional<LoanRepaymentEntity> findByPaymentReference(String paymentReference);

    List<LoanRepaymentEntity> findByLoanIdOrderByCreatedAtAsc(UUID loanId);
}
