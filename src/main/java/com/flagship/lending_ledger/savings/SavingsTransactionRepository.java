package com.flagship.lending_ledger.savings;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SavingsTransactionRepository extends JpaRepository<SavingsTransactionEntity, UUID> {

    List<SavingsTransactionEntity> findBySavingsAccountIdOrderByProcessedAtAsc(UUID savingsAccountId);
}
