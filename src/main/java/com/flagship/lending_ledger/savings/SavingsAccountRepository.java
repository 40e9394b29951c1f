package com.flagship.lending_ledger.savings;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SavingsAccountRepository extends JpaRepository<SavingsAccountEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM SavingsAccountEntity s WHERE s.id = :id")
    Optional<SavingsAccountEntity> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Active interest-bearing accounts opened before {@code monthStart} with no interest credited since.
     */
    @Query("SELECT s.id FROM SavingsAccountEntity s " +
           "WHERE s.status = com.flagship.lending_ledger.savings.SavingsAccountStatus.ACTIVE " +
           "AND s.interestRate > 0 AND s.openedOn < :monthStart " +
           "AND (s.lastInterestDate IS NULL OR s.lastInterestDate < :monthStart) ORDER BY s.accountNumber")
    List<UUID> findIdsDueForInterest(@Param("monthStart") LocalDate monthStart);

    Optional<SavingsAccountEntity> findByAccountNumber(String accountNumber);
}
