package com.flagship.lending_ledger.deposit;

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
public interface FixedDepositRepository extends JpaRepository<FixedDepositEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT f FROM FixedDepositEntity f WHERE f.id = :id")
    Optional<FixedDepositEntity> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Active deposits whose accrual has not yet been brought up to {@code date}.
     */
    @Query("SELECT f.id FROM FixedDepositEntity f " +
           "WHERE f.status = com.flagship.lending_ledger.deposit.FixedDepositStatus.ACTIVE " +
           "AND (f.lastAccrualDate IS NULL OR f.lastAccrualDate < :date) ORDER BY f.maturityDate")
    List<UUID> findIdsDueForAccrual(@Param("date") LocalDate date);

    @Query("SELECT f.id FROM FixedDepositEntity f " +
           "WHERE f.status = com.flagship.lending_ledger.deposit.FixedDepositStatus.ACTIVE " +
           "AND f.maturityDate <= :date ORDER BY f.maturityDate")
    List<UUID> findIdsMaturedBy(@Param("date") LocalDate date);

    Optional<FixedDepositEntity> findByCertificateNumber(String certificateNumber);
}
