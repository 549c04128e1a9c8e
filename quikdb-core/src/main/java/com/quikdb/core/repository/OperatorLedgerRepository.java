package com.quikdb.core.repository;

import com.quikdb.core.domain.OperatorLedger;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigInteger;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for per-operator ledger totals.
 */
@Repository
public interface OperatorLedgerRepository extends JpaRepository<OperatorLedger, UUID> {

    Optional<OperatorLedger> findByOperator(String operator);

    /**
     * Loads an operator's totals under a write lock.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM OperatorLedger l WHERE l.operator = :operator")
    Optional<OperatorLedger> findForUpdate(@Param("operator") String operator);

    /**
     * Slashed amount across all operators, null when there are none.
     */
    @Query("SELECT SUM(l.totalSlashed) FROM OperatorLedger l")
    BigInteger sumTotalSlashed();
}
