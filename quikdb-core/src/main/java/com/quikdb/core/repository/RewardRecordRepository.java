package com.quikdb.core.repository;

import com.quikdb.core.domain.RewardRecord;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Repository for ledgered reward records.
 */
@Repository
public interface RewardRecordRepository extends JpaRepository<RewardRecord, String> {

    /**
     * Loads a record with a write lock so only one settlement can touch it at a time.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM RewardRecord r WHERE r.rewardId = :rewardId")
    Optional<RewardRecord> findForUpdate(@Param("rewardId") String rewardId);

    /**
     * Reward history of an operator, newest first.
     */
    List<RewardRecord> findByOperatorOrderByCalculatedAtDesc(String operator);

    /**
     * Unsettled rewards of an operator.
     */
    List<RewardRecord> findByOperatorAndDistributedFalse(String operator);

    long countByDistributed(boolean distributed);

    // Sums below return null when no row matches.

    @Query("SELECT SUM(r.amount) FROM RewardRecord r")
    BigInteger sumAllAmounts();

    @Query("SELECT SUM(r.amount) FROM RewardRecord r WHERE r.distributed = true")
    BigInteger sumDistributedAmounts();

    @Query("SELECT SUM(r.amount) FROM RewardRecord r WHERE r.operator = :operator AND r.distributed = false")
    BigInteger sumPendingForOperator(@Param("operator") String operator);
}
