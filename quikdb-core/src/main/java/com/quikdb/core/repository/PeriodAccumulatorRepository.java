package com.quikdb.core.repository;

import com.quikdb.core.domain.PeriodAccumulator;
import com.quikdb.core.domain.PeriodType;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository for day and month reward accumulators.
 */
@Repository
public interface PeriodAccumulatorRepository extends JpaRepository<PeriodAccumulator, UUID> {

    Optional<PeriodAccumulator> findByOperatorAndPeriodTypeAndBucketEpoch(
            String operator, PeriodType periodType, long bucketEpoch);

    /**
     * Loads one bucket under a write lock for the read-check-write cap sequence.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM PeriodAccumulator a WHERE a.operator = :operator " +
           "AND a.periodType = :periodType AND a.bucketEpoch = :bucketEpoch")
    Optional<PeriodAccumulator> findForUpdate(
            @Param("operator") String operator,
            @Param("periodType") PeriodType periodType,
            @Param("bucketEpoch") long bucketEpoch);
}
