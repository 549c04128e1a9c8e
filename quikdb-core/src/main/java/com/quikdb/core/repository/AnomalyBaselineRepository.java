package com.quikdb.core.repository;

import com.quikdb.core.domain.AnomalyBaseline;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for anomaly detection baselines.
 */
@Repository
public interface AnomalyBaselineRepository extends JpaRepository<AnomalyBaseline, String> {

    List<AnomalyBaseline> findByDetectedTrue();

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM AnomalyBaseline b WHERE b.metric = :metric")
    Optional<AnomalyBaseline> findForUpdate(@Param("metric") String metric);
}
