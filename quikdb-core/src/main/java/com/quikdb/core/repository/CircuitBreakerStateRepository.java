package com.quikdb.core.repository;

import com.quikdb.core.domain.CircuitBreakerState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for per-operation circuit breakers.
 */
@Repository
public interface CircuitBreakerStateRepository extends JpaRepository<CircuitBreakerState, String> {

    /**
     * Finds all currently open breakers.
     */
    List<CircuitBreakerState> findByTrippedTrue();

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM CircuitBreakerState s WHERE s.operation = :operation")
    Optional<CircuitBreakerState> findForUpdate(@Param("operation") String operation);

    /**
     * Reason of an open breaker, read without loading the entity.
     */
    @Query("SELECT COALESCE(s.reason, '') FROM CircuitBreakerState s WHERE s.operation = :operation AND s.tripped = true")
    Optional<String> findTrippedReason(@Param("operation") String operation);
}
