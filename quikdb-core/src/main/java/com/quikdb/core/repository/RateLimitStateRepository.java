package com.quikdb.core.repository;

import com.quikdb.core.domain.RateLimitState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository for per-caller rate limit windows.
 */
@Repository
public interface RateLimitStateRepository extends JpaRepository<RateLimitState, UUID> {

    Optional<RateLimitState> findByCallerAndOperation(String caller, String operation);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM RateLimitState s WHERE s.caller = :caller AND s.operation = :operation")
    Optional<RateLimitState> findForUpdate(@Param("caller") String caller, @Param("operation") String operation);
}
