package com.quikdb.core.repository;

import com.quikdb.core.domain.AuditChainHead;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for the audit chain tip.
 */
@Repository
public interface AuditChainHeadRepository extends JpaRepository<AuditChainHead, String> {

    /**
     * Loads the chain tip under a write lock held until the appending
     * transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT h FROM AuditChainHead h WHERE h.trail = :trail")
    Optional<AuditChainHead> findForUpdate(@Param("trail") String trail);
}
