package com.quikdb.core.repository;

import com.quikdb.core.domain.TimeLockedProposal;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for time-locked admin proposals.
 */
@Repository
public interface TimeLockedProposalRepository extends JpaRepository<TimeLockedProposal, UUID> {

    /**
     * The proposal for a hash that has neither run nor been cancelled, if any.
     */
    @Query("SELECT p FROM TimeLockedProposal p WHERE p.operationHash = :hash " +
           "AND p.executed = false AND p.cancelled = false")
    Optional<TimeLockedProposal> findPending(@Param("hash") String operationHash);

    List<TimeLockedProposal> findByOperationHashOrderByProposedAtDesc(String operationHash);

    List<TimeLockedProposal> findByExecutedFalseAndCancelledFalseOrderByExecuteAfterAsc();
}
