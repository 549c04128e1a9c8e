package com.quikdb.core.repository;

import com.quikdb.core.domain.AuditEvent;
import com.quikdb.core.domain.AuditEvent.EventType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for the append-only audit trail.
 */
@Repository
public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

    /**
     * Tail of the hash chain.
     */
    Optional<AuditEvent> findTopByOrderBySequenceNumberDesc();

    List<AuditEvent> findAllByOrderBySequenceNumberAsc();

    List<AuditEvent> findByEventTypeOrderBySequenceNumberAsc(EventType eventType);

    List<AuditEvent> findBySubjectOrderBySequenceNumberAsc(String subject);
}
