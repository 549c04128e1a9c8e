package com.quikdb.api.audit;

import com.quikdb.core.domain.AuditChainHead;
import com.quikdb.core.domain.AuditEvent;
import com.quikdb.core.domain.AuditEvent.EventType;
import com.quikdb.core.repository.AuditChainHeadRepository;
import com.quikdb.core.repository.AuditEventRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/**
 * Append-only audit trail with hash chaining.
 *
 * Each event records the value before and after a state transition and
 * links to its predecessor through {@code previousHash}, so ledger and
 * bucket state can be rebuilt and checked independently of the tables.
 * Appends are serialized on the chain head row.
 */
@Service
public class AuditService {

    static final String GENESIS = "GENESIS";

    private final AuditEventRepository auditRepository;
    private final AuditChainHeadRepository headRepository;
    private final Clock clock;

    public AuditService(AuditEventRepository auditRepository, AuditChainHeadRepository headRepository, Clock clock) {
        this.auditRepository = auditRepository;
        this.headRepository = headRepository;
        this.clock = clock;
    }

    /**
     * Appends an event to the chain. Joins the caller's transaction, so a
     * rolled back operation leaves no event behind, and holds the chain
     * head lock until that transaction ends. The event is flushed before
     * returning.
     */
    @Transactional
    public AuditEvent record(
            EventType eventType,
            String actor,
            String subject,
            Object before,
            Object after,
            String details) {

        AuditChainHead head = headRepository.findForUpdate(AuditChainHead.TRAIL)
                .orElseGet(this::createHead);
        long sequence = head.nextSequence();
        String previousHash = head.getLastHash();
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        String beforeValue = before == null ? null : before.toString();
        String afterValue = after == null ? null : after.toString();

        String hash = computeHash(sequence, eventType, actor, subject,
                beforeValue, afterValue, details, now, previousHash);

        AuditEvent event = auditRepository.saveAndFlush(AuditEvent.create(
                sequence, eventType, actor, subject,
                beforeValue, afterValue, details, now, previousHash, hash));
        head.advance(sequence, hash);
        headRepository.saveAndFlush(head);
        return event;
    }

    // first append after an empty start; a concurrent first append fails on the primary key
    private AuditChainHead createHead() {
        AuditChainHead head = auditRepository.findTopByOrderBySequenceNumberDesc()
                .map(last -> AuditChainHead.startingAt(last.getSequenceNumber(), last.getEventHash()))
                .orElseGet(() -> AuditChainHead.startingAt(0, GENESIS));
        return headRepository.saveAndFlush(head);
    }

    /**
     * Walks the chain from genesis and recomputes every hash.
     */
    @Transactional(readOnly = true)
    public ChainVerification verifyChain() {
        List<AuditEvent> events = auditRepository.findAllByOrderBySequenceNumberAsc();
        String expectedPrevious = GENESIS;
        for (AuditEvent event : events) {
            if (!Objects.equals(expectedPrevious, event.getPreviousHash())) {
                return new ChainVerification(false, events.size(), event.getSequenceNumber());
            }
            String recomputed = computeHash(event.getSequenceNumber(), event.getEventType(),
                    event.getActor(), event.getSubject(), event.getBeforeValue(),
                    event.getAfterValue(), event.getDetails(), event.getOccurredAt(),
                    event.getPreviousHash());
            if (!recomputed.equals(event.getEventHash())) {
                return new ChainVerification(false, events.size(), event.getSequenceNumber());
            }
            expectedPrevious = event.getEventHash();
        }
        return new ChainVerification(true, events.size(), null);
    }

    @Transactional(readOnly = true)
    public List<AuditEvent> eventsFor(String subject) {
        return auditRepository.findBySubjectOrderBySequenceNumberAsc(subject);
    }

    @Transactional(readOnly = true)
    public List<AuditEvent> eventsOfType(EventType eventType) {
        return auditRepository.findByEventTypeOrderBySequenceNumberAsc(eventType);
    }

    private String computeHash(long sequence, EventType eventType, String actor, String subject,
                               String before, String after, String details,
                               Instant occurredAt, String previousHash) {
        String data = String.join("|",
                Long.toString(sequence),
                eventType.name(),
                String.valueOf(actor),
                String.valueOf(subject),
                String.valueOf(before),
                String.valueOf(after),
                String.valueOf(details),
                occurredAt.toString(),
                previousHash);
        return sha256(data);
    }

    static String sha256(String data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(data.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * @param firstBrokenSequence null when the chain is intact
     */
    public record ChainVerification(boolean valid, int eventCount, Long firstBrokenSequence) {}
}
