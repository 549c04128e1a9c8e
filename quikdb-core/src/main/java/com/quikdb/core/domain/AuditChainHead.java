package com.quikdb.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

/**
 * Tip of the audit hash chain. Appenders lock this row, so sequence
 * numbers and predecessor hashes are handed out one writer at a time.
 */
@Entity
@Table(name = "audit_chain_heads")
public class AuditChainHead {

    public static final String TRAIL = "audit-trail";

    @Id
    @Column(name = "trail", length = 32)
    private String trail;

    @Column(name = "last_sequence", nullable = false)
    private long lastSequence;

    @NotNull
    @Column(name = "last_hash", nullable = false, length = 64)
    private String lastHash;

    @Version
    private Long version;

    protected AuditChainHead() {}

    public static AuditChainHead startingAt(long lastSequence, String lastHash) {
        var head = new AuditChainHead();
        head.trail = TRAIL;
        head.lastSequence = lastSequence;
        head.lastHash = lastHash;
        return head;
    }

    public void advance(long sequence, String hash) {
        this.lastSequence = sequence;
        this.lastHash = hash;
    }

    public long nextSequence() {
        return lastSequence + 1;
    }

    // Getters
    public String getTrail() { return trail; }
    public long getLastSequence() { return lastSequence; }
    public String getLastHash() { return lastHash; }
}
