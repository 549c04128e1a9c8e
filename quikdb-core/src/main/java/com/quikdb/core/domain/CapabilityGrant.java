package com.quikdb.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

/**
 * One capability held by one account.
 */
@Entity
@Table(name = "capability_grants", uniqueConstraints = {
    @UniqueConstraint(name = "uk_capability_grant", columnNames = {"account_id", "capability"})
})
public class CapabilityGrant {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "account_id", nullable = false, length = 128)
    private String account;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private Capability capability;

    @NotNull
    @Column(name = "granted_by", nullable = false, length = 128)
    private String grantedBy;

    @NotNull
    @Column(name = "granted_at", nullable = false)
    private Instant grantedAt;

    protected CapabilityGrant() {}

    public static CapabilityGrant grant(String account, Capability capability, String grantedBy, Instant now) {
        var grant = new CapabilityGrant();
        grant.account = account;
        grant.capability = capability;
        grant.grantedBy = grantedBy;
        grant.grantedAt = now;
        return grant;
    }

    // Getters
    public UUID getId() { return id; }
    public String getAccount() { return account; }
    public Capability getCapability() { return capability; }
    public String getGrantedBy() { return grantedBy; }
    public Instant getGrantedAt() { return grantedAt; }
}
