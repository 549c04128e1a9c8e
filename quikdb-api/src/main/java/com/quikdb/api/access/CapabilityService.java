package com.quikdb.api.access;

import com.quikdb.api.audit.AuditService;
import com.quikdb.api.config.RewardProperties;
import com.quikdb.api.error.RewardException;
import com.quikdb.core.domain.AuditEvent.EventType;
import com.quikdb.core.domain.Capability;
import com.quikdb.core.domain.CapabilityGrant;
import com.quikdb.core.repository.CapabilityGrantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.EnumSet;
import java.util.Set;

/**
 * Capability grants stored in the ledger.
 *
 * Accounts listed under {@code quikdb.rewards.admins} hold every capability
 * without a stored grant. Everyone else needs an explicit grant, which is
 * only issued through a time-locked admin command.
 */
@Service
public class CapabilityService implements AccessPolicy {

    private static final Logger log = LoggerFactory.getLogger(CapabilityService.class);

    private final CapabilityGrantRepository grantRepository;
    private final RewardProperties properties;
    private final AuditService auditService;
    private final Clock clock;

    public CapabilityService(
            CapabilityGrantRepository grantRepository,
            RewardProperties properties,
            AuditService auditService,
            Clock clock) {
        this.grantRepository = grantRepository;
        this.properties = properties;
        this.auditService = auditService;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasCapability(String caller, Capability capability) {
        if (caller == null) {
            return false;
        }
        if (isBootstrapAdmin(caller)) {
            return true;
        }
        return grantRepository.existsByAccountAndCapability(caller, capability);
    }

    /**
     * Whether a stored grant exists, ignoring bootstrap admin status.
     */
    @Transactional(readOnly = true)
    public boolean hasGrant(String account, Capability capability) {
        return grantRepository.existsByAccountAndCapability(account, capability);
    }

    @Transactional(readOnly = true)
    public Set<Capability> capabilitiesOf(String account) {
        if (isBootstrapAdmin(account)) {
            return EnumSet.allOf(Capability.class);
        }
        Set<Capability> result = EnumSet.noneOf(Capability.class);
        grantRepository.findByAccount(account).forEach(g -> result.add(g.getCapability()));
        return result;
    }

    @Transactional
    public void grant(String account, Capability capability, String grantedBy) {
        if (account == null || account.isBlank()) {
            throw RewardException.validation("Account is required");
        }
        if (grantRepository.existsByAccountAndCapability(account, capability)) {
            throw RewardException.precondition(account + " already holds " + capability);
        }
        grantRepository.save(CapabilityGrant.grant(account, capability, grantedBy, clock.instant()));
        auditService.record(EventType.CAPABILITY_GRANTED, grantedBy, account,
                null, capability, "Capability granted");
        log.info("Granted {} to {} by {}", capability, account, grantedBy);
    }

    @Transactional
    public void revoke(String account, Capability capability, String revokedBy) {
        CapabilityGrant grant = grantRepository.findByAccountAndCapability(account, capability)
                .orElseThrow(() -> RewardException.precondition(account + " does not hold " + capability));
        grantRepository.delete(grant);
        auditService.record(EventType.CAPABILITY_REVOKED, revokedBy, account,
                capability, null, "Capability revoked");
        log.info("Revoked {} from {} by {}", capability, account, revokedBy);
    }

    private boolean isBootstrapAdmin(String account) {
        return properties.getAdmins().contains(account);
    }
}
