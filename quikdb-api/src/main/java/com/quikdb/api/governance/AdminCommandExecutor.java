package com.quikdb.api.governance;

import com.quikdb.api.access.CapabilityService;
import com.quikdb.api.governance.AdminCommand.GrantCapability;
import com.quikdb.api.governance.AdminCommand.RevokeCapability;
import com.quikdb.api.governance.AdminCommand.UpdateCap;
import com.quikdb.api.governance.AdminCommand.UpdateRewardInterval;
import com.quikdb.api.governance.AdminCommand.UpdateRewardProcessor;
import com.quikdb.api.governance.AdminCommand.UpdateSlashingPolicy;
import com.quikdb.core.domain.Capability;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Applies an admin command once its time lock has expired.
 */
@Component
public class AdminCommandExecutor {

    private static final List<Capability> PROCESSOR_CAPABILITIES =
            List.of(Capability.CALCULATE, Capability.DISTRIBUTE);

    private final RewardPolicyService policyService;
    private final CapabilityService capabilityService;

    public AdminCommandExecutor(RewardPolicyService policyService, CapabilityService capabilityService) {
        this.policyService = policyService;
        this.capabilityService = capabilityService;
    }

    @Transactional
    public void execute(AdminCommand command, String actor) {
        if (command instanceof UpdateCap c) {
            policyService.updateCap(c.kind(), c.value(), actor);
        } else if (command instanceof UpdateRewardInterval c) {
            policyService.updateRewardInterval(c.seconds(), actor);
        } else if (command instanceof UpdateSlashingPolicy c) {
            policyService.updateSlashingPolicy(c.threshold(), c.maxPercentage(), c.cooldownSeconds(), actor);
        } else if (command instanceof UpdateRewardProcessor c) {
            switchProcessor(c, actor);
        } else if (command instanceof GrantCapability c) {
            capabilityService.grant(c.account(), c.capability(), actor);
        } else if (command instanceof RevokeCapability c) {
            capabilityService.revoke(c.account(), c.capability(), actor);
        } else {
            throw new IllegalArgumentException("Unsupported admin command: " + command);
        }
    }

    private void switchProcessor(UpdateRewardProcessor command, String actor) {
        String previous = command.previousProcessor();
        for (Capability capability : PROCESSOR_CAPABILITIES) {
            if (previous != null && capabilityService.hasGrant(previous, capability)) {
                capabilityService.revoke(previous, capability, actor);
            }
            if (!capabilityService.hasGrant(command.newProcessor(), capability)) {
                capabilityService.grant(command.newProcessor(), capability, actor);
            }
        }
    }
}
