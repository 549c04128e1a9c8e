package com.quikdb.api.governance;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.quikdb.api.governance.RewardPolicyService.CapKind;
import com.quikdb.core.domain.Capability;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Privileged actions that can only run after a time lock.
 * The set is closed; {@link AdminCommandExecutor} dispatches each variant.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = AdminCommand.UpdateCap.class, name = "UpdateCap"),
        @JsonSubTypes.Type(value = AdminCommand.UpdateRewardInterval.class, name = "UpdateRewardInterval"),
        @JsonSubTypes.Type(value = AdminCommand.UpdateSlashingPolicy.class, name = "UpdateSlashingPolicy"),
        @JsonSubTypes.Type(value = AdminCommand.UpdateRewardProcessor.class, name = "UpdateRewardProcessor"),
        @JsonSubTypes.Type(value = AdminCommand.GrantCapability.class, name = "GrantCapability"),
        @JsonSubTypes.Type(value = AdminCommand.RevokeCapability.class, name = "RevokeCapability")
})
public sealed interface AdminCommand permits AdminCommand.UpdateCap, AdminCommand.UpdateRewardInterval,
        AdminCommand.UpdateSlashingPolicy, AdminCommand.UpdateRewardProcessor,
        AdminCommand.GrantCapability, AdminCommand.RevokeCapability {

    record UpdateCap(CapKind kind, BigInteger value) implements AdminCommand {
        public UpdateCap {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(value, "value");
        }
    }

    record UpdateRewardInterval(long seconds) implements AdminCommand {
        public UpdateRewardInterval {
            if (seconds < 0) {
                throw new IllegalArgumentException("Interval must be non-negative");
            }
        }
    }

    record UpdateSlashingPolicy(int threshold, int maxPercentage, long cooldownSeconds) implements AdminCommand {}

    /**
     * Moves the calculate and distribute capabilities from one account to another.
     * {@code previousProcessor} may be null when no processor was assigned.
     */
    record UpdateRewardProcessor(String previousProcessor, String newProcessor) implements AdminCommand {
        public UpdateRewardProcessor {
            Objects.requireNonNull(newProcessor, "newProcessor");
        }
    }

    record GrantCapability(String account, Capability capability) implements AdminCommand {
        public GrantCapability {
            Objects.requireNonNull(account, "account");
            Objects.requireNonNull(capability, "capability");
        }
    }

    record RevokeCapability(String account, Capability capability) implements AdminCommand {
        public RevokeCapability {
            Objects.requireNonNull(account, "account");
            Objects.requireNonNull(capability, "capability");
        }
    }
}
