package com.quikdb.api.governance;

import com.quikdb.api.audit.AuditService;
import com.quikdb.api.config.RewardProperties;
import com.quikdb.api.error.RewardException;
import com.quikdb.core.domain.AuditEvent.EventType;
import com.quikdb.core.domain.RewardPolicy;
import com.quikdb.core.repository.RewardPolicyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.function.Consumer;

/**
 * Economic parameters of the reward engine.
 *
 * The policy row is seeded from {@code quikdb.rewards} the first time it is
 * read. Updates are only reachable through executed time-locked commands.
 */
@Service
public class RewardPolicyService {

    private static final Logger log = LoggerFactory.getLogger(RewardPolicyService.class);

    private final RewardPolicyRepository policyRepository;
    private final RewardProperties properties;
    private final AuditService auditService;
    private final Clock clock;

    public RewardPolicyService(
            RewardPolicyRepository policyRepository,
            RewardProperties properties,
            AuditService auditService,
            Clock clock) {
        this.policyRepository = policyRepository;
        this.properties = properties;
        this.auditService = auditService;
        this.clock = clock;
    }

    @Transactional
    public RewardPolicy current() {
        return policyRepository.findById(RewardPolicy.DEFAULT_ID)
                .orElseGet(this::seed);
    }

    @Transactional
    public RewardPolicy updateCap(CapKind kind, BigInteger value, String actor) {
        if (value == null) {
            throw RewardException.validation("Cap value is required");
        }
        RewardPolicy policy = current();
        Instant now = clock.instant();
        BigInteger before = switch (kind) {
            case MIN_REWARD_AMOUNT -> policy.getMinRewardAmount();
            case MAX_REWARD_AMOUNT -> policy.getMaxRewardAmount();
            case MAX_DAILY_REWARDS -> policy.getMaxDailyRewards();
            case MAX_MONTHLY_REWARDS -> policy.getMaxMonthlyRewards();
        };
        apply(policy, p -> {
            switch (kind) {
                case MIN_REWARD_AMOUNT -> p.updateMinRewardAmount(value, now);
                case MAX_REWARD_AMOUNT -> p.updateMaxRewardAmount(value, now);
                case MAX_DAILY_REWARDS -> p.updateMaxDailyRewards(value, now);
                case MAX_MONTHLY_REWARDS -> p.updateMaxMonthlyRewards(value, now);
            }
        });
        return saveAndAudit(policy, actor, kind.name(), before, value);
    }

    @Transactional
    public RewardPolicy updateRewardInterval(long seconds, String actor) {
        RewardPolicy policy = current();
        long before = policy.getMinRewardIntervalSeconds();
        apply(policy, p -> p.updateMinRewardInterval(seconds, clock.instant()));
        return saveAndAudit(policy, actor, "MIN_REWARD_INTERVAL", before, seconds);
    }

    @Transactional
    public RewardPolicy updateSlashingPolicy(int threshold, int maxPercentage, long cooldownSeconds, String actor) {
        RewardPolicy policy = current();
        String before = policy.getSlashingThreshold() + "/" + policy.getMaxSlashingPercentage()
                + "%/" + policy.getSlashingCooldownSeconds() + "s";
        apply(policy, p -> p.updateSlashing(threshold, maxPercentage, cooldownSeconds, clock.instant()));
        String after = threshold + "/" + maxPercentage + "%/" + cooldownSeconds + "s";
        return saveAndAudit(policy, actor, "SLASHING_POLICY", before, after);
    }

    private void apply(RewardPolicy policy, Consumer<RewardPolicy> change) {
        try {
            change.accept(policy);
        } catch (IllegalArgumentException e) {
            throw RewardException.validation(e.getMessage());
        }
    }

    private RewardPolicy saveAndAudit(RewardPolicy policy, String actor, String field, Object before, Object after) {
        RewardPolicy saved = policyRepository.save(policy);
        auditService.record(EventType.POLICY_UPDATED, actor, field, before, after, "Reward policy updated");
        log.info("Reward policy {} changed from {} to {} by {}", field, before, after, actor);
        return saved;
    }

    private RewardPolicy seed() {
        RewardPolicy policy = RewardPolicy.seed(
                properties.getMinRewardAmount(),
                properties.getMaxRewardAmount(),
                properties.getMaxDailyRewards(),
                properties.getMaxMonthlyRewards(),
                properties.getMinRewardIntervalSeconds(),
                properties.getSlashingThreshold(),
                properties.getMaxSlashingPercentage(),
                properties.getSlashingCooldownSeconds(),
                clock.instant());
        log.info("Seeded reward policy from configuration");
        return policyRepository.save(policy);
    }

    public enum CapKind {
        MIN_REWARD_AMOUNT,
        MAX_REWARD_AMOUNT,
        MAX_DAILY_REWARDS,
        MAX_MONTHLY_REWARDS
    }
}
