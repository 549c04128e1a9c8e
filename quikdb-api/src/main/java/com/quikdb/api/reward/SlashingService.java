package com.quikdb.api.reward;

import com.quikdb.api.access.AccessPolicy;
import com.quikdb.api.audit.AuditService;
import com.quikdb.api.error.RewardException;
import com.quikdb.api.governance.RewardPolicyService;
import com.quikdb.api.resilience.ResilienceGate;
import com.quikdb.core.domain.AuditEvent.EventType;
import com.quikdb.core.domain.Capability;
import com.quikdb.core.domain.OperatorLedger;
import com.quikdb.core.domain.RewardPolicy;
import com.quikdb.core.domain.SlashingRecord;
import com.quikdb.core.repository.SlashingRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Penalizes under-performing operators.
 *
 * A slash only reduces the operator's accounted entitlement; it moves no
 * funds. It is bounded by a share of everything ever distributed to the
 * operator and starts a cooldown during which new rewards are refused.
 */
@Service
public class SlashingService {

    private static final Logger log = LoggerFactory.getLogger(SlashingService.class);

    public static final String OPERATION = "slashing";

    private static final BigInteger HUNDRED = BigInteger.valueOf(100);

    private final RewardLedgerService ledger;
    private final SlashingRecordRepository slashingRepository;
    private final RewardPolicyService policyService;
    private final PerformanceScorer scorer;
    private final ResilienceGate gate;
    private final AccessPolicy accessPolicy;
    private final AuditService auditService;
    private final Clock clock;

    public SlashingService(
            RewardLedgerService ledger,
            SlashingRecordRepository slashingRepository,
            RewardPolicyService policyService,
            PerformanceScorer scorer,
            ResilienceGate gate,
            AccessPolicy accessPolicy,
            AuditService auditService,
            Clock clock) {
        this.ledger = ledger;
        this.slashingRepository = slashingRepository;
        this.policyService = policyService;
        this.scorer = scorer;
        this.gate = gate;
        this.accessPolicy = accessPolicy;
        this.auditService = auditService;
        this.clock = clock;
    }

    @Transactional
    public SlashResult slash(String caller, String operator, BigInteger amount, String reason,
                             int uptime, int performance, int quality) {
        accessPolicy.require(caller, Capability.SLASH);
        return gate.guard(caller, OPERATION,
                () -> doSlash(caller, operator, amount, reason, uptime, performance, quality));
    }

    private SlashResult doSlash(String caller, String operatorAddress, BigInteger amount, String reason,
                                int uptime, int performance, int quality) {
        String operator = RewardInputs.normalizeOperator(operatorAddress);
        if (amount == null || amount.signum() <= 0) {
            throw RewardException.validation("Slash amount must be positive");
        }
        if (reason == null || reason.isBlank() || reason.length() > RewardInputs.MAX_REASON_LENGTH) {
            throw RewardException.validation("Slash reason is required and at most "
                    + RewardInputs.MAX_REASON_LENGTH + " characters");
        }
        int overall = scorer.score(uptime, performance, quality);

        RewardPolicy policy = policyService.current();
        if (overall >= policy.getSlashingThreshold()) {
            throw RewardException.precondition("Slashing threshold not met: score " + overall
                    + " >= " + policy.getSlashingThreshold());
        }

        OperatorLedger operatorLedger = ledger.lockLedger(operator);
        BigInteger maxSlashing = operatorLedger.getTotalDistributed()
                .multiply(BigInteger.valueOf(policy.getMaxSlashingPercentage()))
                .divide(HUNDRED);
        if (amount.compareTo(maxSlashing) > 0) {
            throw RewardException.capacity("Excessive slashing: " + amount + " > " + maxSlashing);
        }

        Instant now = clock.instant();
        BigInteger slashedBefore = operatorLedger.getTotalSlashed();
        operatorLedger.recordSlash(amount, now);
        slashingRepository.save(SlashingRecord.create(operator, amount, reason,
                uptime, performance, quality, overall, caller, now));

        auditService.record(EventType.OPERATOR_SLASHED, caller, operator, slashedBefore,
                operatorLedger.getTotalSlashed(), reason);
        log.warn("Slashed {} from {} (score {}) by {}: {}", amount, operator, overall, caller, reason);

        return new SlashResult(operator, amount, operatorLedger.getTotalSlashed(), overall,
                now.plusSeconds(policy.getSlashingCooldownSeconds()));
    }

    @Transactional
    public boolean isEligibleForRewards(String operator) {
        return ledger.isEligibleForRewards(RewardInputs.normalizeOperator(operator),
                policyService.current(), clock.instant());
    }

    @Transactional(readOnly = true)
    public List<SlashingRecord> slashingHistory(String operator) {
        return slashingRepository.findByOperatorOrderBySlashedAtDesc(RewardInputs.normalizeOperator(operator));
    }

    public record SlashResult(
            String operator,
            BigInteger amount,
            BigInteger totalSlashed,
            int overallScore,
            Instant eligibleAgainAt
    ) {}
}
