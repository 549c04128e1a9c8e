package com.quikdb.api.reward;

import com.quikdb.api.access.AccessPolicy;
import com.quikdb.api.audit.AuditService;
import com.quikdb.api.error.RewardException;
import com.quikdb.api.governance.RewardPolicyService;
import com.quikdb.api.node.NodeDirectory;
import com.quikdb.api.node.NodeInfo;
import com.quikdb.api.resilience.ResilienceGate;
import com.quikdb.core.domain.AuditEvent.EventType;
import com.quikdb.core.domain.Capability;
import com.quikdb.core.domain.OperatorLedger;
import com.quikdb.core.domain.RewardPolicy;
import com.quikdb.core.domain.RewardRecord;
import com.quikdb.core.domain.RewardType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.interceptor.TransactionAspectSupport;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;

/**
 * Turns a base reward and three performance signals into a pending,
 * capped reward record.
 */
@Service
public class RewardCalculatorService {

    private static final Logger log = LoggerFactory.getLogger(RewardCalculatorService.class);

    public static final String OPERATION = "rewardCalculation";
    public static final String AMOUNT_METRIC = "rewardCalculation.amount";

    private static final int MAX_PERIOD_LENGTH = 64;

    private final RewardLedgerService ledger;
    private final RewardPolicyService policyService;
    private final PerformanceScorer scorer;
    private final RewardIdGenerator idGenerator;
    private final NodeDirectory nodeDirectory;
    private final ResilienceGate gate;
    private final AccessPolicy accessPolicy;
    private final AuditService auditService;
    private final Clock clock;

    public RewardCalculatorService(
            RewardLedgerService ledger,
            RewardPolicyService policyService,
            PerformanceScorer scorer,
            RewardIdGenerator idGenerator,
            NodeDirectory nodeDirectory,
            ResilienceGate gate,
            AccessPolicy accessPolicy,
            AuditService auditService,
            Clock clock) {
        this.ledger = ledger;
        this.policyService = policyService;
        this.scorer = scorer;
        this.idGenerator = idGenerator;
        this.nodeDirectory = nodeDirectory;
        this.gate = gate;
        this.accessPolicy = accessPolicy;
        this.auditService = auditService;
        this.clock = clock;
    }

    /**
     * Calculates and ledgers a reward.
     *
     * @return the id of the pending reward record
     * @throws RewardException on the first failed check; nothing is committed
     */
    @Transactional
    public String calculate(String caller, CalculationRequest request) {
        accessPolicy.require(caller, Capability.CALCULATE);
        return gate.guard(caller, OPERATION, () -> doCalculate(caller, request));
    }

    /**
     * Batch variant of {@link #calculate(String, CalculationRequest)} that
     * returns a refused check as a failed outcome and rolls back its own
     * transaction.
     */
    @Transactional
    public ItemOutcome<String> attemptCalculate(String caller, CalculationRequest request) {
        try {
            return ItemOutcome.succeeded(calculate(caller, request));
        } catch (RewardException e) {
            TransactionAspectSupport.currentTransactionStatus().setRollbackOnly();
            return ItemOutcome.failed(e);
        }
    }

    @Transactional
    public String calculate(String caller, String operator, String nodeId, BigInteger baseAmount,
                            RewardType rewardType, int uptime, int performance, int quality, String period) {
        return calculate(caller, new CalculationRequest(operator, nodeId, baseAmount,
                rewardType.getCode(), uptime, performance, quality, period));
    }

    private String doCalculate(String caller, CalculationRequest request) {
        validateIdentifiers(request);
        String operator = RewardInputs.normalizeOperator(request.operator());
        PerformanceScorer.requireScore("uptime", request.uptimeScore());
        PerformanceScorer.requireScore("performance", request.performanceScore());
        PerformanceScorer.requireScore("quality", request.qualityScore());
        if (!RewardType.isValidCode(request.rewardType())) {
            throw RewardException.validation("Invalid reward type: " + request.rewardType());
        }
        RewardType rewardType = RewardType.fromCode(request.rewardType());

        RewardPolicy policy = policyService.current();
        requireWithinBounds("Base amount", request.baseAmount(), policy);

        Instant now = clock.instant();
        OperatorLedger operatorLedger = ledger.lockLedger(operator);
        Instant last = operatorLedger.getLastCalculationAt();
        if (last != null && now.isBefore(last.plusSeconds(policy.getMinRewardIntervalSeconds()))) {
            throw RewardException.precondition("Reward too recent for " + operator
                    + ", next allowed at " + last.plusSeconds(policy.getMinRewardIntervalSeconds()));
        }
        if (!ledger.isEligibleForRewards(operator, policy, now)) {
            throw RewardException.precondition("Operator in slashing cooldown: " + operator);
        }

        int overall = scorer.score(request.uptimeScore(), request.performanceScore(), request.qualityScore());
        BigInteger adjusted = scorer.adjust(request.baseAmount(), overall);
        requireWithinBounds("Adjusted amount", adjusted, policy);

        ledger.accrue(operator, adjusted, now, policy);
        operatorLedger.recordCalculation(now);

        String rewardId = idGenerator.generate(operator, request.nodeId(), adjusted, now,
                rewardType, request.period());
        ledger.insertRecord(RewardRecord.create(rewardId, operator, request.nodeId(),
                request.baseAmount(), adjusted, rewardType,
                request.uptimeScore(), request.performanceScore(), request.qualityScore(), overall,
                request.period(), now));

        auditService.record(EventType.REWARD_CALCULATED, caller, rewardId, request.baseAmount(), adjusted,
                rewardType + " for " + operator + " on " + request.nodeId() + ", score " + overall);
        log.info("Calculated reward {} of {} for {} (score {})", rewardId, adjusted, operator, overall);

        gate.reportMetric(AMOUNT_METRIC, adjusted);
        return rewardId;
    }

    private void validateIdentifiers(CalculationRequest request) {
        RewardInputs.requireOperator(request.operator());
        RewardInputs.requireNodeId(request.nodeId());
        if (request.period() != null && request.period().length() > MAX_PERIOD_LENGTH) {
            throw RewardException.validation("Period label too long");
        }
        if (!nodeDirectory.nodeExists(request.nodeId())) {
            throw RewardException.validation("Node not found: " + request.nodeId());
        }
        NodeInfo node = nodeDirectory.getNodeInfo(request.nodeId())
                .orElseThrow(() -> RewardException.validation("Node not found: " + request.nodeId()));
        if (node.status() == null || !node.status().isRewardable()) {
            throw RewardException.validation("Node not active: " + request.nodeId() + " is " + node.status());
        }
    }

    private static void requireWithinBounds(String label, BigInteger amount, RewardPolicy policy) {
        if (amount == null) {
            throw RewardException.validation(label + " is required");
        }
        if (amount.compareTo(policy.getMinRewardAmount()) < 0 || amount.compareTo(policy.getMaxRewardAmount()) > 0) {
            throw RewardException.validation(label + " " + amount + " outside ["
                    + policy.getMinRewardAmount() + ", " + policy.getMaxRewardAmount() + "]");
        }
    }

    /**
     * One calculation input. {@code rewardType} is the wire code so that
     * out-of-range values can be reported per item.
     */
    public record CalculationRequest(
            String operator,
            String nodeId,
            BigInteger baseAmount,
            int rewardType,
            int uptimeScore,
            int performanceScore,
            int qualityScore,
            String period
    ) {}
}
