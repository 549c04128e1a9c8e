package com.quikdb.api.reward;

import com.quikdb.api.access.AccessPolicy;
import com.quikdb.api.audit.AuditService;
import com.quikdb.api.error.RewardException;
import com.quikdb.api.resilience.ResilienceGate;
import com.quikdb.api.token.RewardTokenGateway;
import com.quikdb.core.domain.AuditEvent.EventType;
import com.quikdb.core.domain.Capability;
import com.quikdb.core.domain.OperatorLedger;
import com.quikdb.core.domain.RewardRecord;
import com.quikdb.core.repository.OperatorLedgerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.interceptor.TransactionAspectSupport;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;

/**
 * Settles ledgered rewards.
 *
 * The settlement flag, ledger totals, audit event and anomaly observation
 * are all flushed before the payout, which is the last fallible step of the
 * transaction. After it only the payout reference is written, to a record
 * row this transaction holds locked. A payout failure rolls the settlement
 * back, so a record is either paid and settled or neither.
 */
@Service
public class RewardDistributorService {

    private static final Logger log = LoggerFactory.getLogger(RewardDistributorService.class);

    public static final String OPERATION = "rewardDistribution";
    public static final String AMOUNT_METRIC = "rewardDistribution.amount";

    private final RewardLedgerService ledger;
    private final OperatorLedgerRepository ledgerRepository;
    private final RewardTokenGateway tokenGateway;
    private final ResilienceGate gate;
    private final AccessPolicy accessPolicy;
    private final AuditService auditService;
    private final Clock clock;

    public RewardDistributorService(
            RewardLedgerService ledger,
            OperatorLedgerRepository ledgerRepository,
            RewardTokenGateway tokenGateway,
            ResilienceGate gate,
            AccessPolicy accessPolicy,
            AuditService auditService,
            Clock clock) {
        this.ledger = ledger;
        this.ledgerRepository = ledgerRepository;
        this.tokenGateway = tokenGateway;
        this.gate = gate;
        this.accessPolicy = accessPolicy;
        this.auditService = auditService;
        this.clock = clock;
    }

    @Transactional
    public DistributionResult distribute(String caller, String rewardId) {
        accessPolicy.require(caller, Capability.DISTRIBUTE);
        return gate.guard(caller, OPERATION, () -> doDistribute(caller, rewardId));
    }

    /**
     * Batch variant of {@link #distribute(String, String)}; a refused check
     * or failed payout comes back as a failed outcome and nothing commits.
     */
    @Transactional
    public ItemOutcome<DistributionResult> attemptDistribute(String caller, String rewardId) {
        try {
            return ItemOutcome.succeeded(distribute(caller, rewardId));
        } catch (RewardException e) {
            TransactionAspectSupport.currentTransactionStatus().setRollbackOnly();
            return ItemOutcome.failed(e);
        }
    }

    private DistributionResult doDistribute(String caller, String rewardId) {
        RewardInputs.requireRewardId(rewardId);
        RewardRecord record = ledger.lockRecord(rewardId)
                .orElseThrow(() -> RewardException.precondition("Reward not found: " + rewardId));
        if (record.isDistributed()) {
            throw RewardException.precondition("Reward already distributed: " + rewardId);
        }

        BigInteger amount = record.getAmount();
        if (!tokenGateway.isMintable()) {
            BigInteger available = tokenGateway.availableBalance();
            if (available.compareTo(amount) < 0) {
                throw RewardException.capacity("Insufficient balance: " + available + " < " + amount);
            }
        }

        Instant now = clock.instant();
        String operator = record.getOperator();
        OperatorLedger operatorLedger = ledger.lockLedger(operator);
        BigInteger totalBefore = operatorLedger.getTotalDistributed();
        operatorLedger.recordDistribution(amount, now);
        record.markDistributed(now);

        auditService.record(EventType.REWARD_DISTRIBUTED, caller, rewardId, totalBefore,
                operatorLedger.getTotalDistributed(), amount + " settled to " + operator);
        gate.reportMetric(AMOUNT_METRIC, amount);
        ledgerRepository.flush();

        String payoutReference = tokenGateway.payout(operator, amount);
        record.attachPayoutReference(payoutReference);
        log.info("Distributed reward {} of {} to {} ({})", rewardId, amount, operator, payoutReference);

        return new DistributionResult(rewardId, operator, amount, payoutReference, now);
    }

    public record DistributionResult(
            String rewardId,
            String operator,
            BigInteger amount,
            String payoutReference,
            Instant distributedAt
    ) {}
}
