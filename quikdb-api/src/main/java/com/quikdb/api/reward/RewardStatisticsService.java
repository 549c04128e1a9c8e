package com.quikdb.api.reward;

import com.quikdb.core.domain.OperatorLedger;
import com.quikdb.core.domain.PeriodType;
import com.quikdb.core.domain.RewardRecord;
import com.quikdb.core.repository.OperatorLedgerRepository;
import com.quikdb.core.repository.PeriodAccumulatorRepository;
import com.quikdb.core.repository.RewardRecordRepository;
import com.quikdb.core.repository.SlashingRecordRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read model over the reward ledger.
 */
@Service
@Transactional(readOnly = true)
public class RewardStatisticsService {

    private final RewardRecordRepository recordRepository;
    private final OperatorLedgerRepository ledgerRepository;
    private final PeriodAccumulatorRepository accumulatorRepository;
    private final SlashingRecordRepository slashingRepository;
    private final Clock clock;

    public RewardStatisticsService(
            RewardRecordRepository recordRepository,
            OperatorLedgerRepository ledgerRepository,
            PeriodAccumulatorRepository accumulatorRepository,
            SlashingRecordRepository slashingRepository,
            Clock clock) {
        this.recordRepository = recordRepository;
        this.ledgerRepository = ledgerRepository;
        this.accumulatorRepository = accumulatorRepository;
        this.slashingRepository = slashingRepository;
        this.clock = clock;
    }

    public RewardStatistics globalStatistics() {
        return new RewardStatistics(
                orZero(recordRepository.sumAllAmounts()),
                orZero(recordRepository.sumDistributedAmounts()),
                orZero(ledgerRepository.sumTotalSlashed()),
                recordRepository.countByDistributed(false),
                recordRepository.countByDistributed(true));
    }

    public OperatorSummary operatorSummary(String operatorAddress) {
        String operator = RewardInputs.normalizeOperator(operatorAddress);
        Instant now = clock.instant();
        Optional<OperatorLedger> ledger = ledgerRepository.findByOperator(operator);
        return new OperatorSummary(
                operator,
                ledger.map(OperatorLedger::getTotalDistributed).orElse(BigInteger.ZERO),
                ledger.map(OperatorLedger::getTotalSlashed).orElse(BigInteger.ZERO),
                ledger.map(OperatorLedger::getNetEntitlement).orElse(BigInteger.ZERO),
                orZero(recordRepository.sumPendingForOperator(operator)),
                accrued(operator, PeriodType.DAY, now),
                accrued(operator, PeriodType.MONTH, now),
                ledger.map(OperatorLedger::getRewardCount).orElse(0L),
                slashingRepository.countByOperator(operator),
                ledger.map(OperatorLedger::getLastDistributionAt).orElse(null),
                ledger.map(OperatorLedger::getLastSlashAt).orElse(null));
    }

    public List<RewardRecord> rewardHistory(String operator) {
        return recordRepository.findByOperatorOrderByCalculatedAtDesc(RewardInputs.normalizeOperator(operator));
    }

    public List<RewardRecord> pendingRewards(String operator) {
        return recordRepository.findByOperatorAndDistributedFalse(RewardInputs.normalizeOperator(operator));
    }

    public Optional<RewardRecord> reward(String rewardId) {
        return recordRepository.findById(rewardId);
    }

    private BigInteger accrued(String operator, PeriodType periodType, Instant now) {
        return accumulatorRepository
                .findByOperatorAndPeriodTypeAndBucketEpoch(operator, periodType, periodType.bucketOf(now.getEpochSecond()))
                .map(a -> a.getAccruedAmount())
                .orElse(BigInteger.ZERO);
    }

    private static BigInteger orZero(BigInteger value) {
        return value == null ? BigInteger.ZERO : value;
    }

    public record RewardStatistics(
            BigInteger totalCalculated,
            BigInteger totalDistributed,
            BigInteger totalSlashed,
            long pendingCount,
            long distributedCount
    ) {}

    public record OperatorSummary(
            String operator,
            BigInteger totalDistributed,
            BigInteger totalSlashed,
            BigInteger netEntitlement,
            BigInteger pendingAmount,
            BigInteger accruedToday,
            BigInteger accruedThisMonth,
            long rewardCount,
            long slashCount,
            Instant lastDistributionAt,
            Instant lastSlashAt
    ) {}
}
