package com.quikdb.api.reward;

import com.quikdb.api.audit.AuditService;
import com.quikdb.api.error.RewardException;
import com.quikdb.core.domain.AuditEvent.EventType;
import com.quikdb.core.domain.OperatorLedger;
import com.quikdb.core.domain.PeriodAccumulator;
import com.quikdb.core.domain.PeriodType;
import com.quikdb.core.domain.RewardPolicy;
import com.quikdb.core.domain.RewardRecord;
import com.quikdb.core.repository.OperatorLedgerRepository;
import com.quikdb.core.repository.PeriodAccumulatorRepository;
import com.quikdb.core.repository.RewardRecordRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable store of reward records, operator totals and period buckets.
 *
 * Every write happens inside the caller's transaction, on rows loaded with a
 * pessimistic write lock, so a read-check-write sequence on one record,
 * operator or bucket is never interleaved with another.
 */
@Service
@Transactional(propagation = Propagation.MANDATORY)
public class RewardLedgerService {

    private final RewardRecordRepository recordRepository;
    private final OperatorLedgerRepository ledgerRepository;
    private final PeriodAccumulatorRepository accumulatorRepository;
    private final AuditService auditService;

    public RewardLedgerService(
            RewardRecordRepository recordRepository,
            OperatorLedgerRepository ledgerRepository,
            PeriodAccumulatorRepository accumulatorRepository,
            AuditService auditService) {
        this.recordRepository = recordRepository;
        this.ledgerRepository = ledgerRepository;
        this.accumulatorRepository = accumulatorRepository;
        this.auditService = auditService;
    }

    public OperatorLedger lockLedger(String operator) {
        return ledgerRepository.findForUpdate(operator)
                .orElseGet(() -> ledgerRepository.save(OperatorLedger.open(operator)));
    }

    /**
     * Adds an amount to the operator's day and month buckets, or to neither
     * when either cap would be exceeded.
     */
    public void accrue(String operator, BigInteger amount, Instant now, RewardPolicy policy) {
        long epochSecond = now.getEpochSecond();
        PeriodAccumulator day = lockBucket(operator, PeriodType.DAY, epochSecond);
        PeriodAccumulator month = lockBucket(operator, PeriodType.MONTH, epochSecond);

        if (day.wouldExceed(amount, policy.getMaxDailyRewards())) {
            throw RewardException.capacity("Daily reward cap exceeded: " + day.getAccruedAmount()
                    + " + " + amount + " > " + policy.getMaxDailyRewards());
        }
        if (month.wouldExceed(amount, policy.getMaxMonthlyRewards())) {
            throw RewardException.capacity("Monthly reward cap exceeded: " + month.getAccruedAmount()
                    + " + " + amount + " > " + policy.getMaxMonthlyRewards());
        }
        BigInteger dayBefore = day.getAccruedAmount();
        day.accrue(amount, policy.getMaxDailyRewards());
        month.accrue(amount, policy.getMaxMonthlyRewards());
        accumulatorRepository.save(day);
        accumulatorRepository.save(month);
        auditService.record(EventType.PERIOD_ACCRUED, operator, operator + ":DAY:" + day.getBucketEpoch(),
                dayBefore, day.getAccruedAmount(), "Month bucket " + month.getBucketEpoch()
                        + " at " + month.getAccruedAmount());
    }

    /**
     * Persists a new record. An existing record with the same id is never
     * overwritten.
     */
    public RewardRecord insertRecord(RewardRecord record) {
        if (recordRepository.existsById(record.getRewardId())) {
            throw RewardException.collision("Reward id collision: " + record.getRewardId());
        }
        return recordRepository.save(record);
    }

    public Optional<RewardRecord> lockRecord(String rewardId) {
        return recordRepository.findForUpdate(rewardId);
    }

    /**
     * False until the slashing cooldown has passed since the last slash.
     */
    @Transactional(readOnly = true, propagation = Propagation.REQUIRED)
    public boolean isEligibleForRewards(String operator, RewardPolicy policy, Instant now) {
        return ledgerRepository.findByOperator(operator)
                .map(OperatorLedger::getLastSlashAt)
                .map(lastSlash -> !now.isBefore(lastSlash.plusSeconds(policy.getSlashingCooldownSeconds())))
                .orElse(true);
    }

    @Transactional(readOnly = true, propagation = Propagation.REQUIRED)
    public List<RewardRecord> findRecords(List<String> rewardIds) {
        return recordRepository.findAllById(rewardIds);
    }

    private PeriodAccumulator lockBucket(String operator, PeriodType periodType, long epochSecond) {
        long bucket = periodType.bucketOf(epochSecond);
        return accumulatorRepository.findForUpdate(operator, periodType, bucket)
                .orElseGet(() -> PeriodAccumulator.open(operator, periodType, bucket));
    }
}
