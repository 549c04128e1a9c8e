package com.quikdb.api.reward;

import com.quikdb.api.access.AccessPolicy;
import com.quikdb.api.audit.AuditService;
import com.quikdb.api.config.RewardProperties;
import com.quikdb.api.error.ErrorCategory;
import com.quikdb.api.error.RewardException;
import com.quikdb.api.reward.RewardCalculatorService.CalculationRequest;
import com.quikdb.api.reward.RewardDistributorService.DistributionResult;
import com.quikdb.api.token.RewardTokenGateway;
import com.quikdb.core.domain.AuditEvent.EventType;
import com.quikdb.core.domain.Capability;
import com.quikdb.core.domain.RewardRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs calculations and distributions over many items.
 *
 * Not transactional itself: every item goes through the calculator or
 * distributor proxy and commits or rolls back on its own, reporting a
 * refused item as a failed {@link ItemOutcome}. Only a malformed batch, or
 * one where every item failed, fails as a whole.
 */
@Service
public class BatchCoordinatorService {

    private static final Logger log = LoggerFactory.getLogger(BatchCoordinatorService.class);

    private final RewardCalculatorService calculator;
    private final RewardDistributorService distributor;
    private final RewardLedgerService ledger;
    private final RewardTokenGateway tokenGateway;
    private final AccessPolicy accessPolicy;
    private final AuditService auditService;
    private final RewardProperties properties;

    public BatchCoordinatorService(
            RewardCalculatorService calculator,
            RewardDistributorService distributor,
            RewardLedgerService ledger,
            RewardTokenGateway tokenGateway,
            AccessPolicy accessPolicy,
            AuditService auditService,
            RewardProperties properties) {
        this.calculator = calculator;
        this.distributor = distributor;
        this.ledger = ledger;
        this.tokenGateway = tokenGateway;
        this.accessPolicy = accessPolicy;
        this.auditService = auditService;
        this.properties = properties;
    }

    public BatchReport batchDistribute(String caller, List<String> rewardIds) {
        accessPolicy.require(caller, Capability.DISTRIBUTE);
        requireBatchSize(rewardIds == null ? 0 : rewardIds.size());

        // First pass: total of the records that can still be settled
        List<String> distinctIds = new ArrayList<>(new LinkedHashSet<>(rewardIds));
        distinctIds.removeIf(id -> id == null || id.isBlank());
        Map<String, RewardRecord> records = ledger.findRecords(distinctIds).stream()
                .collect(Collectors.toMap(RewardRecord::getRewardId, Function.identity()));
        BigInteger pendingTotal = records.values().stream()
                .filter(r -> !r.isDistributed())
                .map(RewardRecord::getAmount)
                .reduce(BigInteger.ZERO, BigInteger::add);
        if (!tokenGateway.isMintable() && pendingTotal.signum() > 0) {
            BigInteger available = tokenGateway.availableBalance();
            if (available.compareTo(pendingTotal) < 0) {
                throw RewardException.capacity("Insufficient balance for batch: "
                        + available + " < " + pendingTotal);
            }
        }

        List<BatchItemResult> results = new ArrayList<>(rewardIds.size());
        BigInteger paid = BigInteger.ZERO;
        for (int i = 0; i < rewardIds.size(); i++) {
            String rewardId = rewardIds.get(i);
            ItemOutcome<DistributionResult> outcome;
            try {
                outcome = distributor.attemptDistribute(caller, rewardId);
            } catch (RuntimeException e) {
                // infrastructure failure, e.g. at commit; the item is rolled back
                log.error("Unexpected failure distributing {}", rewardId, e);
                results.add(BatchItemResult.failed(i, rewardId, null, e.getMessage()));
                continue;
            }
            if (outcome.success()) {
                DistributionResult result = outcome.value();
                paid = paid.add(result.amount());
                results.add(BatchItemResult.succeeded(i, rewardId, result.payoutReference(), result.amount()));
            } else {
                results.add(BatchItemResult.failed(i, rewardId, outcome.errorCategory(), outcome.failureReason()));
            }
        }
        return finish(caller, EventType.BATCH_DISTRIBUTED, results, paid);
    }

    public BatchReport batchCalculate(String caller, BatchCalculationColumns columns) {
        if (columns == null) {
            throw RewardException.validation("Batch input is required");
        }
        accessPolicy.require(caller, Capability.CALCULATE);
        requireBatchSize(columns.operators() == null ? 0 : columns.operators().size());
        return batchCalculate(caller, columns.toRequests());
    }

    public BatchReport batchCalculate(String caller, List<CalculationRequest> requests) {
        accessPolicy.require(caller, Capability.CALCULATE);
        requireBatchSize(requests == null ? 0 : requests.size());

        List<BatchItemResult> results = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            CalculationRequest request = requests.get(i);
            if (request == null) {
                results.add(BatchItemResult.failed(i, null, ErrorCategory.VALIDATION, "Missing request at index " + i));
                continue;
            }
            String key = request.operator();
            ItemOutcome<String> outcome;
            try {
                outcome = calculator.attemptCalculate(caller, request);
            } catch (RuntimeException e) {
                log.error("Unexpected failure calculating item {} for {}", i, key, e);
                results.add(BatchItemResult.failed(i, key, null, e.getMessage()));
                continue;
            }
            results.add(outcome.success()
                    ? BatchItemResult.succeeded(i, key, outcome.value(), null)
                    : BatchItemResult.failed(i, key, outcome.errorCategory(), outcome.failureReason()));
        }
        return finish(caller, EventType.BATCH_CALCULATED, results, null);
    }

    private BatchReport finish(String caller, EventType eventType, List<BatchItemResult> results,
                               BigInteger totalAmount) {
        BatchReport report = BatchReport.of(results, totalAmount);
        if (report.successCount() == 0) {
            log.warn("Batch failed completely: {} items, caller {}", results.size(), caller);
            throw new BatchFailedException(report);
        }
        auditService.record(eventType, caller, "batch", null, report.successCount() + "/" + results.size(),
                totalAmount == null ? null : "Total " + totalAmount);
        log.info("Batch {} finished: {} succeeded, {} failed",
                eventType, report.successCount(), report.failureCount());
        return report;
    }

    private void requireBatchSize(int size) {
        if (size == 0) {
            throw RewardException.validation("Empty batch");
        }
        if (size > properties.getMaxBatchSize()) {
            throw RewardException.validation("Batch too large: " + size + " > " + properties.getMaxBatchSize());
        }
    }

    /**
     * Calculation input as parallel columns. All columns must have the same
     * length; this is checked before any item runs.
     */
    public record BatchCalculationColumns(
            List<String> operators,
            List<String> nodeIds,
            List<BigInteger> baseAmounts,
            List<Integer> rewardTypes,
            List<Integer> uptimeScores,
            List<Integer> performanceScores,
            List<Integer> qualityScores,
            List<String> periods
    ) {
        public List<CalculationRequest> toRequests() {
            int size = sizeOf(operators);
            List<List<?>> columns = Arrays.asList(nodeIds, baseAmounts, rewardTypes,
                    uptimeScores, performanceScores, qualityScores, periods);
            for (List<?> column : columns) {
                if (sizeOf(column) != size) {
                    throw RewardException.validation("Array length mismatch: expected " + size
                            + " entries, got " + sizeOf(column));
                }
            }
            List<CalculationRequest> requests = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                if (rewardTypes.get(i) == null || uptimeScores.get(i) == null
                        || performanceScores.get(i) == null || qualityScores.get(i) == null) {
                    throw RewardException.validation("Missing numeric value at index " + i);
                }
                requests.add(new CalculationRequest(operators.get(i), nodeIds.get(i), baseAmounts.get(i),
                        rewardTypes.get(i), uptimeScores.get(i), performanceScores.get(i),
                        qualityScores.get(i), periods.get(i)));
            }
            return requests;
        }

        private static int sizeOf(List<?> column) {
            return column == null ? 0 : column.size();
        }
    }

    /**
     * Outcome of one batch item. {@code reference} is the reward id of a
     * calculation or the payout reference of a distribution.
     */
    public record BatchItemResult(
            int index,
            String key,
            boolean success,
            String reference,
            BigInteger amount,
            ErrorCategory errorCategory,
            String failureReason
    ) {
        static BatchItemResult succeeded(int index, String key, String reference, BigInteger amount) {
            return new BatchItemResult(index, key, true, reference, amount, null, null);
        }

        static BatchItemResult failed(int index, String key, ErrorCategory category, String reason) {
            return new BatchItemResult(index, key, false, null, null, category, reason);
        }
    }

    public record BatchReport(
            List<BatchItemResult> items,
            int successCount,
            int failureCount,
            BigInteger totalAmount
    ) {
        static BatchReport of(List<BatchItemResult> items, BigInteger totalAmount) {
            int successes = (int) items.stream().filter(BatchItemResult::success).count();
            return new BatchReport(List.copyOf(items), successes, items.size() - successes, totalAmount);
        }
    }

    public static class BatchFailedException extends RewardException {
        private final BatchReport report;

        public BatchFailedException(BatchReport report) {
            super(ErrorCategory.PRECONDITION, "Batch failed completely: " + report.failureCount() + " of "
                    + report.items().size() + " items failed");
            this.report = report;
        }

        public BatchReport getReport() {
            return report;
        }
    }
}
