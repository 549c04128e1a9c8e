package com.quikdb.api.resilience;

import com.quikdb.api.access.AccessPolicy;
import com.quikdb.api.audit.AuditService;
import com.quikdb.api.error.RewardException;
import com.quikdb.core.domain.AnomalyBaseline;
import com.quikdb.core.domain.AuditEvent.EventType;
import com.quikdb.core.domain.Capability;
import com.quikdb.core.repository.AnomalyBaselineRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Baseline-versus-current comparison per metric.
 *
 * An observation more than {@value #THRESHOLD_PERCENT}% above the baseline is
 * an anomaly. Observations never move the baseline; only
 * {@link #recalibrate(String, String, BigInteger, String)} does.
 */
@Service
public class AnomalyDetectorService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectorService.class);

    public static final long THRESHOLD_PERCENT = 50;

    private static final BigInteger HUNDRED = BigInteger.valueOf(100);
    private static final BigInteger THRESHOLD = BigInteger.valueOf(THRESHOLD_PERCENT);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private final AnomalyBaselineRepository baselineRepository;
    private final AccessPolicy accessPolicy;
    private final AuditService auditService;
    private final Clock clock;

    public AnomalyDetectorService(
            AnomalyBaselineRepository baselineRepository,
            AccessPolicy accessPolicy,
            AuditService auditService,
            Clock clock) {
        this.baselineRepository = baselineRepository;
        this.accessPolicy = accessPolicy;
        this.auditService = auditService;
        this.clock = clock;
    }

    /**
     * Records an observation and reports whether it is anomalous.
     * Metrics without a positive baseline never detect.
     */
    @Transactional
    public AnomalyDetection update(String metric, BigInteger currentValue) {
        Optional<AnomalyBaseline> found = baselineRepository.findForUpdate(metric);
        if (found.isEmpty() || found.get().getBaselineValue().signum() <= 0) {
            return AnomalyDetection.none(metric, currentValue);
        }
        AnomalyBaseline baseline = found.get();
        Instant now = clock.instant();

        BigInteger exactIncrease = increasePercent(baseline.getBaselineValue(), currentValue);
        boolean anomalous = exactIncrease != null && exactIncrease.compareTo(THRESHOLD) > 0;
        Long increase = saturate(exactIncrease);
        baseline.observe(currentValue, increase, anomalous, now);
        baselineRepository.save(baseline);

        if (anomalous) {
            auditService.record(EventType.ANOMALY_DETECTED, CircuitBreakerService.ANOMALY_DETECTOR, metric,
                    baseline.getBaselineValue(), currentValue, "Increase of " + exactIncrease + "%");
            log.warn("Anomaly on {}: baseline={} current={} increase={}%",
                    metric, baseline.getBaselineValue(), currentValue, exactIncrease);
        }
        return new AnomalyDetection(metric, anomalous, baseline.getBaselineValue(), currentValue,
                increase, baseline.getGuardedOperation());
    }

    @Transactional
    public AnomalyBaseline recalibrate(String caller, String metric, BigInteger baselineValue,
                                       String guardedOperation) {
        accessPolicy.require(caller, Capability.ADMIN);
        if (metric == null || metric.isBlank()) {
            throw RewardException.validation("Metric is required");
        }
        if (baselineValue == null || baselineValue.signum() < 0) {
            throw RewardException.validation("Baseline must be non-negative");
        }
        if (guardedOperation == null || guardedOperation.isBlank()) {
            throw RewardException.validation("Guarded operation is required");
        }
        Instant now = clock.instant();
        Optional<AnomalyBaseline> existing = baselineRepository.findById(metric);
        BigInteger previous = existing.map(AnomalyBaseline::getBaselineValue).orElse(null);
        AnomalyBaseline baseline = existing
                .map(b -> {
                    b.recalibrate(baselineValue, guardedOperation, now);
                    return b;
                })
                .orElseGet(() -> AnomalyBaseline.calibrate(metric, baselineValue, guardedOperation, now));
        auditService.record(EventType.ANOMALY_BASELINE_RECALIBRATED, caller, metric,
                previous, baselineValue, "Guards " + guardedOperation);
        log.info("Baseline for {} set to {} by {}", metric, baselineValue, caller);
        return baselineRepository.save(baseline);
    }

    @Transactional(readOnly = true)
    public Optional<AnomalyBaseline> baseline(String metric) {
        return baselineRepository.findById(metric);
    }

    @Transactional(readOnly = true)
    public List<AnomalyBaseline> detectedAnomalies() {
        return baselineRepository.findByDetectedTrue();
    }

    /**
     * Whole-percent increase over the baseline, truncated; null when the
     * value did not grow.
     */
    static BigInteger increasePercent(BigInteger baseline, BigInteger current) {
        if (current.compareTo(baseline) <= 0) {
            return null;
        }
        return current.subtract(baseline).multiply(HUNDRED).divide(baseline);
    }

    /**
     * Narrows an increase for storage, capping at {@link Long#MAX_VALUE}.
     */
    static Long saturate(BigInteger increase) {
        if (increase == null) {
            return null;
        }
        return increase.compareTo(LONG_MAX) > 0 ? Long.MAX_VALUE : increase.longValue();
    }

    public record AnomalyDetection(
            String metric,
            boolean detected,
            BigInteger baseline,
            BigInteger current,
            Long increasePercent,
            String guardedOperation
    ) {
        static AnomalyDetection none(String metric, BigInteger current) {
            return new AnomalyDetection(metric, false, null, current, null, null);
        }
    }
}
