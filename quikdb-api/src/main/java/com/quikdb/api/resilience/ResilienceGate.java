package com.quikdb.api.resilience;

import com.quikdb.api.config.RewardProperties;
import com.quikdb.api.config.RewardProperties.RateLimit;
import com.quikdb.api.resilience.AnomalyDetectorService.AnomalyDetection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigInteger;
import java.util.function.Supplier;

/**
 * Runs a gated operation behind the emergency pause, the circuit breaker and
 * the rate limiter, in that order, and reports its outcome to the breaker.
 *
 * Callers invoke this from inside their own transaction so a rejected or
 * failed call commits nothing, the consumed rate limit slot included. The
 * outcome is counted once that transaction has completed: a commit is a
 * success, a rollback a failure. Counting happens in a transaction of its
 * own and never changes the outcome of the guarded call.
 */
@Component
public class ResilienceGate {

    private static final Logger log = LoggerFactory.getLogger(ResilienceGate.class);

    private final EmergencyPauseService pauseService;
    private final CircuitBreakerService circuitBreaker;
    private final RateLimiterService rateLimiter;
    private final AnomalyDetectorService anomalyDetector;
    private final RewardProperties properties;

    public ResilienceGate(
            EmergencyPauseService pauseService,
            CircuitBreakerService circuitBreaker,
            RateLimiterService rateLimiter,
            AnomalyDetectorService anomalyDetector,
            RewardProperties properties) {
        this.pauseService = pauseService;
        this.circuitBreaker = circuitBreaker;
        this.rateLimiter = rateLimiter;
        this.anomalyDetector = anomalyDetector;
        this.properties = properties;
    }

    public <T> T guard(String caller, String operation, Supplier<T> action) {
        pauseService.check(operation);
        circuitBreaker.check(operation);
        RateLimit limit = properties.rateLimitFor(operation);
        rateLimiter.check(caller, operation, limit.getMaxCalls(), limit.getWindowSeconds());

        countOutcome(operation);
        return action.get();
    }

    /**
     * Feeds a metric to the anomaly detector and trips the guarded
     * operation's breaker on detection.
     */
    public AnomalyDetection reportMetric(String metric, BigInteger value) {
        AnomalyDetection detection = anomalyDetector.update(metric, value);
        if (detection.detected()) {
            String reason = "Anomaly on " + metric + ": " + detection.current()
                    + " is " + detection.increasePercent() + "% over baseline " + detection.baseline();
            circuitBreaker.tripOnAnomaly(detection.guardedOperation(), reason)
                    .ifPresent(state -> log.warn("Tripped {} after anomaly on {}", state.getOperation(), metric));
        }
        return detection;
    }

    private void countOutcome(String operation) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            throw new IllegalStateException("Gated operation " + operation + " must run inside a transaction");
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                try {
                    if (status == STATUS_COMMITTED) {
                        circuitBreaker.recordSuccess(operation);
                    } else if (status == STATUS_ROLLED_BACK) {
                        circuitBreaker.recordFailure(operation);
                    }
                } catch (RuntimeException e) {
                    log.warn("Could not count outcome of {}", operation, e);
                }
            }
        });
    }
}
