package com.quikdb.api.resilience;

import com.quikdb.api.access.AccessPolicy;
import com.quikdb.api.audit.AuditService;
import com.quikdb.api.error.CircuitOpenException;
import com.quikdb.api.error.RewardException;
import com.quikdb.core.domain.AuditEvent.EventType;
import com.quikdb.core.domain.Capability;
import com.quikdb.core.domain.CircuitBreakerState;
import com.quikdb.core.repository.CircuitBreakerStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Per-operation circuit breaker.
 *
 * Counters never trip the breaker on their own. It opens only through an
 * explicit trip, by an admin or by the anomaly detector, and closes only
 * through {@link #reset(String, String)}.
 */
@Service
public class CircuitBreakerService {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerService.class);

    static final String ANOMALY_DETECTOR = "anomaly-detector";

    private final CircuitBreakerStateRepository stateRepository;
    private final AccessPolicy accessPolicy;
    private final AuditService auditService;
    private final Clock clock;

    public CircuitBreakerService(
            CircuitBreakerStateRepository stateRepository,
            AccessPolicy accessPolicy,
            AuditService auditService,
            Clock clock) {
        this.stateRepository = stateRepository;
        this.accessPolicy = accessPolicy;
        this.auditService = auditService;
        this.clock = clock;
    }

    // projections keep the row out of the caller's persistence context
    @Transactional(readOnly = true)
    public void check(String operation) {
        stateRepository.findTrippedReason(operation)
                .ifPresent(reason -> {
                    throw new CircuitOpenException(operation, reason);
                });
    }

    @Transactional(readOnly = true)
    public boolean isTripped(String operation) {
        return stateRepository.findTrippedReason(operation).isPresent();
    }

    @Transactional
    public CircuitBreakerState trip(String caller, String operation, String reason) {
        accessPolicy.require(caller, Capability.ADMIN);
        CircuitBreakerState state = tripInternal(operation, reason, caller);
        if (state == null) {
            throw RewardException.precondition("Circuit breaker already tripped: " + operation);
        }
        return state;
    }

    /**
     * Trip requested by the anomaly detector. Joins the caller's transaction
     * and leaves an already open breaker as it is.
     */
    @Transactional
    public Optional<CircuitBreakerState> tripOnAnomaly(String operation, String reason) {
        return Optional.ofNullable(tripInternal(operation, reason, ANOMALY_DETECTOR));
    }

    @Transactional
    public CircuitBreakerState reset(String caller, String operation) {
        accessPolicy.require(caller, Capability.ADMIN);
        CircuitBreakerState state = stateRepository.findForUpdate(operation)
                .orElseThrow(() -> RewardException.precondition("No circuit breaker for " + operation));
        if (!state.isTripped()) {
            throw RewardException.precondition("Circuit breaker not tripped: " + operation);
        }
        String reason = state.getReason();
        state.reset(clock.instant());
        auditService.record(EventType.CIRCUIT_RESET, caller, operation, "OPEN: " + reason, "CLOSED",
                "Circuit breaker reset");
        log.info("Circuit breaker reset for {} by {}", operation, caller);
        return stateRepository.save(state);
    }

    /**
     * Counts a failed gated call. Runs in its own transaction, after the
     * failed call has rolled back.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordFailure(String operation) {
        Instant now = clock.instant();
        CircuitBreakerState state = lockOrCreate(operation, now);
        state.recordFailure(now);
        stateRepository.save(state);
    }

    /**
     * Counts a committed gated call, in its own transaction.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordSuccess(String operation) {
        Instant now = clock.instant();
        CircuitBreakerState state = lockOrCreate(operation, now);
        state.recordSuccess(now);
        stateRepository.save(state);
    }

    @Transactional(readOnly = true)
    public BreakerStatus status(String operation) {
        return stateRepository.findById(operation)
                .map(s -> new BreakerStatus(operation, s.isTripped(), s.getReason(),
                        s.getFailureCount(), s.getSuccessCount()))
                .orElse(new BreakerStatus(operation, false, null, 0, 0));
    }

    @Transactional(readOnly = true)
    public List<CircuitBreakerState> trippedBreakers() {
        return stateRepository.findByTrippedTrue();
    }

    private CircuitBreakerState lockOrCreate(String operation, Instant now) {
        return stateRepository.findForUpdate(operation)
                .orElseGet(() -> CircuitBreakerState.closed(operation, now));
    }

    /**
     * @return the tripped breaker, or null when it was already open
     */
    private CircuitBreakerState tripInternal(String operation, String reason, String trippedBy) {
        if (reason == null || reason.isBlank()) {
            throw RewardException.validation("Trip reason is required");
        }
        Instant now = clock.instant();
        CircuitBreakerState state = lockOrCreate(operation, now);
        if (state.isTripped()) {
            return null;
        }
        state.trip(reason, trippedBy, now);
        auditService.record(EventType.CIRCUIT_TRIPPED, trippedBy, operation, "CLOSED", "OPEN", reason);
        log.warn("Circuit breaker tripped for {} by {}: {}", operation, trippedBy, reason);
        return stateRepository.save(state);
    }

    public record BreakerStatus(String operation, boolean tripped, String reason,
                                long failureCount, long successCount) {}
}
