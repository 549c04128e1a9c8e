package com.quikdb.api.resilience;

import com.quikdb.api.access.AccessPolicy;
import com.quikdb.api.audit.AuditService;
import com.quikdb.api.error.RateLimitExceededException;
import com.quikdb.api.error.RewardException;
import com.quikdb.core.domain.AuditEvent.EventType;
import com.quikdb.core.domain.Capability;
import com.quikdb.core.domain.RateLimitState;
import com.quikdb.core.repository.RateLimitStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Fixed window call budget per (caller, operation) pair.
 *
 * The window restarts once {@code now >= windowStart + windowSeconds}.
 * A rejected call does not consume budget.
 */
@Service
public class RateLimiterService {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterService.class);

    private final RateLimitStateRepository stateRepository;
    private final AccessPolicy accessPolicy;
    private final AuditService auditService;
    private final Clock clock;

    public RateLimiterService(
            RateLimitStateRepository stateRepository,
            AccessPolicy accessPolicy,
            AuditService auditService,
            Clock clock) {
        this.stateRepository = stateRepository;
        this.accessPolicy = accessPolicy;
        this.auditService = auditService;
        this.clock = clock;
    }

    /**
     * Consumes one call from the budget or fails with the current count.
     *
     * @return calls used in the current window, this one included
     */
    @Transactional
    public int check(String caller, String operation, int maxAllowed, long windowSeconds) {
        if (maxAllowed < 0 || windowSeconds <= 0) {
            throw RewardException.validation("Invalid rate limit " + maxAllowed + "/" + windowSeconds + "s");
        }
        Instant now = clock.instant();
        RateLimitState state = stateRepository.findForUpdate(caller, operation)
                .orElseGet(() -> RateLimitState.open(caller, operation, now));

        state.rollWindow(now, windowSeconds);
        if (state.isExhausted(maxAllowed)) {
            log.warn("Rate limit hit: caller={} operation={} count={} max={}",
                    caller, operation, state.getCallCount(), maxAllowed);
            throw new RateLimitExceededException(caller, operation, state.getCallCount(), maxAllowed);
        }
        state.increment();
        stateRepository.save(state);
        return state.getCallCount();
    }

    /**
     * Calls left in the current window, without consuming one.
     */
    @Transactional(readOnly = true)
    public int remaining(String caller, String operation, int maxAllowed, long windowSeconds) {
        Instant now = clock.instant();
        return stateRepository.findByCallerAndOperation(caller, operation)
                .map(state -> {
                    boolean elapsed = !now.isBefore(state.getWindowStartedAt().plusSeconds(windowSeconds));
                    int used = elapsed ? 0 : state.getCallCount();
                    return Math.max(0, maxAllowed - used);
                })
                .orElse(maxAllowed);
    }

    /**
     * Clears the window of one caller. Admin only.
     */
    @Transactional
    public void reset(String admin, String caller, String operation) {
        accessPolicy.require(admin, Capability.ADMIN);
        stateRepository.findForUpdate(caller, operation).ifPresent(state -> {
            auditService.record(EventType.RATE_LIMIT_RESET, admin, caller + ":" + operation,
                    state.getCallCount(), 0, "Rate limit window cleared");
            stateRepository.delete(state);
            log.info("Rate limit reset for caller={} operation={} by {}", caller, operation, admin);
        });
    }
}
