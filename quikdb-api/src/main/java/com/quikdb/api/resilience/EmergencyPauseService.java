package com.quikdb.api.resilience;

import com.quikdb.api.access.AccessPolicy;
import com.quikdb.api.audit.AuditService;
import com.quikdb.api.error.RewardException;
import com.quikdb.api.error.SubsystemPausedException;
import com.quikdb.core.domain.AuditEvent.EventType;
import com.quikdb.core.domain.Capability;
import com.quikdb.core.domain.EmergencyPauseState;
import com.quikdb.core.repository.EmergencyPauseStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * Named kill-switches. A pause stays active until deactivated; its duration
 * is recorded for operators but never lifts the pause by itself.
 */
@Service
public class EmergencyPauseService {

    private static final Logger log = LoggerFactory.getLogger(EmergencyPauseService.class);

    /** Pausing this subsystem halts every gated operation. */
    public static final String GLOBAL = "global";

    private final EmergencyPauseStateRepository stateRepository;
    private final AccessPolicy accessPolicy;
    private final AuditService auditService;
    private final Clock clock;

    public EmergencyPauseService(
            EmergencyPauseStateRepository stateRepository,
            AccessPolicy accessPolicy,
            AuditService auditService,
            Clock clock) {
        this.stateRepository = stateRepository;
        this.accessPolicy = accessPolicy;
        this.auditService = auditService;
        this.clock = clock;
    }

    @Transactional
    public EmergencyPauseState activate(String caller, String subsystem, String reason, long durationSeconds) {
        accessPolicy.require(caller, Capability.ADMIN);
        if (subsystem == null || subsystem.isBlank()) {
            throw RewardException.validation("Subsystem is required");
        }
        if (reason == null || reason.isBlank()) {
            throw RewardException.validation("Pause reason is required");
        }
        if (durationSeconds <= 0) {
            throw RewardException.validation("Pause duration must be positive");
        }
        EmergencyPauseState state = stateRepository.findById(subsystem)
                .orElseGet(() -> EmergencyPauseState.inactive(subsystem));
        if (state.isActive()) {
            throw RewardException.precondition("Subsystem already paused: " + subsystem);
        }
        state.activate(reason, durationSeconds, caller, clock.instant());
        auditService.record(EventType.EMERGENCY_PAUSE_ACTIVATED, caller, subsystem,
                "inactive", "active", reason + " (" + durationSeconds + "s)");
        log.warn("Emergency pause activated for {} by {}: {}", subsystem, caller, reason);
        return stateRepository.save(state);
    }

    @Transactional
    public EmergencyPauseState deactivate(String caller, String subsystem) {
        accessPolicy.require(caller, Capability.ADMIN);
        EmergencyPauseState state = stateRepository.findById(subsystem)
                .filter(EmergencyPauseState::isActive)
                .orElseThrow(() -> RewardException.precondition("Subsystem not paused: " + subsystem));
        state.deactivate(caller, clock.instant());
        auditService.record(EventType.EMERGENCY_PAUSE_DEACTIVATED, caller, subsystem,
                "active", "inactive", "Emergency pause lifted");
        log.info("Emergency pause deactivated for {} by {}", subsystem, caller);
        return stateRepository.save(state);
    }

    /**
     * Fails when the subsystem or the global switch is paused.
     */
    @Transactional(readOnly = true)
    public void check(String subsystem) {
        checkSingle(GLOBAL);
        if (!GLOBAL.equals(subsystem)) {
            checkSingle(subsystem);
        }
    }

    @Transactional(readOnly = true)
    public boolean isPaused(String subsystem) {
        return stateRepository.findById(subsystem).map(EmergencyPauseState::isActive).orElse(false);
    }

    @Transactional(readOnly = true)
    public List<EmergencyPauseState> activePauses() {
        return stateRepository.findByActiveTrue();
    }

    private void checkSingle(String subsystem) {
        stateRepository.findById(subsystem)
                .filter(EmergencyPauseState::isActive)
                .ifPresent(state -> {
                    throw new SubsystemPausedException(subsystem, state.getReason());
                });
    }
}
