package com.quikdb.core.domain;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Kill-switch for a named subsystem.
 * The stored duration is informational; the pause holds until deactivated.
 */
@Entity
@Table(name = "emergency_pause_states")
public class EmergencyPauseState {

    @Id
    @Column(name = "subsystem", length = 64)
    private String subsystem;

    @Column(nullable = false)
    private boolean active;

    @Column(length = 512)
    private String reason;

    @Column(name = "activated_at")
    private Instant activatedAt;

    @Column(name = "duration_seconds", nullable = false)
    private long durationSeconds;

    @Column(name = "activated_by", length = 128)
    private String activatedBy;

    @Column(name = "deactivated_at")
    private Instant deactivatedAt;

    @Column(name = "deactivated_by", length = 128)
    private String deactivatedBy;

    @Version
    private Long version;

    protected EmergencyPauseState() {}

    public static EmergencyPauseState inactive(String subsystem) {
        var state = new EmergencyPauseState();
        state.subsystem = subsystem;
        state.active = false;
        state.durationSeconds = 0;
        return state;
    }

    public void activate(String reason, long durationSeconds, String activatedBy, Instant now) {
        this.active = true;
        this.reason = reason;
        this.durationSeconds = durationSeconds;
        this.activatedBy = activatedBy;
        this.activatedAt = now;
        this.deactivatedAt = null;
        this.deactivatedBy = null;
    }

    public void deactivate(String deactivatedBy, Instant now) {
        this.active = false;
        this.deactivatedBy = deactivatedBy;
        this.deactivatedAt = now;
    }

    /**
     * When the stated duration runs out. Not used to lift the pause.
     */
    public Instant getNominalEnd() {
        return activatedAt == null ? null : activatedAt.plusSeconds(durationSeconds);
    }

    // Getters
    public String getSubsystem() { return subsystem; }
    public boolean isActive() { return active; }
    public String getReason() { return reason; }
    public Instant getActivatedAt() { return activatedAt; }
    public long getDurationSeconds() { return durationSeconds; }
    public String getActivatedBy() { return activatedBy; }
    public Instant getDeactivatedAt() { return deactivatedAt; }
    public String getDeactivatedBy() { return deactivatedBy; }
}
