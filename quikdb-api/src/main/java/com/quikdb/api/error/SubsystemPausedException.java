package com.quikdb.api.error;

public class SubsystemPausedException extends RewardException {

    private final String subsystem;
    private final String reason;

    public SubsystemPausedException(String subsystem, String reason) {
        super(ErrorCategory.PRECONDITION, "Subsystem paused: " + subsystem + " (" + reason + ")");
        this.subsystem = subsystem;
        this.reason = reason;
    }

    public String getSubsystem() { return subsystem; }
    public String getReason() { return reason; }
}
