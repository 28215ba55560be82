package tw.gc.auto.lifecycle.enums;

public enum AuditAction {
    DRIFT_EVALUATED,
    SCHEDULE_EVALUATED,
    TRIGGER_ACCEPTED,
    TRIGGER_REJECTED,
    TRIGGER_RESOLVED,
    JOB_STATE_CHANGED,
    JOB_CANCEL_REQUESTED,
    CANDIDATE_CREATED,
    VALIDATION_COMPLETED,
    DEPLOYMENT_DECIDED,
    CHAMPION_PROMOTED,
    CHAMPION_SEEDED,
    CANDIDATE_REJECTED,
    DEPLOYMENT_CONFLICT;

    /**
     * Actions that represent a decision surfaced by {@code getStatus}.
     */
    public boolean isDecision() {
        return this == TRIGGER_ACCEPTED
                || this == TRIGGER_REJECTED
                || this == VALIDATION_COMPLETED
                || this == DEPLOYMENT_DECIDED
                || this == CHAMPION_PROMOTED
                || this == CANDIDATE_REJECTED
                || this == DEPLOYMENT_CONFLICT;
    }
}
