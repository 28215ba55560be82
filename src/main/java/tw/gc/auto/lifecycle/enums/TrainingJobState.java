package tw.gc.auto.lifecycle.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Training job state machine.
 *
 * <pre>
 * PENDING → RUNNING → SUCCEEDED
 *              ↓
 *           FAILED ──(retryable, retries left)──→ PENDING
 * </pre>
 */
public enum TrainingJobState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED;

    public static final Set<TrainingJobState> ACTIVE = EnumSet.of(PENDING, RUNNING);

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public boolean canTransitionTo(TrainingJobState next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == FAILED;
            case RUNNING -> next == SUCCEEDED || next == FAILED;
            case FAILED -> next == PENDING;
            case SUCCEEDED -> false;
        };
    }
}
