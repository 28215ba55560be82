package tw.gc.auto.lifecycle.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tw.gc.auto.lifecycle.enums.FailureCode;
import tw.gc.auto.lifecycle.enums.TrainingJobState;
import tw.gc.auto.lifecycle.enums.TriggerCause;

import java.time.LocalDateTime;

/**
 * One retraining attempt series. Retries reuse the same job id with an incremented
 * {@code retryCount}. SUCCEEDED and terminal FAILED rows are never modified again.
 */
@Entity
@Table(name = "training_jobs", indexes = {
        @Index(name = "idx_job_family_state", columnList = "family_id, state"),
        @Index(name = "idx_job_handle", columnList = "external_handle")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingJob {

    @Id
    @Column(name = "job_id", length = 64, nullable = false)
    private String jobId;

    @Column(name = "family_id", length = 100, nullable = false)
    private String familyId;

    @Column(name = "trigger_id", length = 64, nullable = false)
    private String triggerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "cause", length = 32, nullable = false)
    private TriggerCause cause;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", length = 16, nullable = false)
    private TrainingJobState state;

    @Column(name = "external_handle", length = 128)
    private String externalHandle;

    @Column(name = "retry_count", nullable = false)
    @Builder.Default
    private int retryCount = 0;

    @Column(name = "max_retries", nullable = false)
    private int maxRetries;

    @Column(name = "data_window_start", nullable = false)
    private LocalDateTime dataWindowStart;

    @Column(name = "data_window_end", nullable = false)
    private LocalDateTime dataWindowEnd;

    @Column(name = "next_attempt_at")
    private LocalDateTime nextAttemptAt;

    @Column(name = "attempt_started_at")
    private LocalDateTime attemptStartedAt;

    @Column(name = "started_at", nullable = false)
    private LocalDateTime startedAt;

    @Column(name = "ended_at")
    private LocalDateTime endedAt;

    @Column(name = "candidate_version_id", length = 64)
    private String candidateVersionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_code", length = 32)
    private FailureCode failureCode;

    @Column(name = "failure_reason", length = 1000)
    private String failureReason;

    @Version
    private Long version;

    public boolean isTerminal() {
        // A retryable failure moves straight back to PENDING in the same transaction,
        // so a committed FAILED row is always final.
        return state == TrainingJobState.SUCCEEDED || state == TrainingJobState.FAILED;
    }
}
