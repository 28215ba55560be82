package tw.gc.auto.lifecycle.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tw.gc.auto.lifecycle.enums.TriggerCause;
import tw.gc.auto.lifecycle.enums.TriggerStatus;

import java.time.LocalDateTime;

@Entity
@Table(name = "retrain_triggers", indexes = {
        @Index(name = "idx_trigger_family_created", columnList = "family_id, created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrainTrigger {

    @Id
    @Column(name = "trigger_id", length = 64, nullable = false)
    private String triggerId;

    @Column(name = "family_id", length = 100, nullable = false)
    private String familyId;

    @Enumerated(EnumType.STRING)
    @Column(name = "cause", length = 32, nullable = false)
    private TriggerCause cause;

    /**
     * Optional sub-model scoping as a JSON array, e.g. ["engagement","reach"].
     */
    @Column(name = "scope_json", columnDefinition = "TEXT")
    private String scopeJson;

    @Column(name = "requested_by", length = 100)
    private String requestedBy;

    @Column(name = "reason", length = 500)
    private String reason;

    @Column(name = "forced", nullable = false)
    @Builder.Default
    private boolean forced = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 16, nullable = false)
    @Builder.Default
    private TriggerStatus status = TriggerStatus.ACTIVE;

    @Column(name = "job_id", length = 64)
    private String jobId;

    @Column(name = "resolution", length = 64)
    private String resolution;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;
}
