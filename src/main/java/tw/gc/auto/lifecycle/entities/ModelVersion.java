package tw.gc.auto.lifecycle.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tw.gc.auto.lifecycle.enums.ModelVersionStatus;

import java.time.LocalDateTime;

/**
 * Opaque model artifact reference plus its lifecycle metadata. A champion is the single
 * DEPLOYED version of its family.
 */
@Entity
@Table(name = "model_versions", indexes = {
        @Index(name = "idx_version_family_status", columnList = "family_id, status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelVersion {

    @Id
    @Column(name = "version_id", length = 64, nullable = false)
    private String versionId;

    @Column(name = "family_id", length = 100, nullable = false)
    private String familyId;

    @Column(name = "artifact_ref", length = 500, nullable = false)
    private String artifactRef;

    @Column(name = "training_job_id", length = 64)
    private String trainingJobId;

    /**
     * Self-reported (candidate) or deployment-time (champion) score on the family's criteria.
     */
    @Column(name = "validation_score")
    private Double validationScore;

    @Column(name = "metrics_json", columnDefinition = "TEXT")
    private String metricsJson;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 16, nullable = false)
    private ModelVersionStatus status;

    @Column(name = "status_reason", length = 500)
    private String statusReason;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "deployed_at")
    private LocalDateTime deployedAt;

    @Column(name = "retired_at")
    private LocalDateTime retiredAt;
}
