package tw.gc.auto.lifecycle.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Logical identity of a model type (e.g. "content_performance").
 *
 * <p>{@code championVersionId} and {@code activeTriggerId} are only ever changed through the
 * compare-and-set statements in {@code ModelFamilyRepository}, never by saving this entity.
 * Threshold columns are nullable overrides of the configured defaults.</p>
 */
@Entity
@Table(name = "model_families")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelFamily {

    @Id
    @Column(name = "family_id", length = 100, nullable = false)
    private String familyId;

    @Column(name = "description")
    private String description;

    @Column(name = "champion_version_id", length = 64)
    private String championVersionId;

    @Column(name = "active_trigger_id", length = 64)
    private String activeTriggerId;

    @Column(name = "last_deployed_at")
    private LocalDateTime lastDeployedAt;

    @Column(name = "drift_threshold")
    private Double driftThreshold;

    @Column(name = "auto_deploy_threshold")
    private Double autoDeployThreshold;

    @Column(name = "regression_tolerance")
    private Double regressionTolerance;

    @Column(name = "quality_floor")
    private Double qualityFloor;

    @Column(name = "min_training_samples")
    private Integer minTrainingSamples;

    @Column(name = "max_retries")
    private Integer maxRetries;

    @Column(name = "schedule_interval_seconds")
    private Long scheduleIntervalSeconds;

    @Column(name = "lookback_window_seconds")
    private Long lookbackWindowSeconds;

    @Column(name = "created_at", nullable = false)
    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();
}
