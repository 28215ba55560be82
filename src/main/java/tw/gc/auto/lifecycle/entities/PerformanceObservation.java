package tw.gc.auto.lifecycle.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

/**
 * Timestamped accuracy sample for a deployed model version, written by the external
 * metrics source. Never updated.
 */
@Entity
@Immutable
@Table(name = "performance_observations", indexes = {
        @Index(name = "idx_observation_family_time", columnList = "family_id, observed_at")
})
@Getter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceObservation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "family_id", length = 100, nullable = false)
    private String familyId;

    @Column(name = "model_version_id", length = 64)
    private String modelVersionId;

    @Column(name = "observed_at", nullable = false)
    private LocalDateTime observedAt;

    @Column(name = "score", nullable = false)
    private double score;
}
