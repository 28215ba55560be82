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
 * Champion/challenger comparison for one candidate. One row per candidate, never updated.
 */
@Entity
@Immutable
@Table(name = "validation_results", uniqueConstraints = {
        @UniqueConstraint(name = "uq_validation_candidate", columnNames = "candidate_version_id")
})
@Getter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationResult {

    public enum Verdict { PASS, FAIL }

    public enum Reason {
        /** Candidate reported no score for the configured metric */
        MISSING_SCORE,
        /** Candidate score below the family's absolute quality floor */
        BELOW_QUALITY_FLOOR,
        /** Candidate worse than the champion by at least the regression tolerance */
        REGRESSION_BEYOND_TOLERANCE
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "family_id", length = 100, nullable = false)
    private String familyId;

    @Column(name = "candidate_version_id", length = 64, nullable = false)
    private String candidateVersionId;

    @Column(name = "champion_version_id", length = 64)
    private String championVersionId;

    @Column(name = "candidate_score")
    private Double candidateScore;

    @Column(name = "champion_score")
    private Double championScore;

    @Column(name = "delta")
    private Double delta;

    @Column(name = "quality_floor", nullable = false)
    private double qualityFloor;

    @Column(name = "regression_tolerance", nullable = false)
    private double regressionTolerance;

    @Enumerated(EnumType.STRING)
    @Column(name = "verdict", length = 8, nullable = false)
    private Verdict verdict;

    /**
     * Comma-separated {@link Reason} codes; empty on PASS.
     */
    @Column(name = "reasons", length = 200)
    private String reasons;

    @Column(name = "detail", columnDefinition = "TEXT")
    private String detail;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public boolean passed() {
        return verdict == Verdict.PASS;
    }
}
