package tw.gc.auto.lifecycle.services.promotion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tw.gc.auto.lifecycle.AppConstants;
import tw.gc.auto.lifecycle.entities.ModelVersion;
import tw.gc.auto.lifecycle.entities.ValidationResult;
import tw.gc.auto.lifecycle.entities.ValidationResult.Reason;
import tw.gc.auto.lifecycle.entities.ValidationResult.Verdict;
import tw.gc.auto.lifecycle.enums.AuditAction;
import tw.gc.auto.lifecycle.enums.ModelVersionStatus;
import tw.gc.auto.lifecycle.enums.NotificationType;
import tw.gc.auto.lifecycle.repositories.ModelVersionRepository;
import tw.gc.auto.lifecycle.repositories.ValidationResultRepository;
import tw.gc.auto.lifecycle.services.FamilyThresholds;
import tw.gc.auto.lifecycle.services.Scores;
import tw.gc.auto.lifecycle.services.audit.AuditLogService;
import tw.gc.auto.lifecycle.services.notification.NotificationService;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Champion/challenger gate.
 *
 * <p>A candidate passes iff it reported a score, the score meets the family's quality floor, and
 * {@code delta = candidate - champion} is strictly greater than {@code -regressionTolerance}.
 * Without a champion the regression check does not apply. Every failed condition is listed.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ValidationGate {

    private final ValidationResultRepository resultRepository;
    private final ModelVersionRepository versionRepository;
    private final AuditLogService auditLogService;
    private final NotificationService notificationService;
    private final Clock clock;

    /**
     * Validates a candidate once. A candidate that already has a result gets that result back;
     * otherwise it must still be in CANDIDATE status.
     */
    @Transactional
    public ValidationResult validate(ModelVersion candidate, ModelVersion champion, FamilyThresholds thresholds) {
        ValidationResult existing = resultRepository.findByCandidateVersionId(candidate.getVersionId()).orElse(null);
        if (existing != null) {
            log.debug("Candidate {} already validated ({})", candidate.getVersionId(), existing.getVerdict());
            return existing;
        }
        if (candidate.getStatus() != ModelVersionStatus.CANDIDATE) {
            throw new IllegalStateException("Only CANDIDATE versions can be validated; %s is %s"
                .formatted(candidate.getVersionId(), candidate.getStatus()));
        }

        Double candidateScore = candidate.getValidationScore();
        Double championScore = champion != null ? champion.getValidationScore() : null;
        Double delta = candidateScore != null && championScore != null
            ? Scores.delta(candidateScore, championScore) : null;

        List<Reason> reasons = new ArrayList<>();
        if (candidateScore == null) {
            reasons.add(Reason.MISSING_SCORE);
        } else if (candidateScore < thresholds.qualityFloor()) {
            reasons.add(Reason.BELOW_QUALITY_FLOOR);
        }
        if (delta != null && delta <= -thresholds.regressionTolerance()) {
            reasons.add(Reason.REGRESSION_BEYOND_TOLERANCE);
        }
        Verdict verdict = reasons.isEmpty() ? Verdict.PASS : Verdict.FAIL;

        String detail = describe(candidateScore, championScore, delta, thresholds, reasons, champion != null);
        ValidationResult result = resultRepository.save(ValidationResult.builder()
            .familyId(candidate.getFamilyId())
            .candidateVersionId(candidate.getVersionId())
            .championVersionId(champion != null ? champion.getVersionId() : null)
            .candidateScore(candidateScore)
            .championScore(championScore)
            .delta(delta)
            .qualityFloor(thresholds.qualityFloor())
            .regressionTolerance(thresholds.regressionTolerance())
            .verdict(verdict)
            .reasons(reasons.stream().map(Enum::name).collect(Collectors.joining(",")))
            .detail(detail)
            .createdAt(LocalDateTime.now(clock))
            .build());

        candidate.setStatus(verdict == Verdict.PASS ? ModelVersionStatus.VALIDATED : ModelVersionStatus.REJECTED);
        candidate.setStatusReason(detail);
        versionRepository.save(candidate);

        Map<String, Object> audit = new LinkedHashMap<>();
        audit.put("championVersionId", result.getChampionVersionId());
        audit.put("candidateScore", candidateScore);
        audit.put("championScore", championScore);
        audit.put("delta", delta);
        audit.put("qualityFloor", thresholds.qualityFloor());
        audit.put("regressionTolerance", thresholds.regressionTolerance());
        audit.put("reasons", reasons);
        auditLogService.record(AppConstants.ACTOR_VALIDATION_GATE, candidate.getFamilyId(), candidate.getVersionId(),
            candidate.getTrainingJobId(), AuditAction.VALIDATION_COMPLETED, verdict.name(), audit);

        if (verdict == Verdict.FAIL) {
            auditLogService.record(AppConstants.ACTOR_VALIDATION_GATE, candidate.getFamilyId(), candidate.getVersionId(),
                candidate.getTrainingJobId(), AuditAction.CANDIDATE_REJECTED, ModelVersionStatus.REJECTED.name(), audit);
            notificationService.notify(NotificationType.VALIDATION_FAILED, candidate.getFamilyId(),
                "Candidate " + candidate.getVersionId() + " rejected: " + detail);
            log.warn("🚫 Candidate {} of {} failed validation: {}", candidate.getVersionId(), candidate.getFamilyId(), detail);
        } else {
            log.info("✅ Candidate {} of {} passed validation: {}", candidate.getVersionId(), candidate.getFamilyId(), detail);
        }
        return result;
    }

    private static String describe(Double candidateScore, Double championScore, Double delta,
                                   FamilyThresholds thresholds, List<Reason> reasons, boolean hasChampion) {
        StringBuilder sb = new StringBuilder();
        sb.append("candidate=").append(candidateScore);
        if (hasChampion) {
            sb.append(" champion=").append(championScore).append(" delta=").append(delta)
              .append(" tolerance=").append(thresholds.regressionTolerance());
        } else {
            sb.append(" (no champion)");
        }
        sb.append(" floor=").append(thresholds.qualityFloor());
        if (!reasons.isEmpty()) {
            sb.append(" reasons=").append(reasons);
        }
        return sb.toString();
    }
}
