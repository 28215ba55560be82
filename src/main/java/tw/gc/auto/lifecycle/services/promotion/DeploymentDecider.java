package tw.gc.auto.lifecycle.services.promotion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tw.gc.auto.lifecycle.AppConstants;
import tw.gc.auto.lifecycle.entities.ModelFamily;
import tw.gc.auto.lifecycle.entities.ModelVersion;
import tw.gc.auto.lifecycle.entities.TrainingJob;
import tw.gc.auto.lifecycle.entities.ValidationResult;
import tw.gc.auto.lifecycle.enums.AuditAction;
import tw.gc.auto.lifecycle.enums.ModelVersionStatus;
import tw.gc.auto.lifecycle.enums.NotificationType;
import tw.gc.auto.lifecycle.exceptions.DeploymentConflictException;
import tw.gc.auto.lifecycle.exceptions.UnknownEntityException;
import tw.gc.auto.lifecycle.repositories.ModelFamilyRepository;
import tw.gc.auto.lifecycle.repositories.ModelVersionRepository;
import tw.gc.auto.lifecycle.repositories.TrainingJobRepository;
import tw.gc.auto.lifecycle.services.FamilyThresholds;
import tw.gc.auto.lifecycle.services.ModelFamilyService;
import tw.gc.auto.lifecycle.services.Scores;
import tw.gc.auto.lifecycle.services.TriggerClaimService;
import tw.gc.auto.lifecycle.services.audit.AuditLogService;
import tw.gc.auto.lifecycle.services.notification.NotificationService;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Auto-deploy vs. hold-for-approval, and the champion swap itself.
 *
 * <p>Promotion is a compare-and-set of the family's champion pointer against the champion the
 * candidate was validated against. If the pointer moved, it is re-read once: an approved
 * candidate is swapped against the new champion, an auto-deploy candidate only if it still
 * clears the auto-deploy threshold against it. A second miss raises
 * {@link DeploymentConflictException}.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DeploymentDecider {

    private final ModelFamilyRepository familyRepository;
    private final ModelVersionRepository versionRepository;
    private final TrainingJobRepository jobRepository;
    private final ModelFamilyService familyService;
    private final TriggerClaimService claimService;
    private final AuditLogService auditLogService;
    private final NotificationService notificationService;
    private final Clock clock;

    /**
     * Pure decision for a passed validation. Deploy iff {@code delta >= autoDeployThreshold}.
     */
    public DeploymentDecision decide(ValidationResult result, FamilyThresholds thresholds) {
        if (!result.passed()) {
            throw new IllegalArgumentException("Candidate " + result.getCandidateVersionId() + " did not pass validation");
        }

        double threshold = thresholds.autoDeployThreshold();
        Double delta = result.getDelta();

        if (result.getChampionVersionId() == null) {
            return new DeploymentDecision(result.getFamilyId(), result.getCandidateVersionId(),
                DeploymentDecision.Outcome.DEPLOY, DeploymentDecision.Reason.FIRST_CHAMPION, null, threshold,
                "no champion; candidate %s meets quality floor %.4f".formatted(result.getCandidateScore(), result.getQualityFloor()));
        }
        if (delta == null) {
            return new DeploymentDecision(result.getFamilyId(), result.getCandidateVersionId(),
                DeploymentDecision.Outcome.HOLD_FOR_APPROVAL, DeploymentDecision.Reason.NO_COMPARABLE_BASELINE, null,
                threshold, "champion " + result.getChampionVersionId() + " has no recorded score");
        }
        if (delta >= threshold) {
            return new DeploymentDecision(result.getFamilyId(), result.getCandidateVersionId(),
                DeploymentDecision.Outcome.DEPLOY, DeploymentDecision.Reason.THRESHOLD_MET, delta, threshold,
                "delta %.4f >= auto-deploy threshold %.4f".formatted(delta, threshold));
        }
        return new DeploymentDecision(result.getFamilyId(), result.getCandidateVersionId(),
            DeploymentDecision.Outcome.HOLD_FOR_APPROVAL, DeploymentDecision.Reason.BELOW_THRESHOLD, delta, threshold,
            "delta %.4f < auto-deploy threshold %.4f".formatted(delta, threshold));
    }

    /**
     * Decides, audits the decision, and either promotes the candidate or holds it for approval.
     */
    @Transactional(noRollbackFor = DeploymentConflictException.class)
    public DeploymentDecision decideAndApply(ValidationResult result, FamilyThresholds thresholds) {
        DeploymentDecision decision = decide(result, thresholds);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("reason", decision.reason());
        detail.put("delta", decision.delta());
        detail.put("threshold", decision.threshold());
        detail.put("championVersionId", result.getChampionVersionId());
        detail.put("scoreBefore", result.getChampionScore());
        detail.put("scoreAfter", result.getCandidateScore());
        auditLogService.record(AppConstants.ACTOR_DEPLOYMENT_DECIDER, result.getFamilyId(), result.getCandidateVersionId(),
            jobOf(result.getCandidateVersionId()), AuditAction.DEPLOYMENT_DECIDED, decision.outcome().name(), detail);

        if (decision.deploy()) {
            promote(result.getCandidateVersionId(), result.getChampionVersionId(), AppConstants.ACTOR_DEPLOYMENT_DECIDER,
                thresholds);
        } else {
            notificationService.notify(NotificationType.APPROVAL_REQUIRED, result.getFamilyId(),
                "Candidate %s held for approval: %s".formatted(result.getCandidateVersionId(), decision.detail()));
            log.info("✋ Candidate {} of {} held for approval ({})",
                result.getCandidateVersionId(), result.getFamilyId(), decision.detail());
        }
        return decision;
    }

    /**
     * Manually promotes a held (VALIDATED) candidate.
     */
    @Transactional(noRollbackFor = DeploymentConflictException.class)
    public ModelVersion approveCandidate(String versionId, String actor) {
        ModelVersion candidate = getVersion(versionId);
        if (candidate.getStatus() != ModelVersionStatus.VALIDATED) {
            throw new IllegalStateException("Only VALIDATED versions can be approved; %s is %s"
                .formatted(versionId, candidate.getStatus()));
        }

        ModelFamily family = familyService.getFamily(candidate.getFamilyId());
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("championVersionId", family.getChampionVersionId());
        detail.put("scoreAfter", candidate.getValidationScore());
        auditLogService.record(actor, candidate.getFamilyId(), versionId, candidate.getTrainingJobId(),
            AuditAction.DEPLOYMENT_DECIDED, "APPROVED", detail);

        return promote(versionId, family.getChampionVersionId(), actor, null);
    }

    /**
     * Manually rejects a candidate, held or not yet validated. The champion is unchanged and the
     * trigger that produced the candidate is resolved, if it is still active.
     */
    @Transactional
    public ModelVersion rejectCandidate(String versionId, String actor, String reason) {
        String familyId = versionRepository.findFamilyIdByVersionId(versionId)
            .orElseThrow(() -> new UnknownEntityException("model version", versionId));
        // Serializes with a promotion of the same candidate
        familyRepository.lockByFamilyId(familyId);
        ModelVersion candidate = getVersion(versionId);
        if (candidate.getStatus() != ModelVersionStatus.VALIDATED && candidate.getStatus() != ModelVersionStatus.CANDIDATE) {
            throw new IllegalStateException("Only CANDIDATE or VALIDATED versions can be rejected; %s is %s"
                .formatted(versionId, candidate.getStatus()));
        }

        candidate.setStatus(ModelVersionStatus.REJECTED);
        candidate.setStatusReason("Rejected by " + actor + (reason != null ? ": " + reason : ""));
        candidate = versionRepository.save(candidate);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("reason", reason);
        auditLogService.record(actor, candidate.getFamilyId(), versionId, candidate.getTrainingJobId(),
            AuditAction.CANDIDATE_REJECTED, ModelVersionStatus.REJECTED.name(), detail);

        if (candidate.getTrainingJobId() != null) {
            jobRepository.findById(candidate.getTrainingJobId())
                .map(TrainingJob::getTriggerId)
                .ifPresent(triggerId -> claimService.release(triggerId, PromotionPipeline.Outcome.CANDIDATE_REJECTED.name()));
        }

        log.info("🗑️ Candidate {} of {} rejected by {}", versionId, candidate.getFamilyId(), actor);
        return candidate;
    }

    public List<ModelVersion> heldCandidates(String familyId) {
        return versionRepository.findByFamilyIdAndStatus(familyId, ModelVersionStatus.VALIDATED);
    }

    /**
     * @param thresholds non-null on the auto-deploy path: after a conflict the candidate must still
     *                   clear the auto-deploy threshold against the re-read champion
     */
    private ModelVersion promote(String candidateId, String expectedChampionId, String actor, FamilyThresholds thresholds) {
        ModelVersion candidate = getVersion(candidateId);
        if (candidate.getStatus() != ModelVersionStatus.VALIDATED) {
            throw new IllegalStateException("Only VALIDATED versions can be promoted; %s is %s"
                .formatted(candidateId, candidate.getStatus()));
        }
        String familyId = candidate.getFamilyId();
        LocalDateTime now = LocalDateTime.now(clock);

        String previousChampionId = expectedChampionId;
        if (!swap(familyId, expectedChampionId, candidateId, now)) {
            String observed = familyService.getFamily(familyId).getChampionVersionId();
            log.warn("⚠️ Champion of {} moved from {} to {} during promotion of {}, retrying once",
                familyId, expectedChampionId, observed, candidateId);

            if (candidateId.equals(observed)) {
                return getVersion(candidateId);
            }
            if (thresholds != null && !stillClearsThreshold(candidate, observed, thresholds)) {
                throw new DeploymentConflictException(familyId, candidateId, observed);
            }
            if (!swap(familyId, observed, candidateId, now)) {
                throw new DeploymentConflictException(familyId, candidateId,
                    familyService.getFamily(familyId).getChampionVersionId());
            }
            previousChampionId = observed;
        }

        int retired = versionRepository.retireDeployedExcept(familyId, candidateId, now, "Superseded by " + candidateId);

        ModelVersion promoted = getVersion(candidateId);
        promoted.setStatus(ModelVersionStatus.DEPLOYED);
        promoted.setDeployedAt(now);
        promoted.setStatusReason("Promoted by " + actor);
        promoted = versionRepository.save(promoted);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("previousChampionVersionId", previousChampionId);
        detail.put("retired", retired);
        detail.put("score", promoted.getValidationScore());
        auditLogService.record(actor, familyId, candidateId, promoted.getTrainingJobId(),
            AuditAction.CHAMPION_PROMOTED, ModelVersionStatus.DEPLOYED.name(), detail);

        notificationService.notify(NotificationType.MODEL_DEPLOYED, familyId,
            "Model %s deployed (score %s), replacing %s".formatted(candidateId, promoted.getValidationScore(), previousChampionId));
        log.info("🚀 {} is the new champion of {} (was {})", candidateId, familyId, previousChampionId);
        return promoted;
    }

    private boolean swap(String familyId, String expected, String next, LocalDateTime now) {
        int updated = expected == null
            ? familyRepository.installFirstChampion(familyId, next, now)
            : familyRepository.swapChampion(familyId, expected, next, now);
        return updated == 1;
    }

    private boolean stillClearsThreshold(ModelVersion candidate, String observedChampionId, FamilyThresholds thresholds) {
        if (observedChampionId == null) {
            return true;
        }
        Double championScore = versionRepository.findById(observedChampionId)
            .map(ModelVersion::getValidationScore)
            .orElse(null);
        if (championScore == null || candidate.getValidationScore() == null) {
            return false;
        }
        return Scores.delta(candidate.getValidationScore(), championScore) >= thresholds.autoDeployThreshold();
    }

    private String jobOf(String versionId) {
        return versionRepository.findById(versionId).map(ModelVersion::getTrainingJobId).orElse(null);
    }

    private ModelVersion getVersion(String versionId) {
        return versionRepository.findById(versionId)
            .orElseThrow(() -> new UnknownEntityException("model version", versionId));
    }
}
