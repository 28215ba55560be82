package tw.gc.auto.lifecycle.services.promotion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tw.gc.auto.lifecycle.AppConstants;
import tw.gc.auto.lifecycle.entities.ModelFamily;
import tw.gc.auto.lifecycle.entities.ModelVersion;
import tw.gc.auto.lifecycle.entities.RetrainTrigger;
import tw.gc.auto.lifecycle.entities.TrainingJob;
import tw.gc.auto.lifecycle.entities.ValidationResult;
import tw.gc.auto.lifecycle.enums.AuditAction;
import tw.gc.auto.lifecycle.enums.ModelVersionStatus;
import tw.gc.auto.lifecycle.enums.NotificationType;
import tw.gc.auto.lifecycle.enums.TrainingJobState;
import tw.gc.auto.lifecycle.enums.TriggerStatus;
import tw.gc.auto.lifecycle.exceptions.DeploymentConflictException;
import tw.gc.auto.lifecycle.exceptions.UnknownEntityException;
import tw.gc.auto.lifecycle.repositories.ModelFamilyRepository;
import tw.gc.auto.lifecycle.repositories.ModelVersionRepository;
import tw.gc.auto.lifecycle.repositories.RetrainTriggerRepository;
import tw.gc.auto.lifecycle.repositories.TrainingJobRepository;
import tw.gc.auto.lifecycle.services.FamilyThresholds;
import tw.gc.auto.lifecycle.services.ModelFamilyService;
import tw.gc.auto.lifecycle.services.TriggerClaimService;
import tw.gc.auto.lifecycle.services.audit.AuditLogService;
import tw.gc.auto.lifecycle.services.notification.NotificationService;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Validate → decide → release, for the candidate of a succeeded job, in one transaction.
 * The family's claim is released whatever the outcome, so the next trigger can be accepted.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PromotionPipeline {

    public enum Outcome {
        DEPLOYED,
        HELD_FOR_APPROVAL,
        CANDIDATE_REJECTED,
        DEPLOYMENT_CONFLICT,
        /** The job's trigger was already resolved; nothing was done */
        ALREADY_RESOLVED
    }

    private final TrainingJobRepository jobRepository;
    private final ModelFamilyRepository familyRepository;
    private final RetrainTriggerRepository triggerRepository;
    private final ModelVersionRepository versionRepository;
    private final ModelFamilyService familyService;
    private final ValidationGate validationGate;
    private final DeploymentDecider deploymentDecider;
    private final TriggerClaimService claimService;
    private final AuditLogService auditLogService;
    private final NotificationService notificationService;

    @Transactional
    public Outcome process(String jobId) {
        TrainingJob job = jobRepository.findById(jobId)
            .orElseThrow(() -> new UnknownEntityException("training job", jobId));
        if (job.getState() != TrainingJobState.SUCCEEDED || job.getCandidateVersionId() == null) {
            throw new IllegalStateException("Job %s has no candidate to promote (state %s)".formatted(jobId, job.getState()));
        }

        // Serializes with a concurrent poll tick or completion callback for the same job
        familyRepository.lockByFamilyId(job.getFamilyId());

        RetrainTrigger trigger = triggerRepository.findById(job.getTriggerId())
            .orElseThrow(() -> new UnknownEntityException("retrain trigger", job.getTriggerId()));
        if (trigger.getStatus() == TriggerStatus.RESOLVED) {
            log.debug("Trigger {} of job {} already resolved ({})", trigger.getTriggerId(), jobId, trigger.getResolution());
            return Outcome.ALREADY_RESOLVED;
        }

        ModelVersion candidate = versionRepository.findById(job.getCandidateVersionId())
            .orElseThrow(() -> new UnknownEntityException("model version", job.getCandidateVersionId()));
        if (candidate.getStatus() != ModelVersionStatus.CANDIDATE && candidate.getStatus() != ModelVersionStatus.VALIDATED) {
            Outcome settled = candidate.getStatus() == ModelVersionStatus.DEPLOYED ? Outcome.DEPLOYED : Outcome.CANDIDATE_REJECTED;
            log.info("Candidate {} of job {} is already {}, not promoting", candidate.getVersionId(), jobId, candidate.getStatus());
            claimService.release(trigger.getTriggerId(), settled.name());
            return settled;
        }

        ModelFamily family = familyService.getFamily(job.getFamilyId());
        FamilyThresholds thresholds = familyService.resolveThresholds(family);
        ModelVersion champion = familyService.findChampion(family).orElse(null);

        ValidationResult result = validationGate.validate(candidate, champion, thresholds);

        Outcome outcome;
        if (!result.passed()) {
            outcome = Outcome.CANDIDATE_REJECTED;
        } else {
            try {
                DeploymentDecision decision = deploymentDecider.decideAndApply(result, thresholds);
                outcome = decision.deploy() ? Outcome.DEPLOYED : Outcome.HELD_FOR_APPROVAL;
            } catch (DeploymentConflictException e) {
                recordConflict(job, e);
                outcome = Outcome.DEPLOYMENT_CONFLICT;
            }
        }

        claimService.release(trigger.getTriggerId(), outcome.name());
        return outcome;
    }

    private void recordConflict(TrainingJob job, DeploymentConflictException e) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("message", e.getMessage());
        auditLogService.record(AppConstants.ACTOR_DEPLOYMENT_DECIDER, e.getFamilyId(), e.getCandidateVersionId(),
            job.getJobId(), AuditAction.DEPLOYMENT_CONFLICT, "ABANDONED", detail);
        notificationService.notify(NotificationType.DEPLOYMENT_CONFLICT, e.getFamilyId(), e.getMessage());
        log.error("🚨 Deployment conflict for {}: {}", e.getFamilyId(), e.getMessage());
    }
}
