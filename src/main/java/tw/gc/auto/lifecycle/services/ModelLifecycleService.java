package tw.gc.auto.lifecycle.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.auto.lifecycle.entities.ModelFamily;
import tw.gc.auto.lifecycle.entities.ModelVersion;
import tw.gc.auto.lifecycle.entities.TrainingJob;
import tw.gc.auto.lifecycle.enums.TrainingJobState;
import tw.gc.auto.lifecycle.enums.TriggerCause;
import tw.gc.auto.lifecycle.enums.TriggerStatus;
import tw.gc.auto.lifecycle.repositories.RetrainTriggerRepository;
import tw.gc.auto.lifecycle.services.audit.AuditLogService;
import tw.gc.auto.lifecycle.services.audit.ChainVerification;
import tw.gc.auto.lifecycle.services.audit.HistoryPage;
import tw.gc.auto.lifecycle.services.audit.JobReplay;
import tw.gc.auto.lifecycle.services.promotion.DeploymentDecider;
import tw.gc.auto.lifecycle.services.promotion.PromotionPipeline;
import tw.gc.auto.lifecycle.services.training.TrainingJobManager;
import tw.gc.auto.lifecycle.services.training.TrainingStatus;
import tw.gc.auto.lifecycle.services.trigger.EvaluationOutcome;
import tw.gc.auto.lifecycle.services.trigger.RetrainRequest;
import tw.gc.auto.lifecycle.services.trigger.TriggerCoordinator;
import tw.gc.auto.lifecycle.services.trigger.TriggerResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Exposed boundary of the orchestrator. Every call runs through {@link StoreRetryTemplate};
 * verdicts come back as values, and only unknown entities, malformed configuration and an
 * unavailable store surface as exceptions.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ModelLifecycleService {

    private final ModelFamilyService familyService;
    private final TriggerCoordinator triggerCoordinator;
    private final TrainingJobManager jobManager;
    private final PromotionPipeline promotionPipeline;
    private final DeploymentDecider deploymentDecider;
    private final AuditLogService auditLogService;
    private final RetrainTriggerRepository triggerRepository;
    private final StoreRetryTemplate storeRetry;

    /**
     * Submits one request per family. Each family gets its own answer; one rejection does not
     * affect the others.
     */
    public List<TriggerResult> triggerRetraining(List<String> familyIds, TriggerCause cause, boolean force, String actor) {
        List<TriggerResult> results = new ArrayList<>();
        for (String familyId : familyIds) {
            RetrainRequest request = new RetrainRequest(familyId, cause, List.of(), force, actor, "requested by " + actor);
            results.add(submit(request));
        }
        return results;
    }

    public TriggerResult submit(RetrainRequest request) {
        return storeRetry.execute("triggerRetraining", () -> triggerCoordinator.submit(request));
    }

    /**
     * Evaluates the given families, or every registered family when none are given.
     *
     * @param threshold drift threshold override for this check; null for each family's own
     * @param window lookback window override for this check; null for each family's own
     */
    public List<EvaluationOutcome> checkPerformance(List<String> familyIds, Double threshold, Duration window) {
        List<String> targets = familyIds == null || familyIds.isEmpty()
            ? storeRetry.execute("listFamilies", familyService::listFamilyIds)
            : familyIds;
        List<EvaluationOutcome> outcomes = new ArrayList<>();
        for (String familyId : targets) {
            outcomes.add(storeRetry.execute("checkPerformance",
                () -> triggerCoordinator.evaluateFamily(familyId, threshold, window)));
        }
        return outcomes;
    }

    public FamilyStatus getStatus(String familyId) {
        return storeRetry.execute("getStatus", () -> {
            ModelFamily family = familyService.getFamily(familyId);
            return new FamilyStatus(
                familyId,
                family.getDescription(),
                familyService.resolveThresholds(family),
                familyService.findChampion(family).orElse(null),
                triggerRepository.findFirstByFamilyIdAndStatus(familyId, TriggerStatus.ACTIVE).orElse(null),
                jobManager.findActiveJob(familyId).orElse(null),
                auditLogService.lastDecision(familyId).orElse(null),
                deploymentDecider.heldCandidates(familyId));
        });
    }

    public HistoryPage listHistory(String familyId, int limit, Long cursor) {
        return storeRetry.execute("listHistory", () -> {
            familyService.getFamily(familyId);
            return auditLogService.listHistory(familyId, limit, cursor);
        });
    }

    public TrainingJob getJob(String jobId) {
        return storeRetry.execute("getJob", () -> jobManager.getJob(jobId));
    }

    public TrainingJob cancelJob(String jobId, String actor) {
        return storeRetry.execute("cancelJob", () -> jobManager.cancel(jobId, actor));
    }

    public ModelVersion approveCandidate(String versionId, String actor) {
        return storeRetry.execute("approveCandidate", () -> deploymentDecider.approveCandidate(versionId, actor));
    }

    public ModelVersion rejectCandidate(String versionId, String actor, String reason) {
        return storeRetry.execute("rejectCandidate", () -> deploymentDecider.rejectCandidate(versionId, actor, reason));
    }

    /**
     * Result pushed by the training operation. A success runs validation and the deployment
     * decision right away instead of waiting for the next poll tick.
     */
    public TrainingJob onTrainingCompleted(String handle, TrainingStatus status) {
        TrainingJob job = storeRetry.execute("onTrainingCompleted", () -> jobManager.onCompletion(handle, status));
        if (job.getState() == TrainingJobState.SUCCEEDED) {
            PromotionPipeline.Outcome outcome = storeRetry.execute("promote", () -> promotionPipeline.process(job.getJobId()));
            log.info("🏁 Job {} pipeline finished: {}", job.getJobId(), outcome);
        }
        return getJob(job.getJobId());
    }

    public ModelVersion seedChampion(String familyId, String artifactRef, double score) {
        return storeRetry.execute("seedChampion", () -> familyService.seedChampion(familyId, artifactRef, score));
    }

    public ChainVerification verifyAuditChain(String familyId) {
        return storeRetry.execute("verifyAuditChain", () -> auditLogService.verifyChain(familyId));
    }

    public JobReplay replayJobState(String jobId) {
        return storeRetry.execute("replayJobState", () -> auditLogService.replayJobState(jobId));
    }
}
