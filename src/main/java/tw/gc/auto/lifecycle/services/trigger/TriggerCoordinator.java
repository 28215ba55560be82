package tw.gc.auto.lifecycle.services.trigger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tw.gc.auto.lifecycle.AppConstants;
import tw.gc.auto.lifecycle.entities.ModelFamily;
import tw.gc.auto.lifecycle.entities.RetrainTrigger;
import tw.gc.auto.lifecycle.entities.TrainingJob;
import tw.gc.auto.lifecycle.enums.AuditAction;
import tw.gc.auto.lifecycle.enums.NotificationType;
import tw.gc.auto.lifecycle.enums.TriggerCause;
import tw.gc.auto.lifecycle.enums.TriggerStatus;
import tw.gc.auto.lifecycle.repositories.ModelFamilyRepository;
import tw.gc.auto.lifecycle.repositories.RetrainTriggerRepository;
import tw.gc.auto.lifecycle.services.FamilyThresholds;
import tw.gc.auto.lifecycle.services.ModelFamilyService;
import tw.gc.auto.lifecycle.services.TriggerClaimService;
import tw.gc.auto.lifecycle.services.audit.AuditLogService;
import tw.gc.auto.lifecycle.services.evaluation.DriftEvaluator;
import tw.gc.auto.lifecycle.services.evaluation.DriftVerdict;
import tw.gc.auto.lifecycle.services.evaluation.MetricsGateway;
import tw.gc.auto.lifecycle.services.evaluation.ScheduleEvaluator;
import tw.gc.auto.lifecycle.services.notification.NotificationService;
import tw.gc.auto.lifecycle.services.training.TrainingJobManager;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Single entry point for retrain requests from drift, schedule and manual sources.
 *
 * <p>Enforces at most one active trigger per family through the compare-and-set claim on the
 * family row. A losing request is rejected with ALREADY_ACTIVE and never queued. Accepted and
 * rejected submissions are both audited.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TriggerCoordinator {

    private final ModelFamilyRepository familyRepository;
    private final RetrainTriggerRepository triggerRepository;
    private final ModelFamilyService familyService;
    private final TriggerClaimService claimService;
    private final TrainingJobManager jobManager;
    private final MetricsGateway metricsGateway;
    private final DriftEvaluator driftEvaluator;
    private final ScheduleEvaluator scheduleEvaluator;
    private final AuditLogService auditLogService;
    private final NotificationService notificationService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional
    public TriggerResult submit(RetrainRequest request) {
        String familyId = request.familyId();
        Optional<ModelFamily> found = familyRepository.findById(familyId);
        if (found.isEmpty()) {
            log.warn("⚠️ Retrain request for unknown family {} rejected", familyId);
            return TriggerResult.rejected(familyId, request.cause(), TriggerResult.Rejection.UNKNOWN_FAMILY,
                "unknown model family " + familyId);
        }

        FamilyThresholds thresholds = familyService.resolveThresholds(found.get());
        LocalDateTime now = LocalDateTime.now(clock);

        if (request.cause() == TriggerCause.MANUAL && !request.force()) {
            long samples = metricsGateway.countObservations(familyId, now.minus(thresholds.lookbackWindow()));
            if (samples < thresholds.minTrainingSamples()) {
                return reject(request, TriggerResult.Rejection.INSUFFICIENT_DATA,
                    "insufficient_data: %d of %d required observations".formatted(samples, thresholds.minTrainingSamples()));
            }
        }

        if (jobManager.findActiveJob(familyId).isPresent()) {
            return reject(request, TriggerResult.Rejection.ALREADY_ACTIVE, "a training job is already in progress");
        }

        String triggerId = UUID.randomUUID().toString();
        if (!claimService.claim(familyId, triggerId)) {
            String holder = triggerRepository.findFirstByFamilyIdAndStatus(familyId, TriggerStatus.ACTIVE)
                .map(RetrainTrigger::getTriggerId)
                .orElse("unknown");
            return reject(request, TriggerResult.Rejection.ALREADY_ACTIVE, "family claimed by trigger " + holder);
        }

        RetrainTrigger trigger = triggerRepository.save(RetrainTrigger.builder()
            .triggerId(triggerId)
            .familyId(familyId)
            .cause(request.cause())
            .scopeJson(toJson(request))
            .requestedBy(request.requestedBy())
            .reason(request.reason())
            .forced(request.force())
            .createdAt(now)
            .build());

        TrainingJob job = jobManager.createJob(trigger, thresholds);
        trigger.setJobId(job.getJobId());
        triggerRepository.save(trigger);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("cause", request.cause());
        detail.put("force", request.force());
        detail.put("scope", request.scope());
        detail.put("requestedBy", request.requestedBy());
        detail.put("reason", request.reason());
        auditLogService.record(AppConstants.ACTOR_TRIGGER_COORDINATOR, familyId, triggerId, job.getJobId(),
            AuditAction.TRIGGER_ACCEPTED, "ACCEPTED", detail);

        notificationService.notify(NotificationType.RETRAIN_TRIGGERED, familyId,
            "%s retrain of %s accepted (job %s)".formatted(request.cause(), familyId, job.getJobId()));
        log.info("🔄 {} retrain of {} accepted: trigger={} job={}", request.cause(), familyId, triggerId, job.getJobId());

        return TriggerResult.accepted(familyId, request.cause(), triggerId, job.getJobId());
    }

    /**
     * Runs the drift and schedule evaluators for one family and submits a trigger when either
     * calls for it. Drift outranks schedule when both fire. A family that already has an active
     * trigger is evaluated and audited but not resubmitted.
     *
     * @param thresholdOverride drift threshold for this evaluation only; null for the family's
     * @param windowOverride lookback window for this evaluation only; null for the family's
     */
    @Transactional
    public EvaluationOutcome evaluateFamily(String familyId, Double thresholdOverride, Duration windowOverride) {
        ModelFamily family = familyService.getFamily(familyId);
        FamilyThresholds thresholds = familyService.resolveThresholds(family)
            .withDriftThreshold(thresholdOverride)
            .withLookbackWindow(windowOverride);
        LocalDateTime now = LocalDateTime.now(clock);

        DriftVerdict verdict = driftEvaluator.evaluate(family, thresholds, now);
        Map<String, Object> driftDetail = new LinkedHashMap<>();
        driftDetail.put("currentScore", verdict.currentScore());
        driftDetail.put("baselineScore", verdict.baselineScore());
        driftDetail.put("delta", verdict.delta());
        driftDetail.put("threshold", verdict.threshold());
        driftDetail.put("sampleCount", verdict.sampleCount());
        driftDetail.put("lookbackWindow", thresholds.lookbackWindow().toString());
        auditLogService.record(AppConstants.ACTOR_DRIFT_EVALUATOR, familyId, familyId, null,
            AuditAction.DRIFT_EVALUATED, verdict.reason().name(), driftDetail);

        boolean scheduleDue = scheduleEvaluator.dueForForcedRetrain(family, thresholds, now);
        Map<String, Object> scheduleDetail = new LinkedHashMap<>();
        scheduleDetail.put("lastDeployedAt", family.getLastDeployedAt() != null ? family.getLastDeployedAt().toString() : null);
        LocalDateTime intervalStart = scheduleEvaluator.intervalStart(family);
        scheduleDetail.put("intervalStart", intervalStart != null ? intervalStart.toString() : null);
        scheduleDetail.put("scheduleInterval", thresholds.scheduleInterval().toString());
        auditLogService.record(AppConstants.ACTOR_SCHEDULE_EVALUATOR, familyId, familyId, null,
            AuditAction.SCHEDULE_EVALUATED, scheduleDue ? "DUE" : "NOT_DUE", scheduleDetail);

        TriggerCause cause = verdict.retrain() ? TriggerCause.PERFORMANCE_DRIFT
            : scheduleDue ? TriggerCause.SCHEDULE : null;
        if (cause == null) {
            return new EvaluationOutcome(familyId, verdict, scheduleDue, null);
        }
        if (family.getActiveTriggerId() != null) {
            log.debug("{} due for {} retrain but trigger {} is active", familyId, cause, family.getActiveTriggerId());
            return new EvaluationOutcome(familyId, verdict, scheduleDue, null);
        }

        String reason = cause == TriggerCause.PERFORMANCE_DRIFT ? verdict.detail()
            : "schedule interval %s elapsed since last deployment or scheduled retrain".formatted(thresholds.scheduleInterval());
        String requestedBy = cause == TriggerCause.PERFORMANCE_DRIFT
            ? AppConstants.ACTOR_DRIFT_EVALUATOR : AppConstants.ACTOR_SCHEDULE_EVALUATOR;
        TriggerResult result = submit(new RetrainRequest(familyId, cause, null, false, requestedBy, reason));
        return new EvaluationOutcome(familyId, verdict, scheduleDue, result);
    }

    private TriggerResult reject(RetrainRequest request, TriggerResult.Rejection rejection, String detail) {
        Map<String, Object> audit = new LinkedHashMap<>();
        audit.put("cause", request.cause());
        audit.put("force", request.force());
        audit.put("requestedBy", request.requestedBy());
        audit.put("rejection", rejection);
        audit.put("detail", detail);
        auditLogService.record(AppConstants.ACTOR_TRIGGER_COORDINATOR, request.familyId(), request.familyId(), null,
            AuditAction.TRIGGER_REJECTED, rejection.name(), audit);

        log.info("🚫 {} retrain of {} rejected: {} ({})", request.cause(), request.familyId(), rejection, detail);
        return TriggerResult.rejected(request.familyId(), request.cause(), rejection, detail);
    }

    private String toJson(RetrainRequest request) {
        try {
            return objectMapper.writeValueAsString(request.scope());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize trigger scope", e);
            return "[]";
        }
    }
}
