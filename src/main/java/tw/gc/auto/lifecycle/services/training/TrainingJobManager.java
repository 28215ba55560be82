package tw.gc.auto.lifecycle.services.training;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tw.gc.auto.lifecycle.AppConstants;
import tw.gc.auto.lifecycle.config.LifecycleProperties;
import tw.gc.auto.lifecycle.config.TrainingProperties;
import tw.gc.auto.lifecycle.entities.ModelVersion;
import tw.gc.auto.lifecycle.entities.RetrainTrigger;
import tw.gc.auto.lifecycle.entities.TrainingJob;
import tw.gc.auto.lifecycle.enums.AuditAction;
import tw.gc.auto.lifecycle.enums.FailureCode;
import tw.gc.auto.lifecycle.enums.ModelVersionStatus;
import tw.gc.auto.lifecycle.enums.NotificationType;
import tw.gc.auto.lifecycle.enums.TrainingJobState;
import tw.gc.auto.lifecycle.exceptions.AlreadyInProgressException;
import tw.gc.auto.lifecycle.exceptions.TrainingOperationException;
import tw.gc.auto.lifecycle.exceptions.UnknownEntityException;
import tw.gc.auto.lifecycle.repositories.ModelVersionRepository;
import tw.gc.auto.lifecycle.repositories.RetrainTriggerRepository;
import tw.gc.auto.lifecycle.repositories.TrainingJobRepository;
import tw.gc.auto.lifecycle.services.FamilyThresholds;
import tw.gc.auto.lifecycle.services.TriggerClaimService;
import tw.gc.auto.lifecycle.services.audit.AuditLogService;
import tw.gc.auto.lifecycle.services.notification.NotificationService;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns the training job state machine.
 *
 * <p>A job is never waited on. Each call to {@link #advance} makes at most one step
 * (dispatch a PENDING job whose backoff has elapsed, or poll a RUNNING one) and returns, so a
 * worker is occupied for one HTTP round trip rather than for the whole training run. Completion
 * can also arrive through {@link #onCompletion}.</p>
 *
 * <p>Every state change writes exactly one JOB_STATE_CHANGED audit entry in the same
 * transaction. A retryable failure is recorded as FAILED followed by PENDING with an
 * incremented retry count under the same job id.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TrainingJobManager {

    private static final int MAX_REASON_LENGTH = 1000;

    private final TrainingJobRepository jobRepository;
    private final RetrainTriggerRepository triggerRepository;
    private final ModelVersionRepository versionRepository;
    private final TrainingOperationClient trainingClient;
    private final TriggerClaimService claimService;
    private final AuditLogService auditLogService;
    private final NotificationService notificationService;
    private final LifecycleProperties lifecycleProperties;
    private final TrainingProperties trainingProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    // Bounded wait on best-effort cancel signals
    private final ExecutorService cancelExecutor = Executors.newCachedThreadPool();

    @PreDestroy
    public void shutdown() {
        cancelExecutor.shutdownNow();
    }

    /**
     * Creates the job for an accepted trigger in PENDING. Refuses when the family already has
     * a PENDING or RUNNING job.
     */
    @Transactional
    public TrainingJob createJob(RetrainTrigger trigger, FamilyThresholds thresholds) {
        String familyId = trigger.getFamilyId();
        if (jobRepository.existsByFamilyIdAndStateIn(familyId, TrainingJobState.ACTIVE)) {
            throw new AlreadyInProgressException(familyId);
        }

        LocalDateTime now = now();
        TrainingJob job = jobRepository.save(TrainingJob.builder()
            .jobId(UUID.randomUUID().toString())
            .familyId(familyId)
            .triggerId(trigger.getTriggerId())
            .cause(trigger.getCause())
            .state(TrainingJobState.PENDING)
            .maxRetries(thresholds.maxRetries())
            .dataWindowStart(now.minus(thresholds.lookbackWindow()))
            .dataWindowEnd(now)
            .nextAttemptAt(now)
            .startedAt(now)
            .build());

        recordTransition(job, null, "job created for " + trigger.getCause());
        log.info("🆕 Training job {} created for {} ({})", job.getJobId(), familyId, trigger.getCause());
        return job;
    }

    public Optional<TrainingJob> findActiveJob(String familyId) {
        return jobRepository.findFirstByFamilyIdAndStateIn(familyId, TrainingJobState.ACTIVE);
    }

    public TrainingJob getJob(String jobId) {
        return jobRepository.findById(jobId)
            .orElseThrow(() -> new UnknownEntityException("training job", jobId));
    }

    public List<TrainingJob> findActiveJobs() {
        return jobRepository.findByStateIn(TrainingJobState.ACTIVE);
    }

    /**
     * Moves the job one step forward. Terminal jobs and jobs still backing off are returned unchanged.
     */
    @Transactional
    public TrainingJob advance(String jobId) {
        TrainingJob job = getJob(jobId);
        if (job.isTerminal()) {
            return job;
        }

        LocalDateTime now = now();
        if (job.getState() == TrainingJobState.PENDING) {
            if (job.getNextAttemptAt() != null && job.getNextAttemptAt().isAfter(now)) {
                return job;
            }
            return dispatch(job, now);
        }
        return poll(job, now);
    }

    /**
     * Completion pushed by the training operation. Callbacks for unknown or no longer running
     * handles are ignored.
     */
    @Transactional
    public TrainingJob onCompletion(String handle, TrainingStatus status) {
        TrainingJob job = jobRepository.findByExternalHandle(handle)
            .orElseThrow(() -> new UnknownEntityException("training handle", handle));
        if (job.getState() != TrainingJobState.RUNNING) {
            log.info("Ignoring {} callback for job {} in state {}", status.phase(), job.getJobId(), job.getState());
            return job;
        }
        return applyStatus(job, status, now());
    }

    /**
     * Cancels a PENDING or RUNNING job: the training operation is asked to stop (bounded by
     * training.cancel-timeout), the job ends FAILED(CANCELLED) and the family's claim is released.
     */
    @Transactional
    public TrainingJob cancel(String jobId, String actor) {
        TrainingJob job = getJob(jobId);
        if (!job.getState().isActive()) {
            log.info("Job {} already {}, cancel ignored", jobId, job.getState());
            return job;
        }

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("state", job.getState());
        request.put("handle", job.getExternalHandle());
        auditLogService.record(actor, job.getFamilyId(), jobId, jobId,
            AuditAction.JOB_CANCEL_REQUESTED, "REQUESTED", request);

        if (job.getState() == TrainingJobState.RUNNING && job.getExternalHandle() != null) {
            requestStop(job.getExternalHandle());
        }

        TrainingJobState from = job.getState();
        job.setState(TrainingJobState.FAILED);
        job.setFailureCode(FailureCode.CANCELLED);
        job.setFailureReason("cancelled by " + actor);
        job.setEndedAt(now());
        job = jobRepository.save(job);
        recordTransition(job, from, "cancelled by " + actor);

        notificationService.notify(NotificationType.JOB_CANCELLED, job.getFamilyId(),
            "Job " + jobId + " cancelled by " + actor);
        claimService.release(job.getTriggerId(), FailureCode.CANCELLED.name());

        log.warn("⛔ Job {} of {} cancelled by {}", jobId, job.getFamilyId(), actor);
        return job;
    }

    private TrainingJob dispatch(TrainingJob job, LocalDateTime now) {
        String handle;
        try {
            handle = trainingClient.submitTraining(toRequest(job));
        } catch (TrainingOperationException e) {
            log.warn("⚠️ Dispatch of job {} failed: {}", job.getJobId(), e.getMessage());
            return fail(job, e.isRetryable() ? FailureCode.TRANSIENT : FailureCode.FATAL, e.getMessage(), now);
        }

        TrainingJobState from = job.getState();
        job.setState(TrainingJobState.RUNNING);
        job.setExternalHandle(handle);
        job.setAttemptStartedAt(now);
        job = jobRepository.save(job);
        recordTransition(job, from, "dispatched as " + handle);

        log.info("🏃 Job {} of {} running (attempt {}, handle={})",
            job.getJobId(), job.getFamilyId(), job.getRetryCount() + 1, handle);
        return job;
    }

    private TrainingJob poll(TrainingJob job, LocalDateTime now) {
        TrainingStatus status;
        try {
            status = trainingClient.pollStatus(job.getExternalHandle());
        } catch (TrainingOperationException e) {
            if (!e.isRetryable()) {
                return fail(job, FailureCode.FATAL, e.getMessage(), now);
            }
            log.warn("⚠️ Poll of job {} failed, retrying next tick: {}", job.getJobId(), e.getMessage());
            status = TrainingStatus.running();
        }
        return applyStatus(job, status, now);
    }

    private TrainingJob applyStatus(TrainingJob job, TrainingStatus status, LocalDateTime now) {
        return switch (status.phase()) {
            case SUCCEEDED -> succeed(job, status, now);
            case FAILED -> fail(job, status.retryable() ? FailureCode.TRANSIENT : FailureCode.FATAL,
                status.failureReason(), now);
            case RUNNING -> {
                if (isTimedOut(job, now)) {
                    requestStop(job.getExternalHandle());
                    yield fail(job, FailureCode.TIMEOUT,
                        "attempt exceeded " + trainingProperties.getJobTimeout(), now);
                }
                yield job;
            }
        };
    }

    private TrainingJob succeed(TrainingJob job, TrainingStatus status, LocalDateTime now) {
        if (status.artifactRef() == null || status.artifactRef().isBlank()) {
            return fail(job, FailureCode.FATAL, "training reported success without an artifact reference", now);
        }

        Double score = status.metrics().get(trainingProperties.getScoreMetric());
        ModelVersion candidate = versionRepository.save(ModelVersion.builder()
            .versionId(UUID.randomUUID().toString())
            .familyId(job.getFamilyId())
            .artifactRef(status.artifactRef())
            .trainingJobId(job.getJobId())
            .validationScore(score)
            .metricsJson(toJson(status.metrics()))
            .status(ModelVersionStatus.CANDIDATE)
            .createdAt(now)
            .build());

        TrainingJobState from = job.getState();
        job.setState(TrainingJobState.SUCCEEDED);
        job.setCandidateVersionId(candidate.getVersionId());
        job.setEndedAt(now);
        job = jobRepository.save(job);
        recordTransition(job, from, "produced candidate " + candidate.getVersionId());

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("artifactRef", candidate.getArtifactRef());
        detail.put("scoreMetric", trainingProperties.getScoreMetric());
        detail.put("candidateScore", score);
        auditLogService.record(AppConstants.ACTOR_TRAINING_JOB_MANAGER, job.getFamilyId(), candidate.getVersionId(),
            job.getJobId(), AuditAction.CANDIDATE_CREATED, ModelVersionStatus.CANDIDATE.name(), detail);

        log.info("✅ Job {} of {} succeeded: candidate {} score={}",
            job.getJobId(), job.getFamilyId(), candidate.getVersionId(), score);
        return job;
    }

    private TrainingJob fail(TrainingJob job, FailureCode code, String reason, LocalDateTime now) {
        boolean retry = code.isRetryable() && job.getRetryCount() < job.getMaxRetries();

        TrainingJobState from = job.getState();
        job.setState(TrainingJobState.FAILED);
        job.setFailureCode(retry || !code.isRetryable() ? code : FailureCode.RETRIES_EXHAUSTED);
        job.setFailureReason(truncate(reason));
        if (!retry) {
            job.setEndedAt(now);
        }
        job = jobRepository.save(job);
        recordTransition(job, from, reason);

        if (retry) {
            int failedAttempt = job.getRetryCount();
            Duration delay = backoffDelay(failedAttempt);
            job.setRetryCount(failedAttempt + 1);
            job.setState(TrainingJobState.PENDING);
            job.setExternalHandle(null);
            job.setAttemptStartedAt(null);
            job.setNextAttemptAt(now.plus(delay));
            job = jobRepository.save(job);
            recordTransition(job, TrainingJobState.FAILED, "retry %d of %d in %s"
                .formatted(job.getRetryCount(), job.getMaxRetries(), delay));

            log.warn("🔁 Job {} of {} failed ({}: {}), retry {}/{} in {}",
                job.getJobId(), job.getFamilyId(), code, reason, job.getRetryCount(), job.getMaxRetries(), delay);
            return job;
        }

        log.error("❌ Job {} of {} failed terminally ({}: {})", job.getJobId(), job.getFamilyId(), job.getFailureCode(), reason);
        notificationService.notify(NotificationType.TRAINING_FAILED, job.getFamilyId(),
            "Job %s failed after %d retries: %s".formatted(job.getJobId(), job.getRetryCount(), reason));
        claimService.release(job.getTriggerId(), "TRAINING_" + job.getFailureCode().name());
        return job;
    }

    /**
     * {@code base × 2^attempt}, capped at lifecycle.retry.max-delay. {@code attempt} is the
     * zero-based index of the attempt that just failed.
     */
    Duration backoffDelay(int attempt) {
        Duration base = lifecycleProperties.getRetry().getBaseDelay();
        Duration max = lifecycleProperties.getRetry().getMaxDelay();
        int exponent = Math.min(Math.max(attempt, 0), 30);
        Duration delay = base.multipliedBy(1L << exponent);
        return delay.compareTo(max) > 0 ? max : delay;
    }

    private boolean isTimedOut(TrainingJob job, LocalDateTime now) {
        return job.getAttemptStartedAt() != null
            && !job.getAttemptStartedAt().plus(trainingProperties.getJobTimeout()).isAfter(now);
    }

    private void requestStop(String handle) {
        Future<?> signal = cancelExecutor.submit(() -> trainingClient.cancel(handle));
        try {
            signal.get(trainingProperties.getCancelTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            signal.cancel(true);
            log.warn("⏱️ Training operation did not acknowledge cancel of {} within {}, cancelling locally",
                handle, trainingProperties.getCancelTimeout());
        } catch (ExecutionException e) {
            log.warn("⚠️ Cancel signal for {} failed: {}", handle, e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while signalling cancel of {}", handle);
        }
    }

    private TrainingRequest toRequest(TrainingJob job) {
        List<String> scope = triggerRepository.findById(job.getTriggerId())
            .map(RetrainTrigger::getScopeJson)
            .map(this::readScope)
            .orElse(List.of());
        return new TrainingRequest(job.getJobId(), job.getFamilyId(), job.getCause(),
            job.getDataWindowStart(), job.getDataWindowEnd(), scope, job.getRetryCount() + 1);
    }

    private List<String> readScope(String scopeJson) {
        try {
            return objectMapper.readValue(scopeJson, new TypeReference<List<String>>() {});
        } catch (JsonProcessingException e) {
            log.error("Failed to parse trigger scope JSON", e);
            return List.of();
        }
    }

    private void recordTransition(TrainingJob job, TrainingJobState from, String note) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("from", from);
        detail.put("to", job.getState());
        detail.put("attempt", job.getRetryCount() + 1);
        detail.put("retryCount", job.getRetryCount());
        detail.put("handle", job.getExternalHandle());
        if (job.getState() == TrainingJobState.FAILED) {
            detail.put("failureCode", job.getFailureCode());
            detail.put("retryable", job.getFailureCode() != null && job.getFailureCode().isRetryable());
        }
        detail.put("note", note);
        auditLogService.record(AppConstants.ACTOR_TRAINING_JOB_MANAGER, job.getFamilyId(), job.getJobId(),
            job.getJobId(), AuditAction.JOB_STATE_CHANGED, job.getState().name(), detail);
    }

    private String toJson(Map<String, Double> metrics) {
        try {
            return objectMapper.writeValueAsString(metrics);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize candidate metrics", e);
            return "{}";
        }
    }

    private static String truncate(String reason) {
        if (reason == null) {
            return null;
        }
        return reason.length() > MAX_REASON_LENGTH ? reason.substring(0, MAX_REASON_LENGTH) : reason;
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
