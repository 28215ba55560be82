package tw.gc.auto.lifecycle.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;
import tw.gc.auto.lifecycle.config.LifecycleProperties;
import tw.gc.auto.lifecycle.entities.RetrainTrigger;
import tw.gc.auto.lifecycle.entities.TrainingJob;
import tw.gc.auto.lifecycle.enums.TrainingJobState;
import tw.gc.auto.lifecycle.enums.TriggerStatus;
import tw.gc.auto.lifecycle.repositories.RetrainTriggerRepository;
import tw.gc.auto.lifecycle.repositories.TrainingJobRepository;
import tw.gc.auto.lifecycle.services.promotion.PromotionPipeline;
import tw.gc.auto.lifecycle.services.training.TrainingJobManager;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives every in-flight job one step per tick on the worker pool.
 *
 * <p>At most one task per family is in flight at a time; a family still busy from the previous
 * tick is skipped. Jobs that succeeded while their trigger stayed active (e.g. the process died
 * between training completion and the deployment decision) are handed to the promotion pipeline
 * again.</p>
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TrainingJobPoller {

    private final TrainingJobManager jobManager;
    private final PromotionPipeline promotionPipeline;
    private final TrainingJobRepository jobRepository;
    private final RetrainTriggerRepository triggerRepository;
    private final StoreRetryTemplate storeRetry;
    private final LifecycleProperties properties;
    private final ThreadPoolTaskExecutor lifecycleWorkers;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    @Scheduled(fixedDelayString = "${lifecycle.polling.interval-ms:30000}", initialDelay = 5_000)
    public void pollActiveJobs() {
        if (!properties.getPolling().isEnabled()) {
            return;
        }
        try {
            List<TrainingJob> active = storeRetry.execute("pollActiveJobs", jobManager::findActiveJobs);
            for (TrainingJob job : active) {
                String jobId = job.getJobId();
                submitForFamily(job.getFamilyId(), () -> advanceJob(jobId));
            }

            for (TrainingJob job : findUnpromotedJobs()) {
                String jobId = job.getJobId();
                log.warn("♻️ Job {} of {} succeeded without a decision, resuming promotion", jobId, job.getFamilyId());
                submitForFamily(job.getFamilyId(), () -> promote(jobId));
            }
        } catch (Exception e) {
            log.error("❌ Training job poll tick failed", e);
        }
    }

    void advanceJob(String jobId) {
        TrainingJob job = storeRetry.execute("advanceJob", () -> jobManager.advance(jobId));
        if (job.getState() == TrainingJobState.SUCCEEDED) {
            promote(jobId);
        }
    }

    void promote(String jobId) {
        PromotionPipeline.Outcome outcome = storeRetry.execute("promote", () -> promotionPipeline.process(jobId));
        log.info("🏁 Job {} pipeline finished: {}", jobId, outcome);
    }

    private List<TrainingJob> findUnpromotedJobs() {
        return storeRetry.execute("findUnpromotedJobs", () -> triggerRepository.findByStatus(TriggerStatus.ACTIVE).stream()
            .map(RetrainTrigger::getJobId)
            .filter(Objects::nonNull)
            .map(jobRepository::findById)
            .flatMap(Optional::stream)
            .filter(job -> job.getState() == TrainingJobState.SUCCEEDED)
            .toList());
    }

    private void submitForFamily(String familyId, Runnable task) {
        if (!inFlight.add(familyId)) {
            log.debug("Family {} still busy from previous tick", familyId);
            return;
        }
        try {
            lifecycleWorkers.execute(() -> {
                try {
                    task.run();
                } catch (Exception e) {
                    log.error("❌ Pipeline step for {} failed", familyId, e);
                } finally {
                    inFlight.remove(familyId);
                }
            });
        } catch (TaskRejectedException e) {
            inFlight.remove(familyId);
            log.warn("⚠️ Worker pool saturated, {} deferred to next tick", familyId);
        }
    }

    boolean isInFlight(String familyId) {
        return inFlight.contains(familyId);
    }
}
