package tw.gc.auto.lifecycle.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;
import tw.gc.auto.lifecycle.AppConstants;
import tw.gc.auto.lifecycle.config.LifecycleProperties;
import tw.gc.auto.lifecycle.services.trigger.EvaluationOutcome;
import tw.gc.auto.lifecycle.services.trigger.TriggerCoordinator;

import java.util.List;

/**
 * Periodic drift and schedule evaluation of every registered family. Families are evaluated
 * independently on the worker pool; one failing family does not stop the others.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PerformanceCheckScheduler {

    private final ModelFamilyService familyService;
    private final TriggerCoordinator triggerCoordinator;
    private final StoreRetryTemplate storeRetry;
    private final LifecycleProperties properties;
    private final ThreadPoolTaskExecutor lifecycleWorkers;

    @Scheduled(cron = "${lifecycle.evaluation.cron:0 0 * * * *}", zone = AppConstants.SCHEDULER_TIMEZONE)
    public void runEvaluationCycle() {
        if (!properties.getEvaluation().isEnabled()) {
            return;
        }
        try {
            List<String> familyIds = storeRetry.execute("listFamilies", familyService::listFamilyIds);
            log.info("📊 Evaluation cycle over {} families", familyIds.size());
            for (String familyId : familyIds) {
                try {
                    lifecycleWorkers.execute(() -> evaluate(familyId));
                } catch (TaskRejectedException e) {
                    log.warn("⚠️ Worker pool saturated, evaluation of {} skipped this cycle", familyId);
                }
            }
        } catch (Exception e) {
            log.error("❌ Evaluation cycle failed", e);
        }
    }

    void evaluate(String familyId) {
        try {
            EvaluationOutcome outcome = storeRetry.execute("evaluateFamily",
                () -> triggerCoordinator.evaluateFamily(familyId, null, null));
            if (outcome.triggered()) {
                log.info("🔄 {} retrain triggered for {}", outcome.trigger().cause(), familyId);
            } else {
                log.debug("{}: drift={} scheduleDue={}", familyId, outcome.drift().reason(), outcome.scheduleDue());
            }
        } catch (Exception e) {
            log.error("❌ Evaluation of {} failed", familyId, e);
        }
    }
}
