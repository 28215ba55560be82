package tw.gc.auto.lifecycle.services.evaluation;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tw.gc.auto.lifecycle.entities.ModelFamily;
import tw.gc.auto.lifecycle.entities.RetrainTrigger;
import tw.gc.auto.lifecycle.enums.TriggerCause;
import tw.gc.auto.lifecycle.repositories.RetrainTriggerRepository;
import tw.gc.auto.lifecycle.services.FamilyThresholds;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Time-based forced retraining, independent of measured performance. Guards against silent
 * staleness that accuracy alone does not reveal.
 *
 * <p>The interval runs from the later of the last deployment and the last scheduled retrain, so
 * a family whose scheduled candidate was held or rejected waits a full interval again.</p>
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ScheduleEvaluator {

    private final RetrainTriggerRepository triggerRepository;

    /**
     * True iff the family's schedule interval has elapsed since {@link #intervalStart}.
     * A family that has never deployed is not due.
     */
    public boolean dueForForcedRetrain(ModelFamily family, FamilyThresholds thresholds, LocalDateTime now) {
        LocalDateTime start = intervalStart(family);
        if (start == null) {
            return false;
        }
        return Duration.between(start, now).compareTo(thresholds.scheduleInterval()) >= 0;
    }

    /**
     * @return the later of the last deployment and the last SCHEDULE trigger; null if never deployed
     */
    public LocalDateTime intervalStart(ModelFamily family) {
        LocalDateTime lastDeployedAt = family.getLastDeployedAt();
        if (lastDeployedAt == null) {
            return null;
        }
        LocalDateTime lastScheduledAt = triggerRepository
            .findFirstByFamilyIdAndCauseOrderByCreatedAtDesc(family.getFamilyId(), TriggerCause.SCHEDULE)
            .map(RetrainTrigger::getCreatedAt)
            .orElse(null);
        return lastScheduledAt != null && lastScheduledAt.isAfter(lastDeployedAt) ? lastScheduledAt : lastDeployedAt;
    }
}
