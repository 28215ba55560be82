package tw.gc.auto.lifecycle.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tw.gc.auto.lifecycle.AppConstants;
import tw.gc.auto.lifecycle.entities.RetrainTrigger;
import tw.gc.auto.lifecycle.enums.AuditAction;
import tw.gc.auto.lifecycle.enums.TriggerStatus;
import tw.gc.auto.lifecycle.exceptions.UnknownEntityException;
import tw.gc.auto.lifecycle.repositories.ModelFamilyRepository;
import tw.gc.auto.lifecycle.repositories.RetrainTriggerRepository;
import tw.gc.auto.lifecycle.services.audit.AuditLogService;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-family retrain claim: at most one active trigger per family, held from acceptance until
 * the resulting candidate has been deployed, held, rejected, or the job has failed.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TriggerClaimService {

    private final ModelFamilyRepository familyRepository;
    private final RetrainTriggerRepository triggerRepository;
    private final AuditLogService auditLogService;
    private final Clock clock;

    /**
     * Atomically claims the family for {@code triggerId}.
     *
     * @return false when another trigger already holds the claim
     */
    @Transactional
    public boolean claim(String familyId, String triggerId) {
        return familyRepository.claimActiveTrigger(familyId, triggerId) == 1;
    }

    /**
     * Resolves the trigger and releases the family's claim. Releasing a trigger that is already
     * resolved is a no-op.
     */
    @Transactional
    public void release(String triggerId, String resolution) {
        RetrainTrigger trigger = triggerRepository.findById(triggerId)
            .orElseThrow(() -> new UnknownEntityException("retrain trigger", triggerId));
        if (trigger.getStatus() == TriggerStatus.RESOLVED) {
            return;
        }

        int released = familyRepository.releaseActiveTrigger(trigger.getFamilyId(), triggerId);
        if (released == 0) {
            log.warn("⚠️ Trigger {} did not hold the claim of {} at release", triggerId, trigger.getFamilyId());
        }

        trigger.setStatus(TriggerStatus.RESOLVED);
        trigger.setResolution(resolution);
        trigger.setResolvedAt(LocalDateTime.now(clock));
        triggerRepository.save(trigger);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("cause", trigger.getCause());
        detail.put("resolution", resolution);
        auditLogService.record(AppConstants.ACTOR_TRIGGER_COORDINATOR, trigger.getFamilyId(), triggerId,
            trigger.getJobId(), AuditAction.TRIGGER_RESOLVED, resolution, detail);

        log.info("🔓 Released {} claim on {} ({})", trigger.getCause(), trigger.getFamilyId(), resolution);
    }
}
