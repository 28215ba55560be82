package tw.gc.auto.lifecycle.services;

import tw.gc.auto.lifecycle.entities.AuditEntry;
import tw.gc.auto.lifecycle.entities.ModelVersion;
import tw.gc.auto.lifecycle.entities.RetrainTrigger;
import tw.gc.auto.lifecycle.entities.TrainingJob;

import java.util.List;

/**
 * Point-in-time view of one family for status queries.
 *
 * @param champion current DEPLOYED version; null before the first deployment
 * @param activeTrigger trigger holding the family's claim; null when idle
 * @param activeJob PENDING or RUNNING job; null when none
 * @param lastDecision most recent decision entry of the audit trail
 * @param heldCandidates VALIDATED versions awaiting manual approval
 */
public record FamilyStatus(
    String familyId,
    String description,
    FamilyThresholds thresholds,
    ModelVersion champion,
    RetrainTrigger activeTrigger,
    TrainingJob activeJob,
    AuditEntry lastDecision,
    List<ModelVersion> heldCandidates
) {
    public boolean idle() {
        return activeTrigger == null && activeJob == null;
    }
}
