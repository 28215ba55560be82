package tw.gc.auto.lifecycle.services.trigger;

import tw.gc.auto.lifecycle.services.evaluation.DriftVerdict;

/**
 * Result of one evaluation pass over a family.
 *
 * @param trigger submission made as a consequence; null when neither drift nor schedule called
 *                for retraining, or the family already had an active trigger
 */
public record EvaluationOutcome(
    String familyId,
    DriftVerdict drift,
    boolean scheduleDue,
    TriggerResult trigger
) {
    public boolean triggered() {
        return trigger != null && trigger.accepted();
    }
}
