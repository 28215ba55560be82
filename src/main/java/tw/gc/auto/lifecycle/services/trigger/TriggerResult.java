package tw.gc.auto.lifecycle.services.trigger;

import tw.gc.auto.lifecycle.enums.TriggerCause;

/**
 * Immediate accept/reject answer to a trigger submission. A rejection is a verdict, not an error.
 */
public record TriggerResult(
    String familyId,
    TriggerCause cause,
    boolean accepted,
    String triggerId,
    String jobId,
    Rejection rejection,
    String detail
) {
    public enum Rejection {
        /** Another trigger holds the family's claim */
        ALREADY_ACTIVE,
        /** Too few observations in the lookback window for an unforced manual request */
        INSUFFICIENT_DATA,
        UNKNOWN_FAMILY
    }

    public static TriggerResult accepted(String familyId, TriggerCause cause, String triggerId, String jobId) {
        return new TriggerResult(familyId, cause, true, triggerId, jobId, null, "accepted");
    }

    public static TriggerResult rejected(String familyId, TriggerCause cause, Rejection rejection, String detail) {
        return new TriggerResult(familyId, cause, false, null, null, rejection, detail);
    }
}
