package tw.gc.auto.lifecycle.services.trigger;

import tw.gc.auto.lifecycle.enums.TriggerCause;

import java.util.List;

/**
 * A request to retrain one family.
 *
 * @param scope optional sub-model scoping passed through to the training operation
 * @param force skip the minimum-sample check of manual requests; mutual exclusion still applies
 */
public record RetrainRequest(
    String familyId,
    TriggerCause cause,
    List<String> scope,
    boolean force,
    String requestedBy,
    String reason
) {
    public RetrainRequest {
        if (familyId == null || familyId.isBlank()) {
            throw new IllegalArgumentException("familyId must not be blank");
        }
        if (cause == null) {
            throw new IllegalArgumentException("cause must not be null");
        }
        scope = scope == null ? List.of() : List.copyOf(scope);
    }

    public static RetrainRequest manual(String familyId, boolean force, String requestedBy) {
        return new RetrainRequest(familyId, TriggerCause.MANUAL, List.of(), force, requestedBy, "manual request");
    }
}
