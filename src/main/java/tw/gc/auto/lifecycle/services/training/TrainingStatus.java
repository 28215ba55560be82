package tw.gc.auto.lifecycle.services.training;

import java.util.Map;

/**
 * Status reported by the external training operation for one handle.
 */
public record TrainingStatus(
    Phase phase,
    String artifactRef,
    Map<String, Double> metrics,
    String failureReason,
    boolean retryable
) {
    public enum Phase { RUNNING, SUCCEEDED, FAILED }

    public static TrainingStatus running() {
        return new TrainingStatus(Phase.RUNNING, null, Map.of(), null, false);
    }

    public static TrainingStatus succeeded(String artifactRef, Map<String, Double> metrics) {
        return new TrainingStatus(Phase.SUCCEEDED, artifactRef, metrics != null ? Map.copyOf(metrics) : Map.of(), null, false);
    }

    public static TrainingStatus failed(String reason, boolean retryable) {
        return new TrainingStatus(Phase.FAILED, null, Map.of(), reason, retryable);
    }
}
