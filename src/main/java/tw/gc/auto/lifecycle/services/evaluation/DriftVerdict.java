package tw.gc.auto.lifecycle.services.evaluation;

/**
 * Outcome of comparing a family's recent live score with its champion's deployment-time score.
 *
 * @param currentScore mean of the observations in the window; null when there were none
 * @param baselineScore champion's recorded validation score; null without a champion
 * @param delta {@code baselineScore - currentScore}; positive means degradation
 */
public record DriftVerdict(
    String familyId,
    boolean retrain,
    Double currentScore,
    Double baselineScore,
    Double delta,
    double threshold,
    long sampleCount,
    Reason reason,
    String detail
) {
    public enum Reason {
        DRIFT_DETECTED,
        WITHIN_THRESHOLD,
        INSUFFICIENT_DATA,
        NO_BASELINE
    }
}
