package tw.gc.auto.lifecycle.services.promotion;

/**
 * Deploy or hold, for one validated candidate.
 *
 * @param delta candidate score minus champion score; null when there was no comparable champion
 * @param threshold the family's auto-deploy threshold at decision time
 */
public record DeploymentDecision(
    String familyId,
    String candidateVersionId,
    Outcome outcome,
    Reason reason,
    Double delta,
    double threshold,
    String detail
) {
    public enum Outcome {
        DEPLOY,
        HOLD_FOR_APPROVAL
    }

    public enum Reason {
        /** Improvement reached the auto-deploy threshold */
        THRESHOLD_MET,
        /** Improvement below the auto-deploy threshold */
        BELOW_THRESHOLD,
        /** Family had no champion; a candidate over the quality floor becomes the first one */
        FIRST_CHAMPION,
        /** Champion exists but has no recorded score to compare against */
        NO_COMPARABLE_BASELINE
    }

    public boolean deploy() {
        return outcome == Outcome.DEPLOY;
    }
}
