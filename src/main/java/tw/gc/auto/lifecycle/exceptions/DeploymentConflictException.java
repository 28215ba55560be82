package tw.gc.auto.lifecycle.exceptions;

/**
 * The champion pointer kept changing underneath a promotion, even after one re-fetch.
 */
public class DeploymentConflictException extends LifecycleException {

    private final String familyId;
    private final String candidateVersionId;

    public DeploymentConflictException(String familyId, String candidateVersionId, String observedChampion) {
        super("Champion of " + familyId + " changed concurrently (now " + observedChampion
                + "); promotion of " + candidateVersionId + " abandoned");
        this.familyId = familyId;
        this.candidateVersionId = candidateVersionId;
    }

    public String getFamilyId() {
        return familyId;
    }

    public String getCandidateVersionId() {
        return candidateVersionId;
    }
}
