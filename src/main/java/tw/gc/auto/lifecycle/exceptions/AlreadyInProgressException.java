package tw.gc.auto.lifecycle.exceptions;

public class AlreadyInProgressException extends LifecycleException {

    private final String familyId;

    public AlreadyInProgressException(String familyId) {
        super("Retraining already in progress for " + familyId);
        this.familyId = familyId;
    }

    public String getFamilyId() {
        return familyId;
    }
}
