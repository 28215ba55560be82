package tw.gc.auto.lifecycle.enums;

/**
 * Lifecycle: CANDIDATE → VALIDATED | REJECTED; VALIDATED → DEPLOYED | REJECTED; DEPLOYED → RETIRED
 */
public enum ModelVersionStatus {
    CANDIDATE,
    VALIDATED,
    REJECTED,
    DEPLOYED,
    RETIRED
}
