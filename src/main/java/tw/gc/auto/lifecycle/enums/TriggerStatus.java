package tw.gc.auto.lifecycle.enums;

public enum TriggerStatus {
    /** Holds the family's retrain claim */
    ACTIVE,
    /** Pipeline finished (deployed, held, rejected or failed); claim released */
    RESOLVED
}
