package tw.gc.auto.lifecycle.enums;

public enum NotificationType {
    RETRAIN_TRIGGERED,
    TRAINING_FAILED,
    JOB_CANCELLED,
    VALIDATION_FAILED,
    MODEL_DEPLOYED,
    APPROVAL_REQUIRED,
    DEPLOYMENT_CONFLICT
}
