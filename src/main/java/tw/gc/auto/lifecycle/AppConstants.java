package tw.gc.auto.lifecycle;

import java.time.ZoneId;

/**
 * Application-wide constants
 */
public final class AppConstants {

    // Timezone configuration
    public static final ZoneId TAIPEI_ZONE = ZoneId.of("Asia/Taipei");
    public static final String SCHEDULER_TIMEZONE = "Asia/Taipei";

    // Audit actors (component names)
    public static final String ACTOR_DRIFT_EVALUATOR = "DriftEvaluator";
    public static final String ACTOR_SCHEDULE_EVALUATOR = "ScheduleEvaluator";
    public static final String ACTOR_TRIGGER_COORDINATOR = "TriggerCoordinator";
    public static final String ACTOR_TRAINING_JOB_MANAGER = "TrainingJobManager";
    public static final String ACTOR_VALIDATION_GATE = "ValidationGate";
    public static final String ACTOR_DEPLOYMENT_DECIDER = "DeploymentDecider";
    public static final String ACTOR_FAMILY_REGISTRY = "ModelFamilyService";

    private AppConstants() {
        // Utility class
    }
}
