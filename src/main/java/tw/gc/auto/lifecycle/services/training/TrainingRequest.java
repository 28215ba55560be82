package tw.gc.auto.lifecycle.services.training;

import tw.gc.auto.lifecycle.enums.TriggerCause;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Input contract of the external training operation.
 *
 * @param attempt 1-based attempt number within the job
 * @param scope optional sub-model types to retrain; empty means the whole family
 */
public record TrainingRequest(
    String jobId,
    String familyId,
    TriggerCause cause,
    LocalDateTime dataWindowStart,
    LocalDateTime dataWindowEnd,
    List<String> scope,
    int attempt
) {
}
