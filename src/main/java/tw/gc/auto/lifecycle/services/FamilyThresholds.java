package tw.gc.auto.lifecycle.services;

import tw.gc.auto.lifecycle.exceptions.InvalidConfigurationException;

import java.time.Duration;

/**
 * Effective per-family configuration: the family's overrides layered on the system defaults.
 *
 * @param driftThreshold minimum drop of live score below baseline that warrants retraining
 * @param autoDeployThreshold minimum improvement over the champion for promotion without approval
 * @param scheduleInterval forced-retrain interval measured from the last deployment
 * @param minTrainingSamples observations required in the lookback window before drift is judged
 * @param maxRetries automatic retries of a transiently failed training job
 * @param regressionTolerance how much worse than the champion a candidate may score and still pass
 * @param qualityFloor absolute minimum candidate score
 * @param lookbackWindow how far back observations count as recent
 */
public record FamilyThresholds(
    double driftThreshold,
    double autoDeployThreshold,
    Duration scheduleInterval,
    int minTrainingSamples,
    int maxRetries,
    double regressionTolerance,
    double qualityFloor,
    Duration lookbackWindow
) {
    public FamilyThresholds {
        requireFraction("drift_threshold", driftThreshold);
        requireFraction("auto_deploy_threshold", autoDeployThreshold);
        requireFraction("regression_tolerance", regressionTolerance);
        requireFraction("quality_floor", qualityFloor);
        requirePositive("schedule_interval", scheduleInterval);
        requirePositive("lookback_window", lookbackWindow);
        if (minTrainingSamples < 1) {
            throw new InvalidConfigurationException("min_training_samples must be at least 1, got: %d"
                .formatted(minTrainingSamples));
        }
        if (maxRetries < 0) {
            throw new InvalidConfigurationException("max_retries must be non-negative, got: %d".formatted(maxRetries));
        }
    }

    public FamilyThresholds withDriftThreshold(Double override) {
        if (override == null) {
            return this;
        }
        return new FamilyThresholds(override, autoDeployThreshold, scheduleInterval, minTrainingSamples,
            maxRetries, regressionTolerance, qualityFloor, lookbackWindow);
    }

    public FamilyThresholds withLookbackWindow(Duration override) {
        if (override == null) {
            return this;
        }
        return new FamilyThresholds(driftThreshold, autoDeployThreshold, scheduleInterval, minTrainingSamples,
            maxRetries, regressionTolerance, qualityFloor, override);
    }

    private static void requireFraction(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new InvalidConfigurationException("%s must be a fraction in [0, 1], got: %s".formatted(name, value));
        }
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new InvalidConfigurationException("%s must be a positive duration, got: %s".formatted(name, value));
        }
    }
}
