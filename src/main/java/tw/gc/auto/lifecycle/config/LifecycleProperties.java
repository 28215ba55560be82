package tw.gc.auto.lifecycle.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Orchestrator configuration: system-wide threshold defaults, per-family overrides
 * and the knobs of the retry, evaluation and polling loops.
 */
@Data
@Component
@ConfigurationProperties(prefix = "lifecycle")
public class LifecycleProperties {

    private Defaults defaults = new Defaults();

    /**
     * Model families keyed by identifier. Unset fields fall back to {@link #defaults}.
     */
    private Map<String, FamilyConfig> families = new LinkedHashMap<>();

    private Retry retry = new Retry();
    private Store store = new Store();
    private Evaluation evaluation = new Evaluation();
    private Polling polling = new Polling();
    private int workers = 4;

    @Data
    public static class Defaults {
        private double driftThreshold = 0.03;
        private double autoDeployThreshold = 0.02;
        private Duration scheduleInterval = Duration.ofDays(7);
        private int minTrainingSamples = 500;
        private int maxRetries = 3;
        private double regressionTolerance = 0.01;
        private double qualityFloor = 0.70;
        private Duration lookbackWindow = Duration.ofDays(7);
    }

    @Data
    public static class FamilyConfig {
        private String description;
        private Double driftThreshold;
        private Double autoDeployThreshold;
        private Duration scheduleInterval;
        private Integer minTrainingSamples;
        private Integer maxRetries;
        private Double regressionTolerance;
        private Double qualityFloor;
        private Duration lookbackWindow;

        // Initial champion installed when the family has none yet
        private String championArtifact;
        private Double championScore;
    }

    @Data
    public static class Retry {
        private Duration baseDelay = Duration.ofSeconds(30);
        private Duration maxDelay = Duration.ofMinutes(30);
    }

    @Data
    public static class Store {
        private int maxAttempts = 3;
        private Duration backoff = Duration.ofMillis(200);
    }

    @Data
    public static class Evaluation {
        private boolean enabled = true;
        private String cron = "0 0 * * * *";
    }

    @Data
    public static class Polling {
        private boolean enabled = true;
        private long intervalMs = 30_000L;
    }
}
