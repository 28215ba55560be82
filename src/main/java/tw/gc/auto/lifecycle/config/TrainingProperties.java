package tw.gc.auto.lifecycle.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Connection settings for the external training operation.
 */
@Data
@Component
@ConfigurationProperties(prefix = "training")
public class TrainingProperties {

    private Bridge bridge = new Bridge();

    @Data
    public static class Bridge {
        private String url = "http://localhost:8890";
        private int timeoutMs = 5000;
    }

    /**
     * A Running attempt older than this is failed as a retryable timeout.
     */
    private Duration jobTimeout = Duration.ofHours(6);

    /**
     * Upper bound on waiting for the training operation to acknowledge a cancel.
     */
    private Duration cancelTimeout = Duration.ofSeconds(10);

    /**
     * Name of the reported metric used as the candidate's score.
     */
    private String scoreMetric = "accuracy";
}
