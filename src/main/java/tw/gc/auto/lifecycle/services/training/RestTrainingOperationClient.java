package tw.gc.auto.lifecycle.services.training;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import tw.gc.auto.lifecycle.config.TrainingProperties;
import tw.gc.auto.lifecycle.exceptions.TrainingOperationException;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

/**
 * Talks to the training bridge over HTTP.
 *
 * <pre>
 * POST {url}/train                  → {"job_handle": "..."}
 * GET  {url}/train/{handle}         → {"status": "running|succeeded|failed", "artifact_ref", "metrics", "reason", "retryable"}
 * POST {url}/train/{handle}/cancel
 * </pre>
 *
 * 4xx answers are the bridge rejecting the request itself and are not retried.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RestTrainingOperationClient implements TrainingOperationClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final TrainingProperties trainingProperties;

    @Override
    public String submitTraining(TrainingRequest request) {
        Map<String, Object> body = new HashMap<>();
        body.put("job_id", request.jobId());
        body.put("family", request.familyId());
        body.put("cause", request.cause().name().toLowerCase(Locale.ROOT));
        body.put("data_window_start", request.dataWindowStart().toString());
        body.put("data_window_end", request.dataWindowEnd().toString());
        body.put("scope", request.scope());
        body.put("attempt", request.attempt());

        log.info("📤 Submitting training job={} family={} attempt={}", request.jobId(), request.familyId(), request.attempt());
        JsonNode response = call("submit " + request.jobId(),
            () -> restTemplate.postForObject(getBridgeUrl() + "/train", body, String.class));

        String handle = response.path("job_handle").asText(null);
        if (handle == null || handle.isBlank()) {
            throw new TrainingOperationException("Training bridge returned no job_handle for " + request.jobId(), true);
        }
        return handle;
    }

    @Override
    public TrainingStatus pollStatus(String handle) {
        JsonNode response = call("poll " + handle,
            () -> restTemplate.getForObject(getBridgeUrl() + "/train/" + handle, String.class));

        String status = response.path("status").asText("");
        return switch (status.toLowerCase(Locale.ROOT)) {
            case "running", "pending", "queued" -> TrainingStatus.running();
            case "succeeded", "success", "completed" -> TrainingStatus.succeeded(
                response.path("artifact_ref").asText(null), readMetrics(response.path("metrics")));
            case "failed", "error" -> TrainingStatus.failed(
                response.path("reason").asText("unspecified"), response.path("retryable").asBoolean(true));
            default -> throw new TrainingOperationException("Unknown training status '" + status + "' for " + handle, true);
        };
    }

    @Override
    public void cancel(String handle) {
        call("cancel " + handle,
            () -> restTemplate.postForObject(getBridgeUrl() + "/train/" + handle + "/cancel", Map.of(), String.class));
    }

    private JsonNode call(String operation, RestCall call) {
        String raw;
        try {
            raw = call.execute();
        } catch (HttpClientErrorException e) {
            throw new TrainingOperationException("Training bridge rejected " + operation + ": " + e.getStatusCode(), false, e);
        } catch (RestClientException e) {
            throw new TrainingOperationException("Training bridge unreachable during " + operation + ": " + e.getMessage(), true, e);
        }
        if (raw == null || raw.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new TrainingOperationException("Unreadable training bridge response during " + operation, true, e);
        }
    }

    private static Map<String, Double> readMetrics(JsonNode node) {
        Map<String, Double> metrics = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isNumber()) {
                metrics.put(field.getKey(), field.getValue().asDouble());
            }
        }
        return metrics;
    }

    private String getBridgeUrl() {
        return trainingProperties.getBridge().getUrl();
    }

    @FunctionalInterface
    private interface RestCall {
        String execute();
    }
}
