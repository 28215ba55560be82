package tw.gc.auto.lifecycle.services.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import tw.gc.auto.lifecycle.config.TelegramProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Posts lifecycle events to a Telegram chat.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TelegramNotificationSink implements NotificationSink {

    private final RestTemplate restTemplate;
    private final TelegramProperties telegramProperties;

    @Override
    public void deliver(NotificationEvent event) {
        String message = format(event);

        if (!telegramProperties.delivers(event.type())) {
            log.info("[Telegram {}] {}", telegramProperties.isEnabled() ? "muted" : "disabled", message);
            return;
        }

        String url = String.format("%s/bot%s/sendMessage",
                telegramProperties.getApiUrl(), telegramProperties.getBotToken());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> body = new HashMap<>();
        body.put("chat_id", telegramProperties.getChatId());
        body.put("text", message);

        restTemplate.postForObject(url, new HttpEntity<>(body, headers), String.class);
    }

    static String format(NotificationEvent event) {
        String icon = switch (event.type()) {
            case RETRAIN_TRIGGERED -> "🔄";
            case MODEL_DEPLOYED -> "✅";
            case APPROVAL_REQUIRED -> "🙋";
            case TRAINING_FAILED, VALIDATION_FAILED, DEPLOYMENT_CONFLICT -> "🚨";
            case JOB_CANCELLED -> "⛔";
        };
        return String.format(
            "%s %s\n" +
            "━━━━━━━━━━━━━━━━\n" +
            "Family: %s\n" +
            "%s",
            icon, event.type(), event.familyId(), event.detail() != null ? event.detail() : "");
    }
}
