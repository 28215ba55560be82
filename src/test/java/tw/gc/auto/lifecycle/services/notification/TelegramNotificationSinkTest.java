package tw.gc.auto.lifecycle.services.notification;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpEntity;
import org.springframework.web.client.RestTemplate;
import tw.gc.auto.lifecycle.config.TelegramProperties;
import tw.gc.auto.lifecycle.enums.NotificationType;

import java.util.EnumSet;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static tw.gc.auto.lifecycle.testutil.LifecycleTestFactory.FAMILY;
import static tw.gc.auto.lifecycle.testutil.LifecycleTestFactory.NOW;

@ExtendWith(MockitoExtension.class)
class TelegramNotificationSinkTest {

    @Mock
    private RestTemplate restTemplate;

    private TelegramProperties properties;
    private TelegramNotificationSink sink;

    @BeforeEach
    void setUp() {
        properties = new TelegramProperties();
        properties.setBotToken("test-token");
        properties.setChatId("12345");
        properties.setEnabled(true);
        sink = new TelegramNotificationSink(restTemplate, properties);
    }

    @Test
    @SuppressWarnings("unchecked")
    void postsFormattedMessageToChat() {
        sink.deliver(new NotificationEvent(NotificationType.APPROVAL_REQUIRED, FAMILY, "cand-1 held", NOW));

        ArgumentCaptor<HttpEntity<Map<String, Object>>> captor = ArgumentCaptor.forClass(HttpEntity.class);
        verify(restTemplate).postForObject(eq("https://api.telegram.org/bottest-token/sendMessage"),
            captor.capture(), eq(String.class));
        Map<String, Object> body = captor.getValue().getBody();
        assertThat(body).containsEntry("chat_id", "12345");
        assertThat((String) body.get("text")).contains("APPROVAL_REQUIRED", FAMILY, "cand-1 held");
    }

    @Test
    void disabledSinkOnlyLogs() {
        properties.setEnabled(false);

        sink.deliver(new NotificationEvent(NotificationType.MODEL_DEPLOYED, FAMILY, "deployed", NOW));

        verifyNoInteractions(restTemplate);
    }

    @Test
    void disabledByDefault() {
        assertThat(new TelegramProperties().isEnabled()).isFalse();
    }

    @Test
    void mutedTypeIsNotSent() {
        properties.setMutedTypes(EnumSet.of(NotificationType.RETRAIN_TRIGGERED));

        sink.deliver(new NotificationEvent(NotificationType.RETRAIN_TRIGGERED, FAMILY, "drift", NOW));
        sink.deliver(new NotificationEvent(NotificationType.MODEL_DEPLOYED, FAMILY, "deployed", NOW));

        verify(restTemplate, times(1)).postForObject(anyString(), any(HttpEntity.class), eq(String.class));
    }

    @Test
    void failureIconForFailures() {
        String message = TelegramNotificationSink.format(
            new NotificationEvent(NotificationType.TRAINING_FAILED, FAMILY, null, NOW));

        assertThat(message).startsWith("🚨 TRAINING_FAILED").contains("Family: " + FAMILY);
    }
}
