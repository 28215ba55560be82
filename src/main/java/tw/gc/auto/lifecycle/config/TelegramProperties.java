package tw.gc.auto.lifecycle.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import tw.gc.auto.lifecycle.enums.NotificationType;

import java.util.EnumSet;
import java.util.Set;

/**
 * Telegram delivery of lifecycle notifications. Off unless explicitly enabled.
 */
@Data
@Component
@ConfigurationProperties(prefix = "telegram")
public class TelegramProperties {
    private boolean enabled = false;
    private String apiUrl = "https://api.telegram.org";
    private String botToken;
    private String chatId;
    /** Event types that are logged but not sent */
    private Set<NotificationType> mutedTypes = EnumSet.noneOf(NotificationType.class);

    public boolean delivers(NotificationType type) {
        return enabled && !mutedTypes.contains(type);
    }
}
