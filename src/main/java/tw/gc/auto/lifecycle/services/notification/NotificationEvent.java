package tw.gc.auto.lifecycle.services.notification;

import tw.gc.auto.lifecycle.enums.NotificationType;

import java.time.LocalDateTime;

public record NotificationEvent(NotificationType type, String familyId, String detail, LocalDateTime occurredAt) {
}
