package tw.gc.auto.lifecycle.services.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import tw.gc.auto.lifecycle.enums.NotificationType;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Fire-and-forget notifications.
 *
 * <p>Inside a transaction delivery is deferred until after commit, so a rolled-back transition
 * never announces itself. Sink failures are logged and dropped.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NotificationService {

    private final List<NotificationSink> sinks;
    private final Clock clock;

    public void notify(NotificationType type, String familyId, String detail) {
        NotificationEvent event = new NotificationEvent(type, familyId, detail, LocalDateTime.now(clock));

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    dispatch(event);
                }
            });
        } else {
            dispatch(event);
        }
    }

    void dispatch(NotificationEvent event) {
        for (NotificationSink sink : sinks) {
            try {
                sink.deliver(event);
            } catch (RuntimeException e) {
                log.warn("⚠️ Notification {} for {} via {} failed: {}",
                    event.type(), event.familyId(), sink.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}
