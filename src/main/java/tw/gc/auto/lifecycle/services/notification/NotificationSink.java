package tw.gc.auto.lifecycle.services.notification;

/**
 * Delivery channel for lifecycle events. Implementations may throw; the caller isolates failures.
 */
public interface NotificationSink {

    void deliver(NotificationEvent event);
}
