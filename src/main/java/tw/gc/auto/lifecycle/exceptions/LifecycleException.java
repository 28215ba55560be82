package tw.gc.auto.lifecycle.exceptions;

/**
 * Root of the orchestrator's unrecoverable conditions. Decision outcomes (insufficient data,
 * validation failure, hold-for-approval) are result values and never use this hierarchy.
 */
public class LifecycleException extends RuntimeException {

    public LifecycleException(String message) {
        super(message);
    }

    public LifecycleException(String message, Throwable cause) {
        super(message, cause);
    }
}
