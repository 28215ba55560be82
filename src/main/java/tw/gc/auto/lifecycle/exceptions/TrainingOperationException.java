package tw.gc.auto.lifecycle.exceptions;

/**
 * Failure talking to the external training operation.
 */
public class TrainingOperationException extends LifecycleException {

    private final boolean retryable;

    public TrainingOperationException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public TrainingOperationException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
