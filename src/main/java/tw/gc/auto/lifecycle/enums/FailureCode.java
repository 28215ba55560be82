package tw.gc.auto.lifecycle.enums;

/**
 * Classification of a failed training attempt.
 */
public enum FailureCode {
    /** External operation error or dispatch error; retried with backoff */
    TRANSIENT(true),
    /** Attempt exceeded training.job-timeout; retried with backoff */
    TIMEOUT(true),
    /** Non-retryable failure reported by the training operation (e.g. malformed input data) */
    FATAL(false),
    /** Retryable failures exceeded max_retries */
    RETRIES_EXHAUSTED(false),
    /** Manual cancel */
    CANCELLED(false);

    private final boolean retryable;

    FailureCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
