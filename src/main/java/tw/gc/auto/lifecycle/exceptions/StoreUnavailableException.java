package tw.gc.auto.lifecycle.exceptions;

public class StoreUnavailableException extends LifecycleException {

    private final int attempts;

    public StoreUnavailableException(String operation, int attempts, Throwable cause) {
        super("Store unavailable during " + operation + " after " + attempts + " attempt(s)", cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
