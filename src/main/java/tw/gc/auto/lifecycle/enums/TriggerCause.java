package tw.gc.auto.lifecycle.enums;

/**
 * Why a retrain was requested.
 *
 * <p>When several causes fire in the same evaluation cycle only one trigger is submitted;
 * the cause with the highest {@link #precedence} is recorded.</p>
 */
public enum TriggerCause {
    MANUAL(3),
    PERFORMANCE_DRIFT(2),
    SCHEDULE(1);

    private final int precedence;

    TriggerCause(int precedence) {
        this.precedence = precedence;
    }

    public int getPrecedence() {
        return precedence;
    }

    public boolean outranks(TriggerCause other) {
        return other == null || precedence > other.precedence;
    }
}
