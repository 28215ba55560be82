package tw.gc.auto.lifecycle.services.evaluation;

/**
 * @param meanScore mean of the window at score scale; null when {@code count} is zero
 */
public record ObservationSummary(long count, Double meanScore) {
}
