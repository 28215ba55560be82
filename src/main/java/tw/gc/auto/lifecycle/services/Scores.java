package tw.gc.auto.lifecycle.services;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Score arithmetic in decimal terms, so that threshold comparisons such as
 * {@code 0.82 - 0.80 >= 0.02} hold exactly as written in configuration.
 */
public final class Scores {

    static final int SCALE = 6;

    private Scores() {
        // Utility class
    }

    public static double delta(double minuend, double subtrahend) {
        return BigDecimal.valueOf(minuend)
                .subtract(BigDecimal.valueOf(subtrahend))
                .setScale(SCALE, RoundingMode.HALF_UP)
                .doubleValue();
    }

    public static double round(double score) {
        return BigDecimal.valueOf(score).setScale(SCALE, RoundingMode.HALF_UP).doubleValue();
    }
}
