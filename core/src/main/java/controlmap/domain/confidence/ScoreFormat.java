package controlmap.domain.confidence;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Formats scores for explanations. The exact binary value of the double is rounded half-even, so 0.125
 * becomes "0.12" and 0.305 (stored as 0.30499999...) becomes "0.30". The output does not depend on the
 * default locale.
 */
public final class ScoreFormat {
    private ScoreFormat() {
    }

    public static String format(final double score, final int decimals) {
        if (Double.isNaN(score) || Double.isInfinite(score)) {
            return Double.toString(score);
        }

        return new BigDecimal(score)
                .setScale(decimals, RoundingMode.HALF_EVEN)
                .toPlainString();
    }
}
