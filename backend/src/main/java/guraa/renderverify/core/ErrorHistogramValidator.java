package guraa.renderverify.core;

import guraa.renderverify.model.LevelViolation;
import guraa.renderverify.model.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks an error histogram against a tolerance curve.
 *
 * Thresholds are walked upward from level 0 with a running value that starts at 1.0.
 * A level's threshold replaces the running value unless it equals it or equals 1.0, so a
 * landmark keeps applying to the levels above it until the next one. Level 0 (pixels
 * that match exactly) is never tested. A curve with no entries for its active ratio
 * requires the images to be identical.
 */
public class ErrorHistogramValidator {

    private static final Logger logger = LoggerFactory.getLogger(ErrorHistogramValidator.class);

    private static final double NO_CONSTRAINT = 1.0;
    private static final double STRICT = 0.0;

    /**
     * @param curve     The tolerance to apply, at its active ratio
     * @param histogram Observed fraction of pixels per error level
     * @return true if no tested level exceeds its threshold
     */
    public boolean validate(ToleranceCurve curve, double[] histogram) {
        return diagnose(curve, histogram).isPassed();
    }

    /**
     * Same as {@link #validate} but reports every level that failed.
     *
     * @param curve     The tolerance to apply, at its active ratio
     * @param histogram Observed fraction of pixels per error level
     * @return The pass/fail result with its violations
     */
    public ValidationReport diagnose(ToleranceCurve curve, double[] histogram) {
        checkArguments(curve, histogram);

        boolean strict = !curve.hasEntries();
        if (strict) {
            logger.debug("No tolerance set for DPI ratio {}, requiring identical images", curve.getDpiRatio());
        }

        List<LevelViolation> violations = new ArrayList<>();
        double sentinel = NO_CONSTRAINT;

        for (int level = 0; level < histogram.length; level++) {
            double threshold = strict ? STRICT : curve.interpolatedValue(level);
            if (!Double.isNaN(threshold) && threshold != sentinel && threshold != NO_CONSTRAINT) {
                sentinel = threshold;
            }

            if (level == 0) {
                continue;
            }

            if (histogram[level] > sentinel) {
                logger.debug("Level {} exceeds tolerance: observed {} > allowed {}", level, histogram[level], sentinel);
                violations.add(new LevelViolation(level, histogram[level], sentinel));
            }
        }

        return new ValidationReport(violations.isEmpty(), strict, violations);
    }

    private static void checkArguments(ToleranceCurve curve, double[] histogram) {
        if (curve == null) {
            throw new IllegalArgumentException("Tolerance curve cannot be null");
        }
        if (histogram == null) {
            throw new IllegalArgumentException("Error histogram cannot be null");
        }
        if (histogram.length > ToleranceCurve.MAX_LEVEL + 1) {
            throw new IllegalArgumentException("Error histogram has " + histogram.length + " levels, at most 256 allowed");
        }
        for (int i = 0; i < histogram.length; i++) {
            if (!(histogram[i] >= 0.0 && histogram[i] <= 1.0)) {
                throw new IllegalArgumentException("Histogram value at level " + i + " is outside [0.0, 1.0]: " + histogram[i]);
            }
        }
    }
}
