package guraa.renderverify.model;

import lombok.Getter;

/**
 * Normalized per-level error fractions produced by comparing a master with a capture.
 */
@Getter
public class ErrorHistogram {

    public static final int LEVELS = 256;

    private final double[] fractions;
    private final int width;
    private final int height;
    private final boolean sizeMismatch;

    public ErrorHistogram(double[] fractions, int width, int height, boolean sizeMismatch) {
        this.fractions = fractions.clone();
        this.width = width;
        this.height = height;
        this.sizeMismatch = sizeMismatch;
    }

    public double[] getFractions() {
        return fractions.clone();
    }

    public double fractionAt(int level) {
        return fractions[level];
    }
}
