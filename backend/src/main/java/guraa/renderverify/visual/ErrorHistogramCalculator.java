package guraa.renderverify.visual;

import guraa.renderverify.model.ErrorHistogram;
import lombok.extern.slf4j.Slf4j;

import java.awt.image.BufferedImage;

/**
 * Builds the error histogram of a capture against its master.
 *
 * The per-pixel error is the sum of absolute channel differences (at most 4 * 255),
 * which is bucketed into 256 levels and normalized by the number of pixels compared.
 * Only the area both images cover is compared.
 */
@Slf4j
public class ErrorHistogramCalculator {

    private static final int MAX_DIFF = 255 * 4;
    private static final double INTEGRITY_EPSILON = 1e-9;

    private final ChannelCompareMode mode;

    public ErrorHistogramCalculator() {
        this(ChannelCompareMode.ARGB);
    }

    public ErrorHistogramCalculator(ChannelCompareMode mode) {
        this.mode = mode == null ? ChannelCompareMode.ARGB : mode;
    }

    /**
     * Compare two images.
     *
     * @param master   The master image
     * @param captured The captured image
     * @return The normalized histogram, flagged if the images differ in size
     */
    public ErrorHistogram calculate(BufferedImage master, BufferedImage captured) {
        if (master == null || captured == null) {
            throw new IllegalArgumentException("Both images are required");
        }

        int width = Math.min(master.getWidth(), captured.getWidth());
        int height = Math.min(master.getHeight(), captured.getHeight());
        boolean sizeMismatch = master.getWidth() != captured.getWidth() || master.getHeight() != captured.getHeight();
        if (sizeMismatch) {
            log.debug("Image sizes differ: master {}x{}, capture {}x{}",
                    master.getWidth(), master.getHeight(), captured.getWidth(), captured.getHeight());
        }

        double[] counts = new double[ErrorHistogram.LEVELS];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int diff = pixelDifference(master.getRGB(x, y), captured.getRGB(x, y));
                counts[Math.min(diff, MAX_DIFF) / 4]++;
            }
        }

        double pixels = (double) width * height;
        double integral = 0.0;
        if (pixels > 0) {
            for (int level = 0; level < counts.length; level++) {
                integral += counts[level];
                counts[level] /= pixels;
            }
            integral /= pixels;
        }

        if (!sizeMismatch && pixels > 0 && Math.abs(integral - 1.0) > INTEGRITY_EPSILON) {
            throw new IllegalStateException("Error histogram does not integrate to 1.0: " + integral);
        }

        return new ErrorHistogram(counts, width, height, sizeMismatch);
    }

    int pixelDifference(int argb1, int argb2) {
        int diff = channelDiff(argb1, argb2, 16) + channelDiff(argb1, argb2, 8) + channelDiff(argb1, argb2, 0);
        if (mode == ChannelCompareMode.ARGB) {
            diff += channelDiff(argb1, argb2, 24);
        }
        return diff;
    }

    private static int channelDiff(int argb1, int argb2, int shift) {
        return Math.abs(((argb1 >>> shift) & 0xFF) - ((argb2 >>> shift) & 0xFF));
    }
}
