package guraa.renderverify.visual;

import guraa.renderverify.core.ToleranceCurve;
import lombok.extern.slf4j.Slf4j;

/**
 * Rebuilds a tolerance curve when master and capture were rendered at different colour
 * depths. If exactly one side is at a low depth, quantization shifts errors by a few
 * levels, so each level takes the largest tolerance within that many levels of it.
 * Any rebuilt curve has a value at every level; levels below the first landmark get 0.0.
 */
@Slf4j
public class ToleranceCurveStretcher {

    private static final int LOW_COLOR_DEPTH = 16;
    private static final int LEVEL_OFFSET = 6;

    /**
     * @param curve           Curve at the ratio to stretch
     * @param masterBitDepth  Bits per pixel of the master
     * @param capturedBitDepth Bits per pixel of the capture
     * @return A new curve; a plain copy when both depths are equal
     */
    public ToleranceCurve stretch(ToleranceCurve curve, int masterBitDepth, int capturedBitDepth) {
        ToleranceCurve stretched = curve.copy();
        if (masterBitDepth == capturedBitDepth || !curve.hasEntries()) {
            return stretched;
        }

        boolean masterLow = masterBitDepth <= LOW_COLOR_DEPTH;
        boolean capturedLow = capturedBitDepth <= LOW_COLOR_DEPTH;
        int offset = masterLow != capturedLow ? LEVEL_OFFSET : 0;
        log.debug("Rebuilding tolerance with a {} level window for colour depths {} / {}",
                offset, masterBitDepth, capturedBitDepth);

        stretched.clearEntries();
        double previous = Double.NaN;
        for (int level = ToleranceCurve.MIN_LEVEL; level <= ToleranceCurve.MAX_LEVEL; level++) {
            double localMax = 0.0;
            for (int shift = -offset; shift <= offset; shift++) {
                int neighbour = level + shift;
                if (neighbour >= ToleranceCurve.MIN_LEVEL && neighbour <= ToleranceCurve.MAX_LEVEL) {
                    double value = curve.interpolatedValue(neighbour);
                    if (value > localMax) {
                        localMax = value;
                    }
                }
            }
            if (localMax != previous) {
                previous = localMax;
                stretched.addEntry(level, localMax);
            }
        }
        return stretched;
    }
}
