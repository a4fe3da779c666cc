package guraa.renderverify.visual;

import guraa.renderverify.model.ErrorHistogram;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.*;

class ErrorHistogramCalculatorTest {

    private static BufferedImage filled(int width, int height, int argb) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, argb);
            }
        }
        return image;
    }

    @Test
    void testIdenticalImagesHaveAllErrorAtLevelZero() {
        BufferedImage image = filled(3, 3, 0xFF336699);

        ErrorHistogram histogram = new ErrorHistogramCalculator().calculate(image, filled(3, 3, 0xFF336699));

        assertEquals(1.0, histogram.fractionAt(0), 0.0);
        for (int level = 1; level < ErrorHistogram.LEVELS; level++) {
            assertEquals(0.0, histogram.fractionAt(level), 0.0);
        }
        assertFalse(histogram.isSizeMismatch());
    }

    @Test
    void testPixelErrorIsBucketedByFour() {
        BufferedImage master = filled(2, 2, 0xFF000000);
        BufferedImage captured = filled(2, 2, 0xFF000000);
        captured.setRGB(1, 1, 0xFF280000);

        ErrorHistogram histogram = new ErrorHistogramCalculator().calculate(master, captured);

        assertEquals(0.75, histogram.fractionAt(0), 1e-12);
        assertEquals(0.25, histogram.fractionAt(10), 1e-12);
    }

    @Test
    void testOppositeColoursLandInHighLevel() {
        ErrorHistogram histogram = new ErrorHistogramCalculator()
                .calculate(filled(2, 2, 0xFF000000), filled(2, 2, 0xFFFFFFFF));

        assertEquals(1.0, histogram.fractionAt(765 / 4), 0.0);
    }

    @Test
    void testRgbModeIgnoresAlpha() {
        BufferedImage master = filled(2, 2, 0xFF808080);
        BufferedImage captured = filled(2, 2, 0x10808080);

        assertEquals(1.0, new ErrorHistogramCalculator(ChannelCompareMode.RGB)
                .calculate(master, captured).fractionAt(0), 0.0);
        assertEquals(0.0, new ErrorHistogramCalculator(ChannelCompareMode.ARGB)
                .calculate(master, captured).fractionAt(0), 0.0);
    }

    @Test
    void testSizeMismatchIsFlagged() {
        ErrorHistogram histogram = new ErrorHistogramCalculator()
                .calculate(filled(2, 2, 0xFF000000), filled(3, 2, 0xFF000000));

        assertTrue(histogram.isSizeMismatch());
        assertEquals(2, histogram.getWidth());
        assertEquals(2, histogram.getHeight());
    }

    @Test
    void testMissingImageIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new ErrorHistogramCalculator().calculate(null, filled(1, 1, 0)));
    }
}
