package guraa.renderverify.visual;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Scale ratio between the DPI a master was saved at and the DPI of a capture.
 */
public final class DpiRatio {

    private DpiRatio() {
    }

    /**
     * @return max/min of the two DPIs, rounded to two decimals; 1.0 if either is unusable
     */
    public static double between(String masterDpi, String capturedDpi) {
        double master = parse(masterDpi);
        double captured = parse(capturedDpi);
        if (!(master > 0) || !(captured > 0)) {
            return 1.0;
        }
        return between(master, master, captured, captured);
    }

    /**
     * Ratio of the diagonal DPI magnitudes, rounded to two decimals.
     */
    public static double between(double masterDpiX, double masterDpiY, double capturedDpiX, double capturedDpiY) {
        double masterDistance = Math.hypot(Math.round(masterDpiX), Math.round(masterDpiY));
        double capturedDistance = Math.hypot(Math.round(capturedDpiX), Math.round(capturedDpiY));
        if (!(masterDistance > 0) || !(capturedDistance > 0)) {
            return 1.0;
        }
        double ratio = Math.max(masterDistance, capturedDistance) / Math.min(masterDistance, capturedDistance);
        return BigDecimal.valueOf(ratio).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static double parse(String value) {
        if (value == null) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }
}
