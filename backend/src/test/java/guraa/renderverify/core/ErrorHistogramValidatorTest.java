package guraa.renderverify.core;

import guraa.renderverify.model.LevelViolation;
import guraa.renderverify.model.ValidationReport;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ErrorHistogramValidatorTest {

    private final ErrorHistogramValidator validator = new ErrorHistogramValidator();

    @Test
    void testInheritedLandmarkFailsLevelOne() {
        ToleranceCurve curve = new ToleranceCurve();
        curve.addEntry(0, 0.0);
        curve.addEntry(2, 0.2);

        double[] histogram = {0.0, 0.05, 0.3};
        assertFalse(validator.validate(curve, histogram));

        ValidationReport report = validator.diagnose(curve, histogram);
        assertEquals(2, report.getViolations().size());
        LevelViolation first = report.getViolations().get(0);
        assertEquals(1, first.getLevel());
        assertEquals(0.0, first.getThreshold(), 0.0);
        assertEquals(0.2, report.getViolations().get(1).getThreshold(), 0.0);
    }

    @Test
    void testLevelZeroIsNeverTested() {
        ToleranceCurve curve = new ToleranceCurve();
        curve.addEntry(0, 0.0);

        assertTrue(validator.validate(curve, new double[]{1.0, 0.0, 0.0}));
    }

    @Test
    void testHistogramWithinToleranceAtEveryLevelPasses() {
        ToleranceCurve curve = new ToleranceCurve();
        curve.addEntry(0, 1.0);
        curve.addEntry(1, 0.1);
        curve.addEntry(10, 0.01);

        double[] histogram = new double[256];
        histogram[0] = 0.85;
        histogram[3] = 0.1;
        histogram[12] = 0.01;
        histogram[200] = 0.01;

        assertTrue(validator.validate(curve, histogram));
    }

    @Test
    void testEmptyCurveRequiresIdenticalImages() {
        ToleranceCurve curve = new ToleranceCurve();

        assertTrue(validator.validate(curve, new double[]{1.0, 0.0, 0.0}));

        ValidationReport report = validator.diagnose(curve, new double[]{0.99, 0.01});
        assertFalse(report.isPassed());
        assertTrue(report.isStrict());
    }

    @Test
    void testCurveWithoutEntriesAtActiveRatioIsStrict() {
        ToleranceCurve curve = new ToleranceCurve();
        curve.addEntry(0, 0.5);
        curve.setDpiRatio(2.0);

        assertFalse(validator.validate(curve, new double[]{0.9, 0.1}));
    }

    @Test
    void testLandmarkOfOneDoesNotReplaceRunningThreshold() {
        ToleranceCurve curve = new ToleranceCurve();
        curve.addEntry(0, 0.1);
        curve.addEntry(5, 1.0);
        assertEquals(1.0, curve.interpolatedValue(6), 0.0);

        double[] histogram = new double[8];
        histogram[0] = 0.5;
        histogram[6] = 0.5;

        ValidationReport report = validator.diagnose(curve, histogram);
        assertFalse(report.isPassed());
        assertEquals(6, report.getViolations().get(0).getLevel());
        assertEquals(0.1, report.getViolations().get(0).getThreshold(), 0.0);
    }

    @Test
    void testLevelsBelowFirstLandmarkAreUnconstrained() {
        ToleranceCurve curve = new ToleranceCurve();
        curve.addEntry(10, 0.0);

        double[] histogram = new double[12];
        histogram[0] = 0.7;
        histogram[5] = 0.3;
        assertTrue(validator.validate(curve, histogram));

        histogram[0] = 0.69;
        histogram[11] = 0.01;
        assertFalse(validator.validate(curve, histogram));
    }

    @Test
    void testInvalidHistogramIsRejected() {
        ToleranceCurve curve = new ToleranceCurve();

        assertThrows(IllegalArgumentException.class, () -> validator.validate(curve, null));
        assertThrows(IllegalArgumentException.class, () -> validator.validate(null, new double[]{1.0}));
        assertThrows(IllegalArgumentException.class, () -> validator.validate(curve, new double[]{1.5}));
        assertThrows(IllegalArgumentException.class, () -> validator.validate(curve, new double[257]));
    }
}
