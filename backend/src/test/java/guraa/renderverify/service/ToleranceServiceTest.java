package guraa.renderverify.service;

import guraa.renderverify.config.AppProperties;
import guraa.renderverify.core.ToleranceCurve;
import guraa.renderverify.core.ToleranceParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ToleranceServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void testBundledToleranceIsLoadedByDefault() throws Exception {
        ToleranceService service = new ToleranceService(new AppProperties());
        service.init();

        ToleranceCurve curve = service.currentCurve();

        assertTrue(curve.getDpiRatios().containsAll(List.of(1.0, 1.25, 1.5, 2.0)));
        assertEquals(1.0, curve.getDpiRatio(), 0.0);
        assertEquals(1.0, curve.interpolatedValue(0), 0.0);
        assertEquals(0.0, curve.interpolatedValue(200), 0.0);
    }

    @Test
    void testReadersGetIndependentCopies() throws Exception {
        ToleranceService service = new ToleranceService(new AppProperties());
        service.init();

        ToleranceCurve mine = service.currentCurve();
        mine.clearEntries();

        assertTrue(service.currentCurve().hasEntries());
    }

    @Test
    void testInvalidDocumentKeepsPreviousCurve() throws Exception {
        Path file = tempDir.resolve("tolerance.xml");
        Files.write(file, ("<Tolerances><Tolerance ratio=\"1.0\"><Point level=\"0\" fraction=\"0.25\"/>"
                + "</Tolerance></Tolerances>").getBytes(StandardCharsets.UTF_8));
        AppProperties properties = new AppProperties();
        properties.getTolerance().setFile(file.toString());
        ToleranceService service = new ToleranceService(properties);
        service.init();
        assertEquals(0.25, service.currentCurve().interpolatedValue(10), 0.0);

        Files.write(file, "<Tolerances><Tolerance ratio=\"1.0\"><Point level=\"999\" fraction=\"0.5\"/></Tolerance></Tolerances>"
                .getBytes(StandardCharsets.UTF_8));

        assertThrows(ToleranceParseException.class, service::reload);
        assertEquals(0.25, service.currentCurve().interpolatedValue(10), 0.0);
    }

    @Test
    void testReplaceKeepsACopy() {
        ToleranceService service = new ToleranceService(new AppProperties());
        ToleranceCurve replacement = new ToleranceCurve();
        replacement.addEntry(0, 0.4);

        service.replace(replacement);
        replacement.addEntry(0, 0.9);

        assertEquals(0.4, service.currentCurve().interpolatedValue(0), 0.0);
    }
}
