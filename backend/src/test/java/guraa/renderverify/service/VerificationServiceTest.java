package guraa.renderverify.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import guraa.renderverify.config.AppProperties;
import guraa.renderverify.core.ErrorHistogramValidator;
import guraa.renderverify.model.VerificationResult;
import guraa.renderverify.model.VerificationStatus;
import guraa.renderverify.visual.ErrorHistogramCalculator;
import guraa.renderverify.visual.ToleranceCurveStretcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class VerificationServiceTest {

    @TempDir
    Path mastersDir;

    private AppProperties properties;
    private MasterIndexService masterIndexService;
    private ExecutorService executor;
    private VerificationService service;

    @BeforeEach
    void setUp() throws Exception {
        properties = new AppProperties();
        properties.getMasters().setDirectory(mastersDir.toString());
        properties.getMasters().setCreateMissing(false);
        properties.getDimensions().getOverrides().put("Theme", "aero");
        properties.getDimensions().getOverrides().put("Dpi", "96");
        properties.getDimensions().getOverrides().put("ColorDepth", "32");

        masterIndexService = new MasterIndexService(new ObjectMapper());
        ToleranceService toleranceService = new ToleranceService(properties);
        toleranceService.init();
        executor = Executors.newFixedThreadPool(2);

        service = new VerificationService(properties, masterIndexService, toleranceService,
                new ErrorHistogramCalculator(), new ErrorHistogramValidator(), new ToleranceCurveStretcher(), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static BufferedImage filled(int width, int height, int rgb) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, rgb);
            }
        }
        return image;
    }

    private void storeMaster(String testName, BufferedImage image) throws Exception {
        masterIndexService.createMaster(mastersDir, testName, image, service.currentEnvironment());
    }

    @Test
    void testMissingMasterNeedsBaseline() throws Exception {
        VerificationResult result = service.verify("login", filled(8, 8, 0x336699));

        assertEquals(VerificationStatus.BASELINE_NEEDED, result.getStatus());
        assertFalse(result.isPassed());
    }

    @Test
    void testMissingMasterIsCreatedThenMatched() throws Exception {
        properties.getMasters().setCreateMissing(true);

        VerificationResult created = service.verify("login", filled(8, 8, 0x336699));
        assertEquals(VerificationStatus.BASELINE_CREATED, created.getStatus());
        assertEquals("login_0.png", created.getMasterFile());
        assertTrue(Files.exists(mastersDir.resolve("login_0.png")));

        VerificationResult verified = service.verify("login", filled(8, 8, 0x336699));
        assertEquals(VerificationStatus.PASSED, verified.getStatus());
        assertEquals("login_0.png", verified.getMasterFile());
        assertEquals(1.0, verified.getDpiRatio(), 0.0);
    }

    @Test
    void testLargeDifferenceIsRegression() throws Exception {
        storeMaster("login", filled(8, 8, 0x000000));

        VerificationResult result = service.verify("login", filled(8, 8, 0xFFFFFF));

        assertEquals(VerificationStatus.REGRESSION, result.getStatus());
        assertFalse(result.getViolations().isEmpty());
    }

    @Test
    void testMasterOfAnotherTestIsNeverUsed() throws Exception {
        storeMaster("button_large", filled(8, 8, 0x336699));

        VerificationResult result = service.verify("button", filled(8, 8, 0x336699));

        assertEquals(VerificationStatus.BASELINE_NEEDED, result.getStatus());
        assertNull(result.getMasterFile());
    }

    @Test
    void testSizeMismatchIsRegression() throws Exception {
        storeMaster("login", filled(8, 8, 0x000000));

        VerificationResult result = service.verify("login", filled(9, 8, 0x000000));

        assertEquals(VerificationStatus.REGRESSION, result.getStatus());
        assertTrue(result.getMessage().startsWith("Size mismatch"));
    }

    @Test
    void testChangedEnvironmentDoesNotReuseMaster() throws Exception {
        storeMaster("login", filled(8, 8, 0x000000));
        properties.getDimensions().getOverrides().put("Theme", "classic");

        assertEquals(VerificationStatus.BASELINE_NEEDED, service.verify("login", filled(8, 8, 0x000000)).getStatus());
    }

    @Test
    void testToleranceFollowsDpiRatio() throws Exception {
        properties.getMasters().setDefaultCriteria(List.of("OsName", "Theme"));
        properties.getDimensions().getOverrides().put("Dpi", "144");
        storeMaster("login", filled(8, 8, 0x000000));
        properties.getDimensions().getOverrides().put("Dpi", "96");

        VerificationResult scaled = service.verify("login", filled(8, 8, 0x000000));
        assertEquals(VerificationStatus.PASSED, scaled.getStatus());
        assertEquals(1.5, scaled.getDpiRatio(), 0.0);

        properties.getDimensions().getOverrides().put("Dpi", "108");
        assertEquals(1.0, service.verify("login", filled(8, 8, 0x000000)).getDpiRatio(), 0.0);
    }

    @Test
    void testInvalidTestNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.verify("../etc", filled(1, 1, 0)));
        assertThrows(IllegalArgumentException.class, () -> service.verify("login", null));
    }

    @Test
    void testVerifyAllKeepsInputOrder() throws Exception {
        storeMaster("alpha", filled(8, 8, 0x202020));
        storeMaster("gamma", filled(8, 8, 0x000000));

        Map<String, BufferedImage> captures = new LinkedHashMap<>();
        captures.put("gamma", filled(8, 8, 0xFFFFFF));
        captures.put("beta", filled(8, 8, 0x202020));
        captures.put("alpha", filled(8, 8, 0x202020));

        List<VerificationResult> results = service.verifyAll(captures, Duration.ofSeconds(10));

        assertEquals(3, results.size());
        assertEquals("gamma", results.get(0).getTestName());
        assertEquals(VerificationStatus.REGRESSION, results.get(0).getStatus());
        assertEquals(VerificationStatus.BASELINE_NEEDED, results.get(1).getStatus());
        assertEquals(VerificationStatus.PASSED, results.get(2).getStatus());
    }

    @Test
    void testComparisonsNotFinishedInTimeAreIncomplete() throws Exception {
        storeMaster("alpha", filled(8, 8, 0x202020));
        ExecutorService blocked = Executors.newSingleThreadExecutor();
        CountDownLatch release = new CountDownLatch(1);
        blocked.execute(() -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        VerificationService slow = new VerificationService(properties, masterIndexService, new ToleranceService(properties),
                new ErrorHistogramCalculator(), new ErrorHistogramValidator(), new ToleranceCurveStretcher(), blocked);

        try {
            List<VerificationResult> results = slow.verifyAll(Map.of("alpha", filled(8, 8, 0x202020)), Duration.ofMillis(100));

            assertEquals(VerificationStatus.INCOMPLETE, results.get(0).getStatus());
            assertFalse(results.get(0).isPassed());
        } finally {
            release.countDown();
            blocked.shutdownNow();
        }
    }

    @Test
    void testRejectedComparisonIsIncomplete() throws Exception {
        storeMaster("alpha", filled(8, 8, 0x202020));
        executor.shutdownNow();

        List<VerificationResult> results = service.verifyAll(Map.of("alpha", filled(8, 8, 0x202020)), Duration.ofSeconds(1));

        assertEquals(VerificationStatus.INCOMPLETE, results.get(0).getStatus());
        assertEquals("Comparison failed to run", results.get(0).getMessage());
    }
}
