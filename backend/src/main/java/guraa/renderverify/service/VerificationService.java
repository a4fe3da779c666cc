package guraa.renderverify.service;

import guraa.renderverify.config.AppProperties;
import guraa.renderverify.core.ComparisonResultTracker;
import guraa.renderverify.core.ComparisonUnit;
import guraa.renderverify.core.DimensionCatalog;
import guraa.renderverify.core.ErrorHistogramValidator;
import guraa.renderverify.core.MasterResolution;
import guraa.renderverify.core.MasterResolver;
import guraa.renderverify.core.ResolverWeights;
import guraa.renderverify.core.ToleranceCurve;
import guraa.renderverify.model.ComparisonOutcome;
import guraa.renderverify.model.Dimension;
import guraa.renderverify.model.ErrorHistogram;
import guraa.renderverify.model.MasterCandidate;
import guraa.renderverify.model.MasterMetadata;
import guraa.renderverify.model.ValidationReport;
import guraa.renderverify.model.VerificationResult;
import guraa.renderverify.model.VerificationStatus;
import guraa.renderverify.visual.DpiRatio;
import guraa.renderverify.visual.ErrorHistogramCalculator;
import guraa.renderverify.visual.ToleranceCurveStretcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.regex.Pattern;

/**
 * Service verifying captures against their masters: find the master matching the
 * current environment, build the error histogram, and judge it against the tolerance
 * for the DPI ratio between the two.
 */
@Slf4j
@Service
public class VerificationService {

    private static final Pattern TEST_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");
    private static final int DEFAULT_COLOR_DEPTH = 32;
    private static final int DEFAULT_WEIGHT = 1;

    private final AppProperties properties;
    private final MasterIndexService masterIndexService;
    private final ToleranceService toleranceService;
    private final ErrorHistogramCalculator histogramCalculator;
    private final ErrorHistogramValidator validator;
    private final ToleranceCurveStretcher stretcher;
    private final ExecutorService executorService;

    public VerificationService(
            AppProperties properties,
            MasterIndexService masterIndexService,
            ToleranceService toleranceService,
            ErrorHistogramCalculator histogramCalculator,
            ErrorHistogramValidator validator,
            ToleranceCurveStretcher stretcher,
            @Qualifier("comparisonExecutor") ExecutorService executorService) {
        this.properties = properties;
        this.masterIndexService = masterIndexService;
        this.toleranceService = toleranceService;
        this.histogramCalculator = histogramCalculator;
        this.validator = validator;
        this.stretcher = stretcher;
        this.executorService = executorService;
    }

    /**
     * Verify one capture.
     *
     * @param testName The logical test the capture belongs to
     * @param capture  The captured image
     * @return The verdict
     * @throws IOException If masters cannot be read or written
     */
    public VerificationResult verify(String testName, BufferedImage capture) throws IOException {
        checkRequest(testName, capture);

        MasterMetadata current = currentEnvironment();
        MasterResolution resolution = resolveMaster(testName, current);
        if (!resolution.isFound()) {
            return handleMissingMaster(testName, capture, current);
        }

        MasterCandidate candidate = resolution.getMaster().orElseThrow();
        BufferedImage master = readMaster(candidate);
        try {
            return compare(testName, candidate, master, capture, current);
        } finally {
            master.flush();
        }
    }

    /**
     * Verify several captures, each comparison running on the comparison executor.
     * Comparisons still running when the timeout expires are reported as incomplete.
     *
     * @param captures Captured images by test name, in reporting order
     * @param timeout  How long to wait for the comparisons
     * @return The verdicts, in the order of {@code captures}
     * @throws IOException If masters cannot be read or written
     */
    public List<VerificationResult> verifyAll(Map<String, BufferedImage> captures, Duration timeout) throws IOException {
        for (Map.Entry<String, BufferedImage> entry : captures.entrySet()) {
            checkRequest(entry.getKey(), entry.getValue());
        }

        MasterMetadata current = currentEnvironment();
        Map<String, VerificationResult> immediate = new LinkedHashMap<>();
        Map<Integer, String> testByIndex = new LinkedHashMap<>();
        Map<Integer, VerificationResult> verdicts = new ConcurrentHashMap<>();
        Map<String, VerificationResult> incomplete = new LinkedHashMap<>();

        try (ComparisonResultTracker tracker = new ComparisonResultTracker()) {
            int index = 0;
            for (Map.Entry<String, BufferedImage> entry : captures.entrySet()) {
                String testName = entry.getKey();
                MasterResolution resolution = resolveMaster(testName, current);
                if (!resolution.isFound()) {
                    immediate.put(testName, handleMissingMaster(testName, entry.getValue(), current));
                    continue;
                }

                MasterCandidate candidate = resolution.getMaster().orElseThrow();
                ComparisonUnit unit = new ComparisonUnit(index++, readMaster(candidate), entry.getValue());
                tracker.register(unit);
                testByIndex.put(unit.getIndex(), testName);
                submit(unit, testName, candidate, current, verdicts);
            }

            if (!tracker.awaitAll(timeout)) {
                log.warn("Not every comparison finished within {}", timeout);
            }

            for (ComparisonOutcome outcome : tracker.results()) {
                String testName = testByIndex.get(outcome.getIndex());
                if (!outcome.isCompleted() || !verdicts.containsKey(outcome.getIndex())) {
                    incomplete.put(testName, VerificationResult.builder()
                            .testName(testName)
                            .status(VerificationStatus.INCOMPLETE)
                            .message(outcome.isCompleted() ? "Comparison failed to run" : "Comparison did not finish in time")
                            .build());
                } else {
                    immediate.put(testName, verdicts.get(outcome.getIndex()));
                }
            }
        }

        List<VerificationResult> results = new ArrayList<>();
        for (String testName : captures.keySet()) {
            VerificationResult result = immediate.get(testName);
            results.add(result != null ? result : incomplete.get(testName));
        }
        return results;
    }

    /**
     * @return Description of the machine this service runs on, overrides applied
     */
    public MasterMetadata currentEnvironment() {
        return DimensionCatalog.describeCurrentEnvironment(
                properties.getDimensions().getOverrides(), defaultCriteria());
    }

    /**
     * Builds the resolver weights from configuration. Without configured weights every
     * indexable dimension is required with weight 1.
     *
     * @return The weights
     */
    public ResolverWeights resolverWeights() {
        ResolverWeights weights = new ResolverWeights();
        Map<String, Integer> configured = properties.getDimensions().getWeights();
        if (configured == null || configured.isEmpty()) {
            DimensionCatalog.indexable().forEach(dimension -> weights.require(dimension, DEFAULT_WEIGHT));
            return weights;
        }

        configured.forEach((name, weight) -> {
            Optional<Dimension> dimension = DimensionCatalog.byName(name);
            if (dimension.isEmpty()) {
                log.warn("Ignoring weight for unknown dimension: {}", name);
            } else {
                weights.require(dimension.get(), weight);
            }
        });
        return weights;
    }

    private void submit(ComparisonUnit unit, String testName, MasterCandidate candidate,
                        MasterMetadata current, Map<Integer, VerificationResult> verdicts) {
        try {
            executorService.execute(() -> {
                try {
                    VerificationResult result = compare(testName, candidate, unit.getMaster(), unit.getCaptured(), current);
                    verdicts.put(unit.getIndex(), result);
                    unit.complete(result.getStatus() == VerificationStatus.PASSED);
                } catch (RuntimeException e) {
                    log.error("Error comparing {} against {}: {}", testName, candidate.getFileName(), e.getMessage(), e);
                    unit.fail(e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("Comparison executor rejected {}", testName);
            unit.fail(e);
        }
    }

    private MasterResolution resolveMaster(String testName, MasterMetadata current) throws IOException {
        List<MasterCandidate> candidates = masterIndexService.mastersOf(mastersDirectory(), testName);
        MasterResolution resolution = new MasterResolver(current).resolve(candidates, resolverWeights());
        log.debug("Master resolution for {}: {}", testName, resolution);
        return resolution;
    }

    private VerificationResult handleMissingMaster(String testName, BufferedImage capture, MasterMetadata current)
            throws IOException {
        if (!properties.getMasters().isCreateMissing()) {
            log.info("Baseline needed for {}", testName);
            return VerificationResult.builder()
                    .testName(testName)
                    .status(VerificationStatus.BASELINE_NEEDED)
                    .message("No master matches the current environment")
                    .build();
        }

        Path created = masterIndexService.createMaster(mastersDirectory(), testName, capture, current);
        return VerificationResult.builder()
                .testName(testName)
                .status(VerificationStatus.BASELINE_CREATED)
                .masterFile(created.getFileName().toString())
                .message("No master matched the current environment, capture stored as a new master")
                .build();
    }

    VerificationResult compare(String testName, MasterCandidate candidate, BufferedImage master,
                               BufferedImage capture, MasterMetadata current) {
        ErrorHistogram histogram = histogramCalculator.calculate(master, capture);
        MasterMetadata masterMetadata = candidate.getMetadata();

        ToleranceCurve curve = toleranceService.currentCurve();
        double ratio = DpiRatio.between(masterMetadata.valueOf(DimensionCatalog.DPI), current.valueOf(DimensionCatalog.DPI));
        curve.setDpiRatio(ratio);
        if (!curve.hasEntries()) {
            log.debug("No tolerance for DPI ratio {}, falling back to {}", ratio, ToleranceCurve.DEFAULT_DPI_RATIO);
            curve.setDpiRatio(ToleranceCurve.DEFAULT_DPI_RATIO);
        }
        curve = stretcher.stretch(curve,
                colorDepth(masterMetadata.valueOf(DimensionCatalog.COLOR_DEPTH)),
                colorDepth(current.valueOf(DimensionCatalog.COLOR_DEPTH)));

        VerificationResult.VerificationResultBuilder result = VerificationResult.builder()
                .testName(testName)
                .masterFile(candidate.getFileName())
                .dpiRatio(curve.getDpiRatio());

        if (histogram.isSizeMismatch()) {
            log.info("{} differs in size from master {}", testName, candidate.getFileName());
            return result.status(VerificationStatus.REGRESSION)
                    .message(String.format("Size mismatch: master %dx%d, capture %dx%d",
                            master.getWidth(), master.getHeight(), capture.getWidth(), capture.getHeight()))
                    .build();
        }

        ValidationReport report = validator.diagnose(curve, histogram.getFractions());
        if (report.isPassed()) {
            log.info("{} matches master {}", testName, candidate.getFileName());
            return result.status(VerificationStatus.PASSED).build();
        }

        log.info("{} exceeds tolerance against master {} at {} level(s)",
                testName, candidate.getFileName(), report.getViolations().size());
        return result.status(VerificationStatus.REGRESSION)
                .violations(new ArrayList<>(report.getViolations()))
                .message(report.isStrict() ? "Images differ and no tolerance is configured" : "Error histogram exceeds tolerance")
                .build();
    }

    private BufferedImage readMaster(MasterCandidate candidate) throws IOException {
        BufferedImage image = ImageIO.read(candidate.getFile().toFile());
        if (image == null) {
            throw new IOException("Unsupported image format for master " + candidate.getFile());
        }
        return image;
    }

    private List<Dimension> defaultCriteria() {
        List<Dimension> criteria = new ArrayList<>();
        for (String name : properties.getMasters().getDefaultCriteria()) {
            Optional<Dimension> dimension = DimensionCatalog.byName(name);
            if (dimension.isPresent() && dimension.get().isIndexable()) {
                criteria.add(dimension.get());
            } else {
                log.warn("Ignoring default criterion that is not an indexable dimension: {}", name);
            }
        }
        return criteria;
    }

    private Path mastersDirectory() {
        return Paths.get(properties.getMasters().getDirectory());
    }

    private static int colorDepth(String value) {
        if (value == null) {
            return DEFAULT_COLOR_DEPTH;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return DEFAULT_COLOR_DEPTH;
        }
    }

    private static void checkRequest(String testName, BufferedImage capture) {
        if (testName == null || !TEST_NAME.matcher(testName).matches()) {
            throw new IllegalArgumentException("Invalid test name: " + testName);
        }
        if (capture == null) {
            throw new IllegalArgumentException("Capture for " + testName + " is missing");
        }
    }
}
