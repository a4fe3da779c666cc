package guraa.renderverify.controller;

import guraa.renderverify.model.Dimension;
import guraa.renderverify.model.MasterMetadata;
import guraa.renderverify.model.VerificationResult;
import guraa.renderverify.model.VerificationStatus;
import guraa.renderverify.service.VerificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class VerificationController {

    private final VerificationService verificationService;

    @Value("${app.comparison.timeout-seconds:60}")
    private long timeoutSeconds = 60;

    /**
     * Verify one capture against the master of its test.
     *
     * @param testName The logical test name
     * @param capture  The captured image
     * @return 200 if it passed or a new master was stored, 409 if a baseline is needed,
     *         422 if the capture regressed
     * @throws IOException If the capture or the masters cannot be read
     */
    @PostMapping(value = "/verifications", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<VerificationResult> verify(
            @RequestParam("testName") String testName,
            @RequestParam("capture") MultipartFile capture) throws IOException {
        log.info("Verification requested for {}", testName);
        VerificationResult result = verificationService.verify(testName, decode(capture));
        return ResponseEntity.status(statusOf(result.getStatus())).body(result);
    }

    /**
     * Verify several captures concurrently. Each file's base name is its test name.
     *
     * @param captures The captured images
     * @return The verdicts with a summary
     * @throws IOException If a capture or the masters cannot be read
     */
    @PostMapping(value = "/verifications/batch", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Map<String, Object>> verifyBatch(
            @RequestParam("captures") List<MultipartFile> captures) throws IOException {
        Map<String, BufferedImage> images = new LinkedHashMap<>();
        for (MultipartFile capture : captures) {
            String testName = baseName(capture.getOriginalFilename());
            if (images.put(testName, decode(capture)) != null) {
                throw new IllegalArgumentException("Duplicate capture for test " + testName);
            }
        }

        List<VerificationResult> results = verificationService.verifyAll(images, Duration.ofSeconds(timeoutSeconds));

        Map<String, Long> summary = results.stream()
                .collect(Collectors.groupingBy(r -> r.getStatus().name(), LinkedHashMap::new, Collectors.counting()));
        Map<String, Object> response = new HashMap<>();
        response.put("results", results);
        response.put("summary", summary);
        response.put("passed", results.stream().allMatch(VerificationResult::isPassed));
        return ResponseEntity.ok(response);
    }

    /**
     * Describe the environment masters are currently matched against.
     *
     * @return Dimension values and the dimensions usable as criteria
     */
    @GetMapping("/environment")
    public ResponseEntity<Map<String, Object>> environment() {
        MasterMetadata current = verificationService.currentEnvironment();

        Map<String, String> description = new LinkedHashMap<>();
        current.getDescription().forEach((dimension, value) -> description.put(dimension.getName(), value));

        Map<String, Object> response = new HashMap<>();
        response.put("description", description);
        response.put("criteria", verificationService.resolverWeights().asMap().entrySet().stream()
                .collect(Collectors.toMap(e -> e.getKey().getName(), Map.Entry::getValue,
                        (a, b) -> a, LinkedHashMap::new)));
        response.put("defaultCriteria", current.getCriteria().stream()
                .map(Dimension::getName)
                .collect(Collectors.toList()));
        return ResponseEntity.ok(response);
    }

    private static HttpStatus statusOf(VerificationStatus status) {
        switch (status) {
            case BASELINE_NEEDED:
                return HttpStatus.CONFLICT;
            case REGRESSION:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case INCOMPLETE:
                return HttpStatus.ACCEPTED;
            default:
                return HttpStatus.OK;
        }
    }

    private static BufferedImage decode(MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Capture file is empty");
        }
        try (InputStream input = file.getInputStream()) {
            BufferedImage image = ImageIO.read(input);
            if (image == null) {
                throw new IllegalArgumentException("Unsupported image format: " + file.getOriginalFilename());
            }
            return image;
        }
    }

    private static String baseName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("Every capture needs a file name");
        }
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
