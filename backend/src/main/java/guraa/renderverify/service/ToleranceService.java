package guraa.renderverify.service;

import guraa.renderverify.config.AppProperties;
import guraa.renderverify.core.ToleranceCurve;
import guraa.renderverify.core.ToleranceParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Service holding the tolerance curve comparisons are judged against.
 * Readers always get their own copy; reloading swaps in a freshly parsed curve.
 */
@Slf4j
@Service
public class ToleranceService {

    static final String DEFAULT_TOLERANCE_RESOURCE = "tolerance/DefaultTolerance.xml";

    private final AppProperties properties;
    private final AtomicReference<ToleranceCurve> curve = new AtomicReference<>(new ToleranceCurve());

    public ToleranceService(AppProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void init() throws IOException, ToleranceParseException {
        reload();
    }

    /**
     * @return A private copy of the current curve, at ratio 1.0
     */
    public ToleranceCurve currentCurve() {
        return curve.get().copy();
    }

    /**
     * Parses the configured tolerance document and makes it current. The previous curve
     * stays in use if parsing fails.
     *
     * @throws IOException             If the document cannot be read
     * @throws ToleranceParseException If the document is malformed
     */
    public void reload() throws IOException, ToleranceParseException {
        Resource resource = toleranceResource();
        ToleranceCurve loaded = new ToleranceCurve();
        try (InputStream input = resource.getInputStream()) {
            loaded.load(input);
        } catch (ToleranceParseException e) {
            log.error("Invalid tolerance document {}: {}", resource.getDescription(), e.getMessage());
            throw e;
        }
        curve.set(loaded);
        log.info("Loaded tolerance from {} with DPI ratios {}", resource.getDescription(), loaded.getDpiRatios());
    }

    /**
     * Replaces the current curve.
     *
     * @param replacement The new curve; a copy is kept
     */
    public void replace(ToleranceCurve replacement) {
        if (replacement == null) {
            throw new IllegalArgumentException("Tolerance curve cannot be null");
        }
        curve.set(replacement.copy());
    }

    private Resource toleranceResource() {
        String file = properties.getTolerance().getFile();
        if (file != null && !file.isBlank()) {
            return new FileSystemResource(file);
        }
        return new ClassPathResource(DEFAULT_TOLERANCE_RESOURCE);
    }
}
