package guraa.renderverify.controller;

import guraa.renderverify.core.ToleranceCurve;
import guraa.renderverify.core.ToleranceParseException;
import guraa.renderverify.service.ToleranceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/tolerance")
@RequiredArgsConstructor
public class ToleranceController {

    private final ToleranceService toleranceService;

    /**
     * Get the tolerance currently applied, as a tolerance document.
     *
     * @return The XML document
     */
    @GetMapping(produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<String> getTolerance() {
        return ResponseEntity.ok(toleranceService.currentCurve().toXml());
    }

    /**
     * Re-read the configured tolerance document. The previous tolerance stays in force if
     * the document is invalid.
     *
     * @return The DPI ratios now configured
     * @throws IOException             If the document cannot be read
     * @throws ToleranceParseException If the document is malformed
     */
    @PostMapping("/reload")
    public ResponseEntity<Map<String, Object>> reload() throws IOException, ToleranceParseException {
        log.info("Reloading tolerance");
        toleranceService.reload();
        ToleranceCurve curve = toleranceService.currentCurve();

        Map<String, Object> response = new HashMap<>();
        response.put("dpiRatios", curve.getDpiRatios());
        return ResponseEntity.ok(response);
    }
}
