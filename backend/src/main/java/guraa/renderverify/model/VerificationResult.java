package guraa.renderverify.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of verifying one capture against its master.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationResult {

    /**
     * Logical test the capture belongs to.
     */
    private String testName;

    private VerificationStatus status;

    /**
     * File name of the master used (or created), if any.
     */
    private String masterFile;

    /**
     * DPI ratio whose tolerance table was applied.
     */
    private double dpiRatio;

    /**
     * Levels that exceeded their tolerance.
     */
    @Builder.Default
    private List<LevelViolation> violations = new ArrayList<>();

    private String message;

    public boolean isPassed() {
        return status == VerificationStatus.PASSED || status == VerificationStatus.BASELINE_CREATED;
    }
}
