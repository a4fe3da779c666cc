package guraa.renderverify.model;

import lombok.Value;

import java.util.List;

/**
 * Outcome of validating an error histogram against a tolerance curve.
 */
@Value
public class ValidationReport {

    boolean passed;

    /**
     * True when the curve had no entries and strict equality was required.
     */
    boolean strict;

    List<LevelViolation> violations;
}
