package guraa.renderverify.model;

import lombok.Value;

/**
 * Point-in-time view of one tracked comparison.
 * {@code succeeded} is meaningful only when {@code completed} is true.
 */
@Value
public class ComparisonOutcome {
    int index;
    boolean succeeded;
    boolean completed;
}
