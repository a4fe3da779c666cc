package guraa.renderverify.model;

import lombok.Value;

/**
 * An error level whose observed fraction exceeded the threshold applied at that level.
 */
@Value
public class LevelViolation {
    int level;
    double observed;
    double threshold;
}
