package guraa.renderverify.core;

import guraa.renderverify.model.Dimension;

/**
 * Thrown when a non-indexable dimension is registered as a match criterion.
 */
public class UnsupportedDimensionException extends IllegalArgumentException {

    private final String dimensionName;

    public UnsupportedDimensionException(Dimension dimension) {
        super("Dimension '" + dimension.getName() + "' is descriptive only and cannot be used as a match criterion");
        this.dimensionName = dimension.getName();
    }

    public String getDimensionName() {
        return dimensionName;
    }
}
