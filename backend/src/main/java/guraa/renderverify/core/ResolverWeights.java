package guraa.renderverify.core;

import guraa.renderverify.model.Dimension;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The dimensions a caller requires a master to match on, with their relative importance.
 */
public class ResolverWeights {

    private final Map<Dimension, Integer> weights = new LinkedHashMap<>();

    /**
     * Registers a dimension as a match criterion.
     *
     * @param dimension The dimension, which must be indexable
     * @param weight    Non-negative importance of a match on this dimension
     * @return this, for chaining
     * @throws UnsupportedDimensionException if the dimension is descriptive only
     */
    public ResolverWeights require(Dimension dimension, int weight) {
        if (dimension == null) {
            throw new IllegalArgumentException("Dimension cannot be null");
        }
        if (!dimension.isIndexable()) {
            throw new UnsupportedDimensionException(dimension);
        }
        if (weight < 0) {
            throw new IllegalArgumentException("Weight must be non-negative, got " + weight + " for " + dimension);
        }
        weights.put(dimension, weight);
        return this;
    }

    public boolean contains(Dimension dimension) {
        return weights.containsKey(dimension);
    }

    public int weightOf(Dimension dimension) {
        Integer weight = weights.get(dimension);
        if (weight == null) {
            throw new IllegalArgumentException("Dimension " + dimension + " is not a registered criterion");
        }
        return weight;
    }

    public Map<Dimension, Integer> asMap() {
        return Collections.unmodifiableMap(weights);
    }

    public boolean isEmpty() {
        return weights.isEmpty();
    }

    @Override
    public String toString() {
        return "ResolverWeights" + weights;
    }
}
