package guraa.renderverify.model;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * A named axis of environment variation (OS version, DPI, theme, culture...).
 * Whether a dimension may be used as a match criterion is fixed when it is declared.
 */
public final class Dimension {

    private final String name;
    private final boolean indexable;
    private final Supplier<String> probe;

    public Dimension(String name, boolean indexable, Supplier<String> probe) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Dimension name cannot be empty");
        }
        this.name = name;
        this.indexable = indexable;
        this.probe = Objects.requireNonNull(probe, "probe");
    }

    /**
     * Creates a placeholder for a dimension name found in stored metadata that the
     * catalog does not declare. It can never be registered as a criterion.
     *
     * @param name The dimension name as recorded
     * @return A non-indexable dimension with no known value
     */
    public static Dimension unregistered(String name) {
        return new Dimension(name, false, () -> null);
    }

    public String getName() {
        return name;
    }

    public boolean isIndexable() {
        return indexable;
    }

    /**
     * Queries the environment for the current value of this dimension.
     *
     * @return The current value, or null if it cannot be determined
     */
    public String currentValue() {
        return probe.get();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Dimension)) return false;
        return name.equalsIgnoreCase(((Dimension) o).name);
    }

    @Override
    public int hashCode() {
        return name.toLowerCase(Locale.ROOT).hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
