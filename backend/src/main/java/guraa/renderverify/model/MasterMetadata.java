package guraa.renderverify.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of an environment: the value of every known dimension ("description") plus
 * the ordered dimensions a master image was tagged as caring about ("criteria").
 * Instances are never mutated after construction.
 */
public final class MasterMetadata {

    private static final MasterMetadata EMPTY = new MasterMetadata(Map.of(), List.of());

    private final Map<Dimension, String> description;
    private final List<Dimension> criteria;

    public MasterMetadata(Map<Dimension, String> description, List<Dimension> criteria) {
        this.description = Collections.unmodifiableMap(new LinkedHashMap<>(description));
        this.criteria = List.copyOf(criteria);
    }

    public static MasterMetadata empty() {
        return EMPTY;
    }

    public Map<Dimension, String> getDescription() {
        return description;
    }

    public List<Dimension> getCriteria() {
        return criteria;
    }

    public String valueOf(Dimension dimension) {
        return description.get(dimension);
    }

    /**
     * Returns a snapshot with the same description but different criteria.
     *
     * @param newCriteria The dimensions a master should be matched on
     * @return A new metadata instance
     */
    public MasterMetadata withCriteria(List<Dimension> newCriteria) {
        return new MasterMetadata(description, newCriteria);
    }

    @Override
    public String toString() {
        return "MasterMetadata{description=" + description + ", criteria=" + criteria + "}";
    }
}
