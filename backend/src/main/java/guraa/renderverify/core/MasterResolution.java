package guraa.renderverify.core;

import guraa.renderverify.model.MasterCandidate;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Result of a master search: either the winning candidate, or no usable master.
 * Not finding a master is an expected outcome, typically answered by creating one.
 */
public final class MasterResolution {

    private final MasterCandidate master;
    private final long score;
    private final Map<Path, Long> scores;

    private MasterResolution(MasterCandidate master, long score, Map<Path, Long> scores) {
        this.master = master;
        this.score = score;
        this.scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
    }

    static MasterResolution found(MasterCandidate master, long score, Map<Path, Long> scores) {
        return new MasterResolution(master, score, scores);
    }

    static MasterResolution notFound(Map<Path, Long> scores) {
        return new MasterResolution(null, -1, scores);
    }

    public boolean isFound() {
        return master != null;
    }

    public Optional<MasterCandidate> getMaster() {
        return Optional.ofNullable(master);
    }

    /**
     * @return The winning score, or -1 when nothing was found
     */
    public long getScore() {
        return score;
    }

    /**
     * @return Score of every evaluated candidate by master file, -1 meaning disqualified
     */
    public Map<Path, Long> getScores() {
        return scores;
    }

    @Override
    public String toString() {
        return isFound()
                ? "Found(" + master.getFileName() + ", score=" + score + ")"
                : "NotFound(evaluated=" + scores.size() + ")";
    }
}
