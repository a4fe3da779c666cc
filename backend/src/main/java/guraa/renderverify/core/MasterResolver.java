package guraa.renderverify.core;

import guraa.renderverify.model.Dimension;
import guraa.renderverify.model.MasterCandidate;
import guraa.renderverify.model.MasterMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the stored master that best matches the current environment.
 *
 * Every criterion a candidate was tagged with must be one the caller requires, and the
 * caller's current value must equal the recorded one (ignoring case); the candidate then
 * scores the sum of the weights of its criteria. The highest score wins, the earliest
 * candidate winning ties.
 */
public class MasterResolver {

    private static final Logger logger = LoggerFactory.getLogger(MasterResolver.class);

    private static final long DISQUALIFIED = -1;

    private final MasterMetadata current;

    /**
     * @param current Description of the machine the capture was taken on
     */
    public MasterResolver(MasterMetadata current) {
        if (current == null) {
            throw new IllegalArgumentException("Current environment metadata cannot be null");
        }
        this.current = current;
    }

    /**
     * Selects the best candidate.
     *
     * @param candidates Candidates in a deterministic order; ties go to the first
     * @param weights    Required criteria and their weights
     * @return The winner, or a not-found resolution if every candidate was disqualified
     */
    public MasterResolution resolve(List<MasterCandidate> candidates, ResolverWeights weights) {
        if (candidates == null || weights == null) {
            throw new IllegalArgumentException("Candidates and weights cannot be null");
        }

        Map<Path, Long> scores = new LinkedHashMap<>();
        MasterCandidate best = null;
        long bestScore = DISQUALIFIED;

        for (MasterCandidate candidate : candidates) {
            long score = score(candidate, weights);
            scores.put(candidate.getFile(), score);
            logger.debug("Master candidate {} scored {}", candidate.getFileName(), score);

            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }

        if (best == null) {
            logger.info("No usable master among {} candidate(s) for {}", candidates.size(), weights);
            return MasterResolution.notFound(scores);
        }

        logger.debug("Selected master {} with score {}", best.getFileName(), bestScore);
        return MasterResolution.found(best, bestScore, scores);
    }

    /**
     * Scores one candidate.
     *
     * @return The summed weight of the candidate's criteria, or -1 if disqualified
     */
    long score(MasterCandidate candidate, ResolverWeights weights) {
        long score = 0;
        MasterMetadata metadata = candidate.getMetadata();

        for (Dimension criterion : metadata.getCriteria()) {
            if (!weights.contains(criterion)) {
                logger.trace("{} requires {} which the caller did not specify", candidate.getFileName(), criterion);
                return DISQUALIFIED;
            }

            String expected = metadata.valueOf(criterion);
            String actual = current.valueOf(criterion);
            if (expected == null || !expected.equalsIgnoreCase(actual)) {
                logger.trace("{} recorded {}={} but current value is {}",
                        candidate.getFileName(), criterion, expected, actual);
                return DISQUALIFIED;
            }

            score += weights.weightOf(criterion);
        }
        return score;
    }
}
