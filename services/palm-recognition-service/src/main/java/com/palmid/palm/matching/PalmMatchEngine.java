package com.palmid.palm.matching;

import com.palmid.palm.domain.DistanceVector;
import com.palmid.palm.domain.PalmRegistration;
import com.palmid.palm.domain.PalmTemplate;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

import static com.palmid.palm.util.PalmLogMasking.maskIdentity;

/**
 * Distance computation and nearest-neighbour search over normalized distance vectors.
 * Matching uses distance only; signatures are never compared.
 */
@Slf4j
public class PalmMatchEngine {

    /**
     * Euclidean distance over the keys present in both vectors.
     *
     * @return {@link Double#POSITIVE_INFINITY} when the vectors share no key
     */
    public double distance(DistanceVector first, DistanceVector second) {
        Set<String> commonKeys = new TreeSet<>(first.keys());
        commonKeys.retainAll(second.keys());
        if (commonKeys.isEmpty()) {
            return Double.POSITIVE_INFINITY;
        }
        double sumOfSquares = 0.0;
        for (String key : commonKeys) {
            double diff = first.get(key).getAsDouble() - second.get(key).getAsDouble();
            sumOfSquares += diff * diff;
        }
        return Math.sqrt(sumOfSquares);
    }

    /**
     * Closest candidate to {@code query}. On equal distances the earliest candidate wins.
     */
    public MatchResult search(PalmTemplate query, List<PalmRegistration> candidates) {
        PalmRegistration best = null;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (PalmRegistration candidate : candidates) {
            double distance = distance(query.getNormalizedDistances(), candidate.getNormalizedDistances());
            log.debug("{}: distance = {}", maskIdentity(candidate.getIdentity()),
                String.format(Locale.ROOT, "%.6f", distance));
            if (distance < bestDistance) {
                bestDistance = distance;
                best = candidate;
            }
        }
        if (best == null) {
            return MatchResult.none(candidates.size());
        }
        return new MatchResult(best, bestDistance, candidates.size());
    }

    /**
     * A match iff the distance is within the threshold (inclusive).
     */
    public boolean decide(double bestDistance, double threshold) {
        return bestDistance <= threshold;
    }
}
