package com.palmid.palm.matching;

import com.palmid.palm.domain.PalmRegistration;
import lombok.Value;

import java.util.Optional;

/**
 * Nearest candidate found by a search. The best candidate is empty when there were no
 * candidates or none shared a measurement with the query; the distance is then infinite.
 */
@Value
public class MatchResult {

    PalmRegistration bestCandidate;
    double bestDistance;
    int candidatesCompared;

    public static MatchResult none(int candidatesCompared) {
        return new MatchResult(null, Double.POSITIVE_INFINITY, candidatesCompared);
    }

    public Optional<PalmRegistration> getBest() {
        return Optional.ofNullable(bestCandidate);
    }
}
