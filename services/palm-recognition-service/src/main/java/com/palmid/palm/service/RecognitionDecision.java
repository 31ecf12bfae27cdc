package com.palmid.palm.service;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of comparing one palm template against the store.
 */
@Value
@Builder
public class RecognitionDecision {

    public enum Outcome {
        MATCH,
        NO_MATCH,
        /** Targeted recognition for an identity with no registration. */
        NOT_REGISTERED,
        /** Open-set recognition with nothing registered. */
        EMPTY_STORE
    }

    Outcome outcome;
    /** Matched identity, or the targeted identity; empty for an open-set non-match. */
    String identity;
    double bestDistance;
    double threshold;
    int candidatesCompared;

    public boolean isMatched() {
        return outcome == Outcome.MATCH;
    }

    /**
     * {@code 1 - bestDistance}. A display value, not a probability: it is negative for
     * distances above 1. Null when nothing was compared.
     */
    public Double getConfidence() {
        return Double.isFinite(bestDistance) ? 1.0 - bestDistance : null;
    }
}
