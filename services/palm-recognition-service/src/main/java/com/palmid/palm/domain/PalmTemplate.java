package com.palmid.palm.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.Optional;

/**
 * Transient result of turning one hand detection into a biometric template.
 */
@Value
@Builder
public class PalmTemplate {

    @NonNull
    String signature;

    /** Pairwise knuckle distances in image pixels. */
    @NonNull
    DistanceVector rawDistances;

    /** Raw distances divided by the wrist to middle knuckle distance. */
    @NonNull
    DistanceVector normalizedDistances;

    /** Snapshot of the detection the template was built from, if retained. */
    HandLandmarks landmarks;

    @NonNull
    Instant createdAt;

    public Optional<HandLandmarks> getLandmarkSnapshot() {
        return Optional.ofNullable(landmarks);
    }
}
