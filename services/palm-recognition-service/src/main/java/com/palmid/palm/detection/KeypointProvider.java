package com.palmid.palm.detection;

import com.palmid.palm.domain.HandLandmarks;
import com.palmid.palm.exception.DetectionException;

import java.nio.file.Path;

/**
 * Source of hand landmarks for an image. Implementations wrap an external detector;
 * the recognition pipeline never retries or post-processes their output.
 */
public interface KeypointProvider {

    /**
     * Detect the 21 hand landmarks in {@code image}.
     *
     * @throws DetectionException with {@link DetectionError#UNAVAILABLE} when no model is loaded,
     *         {@link DetectionError#NOT_FOUND} when no hand is visible
     */
    HandLandmarks detect(Path image);

    /**
     * Short name used in logs.
     */
    String getName();
}
