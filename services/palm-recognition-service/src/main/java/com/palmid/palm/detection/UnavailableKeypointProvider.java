package com.palmid.palm.detection;

import com.palmid.palm.domain.HandLandmarks;
import com.palmid.palm.exception.DetectionException;

import java.nio.file.Path;

/**
 * Provider used when no detection model is configured. Every call fails with
 * {@link DetectionError#UNAVAILABLE}.
 */
public class UnavailableKeypointProvider implements KeypointProvider {

    @Override
    public HandLandmarks detect(Path image) {
        throw new DetectionException(DetectionError.UNAVAILABLE, "Palm recognition model not available");
    }

    @Override
    public String getName() {
        return "none";
    }
}
