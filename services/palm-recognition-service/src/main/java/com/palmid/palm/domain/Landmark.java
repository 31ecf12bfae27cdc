package com.palmid.palm.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One detected hand landmark in image pixel coordinates.
 */
@Getter
@EqualsAndHashCode
@ToString
public class Landmark {

    private final int index;
    private final double x;
    private final double y;
    private final double confidence;

    public Landmark(int index, double x, double y, double confidence) {
        if (index < 0 || index >= HandLandmarks.LANDMARK_COUNT) {
            throw new IllegalArgumentException("Landmark index out of range: " + index);
        }
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException("Landmark " + index + " has non-finite coordinates");
        }
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("Landmark " + index + " confidence outside [0,1]: " + confidence);
        }
        this.index = index;
        this.x = x;
        this.y = y;
        this.confidence = confidence;
    }

    public double distanceTo(Landmark other) {
        return Math.hypot(x - other.x, y - other.y);
    }
}
