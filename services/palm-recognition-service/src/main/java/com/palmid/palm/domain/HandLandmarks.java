package com.palmid.palm.domain;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The full ordered set of 21 landmarks produced by a keypoint provider for one hand.
 */
@EqualsAndHashCode
@ToString
public class HandLandmarks {

    public static final int LANDMARK_COUNT = 21;

    private final List<Landmark> landmarks;

    private HandLandmarks(List<Landmark> landmarks) {
        this.landmarks = Collections.unmodifiableList(landmarks);
    }

    /**
     * @throws IllegalArgumentException unless exactly 21 landmarks are given, ordered by index
     */
    public static HandLandmarks of(List<Landmark> landmarks) {
        if (landmarks == null || landmarks.size() != LANDMARK_COUNT) {
            throw new IllegalArgumentException("Expected " + LANDMARK_COUNT + " landmarks but got "
                + (landmarks == null ? 0 : landmarks.size()));
        }
        List<Landmark> copy = new ArrayList<>(landmarks);
        for (int i = 0; i < copy.size(); i++) {
            Landmark landmark = copy.get(i);
            if (landmark == null || landmark.getIndex() != i) {
                throw new IllegalArgumentException("Landmark at position " + i + " has wrong index");
            }
        }
        return new HandLandmarks(copy);
    }

    public Landmark get(int index) {
        return landmarks.get(index);
    }

    public Landmark get(KnucklePoint point) {
        return landmarks.get(point.getLandmarkIndex());
    }

    public List<Landmark> asList() {
        return landmarks;
    }

    public double averageConfidence() {
        return landmarks.stream().mapToDouble(Landmark::getConfidence).average().orElse(0.0);
    }
}
