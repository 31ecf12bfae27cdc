package com.palmid.palm.domain;

import java.util.List;
import java.util.Locale;

/**
 * The five hand landmarks used as the biometric basis of a palm signature.
 * Indices follow the 21-point hand landmark layout (0 = wrist, 4 landmarks per finger).
 */
public enum KnucklePoint {
    WRIST(0),
    INDEX_KNUCKLE(5),
    MIDDLE_KNUCKLE(9),
    RING_KNUCKLE(13),
    PINKY_KNUCKLE(17);

    private static final List<KnucklePoint> ALL = List.of(values());

    private final int landmarkIndex;
    private final String key;

    KnucklePoint(int landmarkIndex) {
        this.landmarkIndex = landmarkIndex;
        this.key = name().toLowerCase(Locale.ROOT);
    }

    public int getLandmarkIndex() {
        return landmarkIndex;
    }

    /**
     * Lower-case name used to build distance keys, e.g. {@code middle_knuckle}
     */
    public String getKey() {
        return key;
    }

    public static List<KnucklePoint> all() {
        return ALL;
    }
}
