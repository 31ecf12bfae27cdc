package com.palmid.palm.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable mapping from a canonical knuckle-pair key to a non-negative distance.
 *
 * <p>Keys are kept in ascending lexical order so iteration is deterministic regardless
 * of insertion order. A vector built from the five {@link KnucklePoint}s has exactly
 * {@link #FULL_PAIR_COUNT} entries; vectors read from older records may hold fewer.
 */
@EqualsAndHashCode
public final class DistanceVector {

    public static final int FULL_PAIR_COUNT = 10;

    /** Wrist to middle knuckle: the scale reference for normalization. */
    public static final String REFERENCE_KEY = pairKey(KnucklePoint.MIDDLE_KNUCKLE, KnucklePoint.WRIST);

    private final SortedMap<String, Double> entries;

    private DistanceVector(SortedMap<String, Double> entries) {
        this.entries = Collections.unmodifiableSortedMap(entries);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static DistanceVector of(Map<String, Double> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("Distance vector must contain at least one entry");
        }
        SortedMap<String, Double> sorted = new TreeMap<>();
        values.forEach((key, value) -> {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("Distance key must not be blank");
            }
            if (value == null || !Double.isFinite(value) || value < 0.0) {
                throw new IllegalArgumentException("Distance for " + key + " must be a finite non-negative number");
            }
            sorted.put(key, value);
        });
        return new DistanceVector(sorted);
    }

    /**
     * Canonical key for an unordered pair: the lexically smaller name first.
     */
    public static String pairKey(String first, String second) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        return first.compareTo(second) <= 0 ? first + "_" + second : second + "_" + first;
    }

    public static String pairKey(KnucklePoint first, KnucklePoint second) {
        return pairKey(first.getKey(), second.getKey());
    }

    public OptionalDouble get(String key) {
        Double value = entries.get(key);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public Set<String> keys() {
        return entries.keySet();
    }

    public int size() {
        return entries.size();
    }

    /**
     * Entries in ascending key order.
     */
    @JsonValue
    public SortedMap<String, Double> asMap() {
        return entries;
    }

    /**
     * Every entry divided by {@code divisor}.
     */
    public DistanceVector scaledBy(double divisor) {
        if (!(divisor > 0.0) || !Double.isFinite(divisor)) {
            throw new IllegalArgumentException("Divisor must be a positive finite number: " + divisor);
        }
        SortedMap<String, Double> scaled = new TreeMap<>();
        entries.forEach((key, value) -> scaled.put(key, value / divisor));
        return new DistanceVector(scaled);
    }

    @Override
    public String toString() {
        return "DistanceVector" + entries;
    }
}
