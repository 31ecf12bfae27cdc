package com.palmid.palm.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Micrometer counters for registration, recognition and store health.
 */
public class PalmRecognitionMetrics {

    public static final String OUTCOME_MATCH = "match";
    public static final String OUTCOME_NO_MATCH = "no_match";
    public static final String OUTCOME_NOT_REGISTERED = "not_registered";
    public static final String OUTCOME_EMPTY_STORE = "empty_store";
    public static final String OUTCOME_FAILED = "failed";

    private final MeterRegistry meterRegistry;
    private final Counter registrations;
    private final Counter deletions;
    private final Counter corruptRecords;

    public PalmRecognitionMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.registrations = Counter.builder("palm.registrations")
            .description("Palm registrations persisted")
            .register(meterRegistry);
        this.deletions = Counter.builder("palm.deletions")
            .description("Palm registrations deleted")
            .register(meterRegistry);
        this.corruptRecords = Counter.builder("palm.store.corrupt_records")
            .description("Unparseable palm records removed from the store")
            .register(meterRegistry);
    }

    public void recordRegistration() {
        registrations.increment();
    }

    public void recordDeletion() {
        deletions.increment();
    }

    public void recordCorruptRecord() {
        corruptRecords.increment();
    }

    public void recordRecognition(String outcome) {
        Counter.builder("palm.recognitions")
            .description("Palm recognition attempts by outcome")
            .tag("outcome", outcome)
            .register(meterRegistry)
            .increment();
    }
}
