package com.palmid.palm.storage;

import com.palmid.palm.domain.PalmRegistration;

import java.util.Optional;

/**
 * Outcome of reading one record file: a valid registration, no file, or a corrupt file.
 */
public final class RecordReadResult {

    public enum Status {
        VALID,
        ABSENT,
        CORRUPT
    }

    private static final RecordReadResult ABSENT = new RecordReadResult(Status.ABSENT, null, null);

    private final Status status;
    private final PalmRegistration registration;
    private final String problem;

    private RecordReadResult(Status status, PalmRegistration registration, String problem) {
        this.status = status;
        this.registration = registration;
        this.problem = problem;
    }

    public static RecordReadResult valid(PalmRegistration registration) {
        return new RecordReadResult(Status.VALID, registration, null);
    }

    public static RecordReadResult absent() {
        return ABSENT;
    }

    public static RecordReadResult corrupt(String problem) {
        return new RecordReadResult(Status.CORRUPT, null, problem);
    }

    public Status getStatus() {
        return status;
    }

    public Optional<PalmRegistration> getRegistration() {
        return Optional.ofNullable(registration);
    }

    /**
     * Why the record was rejected; empty unless {@link Status#CORRUPT}.
     */
    public Optional<String> getProblem() {
        return Optional.ofNullable(problem);
    }
}
