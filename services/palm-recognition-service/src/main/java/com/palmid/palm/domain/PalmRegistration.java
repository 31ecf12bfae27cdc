package com.palmid.palm.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A palm template persisted and bound to an identity. One registration per identity.
 *
 * <p>All fields are required; construction fails on a missing field or a malformed
 * signature so a damaged record can never be half-loaded.
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonPropertyOrder({"identity", "signature", "normalizedDistances", "rawDistances", "registeredAt", "lastUsed"})
public final class PalmRegistration {

    private static final Pattern SIGNATURE_PATTERN = Pattern.compile("[0-9a-f]{16}");

    private final String identity;
    private final String signature;
    private final DistanceVector normalizedDistances;
    private final DistanceVector rawDistances;
    private final Instant registeredAt;
    private final Instant lastUsed;

    @JsonCreator
    public PalmRegistration(
            @JsonProperty(value = "identity", required = true) String identity,
            @JsonProperty(value = "signature", required = true) String signature,
            @JsonProperty(value = "normalizedDistances", required = true) DistanceVector normalizedDistances,
            @JsonProperty(value = "rawDistances", required = true) DistanceVector rawDistances,
            @JsonProperty(value = "registeredAt", required = true) Instant registeredAt,
            @JsonProperty(value = "lastUsed", required = true) Instant lastUsed) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.signature = Objects.requireNonNull(signature, "signature");
        this.normalizedDistances = Objects.requireNonNull(normalizedDistances, "normalizedDistances");
        this.rawDistances = Objects.requireNonNull(rawDistances, "rawDistances");
        this.registeredAt = Objects.requireNonNull(registeredAt, "registeredAt");
        this.lastUsed = Objects.requireNonNull(lastUsed, "lastUsed");
        if (!SIGNATURE_PATTERN.matcher(signature).matches()) {
            throw new IllegalArgumentException("Signature must be 16 lower-case hex characters: " + signature);
        }
    }

    /**
     * New registration for {@code identity} built from {@code template}, registered and last used at {@code now}.
     */
    public static PalmRegistration fromTemplate(String identity, PalmTemplate template, Instant now) {
        return new PalmRegistration(identity, template.getSignature(), template.getNormalizedDistances(),
            template.getRawDistances(), now, now);
    }

    public PalmRegistration withLastUsed(Instant lastUsed) {
        return new PalmRegistration(identity, signature, normalizedDistances, rawDistances, registeredAt, lastUsed);
    }

    public RegistrationSummary toSummary() {
        return new RegistrationSummary(identity, registeredAt, lastUsed);
    }
}
