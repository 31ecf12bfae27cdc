package com.palmid.palm.domain;

import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Instant;

/**
 * Listing projection of a registration.
 */
@Value
@AllArgsConstructor
public class RegistrationSummary {
    String identity;
    Instant registeredAt;
    Instant lastUsed;
}
