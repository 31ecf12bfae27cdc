package com.palmid.palm.template;

import com.palmid.palm.domain.DistanceVector;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.stream.Collectors;

/**
 * Derives the short palm signature from a normalized distance vector.
 *
 * <p>Entries are rendered in ascending key order as {@code key:value}, each value with exactly
 * six decimals (exact binary value, half-even), joined with {@code |}. The signature is the first
 * 16 hex characters of the SHA-256 of that string. Equal vectors always give equal signatures.
 */
public class PalmSignatureGenerator {

    public static final int SIGNATURE_LENGTH = 16;

    private static final int DECIMALS = 6;

    public String generate(DistanceVector normalizedDistances) {
        String digest = HexFormat.of().formatHex(sha256(canonicalForm(normalizedDistances)));
        return digest.substring(0, SIGNATURE_LENGTH);
    }

    String canonicalForm(DistanceVector distances) {
        return distances.asMap().entrySet().stream()
            .map(entry -> entry.getKey() + ":" + formatValue(entry.getValue()))
            .collect(Collectors.joining("|"));
    }

    static String formatValue(double value) {
        return new BigDecimal(value).setScale(DECIMALS, RoundingMode.HALF_EVEN).toPlainString();
    }

    private static byte[] sha256(String input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not supported by this JVM", e);
        }
    }
}
