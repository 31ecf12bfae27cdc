package com.palmid.palm.util;

/**
 * Masks identities (phone numbers in most deployments) before they reach the logs.
 */
public final class PalmLogMasking {

    private static final int VISIBLE_SUFFIX = 4;

    private PalmLogMasking() {
    }

    /**
     * Keeps the last four characters, e.g. {@code ****1111}.
     */
    public static String maskIdentity(String identity) {
        if (identity == null) {
            return "null";
        }
        if (identity.length() <= VISIBLE_SUFFIX) {
            return "****";
        }
        return "****" + identity.substring(identity.length() - VISIBLE_SUFFIX);
    }
}
