package com.partcompat.service.matching;

import java.util.Locale;

/**
 * Canonical form used for every manufacturer, model and part-number comparison:
 * trimmed and lower-cased. Storage-time and query-time values both go through here.
 */
public final class IdentifierNormalizer {

    private IdentifierNormalizer() {
    }

    /**
     * Trim and lower-case. Null becomes the empty string. Idempotent.
     */
    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Like {@link #normalize(String)}, but blank input yields null.
     * Used for optional columns such as a rule's model.
     */
    public static String normalizeOrNull(String value) {
        String normalized = normalize(value);
        return normalized.isEmpty() ? null : normalized;
    }

    /**
     * Trimmed display value, or null when blank.
     */
    public static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
