package com.partcompat.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Confidence status shared by alternate groups and compatibility rules.
 *
 * Allowed transitions: UNVERIFIED -> VERIFIED, UNVERIFIED -> DEPRECATED,
 * VERIFIED -> DEPRECATED. DEPRECATED is terminal.
 */
public enum VerificationStatus {
    UNVERIFIED("unverified"),
    VERIFIED("verified"),
    DEPRECATED("deprecated");

    private final String value;

    VerificationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Whether a status change from this status to {@code target} is permitted.
     * Staying in the same status is always permitted.
     */
    public boolean canTransitionTo(VerificationStatus target) {
        if (target == null || target == this) {
            return true;
        }
        return switch (this) {
            case UNVERIFIED -> target == VERIFIED || target == DEPRECATED;
            case VERIFIED -> target == DEPRECATED;
            case DEPRECATED -> false;
        };
    }

    public static VerificationStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (VerificationStatus status : values()) {
            if (status.value.equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown VerificationStatus: " + value);
    }
}
