package com.partcompat.exception;

/**
 * Reasons an input is rejected before anything is persisted.
 */
public enum ValidationError {
    EMPTY_MANUFACTURER("Manufacturer is required"),
    EMPTY_PATTERN("A model or pattern is required for this match type"),
    MODEL_NOT_ALLOWED_FOR_ANY("A rule matching any model cannot specify a model"),
    WILDCARD_NOT_ALLOWED_IN_PREFIX(
        "Prefix patterns cannot contain wildcards. Use the pattern text directly (e.g. \"JL-\" instead of \"JL-*\")"),
    WILDCARD_NOT_ALLOWED_IN_EXACT("Exact models cannot contain wildcards. Use the wildcard match type instead"),
    TOO_MANY_WILDCARDS("Wildcard patterns can have at most 2 wildcards (*)"),
    PATTERN_TOO_BROAD("Wildcard patterns must include at least 2 non-wildcard characters"),
    EMPTY_GROUP_NAME("Group name is required"),
    INVALID_STATUS_TRANSITION("This status change is not allowed"),
    EMPTY_IDENTIFIER("Part number is required");

    private final String defaultMessage;

    ValidationError(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
