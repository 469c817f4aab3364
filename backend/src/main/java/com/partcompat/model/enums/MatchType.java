package com.partcompat.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the model axis of a compatibility rule is compared.
 * The manufacturer axis is always an exact normalized comparison.
 */
public enum MatchType {
    ANY("any"),
    EXACT("exact"),
    PREFIX("prefix"),
    WILDCARD("wildcard");

    private final String value;

    MatchType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static MatchType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (MatchType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown MatchType: " + value);
    }
}
