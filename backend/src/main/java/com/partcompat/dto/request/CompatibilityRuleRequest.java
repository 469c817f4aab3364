package com.partcompat.dto.request;

/**
 * One rule as submitted by a client.
 * matchType is optional: omitted means "any" for a blank model and "exact" otherwise.
 */
public record CompatibilityRuleRequest(
    String manufacturer,
    String model,
    String matchType,
    String status,
    String notes
) {

    public static CompatibilityRuleRequest of(String manufacturer, String model) {
        return new CompatibilityRuleRequest(manufacturer, model, null, null, null);
    }

    public static CompatibilityRuleRequest of(String manufacturer, String model, String matchType) {
        return new CompatibilityRuleRequest(manufacturer, model, matchType, null, null);
    }
}
