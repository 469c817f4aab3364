package com.partcompat.dto.request;

import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Request DTO for replacing every compatibility rule of an item.
 * Incomplete rules (blank manufacturer) are dropped, not rejected.
 */
public record BulkSetRulesRequest(
    @NotNull(message = "Rules are required")
    List<CompatibilityRuleRequest> rules
) {}
