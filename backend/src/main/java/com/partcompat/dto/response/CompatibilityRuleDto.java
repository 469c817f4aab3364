package com.partcompat.dto.response;

import java.time.LocalDateTime;

/**
 * Response DTO for a stored compatibility rule.
 */
public record CompatibilityRuleDto(
    String id,
    String inventoryItemId,
    String manufacturer,
    String model,
    String manufacturerNorm,
    String modelNorm,
    String matchType,
    String status,
    String notes,
    LocalDateTime createdAt,
    LocalDateTime updatedAt
) {}
