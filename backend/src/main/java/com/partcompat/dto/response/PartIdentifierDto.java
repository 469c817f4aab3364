package com.partcompat.dto.response;

import java.time.LocalDateTime;

/**
 * Response DTO for a part identifier.
 */
public record PartIdentifierDto(
    String id,
    String identifierType,
    String rawValue,
    String normValue,
    String manufacturer,
    String inventoryItemId,
    String notes,
    LocalDateTime createdAt,
    String createdBy
) {}
