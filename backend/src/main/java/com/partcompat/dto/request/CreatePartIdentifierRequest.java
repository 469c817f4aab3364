package com.partcompat.dto.request;

import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for registering a part number.
 */
public record CreatePartIdentifierRequest(
    @NotBlank(message = "Identifier type is required")
    String identifierType,

    @NotBlank(message = "Part number is required")
    String rawValue,

    String manufacturer,
    String inventoryItemId,
    String notes,
    String createdBy
) {}
