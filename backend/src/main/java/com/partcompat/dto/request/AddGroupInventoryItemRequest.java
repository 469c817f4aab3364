package com.partcompat.dto.request;

import jakarta.validation.constraints.NotBlank;

/**
 * Adds a stocked inventory item directly to an alternate group.
 */
public record AddGroupInventoryItemRequest(
    @NotBlank(message = "Inventory item id is required")
    String inventoryItemId,

    boolean primary,
    String notes
) {}
