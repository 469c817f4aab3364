package com.partcompat.dto.response;

import java.time.LocalDateTime;

/**
 * Group member flattened with the display fields of what it references.
 */
public record AlternateGroupMemberDto(
    String id,
    String groupId,
    String partIdentifierId,
    String inventoryItemId,
    boolean primary,
    String notes,
    LocalDateTime createdAt,

    // From the part identifier
    String identifierType,
    String identifierValue,
    String identifierManufacturer,

    // From the inventory item
    String inventoryName,
    String inventorySku,
    int quantityOnHand
) {}
