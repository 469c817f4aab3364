package com.partcompat.dto.response;

import java.math.BigDecimal;

/**
 * One member of an alternate group returned by an alternates lookup,
 * flattened with its group, identifier and stock details.
 */
public record AlternatePartResult(
    // Group
    String groupId,
    String groupName,
    String groupStatus,
    boolean groupVerified,
    String groupNotes,

    // Identifier (null for members added as inventory items)
    String identifierId,
    String identifierType,
    String identifierValue,
    String identifierManufacturer,

    // Inventory item (null when the part is not stocked)
    String inventoryItemId,
    String inventoryName,
    String inventorySku,
    int quantityOnHand,
    int lowStockThreshold,
    BigDecimal defaultUnitCost,
    String location,
    String imageUrl,
    boolean inStock,
    boolean lowStock,

    boolean primary,

    /*
     * For part-number lookups: this row is the searched part number.
     * For inventory-item lookups: this row is the source item.
     */
    boolean matchingInput
) {}
