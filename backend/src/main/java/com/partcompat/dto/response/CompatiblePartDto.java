package com.partcompat.dto.response;

import java.math.BigDecimal;

/**
 * An inventory item that fits the requested equipment, with the rule that matched.
 */
public record CompatiblePartDto(
    String inventoryItemId,
    String name,
    String sku,
    String externalId,
    int quantityOnHand,
    Integer lowStockThreshold,
    BigDecimal defaultUnitCost,
    String location,
    String imageUrl,

    // Rule that produced the match
    String ruleId,
    String ruleMatchType,
    String ruleStatus,

    boolean inStock,
    boolean verified
) {}
