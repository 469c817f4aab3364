package com.partcompat.model.inventory;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/**
 * Stocked inventory item. Owned by the inventory module; this service only reads it
 * to check ownership and to enrich lookup results.
 */
@Entity
@Table(name = "inventory_item", indexes = {
    @Index(name = "idx_inventory_item_org", columnList = "organization_id"),
    @Index(name = "idx_inventory_item_sku", columnList = "organization_id, sku")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventoryItem {

    @Id
    @Column(length = 255)
    private String id;

    @Column(name = "organization_id", nullable = false, length = 255)
    private String organizationId;

    @Column(nullable = false, length = 500)
    private String name;

    @Column(length = 255)
    private String sku;

    @Column(name = "external_id", length = 255)
    private String externalId;

    @Column(name = "quantity_on_hand")
    @Builder.Default
    private Integer quantityOnHand = 0;

    @Column(name = "low_stock_threshold")
    private Integer lowStockThreshold;

    @Column(name = "default_unit_cost", precision = 12, scale = 2)
    private BigDecimal defaultUnitCost;

    @Column(length = 255)
    private String location;

    @Column(name = "image_url", length = 1000)
    private String imageUrl;
}
