package com.partcompat.model.alternate;

import com.partcompat.model.AuditableEntity;
import com.partcompat.model.enums.PartIdentifierType;
import com.partcompat.model.inventory.InventoryItem;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

/**
 * A cataloged part number (OEM, aftermarket, UPC, ...) usable as a lookup key.
 * May or may not be linked to a stocked inventory item.
 */
@Entity
@Table(name = "part_identifier",
    indexes = {
        @Index(name = "idx_part_identifier_org", columnList = "organization_id"),
        @Index(name = "idx_part_identifier_item", columnList = "inventory_item_id")
    },
    uniqueConstraints = @UniqueConstraint(
        name = "uq_part_identifier_org_norm",
        columnNames = {"organization_id", "norm_value"}))
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class PartIdentifier extends AuditableEntity {

    @Id
    @Column(length = 255)
    private String id;

    @Column(name = "organization_id", nullable = false, length = 255)
    private String organizationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "identifier_type", nullable = false, length = 20)
    private PartIdentifierType identifierType;

    @Column(name = "raw_value", nullable = false, length = 255)
    private String rawValue;

    @Column(name = "norm_value", nullable = false, length = 255)
    private String normValue;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "inventory_item_id")
    private InventoryItem inventoryItem;

    @Column(length = 255)
    private String manufacturer;

    @Column(columnDefinition = "TEXT")
    private String notes;
}
