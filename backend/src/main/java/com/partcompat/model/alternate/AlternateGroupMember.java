package com.partcompat.model.alternate;

import com.partcompat.model.AuditableEntity;
import com.partcompat.model.inventory.InventoryItem;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

/**
 * Membership of one part in an alternate group.
 * References either a part identifier or an inventory item, never both.
 */
@Entity
@Table(name = "alternate_group_member",
    indexes = {
        @Index(name = "idx_group_member_group", columnList = "group_id"),
        @Index(name = "idx_group_member_identifier", columnList = "part_identifier_id"),
        @Index(name = "idx_group_member_item", columnList = "inventory_item_id")
    },
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_group_member_identifier", columnNames = {"group_id", "part_identifier_id"}),
        @UniqueConstraint(name = "uq_group_member_item", columnNames = {"group_id", "inventory_item_id"})
    })
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class AlternateGroupMember extends AuditableEntity {

    @Id
    @Column(length = 255)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "group_id", nullable = false)
    private AlternateGroup alternateGroup;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "part_identifier_id")
    private PartIdentifier partIdentifier;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "inventory_item_id")
    private InventoryItem inventoryItem;

    @Column(name = "is_primary", nullable = false)
    @Builder.Default
    private Boolean isPrimary = false;

    @Column(columnDefinition = "TEXT")
    private String notes;

    /**
     * The stocked item this member stands for: its own item, or the item linked
     * to its identifier. May be null for catalog-only identifiers.
     */
    public InventoryItem resolveInventoryItem() {
        if (inventoryItem != null) {
            return inventoryItem;
        }
        return partIdentifier != null ? partIdentifier.getInventoryItem() : null;
    }
}
