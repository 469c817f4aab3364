package com.partcompat.model.compatibility;

import com.partcompat.model.AuditableEntity;
import com.partcompat.model.enums.MatchType;
import com.partcompat.model.enums.VerificationStatus;
import com.partcompat.model.inventory.InventoryItem;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

/**
 * States that an inventory item fits equipment of a manufacturer and, optionally,
 * a model or model pattern.
 *
 * For PREFIX and WILDCARD rules {@code modelNorm} holds the normalized pattern,
 * with wildcard characters kept as entered. {@code modelKey} mirrors {@code modelNorm}
 * with the empty string for "any model", so the unique constraint also covers ANY rules.
 */
@Entity
@Table(name = "compatibility_rule",
    indexes = {
        @Index(name = "idx_compat_rule_item", columnList = "inventory_item_id"),
        @Index(name = "idx_compat_rule_manufacturer", columnList = "manufacturer_norm, match_type")
    },
    uniqueConstraints = @UniqueConstraint(
        name = "uq_compat_rule_item_pattern",
        columnNames = {"inventory_item_id", "manufacturer_norm", "model_key", "match_type"}))
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class CompatibilityRule extends AuditableEntity implements MatchableRule {

    @Id
    @Column(length = 255)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "inventory_item_id", nullable = false)
    private InventoryItem inventoryItem;

    @Column(nullable = false, length = 255)
    private String manufacturer;

    /**
     * Model or pattern as entered (trimmed). NULL means any model.
     */
    @Column(length = 255)
    private String model;

    @Column(name = "manufacturer_norm", nullable = false, length = 255)
    private String manufacturerNorm;

    @Column(name = "model_norm", length = 255)
    private String modelNorm;

    @Column(name = "model_key", nullable = false, length = 255)
    private String modelKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "match_type", nullable = false, length = 20)
    private MatchType matchType;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    @Builder.Default
    private VerificationStatus status = VerificationStatus.UNVERIFIED;

    @Column(columnDefinition = "TEXT")
    private String notes;

    public static String modelKeyOf(String modelNorm) {
        return modelNorm != null ? modelNorm : "";
    }

    @PrePersist
    @PreUpdate
    void syncModelKey() {
        modelKey = modelKeyOf(modelNorm);
    }
}
