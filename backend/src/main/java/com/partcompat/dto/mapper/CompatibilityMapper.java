package com.partcompat.dto.mapper;

import com.partcompat.dto.response.CompatibilityRuleDto;
import com.partcompat.dto.response.CompatiblePartDto;
import com.partcompat.model.compatibility.CompatibilityRule;
import com.partcompat.model.enums.VerificationStatus;
import com.partcompat.model.inventory.InventoryItem;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Mapper for converting compatibility rules and rule-based matches to DTOs.
 */
@Component
public class CompatibilityMapper {

    /**
     * Convert a stored rule to a DTO.
     */
    public CompatibilityRuleDto toDto(CompatibilityRule entity) {
        if (entity == null) {
            return null;
        }
        return new CompatibilityRuleDto(
            entity.getId(),
            entity.getInventoryItem() != null ? entity.getInventoryItem().getId() : null,
            entity.getManufacturer(),
            entity.getModel(),
            entity.getManufacturerNorm(),
            entity.getModelNorm(),
            entity.getMatchType() != null ? entity.getMatchType().getValue() : null,
            entity.getStatus() != null ? entity.getStatus().getValue() : null,
            entity.getNotes(),
            entity.getCreatedAt(),
            entity.getUpdatedAt()
        );
    }

    public List<CompatibilityRuleDto> toDtoList(List<CompatibilityRule> entities) {
        return entities.stream().map(this::toDto).toList();
    }

    /**
     * Describe the item owning a rule as a compatible part, tagged with that rule.
     * The rule's item must already be loaded.
     */
    public CompatiblePartDto toCompatiblePartDto(CompatibilityRule rule) {
        InventoryItem item = rule.getInventoryItem();
        int quantity = item.getQuantityOnHand() != null ? item.getQuantityOnHand() : 0;

        return new CompatiblePartDto(
            item.getId(),
            item.getName(),
            item.getSku(),
            item.getExternalId(),
            quantity,
            item.getLowStockThreshold(),
            item.getDefaultUnitCost(),
            item.getLocation(),
            item.getImageUrl(),
            rule.getId(),
            rule.getMatchType().getValue(),
            rule.getStatus() != null ? rule.getStatus().getValue() : null,
            quantity > 0,
            rule.getStatus() == VerificationStatus.VERIFIED
        );
    }
}
