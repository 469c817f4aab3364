package com.partcompat.dto.mapper;

import com.partcompat.dto.response.AlternateGroupDetailDto;
import com.partcompat.dto.response.AlternateGroupDto;
import com.partcompat.dto.response.AlternateGroupMemberDto;
import com.partcompat.dto.response.AlternatePartResult;
import com.partcompat.dto.response.PartIdentifierDto;
import com.partcompat.model.alternate.AlternateGroup;
import com.partcompat.model.alternate.AlternateGroupMember;
import com.partcompat.model.alternate.PartIdentifier;
import com.partcompat.model.enums.VerificationStatus;
import com.partcompat.model.inventory.InventoryItem;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Mapper for alternate groups, their members and part identifiers.
 */
@Component
public class AlternateGroupMapper {

    // ========================================================================
    // Groups
    // ========================================================================

    public AlternateGroupDto toDto(AlternateGroup entity) {
        if (entity == null) {
            return null;
        }
        return new AlternateGroupDto(
            entity.getId(),
            entity.getOrganizationId(),
            entity.getName(),
            entity.getDescription(),
            entity.getStatus() != null ? entity.getStatus().getValue() : null,
            entity.getNotes(),
            entity.getEvidenceUrl(),
            entity.getVerifiedBy(),
            entity.getVerifiedAt(),
            entity.getCreatedAt(),
            entity.getCreatedBy(),
            entity.getUpdatedAt()
        );
    }

    public List<AlternateGroupDto> toDtoList(List<AlternateGroup> entities) {
        return entities.stream().map(this::toDto).toList();
    }

    /**
     * Group plus members. Members must already be in display order.
     */
    public AlternateGroupDetailDto toDetailDto(AlternateGroup group, List<AlternateGroupMember> members) {
        return new AlternateGroupDetailDto(
            toDto(group),
            members.stream().map(this::toMemberDto).toList()
        );
    }

    /**
     * Flatten a member with the display fields of the identifier or item it references.
     * Stock fields come from the resolved item, so an identifier linked to an item shows it too.
     */
    public AlternateGroupMemberDto toMemberDto(AlternateGroupMember member) {
        PartIdentifier identifier = member.getPartIdentifier();
        InventoryItem item = member.resolveInventoryItem();

        return new AlternateGroupMemberDto(
            member.getId(),
            member.getAlternateGroup() != null ? member.getAlternateGroup().getId() : null,
            identifier != null ? identifier.getId() : null,
            member.getInventoryItem() != null ? member.getInventoryItem().getId() : null,
            Boolean.TRUE.equals(member.getIsPrimary()),
            member.getNotes(),
            member.getCreatedAt(),
            identifier != null && identifier.getIdentifierType() != null
                ? identifier.getIdentifierType().getValue() : null,
            identifier != null ? identifier.getRawValue() : null,
            identifier != null ? identifier.getManufacturer() : null,
            item != null ? item.getName() : null,
            item != null ? item.getSku() : null,
            item != null && item.getQuantityOnHand() != null ? item.getQuantityOnHand() : 0
        );
    }

    // ========================================================================
    // Lookup rows
    // ========================================================================

    /**
     * Build one lookup row. Stock fields come from the member's own item, or from the
     * item linked to its identifier.
     */
    public AlternatePartResult toAlternatePartResult(
            AlternateGroup group,
            AlternateGroupMember member,
            boolean matchingInput,
            int defaultLowStockThreshold) {

        PartIdentifier identifier = member.getPartIdentifier();
        InventoryItem item = member.resolveInventoryItem();

        int quantity = item != null && item.getQuantityOnHand() != null ? item.getQuantityOnHand() : 0;
        int threshold = item != null && item.getLowStockThreshold() != null
            ? item.getLowStockThreshold() : defaultLowStockThreshold;

        return new AlternatePartResult(
            group.getId(),
            group.getName(),
            group.getStatus() != null ? group.getStatus().getValue() : null,
            group.getStatus() == VerificationStatus.VERIFIED,
            group.getNotes(),

            identifier != null ? identifier.getId() : null,
            identifier != null && identifier.getIdentifierType() != null
                ? identifier.getIdentifierType().getValue() : null,
            identifier != null ? identifier.getRawValue() : null,
            identifier != null ? identifier.getManufacturer() : null,

            item != null ? item.getId() : null,
            item != null ? item.getName() : null,
            item != null ? item.getSku() : null,
            quantity,
            threshold,
            item != null ? item.getDefaultUnitCost() : null,
            item != null ? item.getLocation() : null,
            item != null ? item.getImageUrl() : null,
            quantity > 0,
            quantity <= threshold,

            Boolean.TRUE.equals(member.getIsPrimary()),
            matchingInput
        );
    }

    // ========================================================================
    // Part identifiers
    // ========================================================================

    public PartIdentifierDto toDto(PartIdentifier entity) {
        if (entity == null) {
            return null;
        }
        return new PartIdentifierDto(
            entity.getId(),
            entity.getIdentifierType() != null ? entity.getIdentifierType().getValue() : null,
            entity.getRawValue(),
            entity.getNormValue(),
            entity.getManufacturer(),
            entity.getInventoryItem() != null ? entity.getInventoryItem().getId() : null,
            entity.getNotes(),
            entity.getCreatedAt(),
            entity.getCreatedBy()
        );
    }

    public List<PartIdentifierDto> toIdentifierDtoList(List<PartIdentifier> entities) {
        return entities.stream().map(this::toDto).toList();
    }
}
