package com.partcompat.service;

import com.partcompat.dto.mapper.AlternateGroupMapper;
import com.partcompat.dto.request.AddGroupIdentifierRequest;
import com.partcompat.dto.request.AddGroupInventoryItemRequest;
import com.partcompat.dto.request.CreateAlternateGroupRequest;
import com.partcompat.dto.request.UpdateAlternateGroupRequest;
import com.partcompat.dto.response.AlternateGroupDetailDto;
import com.partcompat.exception.TenantAccessDeniedException;
import com.partcompat.exception.TransientStoreException;
import com.partcompat.exception.ValidationError;
import com.partcompat.exception.ValidationFailedException;
import com.partcompat.model.alternate.AlternateGroup;
import com.partcompat.model.alternate.AlternateGroupMember;
import com.partcompat.model.alternate.PartIdentifier;
import com.partcompat.model.enums.VerificationStatus;
import com.partcompat.model.inventory.InventoryItem;
import com.partcompat.repository.AlternateGroupMemberRepository;
import com.partcompat.repository.AlternateGroupRepository;
import com.partcompat.repository.InventoryItemRepository;
import com.partcompat.repository.PartIdentifierRepository;
import com.partcompat.service.matching.IdentifierNormalizer;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Alternate Group Service
 *
 * Manages groups of interchangeable parts:
 * - Group CRUD within an organization
 * - Status lifecycle (unverified, verified, deprecated) with verification stamps
 * - Membership of part identifiers and inventory items
 *
 * A group of another organization is reported exactly like a missing one.
 */
@Slf4j
@Service
@Transactional
public class AlternateGroupService {

    static final String GROUP_NOT_FOUND = "Alternate group not found: ";

    private final AlternateGroupRepository groupRepository;
    private final AlternateGroupMemberRepository memberRepository;
    private final PartIdentifierRepository partIdentifierRepository;
    private final InventoryItemRepository inventoryItemRepository;
    private final AlternateGroupMapper mapper;

    public AlternateGroupService(
            AlternateGroupRepository groupRepository,
            AlternateGroupMemberRepository memberRepository,
            PartIdentifierRepository partIdentifierRepository,
            InventoryItemRepository inventoryItemRepository,
            AlternateGroupMapper mapper) {
        this.groupRepository = groupRepository;
        this.memberRepository = memberRepository;
        this.partIdentifierRepository = partIdentifierRepository;
        this.inventoryItemRepository = inventoryItemRepository;
        this.mapper = mapper;
    }

    // ========================================================================
    // Queries
    // ========================================================================

    /**
     * Groups of an organization, by name.
     */
    @Transactional(readOnly = true)
    public List<AlternateGroup> listGroups(String organizationId) {
        return groupRepository.findByOrganizationIdOrderByNameAsc(organizationId);
    }

    /**
     * A group with its members, primary members first.
     */
    @Transactional(readOnly = true)
    public Optional<AlternateGroupDetailDto> getGroupWithMembers(String organizationId, String groupId) {
        return groupRepository.findByIdAndOrganizationId(groupId, organizationId)
            .map(group -> mapper.toDetailDto(group, memberRepository.findDetailedByGroupId(groupId)));
    }

    // ========================================================================
    // Group lifecycle
    // ========================================================================

    public AlternateGroup createGroup(String organizationId, CreateAlternateGroupRequest request) {
        String name = IdentifierNormalizer.trimToNull(request.name());
        if (name == null) {
            throw new ValidationFailedException(ValidationError.EMPTY_GROUP_NAME);
        }
        VerificationStatus status = VerificationStatus.fromValue(request.status());
        if (status == null) {
            status = VerificationStatus.UNVERIFIED;
        }

        AlternateGroup group = AlternateGroup.builder()
            .id(generateId("grp"))
            .organizationId(organizationId)
            .name(name)
            .description(IdentifierNormalizer.trimToNull(request.description()))
            .status(status)
            .notes(IdentifierNormalizer.trimToNull(request.notes()))
            .evidenceUrl(IdentifierNormalizer.trimToNull(request.evidenceUrl()))
            .createdBy(request.createdBy())
            .build();

        if (status == VerificationStatus.VERIFIED) {
            stampVerification(group, request.createdBy());
        }

        AlternateGroup saved = save(group);
        log.info("Created alternate group {} '{}' in organization {}", saved.getId(), name, organizationId);
        return saved;
    }

    /**
     * Apply the non-null fields of the request.
     *
     * Moving to VERIFIED records who verified the group and when, every time.
     * DEPRECATED is terminal and VERIFIED cannot go back to UNVERIFIED.
     */
    public AlternateGroup updateGroup(String organizationId, String groupId, UpdateAlternateGroupRequest request) {
        AlternateGroup group = requireGroup(organizationId, groupId);

        if (request.name() != null) {
            String name = IdentifierNormalizer.trimToNull(request.name());
            if (name == null) {
                throw new ValidationFailedException(ValidationError.EMPTY_GROUP_NAME);
            }
            group.setName(name);
        }
        if (request.description() != null) {
            group.setDescription(IdentifierNormalizer.trimToNull(request.description()));
        }
        if (request.notes() != null) {
            group.setNotes(IdentifierNormalizer.trimToNull(request.notes()));
        }
        if (request.evidenceUrl() != null) {
            group.setEvidenceUrl(IdentifierNormalizer.trimToNull(request.evidenceUrl()));
        }

        VerificationStatus target = VerificationStatus.fromValue(request.status());
        if (target != null) {
            VerificationStatus current = group.getStatus();
            if (!current.canTransitionTo(target)) {
                throw new ValidationFailedException(ValidationError.INVALID_STATUS_TRANSITION,
                    "Cannot change status from " + current.getValue() + " to " + target.getValue());
            }
            group.setStatus(target);
            if (target == VerificationStatus.VERIFIED) {
                stampVerification(group, request.updatedBy());
            }
        }

        group.setUpdatedBy(request.updatedBy());
        return save(group);
    }

    /**
     * Delete a group and all of its memberships.
     */
    public void deleteGroup(String organizationId, String groupId) {
        AlternateGroup group = requireGroup(organizationId, groupId);
        try {
            groupRepository.delete(group);
            groupRepository.flush();
        } catch (DataAccessException e) {
            log.error("Failed to delete alternate group {}", groupId, e);
            throw new TransientStoreException("Failed to delete alternate group", e);
        }
        log.info("Deleted alternate group {} from organization {}", groupId, organizationId);
    }

    // ========================================================================
    // Membership
    // ========================================================================

    /**
     * Add a cataloged part number to a group. Adding an identifier that is already
     * a member does nothing, including when a concurrent request added it first.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public void addIdentifierToGroup(String organizationId, String groupId, AddGroupIdentifierRequest request) {
        AlternateGroup group = requireGroup(organizationId, groupId);
        PartIdentifier identifier = partIdentifierRepository
            .findByIdAndOrganizationId(request.partIdentifierId(), organizationId)
            .orElseThrow(() -> new TenantAccessDeniedException("Part identifier not found or access denied"));

        if (memberRepository.existsByAlternateGroupIdAndPartIdentifierId(groupId, identifier.getId())) {
            log.debug("Identifier {} is already a member of group {}", identifier.getId(), groupId);
            return;
        }

        insertMember(AlternateGroupMember.builder()
            .id(generateId("mbr"))
            .alternateGroup(group)
            .partIdentifier(identifier)
            .isPrimary(request.primary())
            .notes(IdentifierNormalizer.trimToNull(request.notes()))
            .build());
    }

    /**
     * Add a stocked inventory item to a group. Idempotent like
     * {@link #addIdentifierToGroup}.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public void addInventoryItemToGroup(String organizationId, String groupId, AddGroupInventoryItemRequest request) {
        AlternateGroup group = requireGroup(organizationId, groupId);
        InventoryItem item = inventoryItemRepository
            .findByIdAndOrganizationId(request.inventoryItemId(), organizationId)
            .orElseThrow(() -> new TenantAccessDeniedException("Inventory item not found or access denied"));

        if (memberRepository.existsByAlternateGroupIdAndInventoryItemId(groupId, item.getId())) {
            log.debug("Item {} is already a member of group {}", item.getId(), groupId);
            return;
        }

        insertMember(AlternateGroupMember.builder()
            .id(generateId("mbr"))
            .alternateGroup(group)
            .inventoryItem(item)
            .isPrimary(request.primary())
            .notes(IdentifierNormalizer.trimToNull(request.notes()))
            .build());
    }

    /**
     * Remove one membership. The member's group must belong to the organization.
     */
    public void removeGroupMember(String organizationId, String memberId) {
        AlternateGroupMember member = memberRepository.findWithAlternateGroupById(memberId)
            .filter(m -> organizationId != null && organizationId.equals(m.getAlternateGroup().getOrganizationId()))
            .orElseThrow(() -> new TenantAccessDeniedException("Group member not found or access denied"));

        try {
            memberRepository.delete(member);
            memberRepository.flush();
        } catch (DataAccessException e) {
            log.error("Failed to remove member {} from group {}", memberId, member.getAlternateGroup().getId(), e);
            throw new TransientStoreException("Failed to remove group member", e);
        }
        log.info("Removed member {} from group {}", memberId, member.getAlternateGroup().getId());
    }

    // ========================================================================
    // Helper Methods
    // ========================================================================

    private void insertMember(AlternateGroupMember member) {
        String groupId = member.getAlternateGroup().getId();
        try {
            memberRepository.saveAndFlush(member);
            log.info("Added member {} to group {}", member.getId(), groupId);
        } catch (DataIntegrityViolationException e) {
            // A concurrent request inserted the same membership first
            log.debug("Membership already exists in group {}: {}", groupId, e.getMostSpecificCause().getMessage());
        } catch (DataAccessException e) {
            log.error("Failed to add member to group {}", groupId, e);
            throw new TransientStoreException("Failed to add group member", e);
        }
    }

    private AlternateGroup requireGroup(String organizationId, String groupId) {
        return groupRepository.findByIdAndOrganizationId(groupId, organizationId)
            .orElseThrow(() -> new EntityNotFoundException(GROUP_NOT_FOUND + groupId));
    }

    private AlternateGroup save(AlternateGroup group) {
        try {
            return groupRepository.saveAndFlush(group);
        } catch (DataAccessException e) {
            log.error("Failed to save alternate group {}", group.getId(), e);
            throw new TransientStoreException("Failed to save alternate group", e);
        }
    }

    private static void stampVerification(AlternateGroup group, String actor) {
        group.setVerifiedBy(actor);
        group.setVerifiedAt(LocalDateTime.now());
    }

    private String generateId(String prefix) {
        return prefix + "-" + UUID.randomUUID();
    }
}
