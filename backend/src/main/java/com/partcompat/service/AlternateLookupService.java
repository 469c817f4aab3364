package com.partcompat.service;

import com.partcompat.dto.mapper.AlternateGroupMapper;
import com.partcompat.dto.response.AlternatePartResult;
import com.partcompat.exception.TenantAccessDeniedException;
import com.partcompat.exception.TransientStoreException;
import com.partcompat.model.alternate.AlternateGroup;
import com.partcompat.model.alternate.AlternateGroupMember;
import com.partcompat.model.alternate.PartIdentifier;
import com.partcompat.model.inventory.InventoryItem;
import com.partcompat.repository.AlternateGroupMemberRepository;
import com.partcompat.repository.AlternateGroupRepository;
import com.partcompat.repository.InventoryItemRepository;
import com.partcompat.repository.PartIdentifierRepository;
import com.partcompat.service.matching.IdentifierNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.Predicate;

/**
 * Alternate Lookup Service
 *
 * Given a part number or an inventory item, lists every member of every alternate
 * group it belongs to, enriched with stock data.
 *
 * Lookups by part number accept a {@link CancellationToken}. Cancellation is decided
 * from the token only, never from the text of an error.
 *
 * Not transactional: a cancelled lookup must be able to return normally after one of
 * its queries failed. Group queries fetch everything the result rows need.
 */
@Slf4j
@Service
public class AlternateLookupService {

    static final Comparator<AlternatePartResult> PART_NUMBER_ORDER = Comparator
        .comparing(AlternatePartResult::groupName, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER))
        .thenComparing(Comparator.comparing(AlternatePartResult::primary).reversed())
        .thenComparing(Comparator.comparing(AlternatePartResult::inStock).reversed())
        .thenComparing(AlternatePartResult::defaultUnitCost, Comparator.nullsLast(Comparator.<BigDecimal>naturalOrder()))
        .thenComparing(AlternatePartResult::inventoryName, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER));

    static final Comparator<AlternatePartResult> INVENTORY_ITEM_ORDER = Comparator
        .comparing(AlternatePartResult::groupName, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER))
        .thenComparing(Comparator.comparing(AlternatePartResult::primary).reversed())
        .thenComparing(Comparator.comparing(AlternatePartResult::matchingInput).reversed())
        .thenComparing(Comparator.comparing(AlternatePartResult::inStock).reversed())
        .thenComparing(AlternatePartResult::defaultUnitCost, Comparator.nullsLast(Comparator.<BigDecimal>naturalOrder()))
        .thenComparing(AlternatePartResult::inventoryName, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER));

    private final PartIdentifierRepository partIdentifierRepository;
    private final InventoryItemRepository inventoryItemRepository;
    private final AlternateGroupRepository groupRepository;
    private final AlternateGroupMemberRepository memberRepository;
    private final AlternateGroupMapper mapper;
    private final int defaultLowStockThreshold;

    public AlternateLookupService(
            PartIdentifierRepository partIdentifierRepository,
            InventoryItemRepository inventoryItemRepository,
            AlternateGroupRepository groupRepository,
            AlternateGroupMemberRepository memberRepository,
            AlternateGroupMapper mapper,
            @Value("${parts.alternates.default-low-stock-threshold:5}") int defaultLowStockThreshold) {
        this.partIdentifierRepository = partIdentifierRepository;
        this.inventoryItemRepository = inventoryItemRepository;
        this.groupRepository = groupRepository;
        this.memberRepository = memberRepository;
        this.mapper = mapper;
        this.defaultLowStockThreshold = defaultLowStockThreshold;
    }

    // ========================================================================
    // Lookup by part number
    // ========================================================================

    public List<AlternatePartResult> getAlternatesForPartNumber(String organizationId, String partNumber) {
        return getAlternatesForPartNumber(organizationId, partNumber, null);
    }

    /**
     * Alternates of a part number, matched against cataloged identifiers and
     * against inventory SKUs and external ids.
     *
     * Returns an empty list for a blank part number, and for any lookup whose
     * token is cancelled before or while it runs. Without a token every failure
     * is logged and rethrown.
     */
    public List<AlternatePartResult> getAlternatesForPartNumber(
            String organizationId, String partNumber, CancellationToken token) {

        String normValue = IdentifierNormalizer.normalize(partNumber);
        if (normValue.isEmpty()) {
            return List.of();
        }
        if (token != null && token.isCancelled()) {
            return List.of();
        }

        try {
            Set<String> groupIds = new LinkedHashSet<>();

            List<String> identifierIds = partIdentifierRepository
                .findByOrganizationIdAndNormValue(organizationId, normValue).stream()
                .map(PartIdentifier::getId)
                .toList();
            if (!identifierIds.isEmpty()) {
                groupIds.addAll(memberRepository.findGroupIdsByPartIdentifierIds(identifierIds));
            }
            checkpoint(token);

            List<String> itemIds = inventoryItemRepository
                .findByNormalizedSkuOrExternalId(organizationId, normValue).stream()
                .map(InventoryItem::getId)
                .toList();
            if (!itemIds.isEmpty()) {
                groupIds.addAll(memberRepository.findGroupIdsByInventoryItemIds(itemIds));
            }
            checkpoint(token);

            if (groupIds.isEmpty()) {
                return List.of();
            }

            List<AlternatePartResult> results = buildResults(
                organizationId, groupIds, member -> matchesPartNumber(member, normValue), PART_NUMBER_ORDER);
            checkpoint(token);
            return results;
        } catch (RuntimeException e) {
            if (token != null && (token.isCancelled() || e instanceof CancellationException)) {
                return List.of();
            }
            log.error("Failed to look up alternates for part number '{}' in organization {}",
                partNumber, organizationId, e);
            throw translate(e);
        }
    }

    // ========================================================================
    // Lookup by inventory item
    // ========================================================================

    /**
     * Alternates of an inventory item, through direct membership or through any
     * identifier linked to the item. The item's own rows are flagged as matching input.
     */
    public List<AlternatePartResult> getAlternatesForInventoryItem(String organizationId, String itemId) {
        try {
            inventoryItemRepository.findByIdAndOrganizationId(itemId, organizationId)
                .orElseThrow(() -> new TenantAccessDeniedException("Inventory item not found or access denied"));

            Set<String> groupIds = new LinkedHashSet<>(
                memberRepository.findGroupIdsByInventoryItemIds(List.of(itemId)));

            List<String> identifierIds = partIdentifierRepository.findByInventoryItemId(itemId).stream()
                .map(PartIdentifier::getId)
                .toList();
            if (!identifierIds.isEmpty()) {
                groupIds.addAll(memberRepository.findGroupIdsByPartIdentifierIds(identifierIds));
            }

            if (groupIds.isEmpty()) {
                return List.of();
            }
            return buildResults(organizationId, groupIds, member -> isItem(member, itemId), INVENTORY_ITEM_ORDER);
        } catch (DataAccessException e) {
            log.error("Failed to look up alternates for item {} in organization {}", itemId, organizationId, e);
            throw translate(e);
        }
    }

    // ========================================================================
    // Helper Methods
    // ========================================================================

    private List<AlternatePartResult> buildResults(
            String organizationId,
            Set<String> groupIds,
            Predicate<AlternateGroupMember> matchingInput,
            Comparator<AlternatePartResult> order) {

        List<AlternateGroup> groups = groupRepository.findWithMembersByOrganizationIdAndIdIn(organizationId, groupIds);

        List<AlternatePartResult> results = new ArrayList<>();
        for (AlternateGroup group : groups) {
            for (AlternateGroupMember member : group.getMembers()) {
                results.add(mapper.toAlternatePartResult(
                    group, member, matchingInput.test(member), defaultLowStockThreshold));
            }
        }
        results.sort(order);
        return results;
    }

    private static boolean matchesPartNumber(AlternateGroupMember member, String normValue) {
        PartIdentifier identifier = member.getPartIdentifier();
        if (identifier != null && normValue.equals(identifier.getNormValue())) {
            return true;
        }
        InventoryItem item = member.resolveInventoryItem();
        return item != null
            && (normValue.equals(IdentifierNormalizer.normalize(item.getSku()))
                || normValue.equals(IdentifierNormalizer.normalize(item.getExternalId())));
    }

    private static boolean isItem(AlternateGroupMember member, String itemId) {
        InventoryItem item = member.resolveInventoryItem();
        return item != null && itemId.equals(item.getId());
    }

    private static void checkpoint(CancellationToken token) {
        if (token != null) {
            token.throwIfCancelled();
        }
    }

    private static RuntimeException translate(RuntimeException e) {
        if (e instanceof DataAccessException) {
            return new TransientStoreException("Failed to look up alternates", e);
        }
        return e;
    }
}
