package com.partcompat.service;

import com.partcompat.IntegrationTestSupport;
import com.partcompat.dto.request.AddGroupIdentifierRequest;
import com.partcompat.dto.request.AddGroupInventoryItemRequest;
import com.partcompat.dto.request.CreateAlternateGroupRequest;
import com.partcompat.dto.request.CreatePartIdentifierRequest;
import com.partcompat.dto.response.AlternatePartResult;
import com.partcompat.exception.TenantAccessDeniedException;
import com.partcompat.model.alternate.AlternateGroup;
import com.partcompat.model.alternate.PartIdentifier;
import com.partcompat.model.inventory.InventoryItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Alternate lookups against stored groups, identifiers and items.
 */
class AlternateLookupQueryTest extends IntegrationTestSupport {

    @Autowired
    private AlternateLookupService lookupService;

    @Autowired
    private AlternateGroupService groupService;

    @Autowired
    private PartIdentifierService partIdentifierService;

    private InventoryItem oemFilter;
    private InventoryItem aftermarketFilter;
    private PartIdentifier oemNumber;
    private AlternateGroup group;

    @BeforeEach
    void setUp() {
        oemFilter = item(ORG, "OEM oil filter", "1R-0750", 2, "24.00");
        aftermarketFilter = item(ORG, "Aftermarket oil filter", "AF-100", 12, "11.00");

        oemNumber = partIdentifierService.createIdentifier(ORG,
            new CreatePartIdentifierRequest("oem", "1R-0750", "Caterpillar", oemFilter.getId(), null, "alice"));
        PartIdentifier catalogOnly = partIdentifierService.createIdentifier(ORG,
            new CreatePartIdentifierRequest("aftermarket", "WIX-51515", "Wix", null, null, "alice"));

        group = groupService.createGroup(ORG,
            new CreateAlternateGroupRequest("Oil filters", null, "verified", "Same thread", null, "alice"));
        groupService.addIdentifierToGroup(ORG, group.getId(), new AddGroupIdentifierRequest(oemNumber.getId(), true, null));
        groupService.addInventoryItemToGroup(ORG, group.getId(),
            new AddGroupInventoryItemRequest(aftermarketFilter.getId(), false, null));
        groupService.addIdentifierToGroup(ORG, group.getId(), new AddGroupIdentifierRequest(catalogOnly.getId(), false, null));
    }

    @Test
    void partNumberLookup_findsGroupThroughIdentifier() {
        List<AlternatePartResult> results = lookupService.getAlternatesForPartNumber(ORG, " 1r-0750 ");

        assertThat(results).hasSize(3);
        AlternatePartResult first = results.get(0);
        assertThat(first.primary()).isTrue();
        assertThat(first.matchingInput()).isTrue();
        assertThat(first.groupVerified()).isTrue();
        assertThat(first.inventoryItemId()).isEqualTo(oemFilter.getId());
        assertThat(first.quantityOnHand()).isEqualTo(2);
        assertThat(first.lowStock()).isTrue();

        AlternatePartResult second = results.get(1);
        assertThat(second.inventoryItemId()).isEqualTo(aftermarketFilter.getId());
        assertThat(second.inStock()).isTrue();
        assertThat(second.lowStock()).isFalse();
        assertThat(second.matchingInput()).isFalse();

        AlternatePartResult third = results.get(2);
        assertThat(third.identifierValue()).isEqualTo("WIX-51515");
        assertThat(third.inventoryItemId()).isNull();
        assertThat(third.inStock()).isFalse();
    }

    @Test
    void partNumberLookup_findsGroupThroughInventorySku() {
        List<AlternatePartResult> results = lookupService.getAlternatesForPartNumber(ORG, "af-100");

        assertThat(results).extracting(AlternatePartResult::groupId).containsOnly(group.getId());
        assertThat(results).filteredOn(AlternatePartResult::matchingInput)
            .extracting(AlternatePartResult::inventoryItemId)
            .containsExactly(aftermarketFilter.getId());
    }

    @Test
    void partNumberLookup_matchesSkuStoredWithSurroundingWhitespace() {
        InventoryItem tabbed = item(ORG, "Tabbed filter", "\tAF-200\n", 4, "10.00");
        item(ORG, "Longer sku filter", "AF-2000", 4, "10.00");
        groupService.addInventoryItemToGroup(ORG, group.getId(), new AddGroupInventoryItemRequest(tabbed.getId(), false, null));

        List<AlternatePartResult> results = lookupService.getAlternatesForPartNumber(ORG, "AF-200");

        assertThat(results).filteredOn(AlternatePartResult::matchingInput)
            .extracting(AlternatePartResult::inventoryItemId)
            .containsExactly(tabbed.getId());
    }

    @Test
    void partNumberLookup_isScopedToOrganization() {
        assertThat(lookupService.getAlternatesForPartNumber(OTHER_ORG, "1R-0750")).isEmpty();
        assertThat(lookupService.getAlternatesForPartNumber(ORG, "UNKNOWN-1")).isEmpty();
    }

    @Test
    void inventoryItemLookup_findsGroupsThroughLinkedIdentifier() {
        List<AlternatePartResult> results = lookupService.getAlternatesForInventoryItem(ORG, oemFilter.getId());

        assertThat(results).hasSize(3);
        assertThat(results.get(0).inventoryItemId()).isEqualTo(oemFilter.getId());
        assertThat(results.get(0).matchingInput()).isTrue();
        assertThat(results).filteredOn(AlternatePartResult::matchingInput).hasSize(1);
    }

    @Test
    void inventoryItemLookup_deniesForeignItem() {
        InventoryItem foreign = item(OTHER_ORG, "Filter", "F-1", 3, "9.99");

        assertThatThrownBy(() -> lookupService.getAlternatesForInventoryItem(ORG, foreign.getId()))
            .isInstanceOf(TenantAccessDeniedException.class);
    }

    @Test
    void inventoryItemLookup_withoutGroupsReturnsNothing() {
        InventoryItem loose = item(ORG, "Loose part", "LP-1", 1, null);

        assertThat(lookupService.getAlternatesForInventoryItem(ORG, loose.getId())).isEmpty();
    }
}
