package com.partcompat.service;

import com.partcompat.IntegrationTestSupport;
import com.partcompat.dto.request.CompatibilityRuleRequest;
import com.partcompat.dto.response.CompatiblePartDto;
import com.partcompat.model.inventory.Equipment;
import com.partcompat.model.inventory.InventoryItem;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CompatiblePartsServiceTest extends IntegrationTestSupport {

    @Autowired
    private CompatiblePartsService compatiblePartsService;

    @Autowired
    private CompatibilityRuleService ruleService;

    @Test
    void makeModelLookup_matchesEveryRuleKind() {
        InventoryItem anyModel = item(ORG, "Universal seat", "SEAT-1", 2, "80.00");
        InventoryItem exact = item(ORG, "D6T track pad", "TP-6", 5, "40.00");
        InventoryItem wildcard = item(ORG, "D-series filter", "F-D", 0, "15.00");
        InventoryItem prefix = item(ORG, "Prefix belt", "B-1", 1, "9.00");
        InventoryItem unrelated = item(ORG, "D8 blade", "BL-8", 3, "300.00");

        ruleService.addRule(ORG, anyModel.getId(), CompatibilityRuleRequest.of("Caterpillar", null));
        ruleService.addRule(ORG, exact.getId(), CompatibilityRuleRequest.of("Caterpillar", "D6T"));
        ruleService.addRule(ORG, wildcard.getId(), CompatibilityRuleRequest.of("Caterpillar", "D*T", "wildcard"));
        ruleService.addRule(ORG, prefix.getId(), CompatibilityRuleRequest.of("Caterpillar", "D6", "prefix"));
        ruleService.addRule(ORG, unrelated.getId(), CompatibilityRuleRequest.of("Caterpillar", "D8T"));

        List<CompatiblePartDto> parts = compatiblePartsService.getCompatiblePartsForMakeModel(ORG, "CATERPILLAR", "d6t");

        assertThat(parts).extracting(CompatiblePartDto::inventoryItemId)
            .containsExactlyInAnyOrder(anyModel.getId(), exact.getId(), wildcard.getId(), prefix.getId());
    }

    @Test
    void makeModelLookup_withoutModelUsesOnlyAnyAndExactRules() {
        InventoryItem anyModel = item(ORG, "Universal seat", "SEAT-1", 2, "80.00");
        InventoryItem exact = item(ORG, "D6T track pad", "TP-6", 5, "40.00");
        InventoryItem wildcard = item(ORG, "D-series filter", "F-D", 0, "15.00");

        ruleService.addRule(ORG, anyModel.getId(), CompatibilityRuleRequest.of("Caterpillar", null));
        ruleService.addRule(ORG, exact.getId(), CompatibilityRuleRequest.of("Caterpillar", "D6T"));
        ruleService.addRule(ORG, wildcard.getId(), CompatibilityRuleRequest.of("Caterpillar", "D*T", "wildcard"));

        List<CompatiblePartDto> parts = compatiblePartsService.getCompatiblePartsForMakeModel(ORG, "Caterpillar", " ");

        assertThat(parts).extracting(CompatiblePartDto::inventoryItemId)
            .containsExactlyInAnyOrder(anyModel.getId(), exact.getId());
    }

    @Test
    void makeModelLookup_blankManufacturerReturnsNothing() {
        assertThat(compatiblePartsService.getCompatiblePartsForMakeModel(ORG, "  ", "D6T")).isEmpty();
    }

    @Test
    void makeModelLookup_returnsItemOnceAndPrefersVerifiedRule() {
        InventoryItem item = item(ORG, "Track pad", "TP-6", 5, "40.00");
        ruleService.addRule(ORG, item.getId(), CompatibilityRuleRequest.of("Caterpillar", null));
        ruleService.addRule(ORG, item.getId(),
            new CompatibilityRuleRequest("Caterpillar", "D6T", "exact", "verified", null));

        List<CompatiblePartDto> parts = compatiblePartsService.getCompatiblePartsForMakeModel(ORG, "Caterpillar", "D6T");

        assertThat(parts).hasSize(1);
        assertThat(parts.get(0).verified()).isTrue();
        assertThat(parts.get(0).ruleMatchType()).isEqualTo("exact");
    }

    @Test
    void makeModelLookup_ordersVerifiedThenInStockThenCheapest() {
        InventoryItem outOfStock = item(ORG, "Out of stock", "A", 0, "1.00");
        InventoryItem expensive = item(ORG, "Expensive", "B", 3, "90.00");
        InventoryItem cheap = item(ORG, "Cheap", "C", 3, "10.00");
        InventoryItem verified = item(ORG, "Verified", "D", 0, "500.00");

        for (InventoryItem item : List.of(outOfStock, expensive, cheap)) {
            ruleService.addRule(ORG, item.getId(), CompatibilityRuleRequest.of("Komatsu", null));
        }
        ruleService.addRule(ORG, verified.getId(),
            new CompatibilityRuleRequest("Komatsu", null, null, "verified", null));

        List<CompatiblePartDto> parts = compatiblePartsService.getCompatiblePartsForMakeModel(ORG, "komatsu", "PC200");

        assertThat(parts).extracting(CompatiblePartDto::name)
            .containsExactly("Verified", "Cheap", "Expensive", "Out of stock");
        assertThat(parts.get(3).inStock()).isFalse();
    }

    @Test
    void makeModelLookup_ignoresOtherOrganizations() {
        InventoryItem foreign = item(OTHER_ORG, "Foreign pad", "TP-6", 5, "40.00");
        ruleService.addRule(OTHER_ORG, foreign.getId(), CompatibilityRuleRequest.of("Caterpillar", null));

        assertThat(compatiblePartsService.getCompatiblePartsForMakeModel(ORG, "Caterpillar", "D6T")).isEmpty();
    }

    @Test
    void equipmentLookup_usesStoredManufacturerAndModel() {
        Equipment dozer = equipment(ORG, "Caterpillar", "D6T");
        Equipment lift = equipment(ORG, "JLG", "JL-600");
        Equipment foreign = equipment(OTHER_ORG, "Komatsu", "PC200");

        InventoryItem pad = item(ORG, "Track pad", "TP-6", 5, "40.00");
        InventoryItem battery = item(ORG, "Lift battery", "BAT-1", 2, "150.00");
        InventoryItem bucket = item(ORG, "Bucket tooth", "BT-1", 9, "5.00");

        ruleService.addRule(ORG, pad.getId(), CompatibilityRuleRequest.of("Caterpillar", "D*T", "wildcard"));
        ruleService.addRule(ORG, battery.getId(), CompatibilityRuleRequest.of("JLG", "JL-", "prefix"));
        ruleService.addRule(ORG, bucket.getId(), CompatibilityRuleRequest.of("Komatsu", null));

        List<CompatiblePartDto> parts = compatiblePartsService.getCompatiblePartsForEquipment(ORG,
            List.of(dozer.getId(), lift.getId(), foreign.getId()));

        assertThat(parts).extracting(CompatiblePartDto::inventoryItemId)
            .containsExactlyInAnyOrder(pad.getId(), battery.getId());
    }

    @Test
    void equipmentLookup_withNoIdsReturnsNothing() {
        assertThat(compatiblePartsService.getCompatiblePartsForEquipment(ORG, List.of())).isEmpty();
    }
}
