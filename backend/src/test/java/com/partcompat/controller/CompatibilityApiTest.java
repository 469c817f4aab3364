package com.partcompat.controller;

import com.partcompat.IntegrationTestSupport;
import com.partcompat.model.inventory.InventoryItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
class CompatibilityApiTest extends IntegrationTestSupport {

    private static final String BASE = "/api/organizations/" + ORG;

    @Autowired
    private MockMvc mockMvc;

    private InventoryItem item;

    @BeforeEach
    void setUp() {
        item = item(ORG, "Track pad", "TP-6", 4, "40.00");
        equipment(ORG, "Caterpillar", "D6T");
        equipment(ORG, "Caterpillar", "D8T");
        equipment(ORG, "Caterpillar", "D6R");
    }

    @Test
    void replaceThenListRules() throws Exception {
        mockMvc.perform(put(BASE + "/inventory-items/{itemId}/compatibility-rules", item.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"rules": [
                      {"manufacturer": "Caterpillar", "model": "D*T", "matchType": "wildcard"},
                      {"manufacturer": "caterpillar", "model": "d*t"},
                      {"manufacturer": "", "model": "X"}
                    ]}
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.rulesSet").value(1));

        mockMvc.perform(get(BASE + "/inventory-items/{itemId}/compatibility-rules", item.getId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)))
            .andExpect(jsonPath("$[0].matchType").value("wildcard"))
            .andExpect(jsonPath("$[0].modelNorm").value("d*t"))
            .andExpect(jsonPath("$[0].status").value("unverified"));
    }

    @Test
    void addRule_reportsValidationCode() throws Exception {
        mockMvc.perform(post(BASE + "/inventory-items/{itemId}/compatibility-rules", item.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"manufacturer\": \"JLG\", \"model\": \"JL-*\", \"matchType\": \"prefix\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("WILDCARD_NOT_ALLOWED_IN_PREFIX"));
    }

    @Test
    void addRule_conflictsOnDuplicate() throws Exception {
        String body = "{\"manufacturer\": \"Caterpillar\", \"model\": \"D6T\"}";
        mockMvc.perform(post(BASE + "/inventory-items/{itemId}/compatibility-rules", item.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.matchType").value("exact"));

        mockMvc.perform(post(BASE + "/inventory-items/{itemId}/compatibility-rules", item.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("This manufacturer/model combination already exists for this item"));
    }

    @Test
    void rulesOfAnotherOrganization_areForbidden() throws Exception {
        mockMvc.perform(get("/api/organizations/{org}/inventory-items/{itemId}/compatibility-rules", OTHER_ORG, item.getId()))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error").value("Inventory item not found or access denied"));

        mockMvc.perform(delete(BASE + "/compatibility-rules/{ruleId}", "rule-missing"))
            .andExpect(status().isForbidden());
    }

    @Test
    void matchCount_countsDistinctEquipment() throws Exception {
        mockMvc.perform(post(BASE + "/compatibility-rules/match-count")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"rules": [
                      {"manufacturer": "Caterpillar", "model": "D*T", "matchType": "wildcard"},
                      {"manufacturer": "Caterpillar", "model": "D6T"},
                      {"manufacturer": "Caterpillar", "model": "*", "matchType": "wildcard"}
                    ]}
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.count").value(2));
    }

    @Test
    void compatiblePartsLookup_returnsTaggedItems() throws Exception {
        mockMvc.perform(put(BASE + "/inventory-items/{itemId}/compatibility-rules", item.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"rules\": [{\"manufacturer\": \"Caterpillar\"}]}"))
            .andExpect(status().isOk());

        mockMvc.perform(get(BASE + "/part-lookup/compatible-parts")
                .param("manufacturer", "CATERPILLAR")
                .param("model", "D6T"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)))
            .andExpect(jsonPath("$[0].inventoryItemId").value(item.getId()))
            .andExpect(jsonPath("$[0].ruleMatchType").value("any"))
            .andExpect(jsonPath("$[0].inStock").value(true));
    }

    @Test
    void alternateGroups_missingGroupIsNotFound() throws Exception {
        mockMvc.perform(get(BASE + "/alternate-groups/{groupId}", "grp-missing"))
            .andExpect(status().isNotFound());

        mockMvc.perform(patch(BASE + "/alternate-groups/{groupId}", "grp-missing")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\": \"verified\"}"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void alternateGroups_createRequiresName() throws Exception {
        mockMvc.perform(post(BASE + "/alternate-groups")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").exists());

        mockMvc.perform(post(BASE + "/alternate-groups")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"Oil filters\", \"status\": \"bogus\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void alternatesLookup_blankPartNumberReturnsEmptyList() throws Exception {
        mockMvc.perform(get(BASE + "/part-lookup/alternates").param("partNumber", " "))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(0)));
    }
}
