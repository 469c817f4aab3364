package com.partcompat.controller;

import com.partcompat.dto.mapper.CompatibilityMapper;
import com.partcompat.dto.request.BulkSetRulesRequest;
import com.partcompat.dto.request.CompatibilityRuleRequest;
import com.partcompat.dto.request.MatchCountRequest;
import com.partcompat.dto.response.BulkSetRulesResultDto;
import com.partcompat.dto.response.CompatibilityRuleDto;
import com.partcompat.dto.response.MatchCountDto;
import com.partcompat.model.compatibility.CompatibilityRule;
import com.partcompat.service.CompatibilityRuleService;
import com.partcompat.service.EquipmentMatchService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for the compatibility rules of inventory items.
 */
@RestController
@RequestMapping("/api/organizations/{organizationId}")
public class CompatibilityRuleController {

    private final CompatibilityRuleService ruleService;
    private final EquipmentMatchService equipmentMatchService;
    private final CompatibilityMapper compatibilityMapper;

    public CompatibilityRuleController(
            CompatibilityRuleService ruleService,
            EquipmentMatchService equipmentMatchService,
            CompatibilityMapper compatibilityMapper) {
        this.ruleService = ruleService;
        this.equipmentMatchService = equipmentMatchService;
        this.compatibilityMapper = compatibilityMapper;
    }

    // ========================================================================
    // Rules of an item
    // ========================================================================

    @GetMapping("/inventory-items/{itemId}/compatibility-rules")
    public ResponseEntity<List<CompatibilityRuleDto>> getRules(
            @PathVariable String organizationId,
            @PathVariable String itemId) {
        return ResponseEntity.ok(compatibilityMapper.toDtoList(ruleService.getRulesForItem(organizationId, itemId)));
    }

    @PostMapping("/inventory-items/{itemId}/compatibility-rules")
    public ResponseEntity<CompatibilityRuleDto> addRule(
            @PathVariable String organizationId,
            @PathVariable String itemId,
            @RequestBody CompatibilityRuleRequest request) {
        CompatibilityRule saved = ruleService.addRule(organizationId, itemId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(compatibilityMapper.toDto(saved));
    }

    /**
     * Replace every rule of the item with the submitted set.
     */
    @PutMapping("/inventory-items/{itemId}/compatibility-rules")
    public ResponseEntity<BulkSetRulesResultDto> replaceRules(
            @PathVariable String organizationId,
            @PathVariable String itemId,
            @Valid @RequestBody BulkSetRulesRequest request) {
        int count = ruleService.bulkReplaceRules(organizationId, itemId, request.rules());
        return ResponseEntity.ok(new BulkSetRulesResultDto(count));
    }

    @DeleteMapping("/compatibility-rules/{ruleId}")
    public ResponseEntity<Void> removeRule(
            @PathVariable String organizationId,
            @PathVariable String ruleId) {
        ruleService.removeRule(organizationId, ruleId);
        return ResponseEntity.noContent().build();
    }

    // ========================================================================
    // Preview
    // ========================================================================

    /**
     * Count the equipment a proposed rule set would cover. Invalid rules are ignored.
     */
    @PostMapping("/compatibility-rules/match-count")
    public ResponseEntity<MatchCountDto> countMatches(
            @PathVariable String organizationId,
            @RequestBody MatchCountRequest request) {
        return ResponseEntity.ok(new MatchCountDto(equipmentMatchService.countMatches(organizationId, request.rules())));
    }
}
