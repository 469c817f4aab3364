package com.partcompat.controller;

import com.partcompat.dto.request.EquipmentPartsRequest;
import com.partcompat.dto.response.AlternatePartResult;
import com.partcompat.dto.response.CompatiblePartDto;
import com.partcompat.service.AlternateLookupService;
import com.partcompat.service.CompatiblePartsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Read-only lookups: compatible parts for equipment, and alternates for a part.
 */
@RestController
@RequestMapping("/api/organizations/{organizationId}")
@RequiredArgsConstructor
@Slf4j
public class PartLookupController {

    private final CompatiblePartsService compatiblePartsService;
    private final AlternateLookupService alternateLookupService;

    @GetMapping("/part-lookup/compatible-parts")
    public ResponseEntity<List<CompatiblePartDto>> getCompatiblePartsForMakeModel(
            @PathVariable String organizationId,
            @RequestParam(required = false) String manufacturer,
            @RequestParam(required = false) String model) {
        log.debug("Compatible parts lookup for {}/{} in organization {}", manufacturer, model, organizationId);
        return ResponseEntity.ok(
            compatiblePartsService.getCompatiblePartsForMakeModel(organizationId, manufacturer, model));
    }

    @PostMapping("/part-lookup/compatible-parts/equipment")
    public ResponseEntity<List<CompatiblePartDto>> getCompatiblePartsForEquipment(
            @PathVariable String organizationId,
            @RequestBody EquipmentPartsRequest request) {
        return ResponseEntity.ok(
            compatiblePartsService.getCompatiblePartsForEquipment(organizationId, request.equipmentIds()));
    }

    @GetMapping("/part-lookup/alternates")
    public ResponseEntity<List<AlternatePartResult>> getAlternatesForPartNumber(
            @PathVariable String organizationId,
            @RequestParam(required = false) String partNumber) {
        return ResponseEntity.ok(alternateLookupService.getAlternatesForPartNumber(organizationId, partNumber));
    }

    @GetMapping("/inventory-items/{itemId}/alternates")
    public ResponseEntity<List<AlternatePartResult>> getAlternatesForInventoryItem(
            @PathVariable String organizationId,
            @PathVariable String itemId) {
        return ResponseEntity.ok(alternateLookupService.getAlternatesForInventoryItem(organizationId, itemId));
    }
}
