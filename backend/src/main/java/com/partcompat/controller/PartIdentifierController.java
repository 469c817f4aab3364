package com.partcompat.controller;

import com.partcompat.dto.mapper.AlternateGroupMapper;
import com.partcompat.dto.request.CreatePartIdentifierRequest;
import com.partcompat.dto.response.PartIdentifierDto;
import com.partcompat.service.PartIdentifierService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for cataloged part numbers.
 */
@RestController
@RequestMapping("/api/organizations/{organizationId}/part-identifiers")
@RequiredArgsConstructor
public class PartIdentifierController {

    private final PartIdentifierService partIdentifierService;
    private final AlternateGroupMapper mapper;

    @PostMapping
    public ResponseEntity<PartIdentifierDto> createIdentifier(
            @PathVariable String organizationId,
            @Valid @RequestBody CreatePartIdentifierRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(mapper.toDto(partIdentifierService.createIdentifier(organizationId, request)));
    }

    /**
     * Substring search on part numbers.
     */
    @GetMapping
    public ResponseEntity<List<PartIdentifierDto>> searchIdentifiers(
            @PathVariable String organizationId,
            @RequestParam(name = "q", required = false) String query) {
        return ResponseEntity.ok(
            mapper.toIdentifierDtoList(partIdentifierService.searchIdentifiers(organizationId, query)));
    }
}
