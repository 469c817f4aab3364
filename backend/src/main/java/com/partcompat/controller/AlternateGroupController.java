package com.partcompat.controller;

import com.partcompat.dto.mapper.AlternateGroupMapper;
import com.partcompat.dto.request.AddGroupIdentifierRequest;
import com.partcompat.dto.request.AddGroupInventoryItemRequest;
import com.partcompat.dto.request.CreateAlternateGroupRequest;
import com.partcompat.dto.request.UpdateAlternateGroupRequest;
import com.partcompat.dto.response.AlternateGroupDetailDto;
import com.partcompat.dto.response.AlternateGroupDto;
import com.partcompat.service.AlternateGroupService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for alternate part groups and their members.
 */
@RestController
@RequestMapping("/api/organizations/{organizationId}/alternate-groups")
public class AlternateGroupController {

    private final AlternateGroupService groupService;
    private final AlternateGroupMapper groupMapper;

    public AlternateGroupController(AlternateGroupService groupService, AlternateGroupMapper groupMapper) {
        this.groupService = groupService;
        this.groupMapper = groupMapper;
    }

    // ========================================================================
    // Groups
    // ========================================================================

    @GetMapping
    public ResponseEntity<List<AlternateGroupDto>> listGroups(@PathVariable String organizationId) {
        return ResponseEntity.ok(groupMapper.toDtoList(groupService.listGroups(organizationId)));
    }

    /**
     * Get a group with its members.
     */
    @GetMapping("/{groupId}")
    public ResponseEntity<AlternateGroupDetailDto> getGroup(
            @PathVariable String organizationId,
            @PathVariable String groupId) {
        return groupService.getGroupWithMembers(organizationId, groupId)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping
    public ResponseEntity<AlternateGroupDto> createGroup(
            @PathVariable String organizationId,
            @Valid @RequestBody CreateAlternateGroupRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(groupMapper.toDto(groupService.createGroup(organizationId, request)));
    }

    /**
     * Update a group. Absent fields are left unchanged.
     */
    @PatchMapping("/{groupId}")
    public ResponseEntity<AlternateGroupDto> updateGroup(
            @PathVariable String organizationId,
            @PathVariable String groupId,
            @RequestBody UpdateAlternateGroupRequest request) {
        return ResponseEntity.ok(groupMapper.toDto(groupService.updateGroup(organizationId, groupId, request)));
    }

    @DeleteMapping("/{groupId}")
    public ResponseEntity<Void> deleteGroup(
            @PathVariable String organizationId,
            @PathVariable String groupId) {
        groupService.deleteGroup(organizationId, groupId);
        return ResponseEntity.noContent().build();
    }

    // ========================================================================
    // Members
    // ========================================================================

    @PostMapping("/{groupId}/identifiers")
    public ResponseEntity<Void> addIdentifier(
            @PathVariable String organizationId,
            @PathVariable String groupId,
            @Valid @RequestBody AddGroupIdentifierRequest request) {
        groupService.addIdentifierToGroup(organizationId, groupId, request);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{groupId}/inventory-items")
    public ResponseEntity<Void> addInventoryItem(
            @PathVariable String organizationId,
            @PathVariable String groupId,
            @Valid @RequestBody AddGroupInventoryItemRequest request) {
        groupService.addInventoryItemToGroup(organizationId, groupId, request);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/members/{memberId}")
    public ResponseEntity<Void> removeMember(
            @PathVariable String organizationId,
            @PathVariable String memberId) {
        groupService.removeGroupMember(organizationId, memberId);
        return ResponseEntity.noContent().build();
    }
}
