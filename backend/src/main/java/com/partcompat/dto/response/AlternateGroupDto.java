package com.partcompat.dto.response;

import java.time.LocalDateTime;

/**
 * Response DTO for an alternate group without its members.
 */
public record AlternateGroupDto(
    String id,
    String organizationId,
    String name,
    String description,
    String status,
    String notes,
    String evidenceUrl,
    String verifiedBy,
    LocalDateTime verifiedAt,
    LocalDateTime createdAt,
    String createdBy,
    LocalDateTime updatedAt
) {}
