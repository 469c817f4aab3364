package com.partcompat.dto.request;

/**
 * Request DTO for updating an alternate group.
 * All fields are optional - only provided fields will be updated.
 * An empty string clears description, notes and evidenceUrl.
 */
public record UpdateAlternateGroupRequest(
    String name,
    String description,
    String status,
    String notes,
    String evidenceUrl,

    // Recorded as verifier when status becomes verified
    String updatedBy
) {}
