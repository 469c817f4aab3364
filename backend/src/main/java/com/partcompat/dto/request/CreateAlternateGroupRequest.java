package com.partcompat.dto.request;

import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for creating an alternate group.
 */
public record CreateAlternateGroupRequest(
    @NotBlank(message = "Name is required")
    String name,

    String description,

    // Defaults to unverified
    String status,

    String notes,
    String evidenceUrl,

    String createdBy
) {}
