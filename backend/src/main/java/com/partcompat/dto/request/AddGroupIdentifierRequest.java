package com.partcompat.dto.request;

import jakarta.validation.constraints.NotBlank;

/**
 * Adds a cataloged part number to an alternate group.
 */
public record AddGroupIdentifierRequest(
    @NotBlank(message = "Part identifier id is required")
    String partIdentifierId,

    boolean primary,
    String notes
) {}
