package com.partcompat.dto.response;

/**
 * Number of rules stored by a bulk replace.
 */
public record BulkSetRulesResultDto(int rulesSet) {}
