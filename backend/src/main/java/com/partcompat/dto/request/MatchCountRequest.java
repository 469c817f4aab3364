package com.partcompat.dto.request;

import java.util.List;

/**
 * Candidate rules to preview against the fleet before they are saved.
 */
public record MatchCountRequest(
    List<CompatibilityRuleRequest> rules
) {}
