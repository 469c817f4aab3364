package com.partcompat.service.matching;

import com.partcompat.model.compatibility.MatchableRule;
import com.partcompat.model.enums.MatchType;
import lombok.Builder;
import lombok.Value;

/**
 * A validated, normalized rule that has not been stored yet.
 */
@Value
@Builder
public class RuleCandidate implements MatchableRule {

    String manufacturer;
    String model;
    String manufacturerNorm;
    String modelNorm;
    MatchType matchType;
}
