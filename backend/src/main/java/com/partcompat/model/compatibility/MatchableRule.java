package com.partcompat.model.compatibility;

import com.partcompat.model.enums.MatchType;

/**
 * The normalized view of a rule the matcher needs. Implemented by stored rules and by
 * unsaved candidates, so previews and lookups share one matching path.
 */
public interface MatchableRule {

    String getManufacturerNorm();

    /**
     * Normalized model or pattern; null for ANY rules.
     */
    String getModelNorm();

    MatchType getMatchType();
}
