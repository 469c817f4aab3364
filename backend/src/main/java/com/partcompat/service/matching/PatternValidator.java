package com.partcompat.service.matching;

import com.partcompat.exception.ValidationError;
import com.partcompat.exception.ValidationFailedException;
import com.partcompat.model.enums.MatchType;
import org.springframework.stereotype.Component;

/**
 * Validates a model pattern against its match type and turns raw rule input
 * into a {@link RuleCandidate}.
 *
 * Rules:
 * - ANY: no model.
 * - EXACT: literal model, no wildcard characters.
 * - PREFIX: literal prefix, no wildcard characters.
 * - WILDCARD: '*' (any run) and '?' (one character); at most 2 '*' and at least
 *   2 literal characters once wildcards and separators are removed.
 */
@Component
public class PatternValidator {

    static final int MAX_STAR_WILDCARDS = 2;
    static final int MIN_LITERAL_CHARACTERS = 2;

    private static final String SEPARATORS = "-_./";

    /**
     * Normalize and validate raw rule input.
     *
     * A missing match type is inferred: ANY when the model is blank, EXACT otherwise.
     * An EXACT rule without a model is treated as ANY.
     *
     * @throws ValidationFailedException when the manufacturer is blank or the pattern is invalid
     */
    public RuleCandidate prepare(String manufacturer, String model, MatchType requestedType) {
        String manufacturerDisplay = IdentifierNormalizer.trimToNull(manufacturer);
        if (manufacturerDisplay == null) {
            throw new ValidationFailedException(ValidationError.EMPTY_MANUFACTURER);
        }
        String modelDisplay = IdentifierNormalizer.trimToNull(model);

        MatchType matchType = requestedType;
        if (matchType == null) {
            matchType = modelDisplay == null ? MatchType.ANY : MatchType.EXACT;
        } else if (matchType == MatchType.EXACT && modelDisplay == null) {
            matchType = MatchType.ANY;
        }

        validate(matchType, modelDisplay);

        return RuleCandidate.builder()
            .manufacturer(manufacturerDisplay)
            .model(modelDisplay)
            .manufacturerNorm(IdentifierNormalizer.normalize(manufacturerDisplay))
            .modelNorm(IdentifierNormalizer.normalizeOrNull(modelDisplay))
            .matchType(matchType)
            .build();
    }

    /**
     * Check a pattern against its match type.
     *
     * @throws ValidationFailedException with the specific {@link ValidationError}
     */
    public void validate(MatchType matchType, String pattern) {
        if (matchType == null) {
            throw new IllegalArgumentException("Match type is required");
        }
        boolean blank = IdentifierNormalizer.isBlank(pattern);

        switch (matchType) {
            case ANY -> {
                if (!blank) {
                    throw new ValidationFailedException(ValidationError.MODEL_NOT_ALLOWED_FOR_ANY);
                }
            }
            case EXACT -> {
                requirePattern(blank);
                if (hasWildcard(pattern)) {
                    throw new ValidationFailedException(ValidationError.WILDCARD_NOT_ALLOWED_IN_EXACT);
                }
            }
            case PREFIX -> {
                requirePattern(blank);
                if (hasWildcard(pattern)) {
                    throw new ValidationFailedException(ValidationError.WILDCARD_NOT_ALLOWED_IN_PREFIX);
                }
            }
            case WILDCARD -> {
                requirePattern(blank);
                validateWildcard(pattern.trim());
            }
        }
    }

    /**
     * Non-throwing variant for callers that only want to skip bad input.
     */
    public boolean isValid(MatchType matchType, String pattern) {
        try {
            validate(matchType, pattern);
            return true;
        } catch (ValidationFailedException e) {
            return false;
        }
    }

    private void validateWildcard(String pattern) {
        int stars = 0;
        int literals = 0;
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '*') {
                stars++;
            } else if (c != '?' && !isSeparator(c)) {
                literals++;
            }
        }
        if (stars > MAX_STAR_WILDCARDS) {
            throw new ValidationFailedException(ValidationError.TOO_MANY_WILDCARDS);
        }
        if (literals < MIN_LITERAL_CHARACTERS) {
            throw new ValidationFailedException(ValidationError.PATTERN_TOO_BROAD);
        }
    }

    private void requirePattern(boolean blank) {
        if (blank) {
            throw new ValidationFailedException(ValidationError.EMPTY_PATTERN);
        }
    }

    private static boolean hasWildcard(String pattern) {
        return pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0;
    }

    private static boolean isSeparator(char c) {
        return Character.isWhitespace(c) || SEPARATORS.indexOf(c) >= 0;
    }
}
