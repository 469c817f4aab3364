package com.partcompat.service.matching;

import com.partcompat.exception.ValidationError;
import com.partcompat.exception.ValidationFailedException;
import com.partcompat.model.enums.MatchType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PatternValidatorTest {

    private final PatternValidator validator = new PatternValidator();

    @Test
    void validate_rejectsWildcardsThatAreTooBroad() {
        assertRejected(MatchType.WILDCARD, "*", ValidationError.PATTERN_TOO_BROAD);
        assertRejected(MatchType.WILDCARD, "**", ValidationError.PATTERN_TOO_BROAD);
        assertRejected(MatchType.WILDCARD, "*-*", ValidationError.PATTERN_TOO_BROAD);
        assertRejected(MatchType.WILDCARD, "d*", ValidationError.PATTERN_TOO_BROAD);
    }

    @Test
    void validate_rejectsMoreThanTwoStars() {
        assertRejected(MatchType.WILDCARD, "d*6*t*", ValidationError.TOO_MANY_WILDCARDS);
    }

    @Test
    void validate_acceptsWildcardWithEnoughLiterals() {
        assertThat(validator.isValid(MatchType.WILDCARD, "D*T")).isTrue();
        assertThat(validator.isValid(MatchType.WILDCARD, "D?T")).isTrue();
        assertThat(validator.isValid(MatchType.WILDCARD, "*D6*")).isTrue();
    }

    @Test
    void validate_rejectsWildcardInPrefix() {
        assertRejected(MatchType.PREFIX, "JL-*", ValidationError.WILDCARD_NOT_ALLOWED_IN_PREFIX);
        assertThat(validator.isValid(MatchType.PREFIX, "JL-")).isTrue();
    }

    @Test
    void validate_rejectsWildcardInExact() {
        assertRejected(MatchType.EXACT, "D6?", ValidationError.WILDCARD_NOT_ALLOWED_IN_EXACT);
    }

    @Test
    void validate_requiresPatternForPatternTypes() {
        assertRejected(MatchType.PREFIX, "  ", ValidationError.EMPTY_PATTERN);
        assertRejected(MatchType.WILDCARD, null, ValidationError.EMPTY_PATTERN);
    }

    @Test
    void validate_rejectsModelOnAnyRule() {
        assertRejected(MatchType.ANY, "D6T", ValidationError.MODEL_NOT_ALLOWED_FOR_ANY);
        assertThat(validator.isValid(MatchType.ANY, null)).isTrue();
    }

    @Test
    void prepare_infersMatchTypeFromModel() {
        RuleCandidate anyModel = validator.prepare("Caterpillar", "  ", null);
        assertThat(anyModel.getMatchType()).isEqualTo(MatchType.ANY);
        assertThat(anyModel.getModelNorm()).isNull();

        RuleCandidate exact = validator.prepare(" Caterpillar ", " D6T ", null);
        assertThat(exact.getMatchType()).isEqualTo(MatchType.EXACT);
        assertThat(exact.getManufacturer()).isEqualTo("Caterpillar");
        assertThat(exact.getModel()).isEqualTo("D6T");
        assertThat(exact.getManufacturerNorm()).isEqualTo("caterpillar");
        assertThat(exact.getModelNorm()).isEqualTo("d6t");
    }

    @Test
    void prepare_turnsExactWithoutModelIntoAny() {
        assertThat(validator.prepare("JLG", null, MatchType.EXACT).getMatchType()).isEqualTo(MatchType.ANY);
    }

    @Test
    void prepare_requiresManufacturer() {
        assertThatThrownBy(() -> validator.prepare("  ", "D6T", MatchType.EXACT))
            .isInstanceOf(ValidationFailedException.class)
            .hasFieldOrPropertyWithValue("error", ValidationError.EMPTY_MANUFACTURER);
    }

    @Test
    void prepare_keepsWildcardCharactersInNormalizedPattern() {
        RuleCandidate candidate = validator.prepare("CAT", "D*T", MatchType.WILDCARD);
        assertThat(candidate.getModelNorm()).isEqualTo("d*t");
    }

    private void assertRejected(MatchType type, String pattern, ValidationError expected) {
        assertThatThrownBy(() -> validator.validate(type, pattern))
            .isInstanceOf(ValidationFailedException.class)
            .hasFieldOrPropertyWithValue("error", expected);
        assertThat(validator.isValid(type, pattern)).isFalse();
    }
}
