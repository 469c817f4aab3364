package com.partcompat.service.matching;

import com.partcompat.model.compatibility.MatchableRule;
import com.partcompat.model.enums.MatchType;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Decides whether a piece of equipment (manufacturer + model) is covered by a rule.
 *
 * The manufacturer is always compared exactly after normalization. Only the model
 * axis is pattern-matched, according to the rule's {@link MatchType}.
 */
@Service
public class RuleMatcher {

    private static final int MAX_CACHED_PATTERNS = 1024;

    private final Map<String, Pattern> wildcardCache = new ConcurrentHashMap<>();

    public boolean matches(MatchableRule rule, String manufacturer, String model) {
        if (rule == null || rule.getManufacturerNorm() == null || rule.getMatchType() == null) {
            return false;
        }
        if (!IdentifierNormalizer.normalize(manufacturer).equals(rule.getManufacturerNorm())) {
            return false;
        }

        String modelNorm = IdentifierNormalizer.normalize(model);
        String pattern = rule.getModelNorm();

        return switch (rule.getMatchType()) {
            case ANY -> true;
            case EXACT -> modelNorm.equals(pattern);
            case PREFIX -> pattern != null && modelNorm.startsWith(pattern);
            case WILDCARD -> pattern != null && wildcardPattern(pattern).matcher(modelNorm).matches();
        };
    }

    /**
     * True if any rule matches. Stops at the first match.
     */
    public boolean matchesAny(Collection<? extends MatchableRule> rules, String manufacturer, String model) {
        for (MatchableRule rule : rules) {
            if (matches(rule, manufacturer, model)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Translate a normalized wildcard pattern into an anchored regex:
     * '*' is zero or more characters, '?' exactly one, everything else literal.
     */
    static Pattern toRegex(String wildcard) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < wildcard.length(); i++) {
            char c = wildcard.charAt(i);
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(),
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    }

    private Pattern wildcardPattern(String wildcard) {
        if (wildcardCache.size() >= MAX_CACHED_PATTERNS) {
            wildcardCache.clear();
        }
        return wildcardCache.computeIfAbsent(wildcard, RuleMatcher::toRegex);
    }
}
