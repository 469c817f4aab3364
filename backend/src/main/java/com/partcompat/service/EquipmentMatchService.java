package com.partcompat.service;

import com.partcompat.dto.request.CompatibilityRuleRequest;
import com.partcompat.exception.TransientStoreException;
import com.partcompat.exception.ValidationFailedException;
import com.partcompat.model.enums.MatchType;
import com.partcompat.model.inventory.Equipment;
import com.partcompat.repository.EquipmentRepository;
import com.partcompat.service.matching.IdentifierNormalizer;
import com.partcompat.service.matching.PatternValidator;
import com.partcompat.service.matching.RuleCandidate;
import com.partcompat.service.matching.RuleMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Evaluates a proposed rule set against an organization's equipment,
 * so an editor can preview how many machines the rules would cover.
 */
@Slf4j
@Service
@Transactional(readOnly = true)
public class EquipmentMatchService {

    private final EquipmentRepository equipmentRepository;
    private final PatternValidator patternValidator;
    private final RuleMatcher ruleMatcher;

    public EquipmentMatchService(
            EquipmentRepository equipmentRepository,
            PatternValidator patternValidator,
            RuleMatcher ruleMatcher) {
        this.equipmentRepository = equipmentRepository;
        this.patternValidator = patternValidator;
        this.ruleMatcher = ruleMatcher;
    }

    /**
     * Number of distinct equipment records matched by at least one valid rule.
     * Invalid rules are ignored rather than rejected.
     */
    public int countMatches(String organizationId, List<CompatibilityRuleRequest> rules) {
        return findMatchingEquipment(organizationId, rules).size();
    }

    /**
     * Distinct equipment records matched by at least one valid rule.
     */
    public List<Equipment> findMatchingEquipment(String organizationId, List<CompatibilityRuleRequest> rules) {
        List<RuleCandidate> candidates = toCandidates(rules);
        if (candidates.isEmpty()) {
            return List.of();
        }

        Set<String> manufacturers = candidates.stream()
            .map(RuleCandidate::getManufacturerNorm)
            .collect(Collectors.toSet());

        List<Equipment> population;
        try {
            population = equipmentRepository.findByOrganizationIdAndManufacturerNormIn(organizationId, manufacturers);
        } catch (DataAccessException e) {
            log.error("Failed to load equipment for organization {}", organizationId, e);
            throw new TransientStoreException("Failed to load equipment", e);
        }

        Map<String, Equipment> matched = new LinkedHashMap<>();
        for (Equipment equipment : population) {
            if (ruleMatcher.matchesAny(candidates, equipment.getManufacturer(), equipment.getModel())) {
                matched.putIfAbsent(equipment.getId(), equipment);
            }
        }

        log.debug("{} of {} equipment records matched {} rules in organization {}",
            matched.size(), population.size(), candidates.size(), organizationId);
        return new ArrayList<>(matched.values());
    }

    private List<RuleCandidate> toCandidates(List<CompatibilityRuleRequest> rules) {
        if (rules == null || rules.isEmpty()) {
            return List.of();
        }
        List<RuleCandidate> candidates = new ArrayList<>(rules.size());
        for (CompatibilityRuleRequest rule : rules) {
            if (rule == null || IdentifierNormalizer.isBlank(rule.manufacturer())) {
                continue;
            }
            try {
                candidates.add(patternValidator.prepare(
                    rule.manufacturer(), rule.model(), MatchType.fromValue(rule.matchType())));
            } catch (ValidationFailedException | IllegalArgumentException e) {
                log.debug("Skipping rule {}/{} in match preview: {}", rule.manufacturer(), rule.model(), e.getMessage());
            }
        }
        return candidates;
    }
}
