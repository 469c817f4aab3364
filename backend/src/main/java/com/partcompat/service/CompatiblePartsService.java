package com.partcompat.service;

import com.partcompat.dto.mapper.CompatibilityMapper;
import com.partcompat.dto.response.CompatiblePartDto;
import com.partcompat.exception.TransientStoreException;
import com.partcompat.model.compatibility.CompatibilityRule;
import com.partcompat.model.enums.MatchType;
import com.partcompat.model.enums.VerificationStatus;
import com.partcompat.model.inventory.Equipment;
import com.partcompat.repository.CompatibilityRuleRepository;
import com.partcompat.repository.EquipmentRepository;
import com.partcompat.service.matching.IdentifierNormalizer;
import com.partcompat.service.matching.RuleMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Reverse lookup: which inventory items fit a given make/model or a set of equipment.
 *
 * Each item appears once, tagged with the rule that matched it. A verified rule is
 * preferred when several rules of the same item match.
 */
@Slf4j
@Service
@Transactional(readOnly = true)
public class CompatiblePartsService {

    static final Comparator<CompatiblePartDto> RESULT_ORDER = Comparator
        .comparing(CompatiblePartDto::verified).reversed()
        .thenComparing(Comparator.comparing(CompatiblePartDto::inStock).reversed())
        .thenComparing(CompatiblePartDto::defaultUnitCost, Comparator.nullsLast(Comparator.<BigDecimal>naturalOrder()))
        .thenComparing(CompatiblePartDto::name, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER));

    private final CompatibilityRuleRepository ruleRepository;
    private final EquipmentRepository equipmentRepository;
    private final RuleMatcher ruleMatcher;
    private final CompatibilityMapper compatibilityMapper;

    public CompatiblePartsService(
            CompatibilityRuleRepository ruleRepository,
            EquipmentRepository equipmentRepository,
            RuleMatcher ruleMatcher,
            CompatibilityMapper compatibilityMapper) {
        this.ruleRepository = ruleRepository;
        this.equipmentRepository = equipmentRepository;
        this.ruleMatcher = ruleMatcher;
        this.compatibilityMapper = compatibilityMapper;
    }

    /**
     * Items compatible with a manufacturer and optional model.
     *
     * Without a model only rules that fit any model of the manufacturer, or name
     * a model exactly, are considered; pattern rules need a model to test against.
     */
    public List<CompatiblePartDto> getCompatiblePartsForMakeModel(
            String organizationId, String manufacturer, String model) {

        String manufacturerNorm = IdentifierNormalizer.normalize(manufacturer);
        if (manufacturerNorm.isEmpty()) {
            return List.of();
        }

        boolean modelGiven = !IdentifierNormalizer.isBlank(model);
        List<CompatibilityRule> rules = loadRules(organizationId, Set.of(manufacturerNorm));

        Predicate<CompatibilityRule> applies = modelGiven
            ? rule -> ruleMatcher.matches(rule, manufacturer, model)
            : rule -> rule.getMatchType() == MatchType.ANY || rule.getMatchType() == MatchType.EXACT;

        return collapse(rules.stream().filter(applies).toList());
    }

    /**
     * Items compatible with at least one of the given equipment records.
     * Equipment of other organizations is ignored.
     */
    public List<CompatiblePartDto> getCompatiblePartsForEquipment(String organizationId, Collection<String> equipmentIds) {
        if (equipmentIds == null || equipmentIds.isEmpty()) {
            return List.of();
        }

        List<Equipment> equipment;
        try {
            equipment = equipmentRepository.findByOrganizationIdAndIdIn(organizationId, equipmentIds);
        } catch (DataAccessException e) {
            log.error("Failed to load equipment for organization {}", organizationId, e);
            throw new TransientStoreException("Failed to load equipment", e);
        }

        Set<String> manufacturers = equipment.stream()
            .map(e -> IdentifierNormalizer.normalize(e.getManufacturer()))
            .filter(m -> !m.isEmpty())
            .collect(Collectors.toSet());
        if (manufacturers.isEmpty()) {
            return List.of();
        }

        List<CompatibilityRule> matched = loadRules(organizationId, manufacturers).stream()
            .filter(rule -> equipment.stream()
                .anyMatch(e -> ruleMatcher.matches(rule, e.getManufacturer(), e.getModel())))
            .toList();

        return collapse(matched);
    }

    // ========================================================================
    // Helper Methods
    // ========================================================================

    private List<CompatibilityRule> loadRules(String organizationId, Set<String> manufacturerNorms) {
        try {
            return ruleRepository.findByOrganizationIdAndManufacturerNormIn(organizationId, manufacturerNorms);
        } catch (DataAccessException e) {
            log.error("Failed to load compatibility rules for organization {}", organizationId, e);
            throw new TransientStoreException("Failed to load compatibility rules", e);
        }
    }

    /**
     * One row per item, keeping a verified rule over an unverified one.
     */
    private List<CompatiblePartDto> collapse(List<CompatibilityRule> matchedRules) {
        Map<String, CompatibilityRule> bestByItem = new LinkedHashMap<>();
        for (CompatibilityRule rule : matchedRules) {
            bestByItem.merge(rule.getInventoryItem().getId(), rule,
                (current, candidate) -> isVerified(current) || !isVerified(candidate) ? current : candidate);
        }
        return bestByItem.values().stream()
            .map(compatibilityMapper::toCompatiblePartDto)
            .sorted(RESULT_ORDER)
            .toList();
    }

    private static boolean isVerified(CompatibilityRule rule) {
        return rule.getStatus() == VerificationStatus.VERIFIED;
    }
}
