package com.partcompat.service;

import com.partcompat.dto.request.CompatibilityRuleRequest;
import com.partcompat.exception.DuplicateEntryException;
import com.partcompat.exception.TenantAccessDeniedException;
import com.partcompat.exception.TransientStoreException;
import com.partcompat.model.compatibility.CompatibilityRule;
import com.partcompat.model.enums.MatchType;
import com.partcompat.model.enums.VerificationStatus;
import com.partcompat.model.inventory.InventoryItem;
import com.partcompat.repository.CompatibilityRuleRepository;
import com.partcompat.repository.InventoryItemRepository;
import com.partcompat.service.matching.IdentifierNormalizer;
import com.partcompat.service.matching.PatternValidator;
import com.partcompat.service.matching.RuleCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Compatibility Rule Service
 *
 * Maintains the rules stating which equipment an inventory item fits:
 * - Listing and single-rule add/remove, scoped to the caller's organization
 * - Atomic replacement of an item's whole rule set
 *
 * Every pattern is validated before anything is written.
 */
@Slf4j
@Service
@Transactional
public class CompatibilityRuleService {

    static final String ITEM_ACCESS_DENIED = "Inventory item not found or access denied";
    static final String RULE_ACCESS_DENIED = "Compatibility rule not found or access denied";
    static final String DUPLICATE_RULE = "This manufacturer/model combination already exists for this item";

    private final CompatibilityRuleRepository ruleRepository;
    private final InventoryItemRepository inventoryItemRepository;
    private final PatternValidator patternValidator;

    public CompatibilityRuleService(
            CompatibilityRuleRepository ruleRepository,
            InventoryItemRepository inventoryItemRepository,
            PatternValidator patternValidator) {
        this.ruleRepository = ruleRepository;
        this.inventoryItemRepository = inventoryItemRepository;
        this.patternValidator = patternValidator;
    }

    // ========================================================================
    // Queries
    // ========================================================================

    /**
     * Rules of an item, ordered by manufacturer then model.
     */
    @Transactional(readOnly = true)
    public List<CompatibilityRule> getRulesForItem(String organizationId, String itemId) {
        requireItem(organizationId, itemId);
        return ruleRepository.findByItemIdOrdered(itemId);
    }

    // ========================================================================
    // Single-rule operations
    // ========================================================================

    /**
     * Add one rule to an item.
     *
     * @throws com.partcompat.exception.ValidationFailedException if the pattern is invalid
     * @throws DuplicateEntryException if the same (manufacturer, model, match type) already exists
     */
    public CompatibilityRule addRule(String organizationId, String itemId, CompatibilityRuleRequest request) {
        InventoryItem item = requireItem(organizationId, itemId);

        RuleCandidate candidate = patternValidator.prepare(
            request.manufacturer(), request.model(), MatchType.fromValue(request.matchType()));

        if (ruleRepository.existsByInventoryItemIdAndManufacturerNormAndModelKeyAndMatchType(
                itemId, candidate.getManufacturerNorm(), CompatibilityRule.modelKeyOf(candidate.getModelNorm()),
                candidate.getMatchType())) {
            throw new DuplicateEntryException(DUPLICATE_RULE);
        }

        CompatibilityRule rule = toEntity(item, candidate, request);
        try {
            CompatibilityRule saved = ruleRepository.saveAndFlush(rule);
            log.info("Added {} compatibility rule {} to item {}", candidate.getMatchType().getValue(),
                saved.getId(), itemId);
            return saved;
        } catch (DataIntegrityViolationException e) {
            // Lost a race against a concurrent insert of the same rule
            log.warn("Duplicate compatibility rule for item {}: {}", itemId, e.getMostSpecificCause().getMessage());
            throw new DuplicateEntryException(DUPLICATE_RULE, e);
        } catch (DataAccessException e) {
            log.error("Failed to add compatibility rule to item {}", itemId, e);
            throw new TransientStoreException("Failed to add compatibility rule", e);
        }
    }

    /**
     * Delete one rule. The rule's item must belong to the organization.
     */
    public void removeRule(String organizationId, String ruleId) {
        CompatibilityRule rule = ruleRepository.findWithItemById(ruleId)
            .filter(r -> organizationId != null
                && organizationId.equals(r.getInventoryItem().getOrganizationId()))
            .orElseThrow(() -> new TenantAccessDeniedException(RULE_ACCESS_DENIED));

        try {
            ruleRepository.delete(rule);
            ruleRepository.flush();
        } catch (DataAccessException e) {
            log.error("Failed to remove compatibility rule {}", ruleId, e);
            throw new TransientStoreException("Failed to remove compatibility rule", e);
        }
        log.info("Removed compatibility rule {} from item {}", ruleId, rule.getInventoryItem().getId());
    }

    // ========================================================================
    // Bulk replacement
    // ========================================================================

    /**
     * Replace every rule of an item with the given set, atomically.
     *
     * Entries without a manufacturer are dropped. Entries with the same normalized
     * (manufacturer, model) are collapsed, keeping the first. All remaining entries are
     * validated before the existing rules are touched. The item row is locked for the
     * duration, so concurrent replacements on one item run one after the other.
     *
     * @return number of rules stored
     */
    public int bulkReplaceRules(String organizationId, String itemId, List<CompatibilityRuleRequest> requests) {
        InventoryItem item = inventoryItemRepository.lockByIdAndOrganizationId(itemId, organizationId)
            .orElseThrow(() -> new TenantAccessDeniedException(ITEM_ACCESS_DENIED));

        List<CompatibilityRule> replacement = prepareRuleSet(item, requests != null ? requests : List.of());

        try {
            int removed = ruleRepository.deleteAllByItemId(itemId);
            List<CompatibilityRule> saved = ruleRepository.saveAllAndFlush(replacement);
            log.info("Replaced {} compatibility rules with {} for item {}", removed, saved.size(), itemId);
            return saved.size();
        } catch (DataAccessException e) {
            log.error("Failed to replace compatibility rules for item {}, rolling back", itemId, e);
            throw new TransientStoreException("Failed to replace compatibility rules", e);
        }
    }

    // ========================================================================
    // Helper Methods
    // ========================================================================

    private List<CompatibilityRule> prepareRuleSet(InventoryItem item, List<CompatibilityRuleRequest> requests) {
        Map<String, CompatibilityRuleRequest> unique = new LinkedHashMap<>();
        for (CompatibilityRuleRequest request : requests) {
            if (request == null || IdentifierNormalizer.isBlank(request.manufacturer())) {
                continue;
            }
            String key = IdentifierNormalizer.normalize(request.manufacturer())
                + "\u0000" + IdentifierNormalizer.normalize(request.model());
            unique.putIfAbsent(key, request);
        }

        List<CompatibilityRule> rules = new ArrayList<>(unique.size());
        for (CompatibilityRuleRequest request : unique.values()) {
            RuleCandidate candidate = patternValidator.prepare(
                request.manufacturer(), request.model(), MatchType.fromValue(request.matchType()));
            rules.add(toEntity(item, candidate, request));
        }
        return rules;
    }

    private CompatibilityRule toEntity(InventoryItem item, RuleCandidate candidate, CompatibilityRuleRequest request) {
        VerificationStatus status = VerificationStatus.fromValue(request.status());
        return CompatibilityRule.builder()
            .id(generateId())
            .inventoryItem(item)
            .manufacturer(candidate.getManufacturer())
            .model(candidate.getModel())
            .manufacturerNorm(candidate.getManufacturerNorm())
            .modelNorm(candidate.getModelNorm())
            .modelKey(CompatibilityRule.modelKeyOf(candidate.getModelNorm()))
            .matchType(candidate.getMatchType())
            .status(status != null ? status : VerificationStatus.UNVERIFIED)
            .notes(IdentifierNormalizer.trimToNull(request.notes()))
            .build();
    }

    private InventoryItem requireItem(String organizationId, String itemId) {
        return inventoryItemRepository.findByIdAndOrganizationId(itemId, organizationId)
            .orElseThrow(() -> new TenantAccessDeniedException(ITEM_ACCESS_DENIED));
    }

    private String generateId() {
        return "rule-" + UUID.randomUUID();
    }
}
