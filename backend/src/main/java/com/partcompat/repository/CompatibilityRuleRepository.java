package com.partcompat.repository;

import com.partcompat.model.compatibility.CompatibilityRule;
import com.partcompat.model.enums.MatchType;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for part compatibility rules.
 */
@Repository
public interface CompatibilityRuleRepository extends JpaRepository<CompatibilityRule, String> {

    /**
     * Rules of one item, ordered by manufacturer then model (any-model rules last).
     */
    @Query("""
        SELECT r FROM CompatibilityRule r
        WHERE r.inventoryItem.id = :itemId
        ORDER BY r.manufacturer ASC, r.model ASC NULLS LAST
        """)
    List<CompatibilityRule> findByItemIdOrdered(@Param("itemId") String itemId);

    long countByInventoryItemId(String itemId);

    /**
     * Duplicate check on the normalized identity of a rule. "Any model" is keyed as the empty string.
     */
    boolean existsByInventoryItemIdAndManufacturerNormAndModelKeyAndMatchType(
            String itemId, String manufacturerNorm, String modelKey, MatchType matchType);

    @EntityGraph(attributePaths = {"inventoryItem"})
    Optional<CompatibilityRule> findWithItemById(String id);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM CompatibilityRule r WHERE r.inventoryItem.id = :itemId")
    int deleteAllByItemId(@Param("itemId") String itemId);

    /**
     * Rules in an organization for a set of normalized manufacturers, with their items.
     */
    @Query("""
        SELECT r FROM CompatibilityRule r
        JOIN FETCH r.inventoryItem i
        WHERE i.organizationId = :organizationId
          AND r.manufacturerNorm IN :manufacturerNorms
        """)
    List<CompatibilityRule> findByOrganizationIdAndManufacturerNormIn(
            @Param("organizationId") String organizationId,
            @Param("manufacturerNorms") Collection<String> manufacturerNorms);
}
