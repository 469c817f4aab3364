package com.partcompat.repository;

import com.partcompat.model.inventory.InventoryItem;
import com.partcompat.service.matching.IdentifierNormalizer;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read access to inventory items owned by the inventory module.
 */
@Repository
public interface InventoryItemRepository extends JpaRepository<InventoryItem, String> {

    Optional<InventoryItem> findByIdAndOrganizationId(String id, String organizationId);

    /**
     * Load an item with a row-level write lock. Held until the surrounding
     * transaction ends, so rule-set replacements on the same item run one at a time.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM InventoryItem i WHERE i.id = :id AND i.organizationId = :organizationId")
    Optional<InventoryItem> lockByIdAndOrganizationId(
            @Param("id") String id,
            @Param("organizationId") String organizationId);

    List<InventoryItem> findByOrganizationIdAndSkuContainingIgnoreCase(String organizationId, String sku);

    List<InventoryItem> findByOrganizationIdAndExternalIdContainingIgnoreCase(
            String organizationId, String externalId);

    /**
     * Find items whose SKU or external id equals an already-normalized part number.
     * Candidates come from a case-insensitive substring search and are compared
     * with {@link IdentifierNormalizer}.
     */
    default List<InventoryItem> findByNormalizedSkuOrExternalId(String organizationId, String normValue) {
        Map<String, InventoryItem> matched = new LinkedHashMap<>();
        for (InventoryItem item : findByOrganizationIdAndSkuContainingIgnoreCase(organizationId, normValue)) {
            if (normValue.equals(IdentifierNormalizer.normalize(item.getSku()))) {
                matched.putIfAbsent(item.getId(), item);
            }
        }
        for (InventoryItem item : findByOrganizationIdAndExternalIdContainingIgnoreCase(organizationId, normValue)) {
            if (normValue.equals(IdentifierNormalizer.normalize(item.getExternalId()))) {
                matched.putIfAbsent(item.getId(), item);
            }
        }
        return new ArrayList<>(matched.values());
    }
}
