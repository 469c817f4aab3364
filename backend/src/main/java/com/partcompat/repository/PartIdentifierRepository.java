package com.partcompat.repository;

import com.partcompat.model.alternate.PartIdentifier;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for cataloged part identifiers.
 */
@Repository
public interface PartIdentifierRepository extends JpaRepository<PartIdentifier, String> {

    Optional<PartIdentifier> findByIdAndOrganizationId(String id, String organizationId);

    boolean existsByOrganizationIdAndNormValue(String organizationId, String normValue);

    List<PartIdentifier> findByOrganizationIdAndNormValue(String organizationId, String normValue);

    List<PartIdentifier> findByInventoryItemId(String inventoryItemId);

    /**
     * Substring search on the normalized value. LIKE wildcards in the term are escaped.
     */
    List<PartIdentifier> findByOrganizationIdAndNormValueContainingOrderByRawValueAsc(
            String organizationId, String normValue, Pageable pageable);
}
