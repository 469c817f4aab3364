package com.partcompat.repository;

import com.partcompat.model.alternate.AlternateGroup;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for alternate part groups.
 */
@Repository
public interface AlternateGroupRepository extends JpaRepository<AlternateGroup, String> {

    /**
     * Tenant-scoped lookup. A group of another organization is reported as absent.
     */
    Optional<AlternateGroup> findByIdAndOrganizationId(String id, String organizationId);

    List<AlternateGroup> findByOrganizationIdOrderByNameAsc(String organizationId);

    /**
     * Groups with their members, the members' identifiers and all referenced items
     * loaded in one query. The result is fully usable outside a transaction.
     */
    @Query("""
        SELECT DISTINCT g FROM AlternateGroup g
        LEFT JOIN FETCH g.members m
        LEFT JOIN FETCH m.partIdentifier pi
        LEFT JOIN FETCH pi.inventoryItem
        LEFT JOIN FETCH m.inventoryItem
        WHERE g.organizationId = :organizationId
          AND g.id IN :ids
        """)
    List<AlternateGroup> findWithMembersByOrganizationIdAndIdIn(
            @Param("organizationId") String organizationId,
            @Param("ids") Collection<String> ids);
}
