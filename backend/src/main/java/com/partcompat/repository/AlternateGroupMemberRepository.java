package com.partcompat.repository;

import com.partcompat.model.alternate.AlternateGroupMember;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Repository for alternate group memberships.
 */
@Repository
public interface AlternateGroupMemberRepository extends JpaRepository<AlternateGroupMember, String> {

    boolean existsByAlternateGroupIdAndPartIdentifierId(String groupId, String partIdentifierId);

    boolean existsByAlternateGroupIdAndInventoryItemId(String groupId, String inventoryItemId);

    long countByAlternateGroupId(String groupId);

    @EntityGraph(attributePaths = {"alternateGroup"})
    Optional<AlternateGroupMember> findWithAlternateGroupById(String id);

    /**
     * Members of a group with identifier and item details, primary first, then oldest first.
     */
    @Query("""
        SELECT m FROM AlternateGroupMember m
        LEFT JOIN FETCH m.partIdentifier pi
        LEFT JOIN FETCH pi.inventoryItem
        LEFT JOIN FETCH m.inventoryItem
        WHERE m.alternateGroup.id = :groupId
        ORDER BY m.isPrimary DESC, m.createdAt ASC
        """)
    List<AlternateGroupMember> findDetailedByGroupId(@Param("groupId") String groupId);

    @Query("SELECT DISTINCT m.alternateGroup.id FROM AlternateGroupMember m WHERE m.partIdentifier.id IN :identifierIds")
    Set<String> findGroupIdsByPartIdentifierIds(@Param("identifierIds") Collection<String> identifierIds);

    @Query("SELECT DISTINCT m.alternateGroup.id FROM AlternateGroupMember m WHERE m.inventoryItem.id IN :itemIds")
    Set<String> findGroupIdsByInventoryItemIds(@Param("itemIds") Collection<String> itemIds);
}
