package com.partcompat.repository;

import com.partcompat.model.inventory.Equipment;
import com.partcompat.service.matching.IdentifierNormalizer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Read access to fleet equipment.
 */
@Repository
public interface EquipmentRepository extends JpaRepository<Equipment, String> {

    List<Equipment> findByOrganizationIdAndManufacturerContainingIgnoreCase(
            String organizationId, String manufacturer);

    /**
     * Equipment in an organization whose normalized manufacturer is one of the given values.
     * Narrows the population before rules are evaluated in memory.
     *
     * The database only does a case-insensitive substring search; the exact comparison uses
     * {@link IdentifierNormalizer} so stored whitespace is treated the same as in rule matching.
     */
    default List<Equipment> findByOrganizationIdAndManufacturerNormIn(
            String organizationId, Collection<String> manufacturerNorms) {
        Map<String, Equipment> matched = new LinkedHashMap<>();
        for (String manufacturerNorm : new LinkedHashSet<>(manufacturerNorms)) {
            for (Equipment equipment : findByOrganizationIdAndManufacturerContainingIgnoreCase(
                    organizationId, manufacturerNorm)) {
                if (manufacturerNorm.equals(IdentifierNormalizer.normalize(equipment.getManufacturer()))) {
                    matched.putIfAbsent(equipment.getId(), equipment);
                }
            }
        }
        return new ArrayList<>(matched.values());
    }

    List<Equipment> findByOrganizationIdAndIdIn(String organizationId, Collection<String> ids);
}
