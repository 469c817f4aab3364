package com.partcompat.service;

import com.partcompat.dto.request.CreatePartIdentifierRequest;
import com.partcompat.exception.DuplicateEntryException;
import com.partcompat.exception.TenantAccessDeniedException;
import com.partcompat.exception.TransientStoreException;
import com.partcompat.exception.ValidationError;
import com.partcompat.exception.ValidationFailedException;
import com.partcompat.model.alternate.PartIdentifier;
import com.partcompat.model.enums.PartIdentifierType;
import com.partcompat.model.inventory.InventoryItem;
import com.partcompat.repository.InventoryItemRepository;
import com.partcompat.repository.PartIdentifierRepository;
import com.partcompat.service.matching.IdentifierNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Catalog of part numbers used as alternate lookup keys.
 * A normalized part number is unique within an organization.
 */
@Slf4j
@Service
@Transactional
public class PartIdentifierService {

    static final String DUPLICATE_IDENTIFIER = "This part number already exists";

    private final PartIdentifierRepository partIdentifierRepository;
    private final InventoryItemRepository inventoryItemRepository;
    private final int searchLimit;

    public PartIdentifierService(
            PartIdentifierRepository partIdentifierRepository,
            InventoryItemRepository inventoryItemRepository,
            @Value("${parts.identifiers.search-limit:50}") int searchLimit) {
        this.partIdentifierRepository = partIdentifierRepository;
        this.inventoryItemRepository = inventoryItemRepository;
        this.searchLimit = searchLimit;
    }

    public PartIdentifier createIdentifier(String organizationId, CreatePartIdentifierRequest request) {
        PartIdentifierType type = PartIdentifierType.fromValue(request.identifierType());
        if (type == null) {
            throw new IllegalArgumentException("Identifier type is required");
        }
        String rawValue = IdentifierNormalizer.trimToNull(request.rawValue());
        if (rawValue == null) {
            throw new ValidationFailedException(ValidationError.EMPTY_IDENTIFIER);
        }

        InventoryItem item = null;
        if (!IdentifierNormalizer.isBlank(request.inventoryItemId())) {
            item = inventoryItemRepository.findByIdAndOrganizationId(request.inventoryItemId(), organizationId)
                .orElseThrow(() -> new TenantAccessDeniedException("Inventory item not found or access denied"));
        }

        String normValue = IdentifierNormalizer.normalize(rawValue);
        if (partIdentifierRepository.existsByOrganizationIdAndNormValue(organizationId, normValue)) {
            throw new DuplicateEntryException(DUPLICATE_IDENTIFIER);
        }

        PartIdentifier identifier = PartIdentifier.builder()
            .id("pid-" + UUID.randomUUID())
            .organizationId(organizationId)
            .identifierType(type)
            .rawValue(rawValue)
            .normValue(normValue)
            .inventoryItem(item)
            .manufacturer(IdentifierNormalizer.trimToNull(request.manufacturer()))
            .notes(IdentifierNormalizer.trimToNull(request.notes()))
            .createdBy(request.createdBy())
            .build();

        try {
            PartIdentifier saved = partIdentifierRepository.saveAndFlush(identifier);
            log.info("Created {} part identifier '{}' in organization {}", type.getValue(), rawValue, organizationId);
            return saved;
        } catch (DataIntegrityViolationException e) {
            log.warn("Duplicate part identifier '{}' in organization {}", rawValue, organizationId);
            throw new DuplicateEntryException(DUPLICATE_IDENTIFIER, e);
        } catch (DataAccessException e) {
            log.error("Failed to create part identifier '{}'", rawValue, e);
            throw new TransientStoreException("Failed to create part identifier", e);
        }
    }

    /**
     * Identifiers whose normalized value contains the term, by raw value, capped
     * at the configured limit. A blank term returns nothing.
     */
    @Transactional(readOnly = true)
    public List<PartIdentifier> searchIdentifiers(String organizationId, String term) {
        String normTerm = IdentifierNormalizer.normalize(term);
        if (normTerm.isEmpty()) {
            return List.of();
        }
        return partIdentifierRepository.findByOrganizationIdAndNormValueContainingOrderByRawValueAsc(
            organizationId, normTerm, PageRequest.of(0, searchLimit));
    }
}
