package com.partcompat.dto.request;

import java.util.List;

/**
 * Equipment ids to find compatible parts for.
 */
public record EquipmentPartsRequest(
    List<String> equipmentIds
) {}
