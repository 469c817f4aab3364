package com.partcompat.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of cataloged part number.
 */
public enum PartIdentifierType {
    OEM("oem"),
    AFTERMARKET("aftermarket"),
    SKU("sku"),
    MPN("mpn"),
    UPC("upc"),
    CROSS_REF("cross_ref");

    private final String value;

    PartIdentifierType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static PartIdentifierType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (PartIdentifierType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown PartIdentifierType: " + value);
    }
}
