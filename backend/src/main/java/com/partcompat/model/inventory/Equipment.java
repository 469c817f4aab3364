package com.partcompat.model.inventory;

import jakarta.persistence.*;
import lombok.*;

/**
 * Fleet equipment record. Read-only here: only manufacturer and model take part in matching.
 */
@Entity
@Table(name = "equipment", indexes = {
    @Index(name = "idx_equipment_org", columnList = "organization_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Equipment {

    @Id
    @Column(length = 255)
    private String id;

    @Column(name = "organization_id", nullable = false, length = 255)
    private String organizationId;

    @Column(length = 500)
    private String name;

    @Column(length = 255)
    private String manufacturer;

    @Column(length = 255)
    private String model;
}
