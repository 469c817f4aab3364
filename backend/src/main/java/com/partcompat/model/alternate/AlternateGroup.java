package com.partcompat.model.alternate;

import com.partcompat.model.AuditableEntity;
import com.partcompat.model.enums.VerificationStatus;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Named set of interchangeable parts. Any member can substitute for any other.
 */
@Entity
@Table(name = "alternate_group", indexes = {
    @Index(name = "idx_alternate_group_org", columnList = "organization_id"),
    @Index(name = "idx_alternate_group_status", columnList = "organization_id, status")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
public class AlternateGroup extends AuditableEntity {

    @Id
    @Column(length = 255)
    private String id;

    @Column(name = "organization_id", nullable = false, length = 255)
    private String organizationId;

    @Column(nullable = false, length = 500)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private VerificationStatus status = VerificationStatus.UNVERIFIED;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "evidence_url", length = 1000)
    private String evidenceUrl;

    @Column(name = "verified_by", length = 255)
    private String verifiedBy;

    @Column(name = "verified_at")
    private LocalDateTime verifiedAt;

    @OneToMany(mappedBy = "alternateGroup", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("isPrimary DESC, createdAt ASC")
    @Builder.Default
    private List<AlternateGroupMember> members = new ArrayList<>();
}
