package com.lendora.lending.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Audit record of one parameter change. All changes of one administrative call share a version.
 */
@Entity
@Immutable
@Table(name = "protocol_parameter_changes", indexes = {
        @Index(name = "idx_parameter_changes_version", columnList = "version_number")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class ProtocolParameterChange {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "parameter_name", nullable = false)
    @Enumerated(EnumType.STRING)
    private ProtocolParameter parameter;

    @Column(name = "old_value", nullable = false)
    private Integer oldValue;

    @Column(name = "new_value", nullable = false)
    private Integer newValue;

    @Column(name = "version_number", nullable = false)
    private Long versionNumber;

    @Column(name = "changed_by", nullable = false)
    private String changedBy;

    @Column(name = "changed_at", nullable = false)
    private Instant changedAt;
}
