package com.pandora.reviewservice.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.OffsetDateTime;

/**
 * One row of the audit trail. Write-once: every column is non-updatable and the entity has no setters.
 * The submission is kept as a plain id so entries outlive the submission they describe.
 */
@Entity
@Immutable
@Table(name = "audit_log")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AuditLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "actor_id", updatable = false)
    private User actor;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50, updatable = false)
    private AuditAction action;

    @Column(name = "submission_id", updatable = false)
    private Long submissionId;

    @Column(nullable = false, columnDefinition = "text", updatable = false)
    private String description;

    @Column(name = "origin_address", length = 45, updatable = false)
    private String originAddress;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    public static AuditLogEntry of(User actor, AuditAction action, Long submissionId,
                                   String description, String originAddress, OffsetDateTime createdAt) {
        AuditLogEntry entry = new AuditLogEntry();
        entry.actor = actor;
        entry.action = action;
        entry.submissionId = submissionId;
        entry.description = description;
        entry.originAddress = originAddress;
        entry.createdAt = createdAt;
        return entry;
    }
}
