package com.pandora.reviewservice.dto;

import com.pandora.reviewservice.entity.AuditAction;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
public class AuditLogEntryResponse {
    private Long id;
    private Long actorId;
    private String actorName;
    private AuditAction action;
    private Long submissionId;
    private String description;
    private String originAddress;
    private OffsetDateTime createdAt;
}
