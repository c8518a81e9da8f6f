package com.pandora.reviewservice.dto;

import lombok.Data;

import java.time.OffsetDateTime;

@Data
public class NotificationResponse {
    private Long id;
    private String title;
    private String message;
    private Long submissionId;
    private boolean read;
    private OffsetDateTime createdAt;
}
