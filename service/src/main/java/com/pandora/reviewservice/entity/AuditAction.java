package com.pandora.reviewservice.entity;

public enum AuditAction {
    SUBMISSION_CREATED,
    SUBMISSION_UPDATED,
    SUBMISSION_REVIEWED,
    SUBMISSION_APPROVED,
    SUBMISSION_DENIED,
    SUBMISSION_RETURNED,
    SUBMISSION_DELETED,
    COMMENT_ADDED
}
