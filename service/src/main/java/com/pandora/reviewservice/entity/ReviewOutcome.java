package com.pandora.reviewservice.entity;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ReviewOutcome {
    APPROVE(SubmissionEvent.APPROVE, AuditAction.SUBMISSION_APPROVED),
    RETURN(SubmissionEvent.RETURN, AuditAction.SUBMISSION_RETURNED),
    DENY(SubmissionEvent.DENY, AuditAction.SUBMISSION_DENIED);

    private final SubmissionEvent event;
    private final AuditAction auditAction;
}
