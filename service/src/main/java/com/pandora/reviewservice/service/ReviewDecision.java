package com.pandora.reviewservice.service;

import com.pandora.reviewservice.dto.ReviewRequest;
import com.pandora.reviewservice.entity.Priority;
import com.pandora.reviewservice.entity.ReviewOutcome;

public record ReviewDecision(ReviewOutcome outcome, String reviewerComments, Priority priority,
                             boolean publish, String denialReason) {

    public static ReviewDecision from(ReviewRequest req) {
        return new ReviewDecision(req.getAction(), req.getReviewerComments(), req.getPriority(),
                req.isPublish(), req.getDenialReason());
    }

    public static ReviewDecision approve(boolean publish) {
        return new ReviewDecision(ReviewOutcome.APPROVE, null, null, publish, null);
    }

    public static ReviewDecision returnForEdits(String comments) {
        return new ReviewDecision(ReviewOutcome.RETURN, comments, null, false, null);
    }

    public static ReviewDecision deny(String reason) {
        return new ReviewDecision(ReviewOutcome.DENY, null, null, false, reason);
    }
}
